package org.hypertrace.core.eventsearch.topevents;

import java.util.List;
import java.util.Map;
import lombok.Value;

/** Zero filled timeseries of one top row. */
@Value
public class TopEventsSeries {
  /** Rank of the row in the top events query. */
  int order;

  List<Map<String, Object>> data;
}
