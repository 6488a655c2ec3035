package org.hypertrace.core.eventsearch.topevents;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import org.hypertrace.core.eventsearch.api.QueryPlan;
import org.hypertrace.core.eventsearch.api.RequestParams;

@Value
@Builder
public class TopEventsQuery {
  /** Fields the top rows are grouped by. */
  @Singular List<String> fields;

  /** Rows of the top events query, best first. */
  @Singular List<Map<String, Object>> topEvents;

  /** Timeseries grouped by {@code time} and the fields, not yet restricted to the top rows. */
  @NonNull QueryPlan timeseriesPlan;

  /** Timeseries of everything else, when an "Other" series is wanted. */
  @Nullable QueryPlan otherPlan;

  int limit;
  @NonNull RequestParams params;
  @NonNull Duration rollup;

  /** Whether the series are ordered by {@code -time}. */
  boolean timeDescending;

  Instant getStart() {
    return params.getStart();
  }

  Instant getEnd() {
    return params.getEnd();
  }
}
