package org.hypertrace.core.eventsearch.api.spi;

import java.util.List;
import java.util.Map;
import lombok.NonNull;
import lombok.Value;

/** Rows keyed by output alias. */
@Value
public class QueryResult {
  @NonNull List<Map<String, Object>> rows;

  public static QueryResult of(List<Map<String, Object>> rows) {
    return new QueryResult(rows);
  }

  public boolean isEmpty() {
    return rows.isEmpty();
  }
}
