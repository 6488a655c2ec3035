package org.hypertrace.core.eventsearch.api;

import lombok.NonNull;
import lombok.Value;

/** A filter on the output of a function, for example {@code count():>10}. */
@Value
public class AggregateFilter implements ParsedTerm {
  /** The function text as written, {@code p95(transaction.duration)}. */
  @NonNull String function;

  @NonNull FilterOperator operator;
  @NonNull SearchValue value;

  public static AggregateFilter of(String function, FilterOperator operator, Object value) {
    return new AggregateFilter(function, operator, SearchValue.of(value));
  }

  @Override
  public TermCase getTermCase() {
    return TermCase.AGGREGATE_FILTER;
  }
}
