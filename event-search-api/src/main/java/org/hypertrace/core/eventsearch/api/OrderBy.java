package org.hypertrace.core.eventsearch.api;

import lombok.NonNull;
import lombok.Value;

@Value
public class OrderBy {
  @NonNull Expression expression;
  @NonNull SortDirection direction;
}
