package org.hypertrace.core.eventsearch.api.spi;

import lombok.NonNull;
import lombok.Value;

@Value
public class TransactionThreshold {
  long projectId;
  @NonNull String transaction;
  @NonNull String metric;
  long threshold;
}
