package org.hypertrace.core.eventsearch.api.spi;

import lombok.NonNull;
import lombok.Value;

@Value
public class KeyTransaction {
  long projectId;
  @NonNull String transaction;
}
