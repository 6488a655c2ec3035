package org.hypertrace.core.eventsearch.api.spi;

import lombok.NonNull;
import lombok.Value;

@Value
public class ProjectThreshold {
  long projectId;
  @NonNull String metric;
  long threshold;
}
