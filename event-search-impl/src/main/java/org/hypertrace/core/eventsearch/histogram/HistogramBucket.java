package org.hypertrace.core.eventsearch.histogram;

import lombok.Value;

@Value
public class HistogramBucket {
  /** Lower edge of the bucket. */
  double bin;

  long count;
}
