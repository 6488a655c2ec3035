package org.hypertrace.core.eventsearch.histogram;

import lombok.Value;

/**
 * Bucketing of a histogram. Bucket size and start offset are in scaled units, the values
 * multiplied by {@code multiplier}, so buckets are always integral.
 */
@Value
public class HistogramParams {
  int numBuckets;
  long bucketSize;
  long startOffset;
  long multiplier;

  /** Exclusive upper edge of the last bucket, scaled. */
  public long getEnd() {
    return startOffset + bucketSize * numBuckets;
  }

  /** Lower edge of bucket {@code index} in the original units. */
  public double getBin(int index) {
    return (double) (startOffset + bucketSize * index) / multiplier;
  }
}
