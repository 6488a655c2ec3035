package org.hypertrace.core.eventsearch.histogram;

import java.util.Optional;
import javax.annotation.Nullable;
import lombok.Value;

/** Observed or requested value range; either side is absent when there is no data. */
@Value
public class HistogramBounds {
  private static final HistogramBounds UNKNOWN = new HistogramBounds(null, null);

  @Nullable Double min;
  @Nullable Double max;

  public static HistogramBounds of(@Nullable Double min, @Nullable Double max) {
    return new HistogramBounds(min, max);
  }

  public static HistogramBounds unknown() {
    return UNKNOWN;
  }

  public boolean isComplete() {
    return min != null && max != null;
  }

  /** Fills in the sides this range does not know from {@code other}. */
  public HistogramBounds orElse(HistogramBounds other) {
    return new HistogramBounds(
        Optional.ofNullable(min).orElse(other.min), Optional.ofNullable(max).orElse(other.max));
  }
}
