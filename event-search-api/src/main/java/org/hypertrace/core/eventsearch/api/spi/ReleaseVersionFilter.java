package org.hypertrace.core.eventsearch.api.spi;

import lombok.NonNull;
import lombok.Value;
import org.hypertrace.core.eventsearch.api.FilterOperator;

@Value
public class ReleaseVersionFilter {
  @NonNull Kind kind;
  @NonNull FilterOperator operator;
  @NonNull String value;
  long organizationId;

  public enum Kind {
    /** Semantic version, {@code 1.2.3}, optionally prefixed by a package. */
    VERSION,
    PACKAGE,
    BUILD
  }

  public ReleaseVersionFilter invert() {
    return new ReleaseVersionFilter(kind, operator.negate(), value, organizationId);
  }
}
