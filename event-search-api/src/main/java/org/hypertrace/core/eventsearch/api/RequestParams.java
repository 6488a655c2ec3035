package org.hypertrace.core.eventsearch.api;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import javax.annotation.Nullable;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/** Scope of one compilation: time window, organization, projects, teams and environments. */
@Value
@Builder(toBuilder = true)
public class RequestParams {
  @Nullable Instant start;
  @Nullable Instant end;
  @Singular List<Long> projectIds;
  @Nullable Long organizationId;
  @Singular List<Long> teamIds;
  @Nullable Long userId;
  @Singular List<String> environments;

  /** Precomputed aggregates keyed by the function text a caller may request. */
  @Singular Map<String, Expression> aliases;

  public Optional<Duration> getInterval() {
    if (start == null || end == null) {
      return Optional.empty();
    }
    return Optional.of(Duration.between(start, end));
  }
}
