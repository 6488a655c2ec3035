package org.hypertrace.core.eventsearch.function;

import java.util.Map;
import java.util.function.Function;
import lombok.NonNull;
import lombok.Value;

/** An argument derived from the ones declared before it, e.g. {@code tolerated}. */
@Value
public class CalculatedArgument {
  @NonNull String name;
  @NonNull Function<Map<String, Object>, Object> derivation;

  public static CalculatedArgument of(String name, Function<Map<String, Object>, Object> derivation) {
    return new CalculatedArgument(name, derivation);
  }
}
