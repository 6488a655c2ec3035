package org.hypertrace.core.eventsearch.function;

import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;
import org.hypertrace.core.eventsearch.api.ResultType;

@FunctionalInterface
public interface ResultTypeRule {

  /** Null falls back to the default result type of the function. */
  @Nullable
  ResultType apply(List<FunctionArgument> arguments, Map<String, Object> values);

  /** The type of the argument at {@code index}, e.g. {@code max(timestamp)} is a date. */
  static ResultTypeRule reflective(int index) {
    return (arguments, values) -> {
      FunctionArgument argument = arguments.get(index);
      return argument.getType(values.get(argument.getName()));
    };
  }
}
