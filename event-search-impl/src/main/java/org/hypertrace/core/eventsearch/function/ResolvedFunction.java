package org.hypertrace.core.eventsearch.function;

import java.util.Map;
import java.util.Optional;
import javax.annotation.Nullable;
import lombok.NonNull;
import lombok.Value;
import org.hypertrace.core.eventsearch.api.Expression;
import org.hypertrace.core.eventsearch.api.ResultType;

/** A function call from a field list or an aggregate filter, resolved to its expression. */
@Value
public class ResolvedFunction {
  /** The field text as requested. */
  @NonNull String field;

  @NonNull FunctionSpec spec;

  /** Aliased expression, ready to be selected. */
  @NonNull Expression expression;

  @NonNull String alias;
  @Nullable ResultType resultType;

  /** Normalized argument values by name, calculated ones included. Values may be null. */
  @NonNull Map<String, Object> arguments;

  public boolean isAggregate() {
    return spec.isAggregate();
  }

  /** The field passed as {@code column}, for functions that would group by it redundantly. */
  public Optional<String> getRedundantGroupingColumn() {
    if (!spec.isRedundantGrouping()) {
      return Optional.empty();
    }
    Object column = arguments.get("column");
    return column instanceof String ? Optional.of((String) column) : Optional.empty();
  }
}
