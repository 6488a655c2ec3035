package org.hypertrace.core.eventsearch.api;

import java.util.List;
import javax.annotation.Nullable;
import lombok.NonNull;
import lombok.Value;

/**
 * A call to a function of the analytic engine. Parametric aggregates keep their parameters in the
 * name, {@code quantile(0.95)}.
 */
@Value
public class FunctionCall implements Expression {
  @NonNull String name;
  @NonNull List<Expression> arguments;
  @Nullable String alias;

  public static FunctionCall of(String name, Expression... arguments) {
    return new FunctionCall(name, List.of(arguments), null);
  }

  public static FunctionCall of(String name, List<? extends Expression> arguments) {
    return new FunctionCall(name, List.copyOf(arguments), null);
  }

  @Override
  public ExpressionCase getExpressionCase() {
    return ExpressionCase.FUNCTION;
  }

  public FunctionCall withAlias(@Nullable String newAlias) {
    return new FunctionCall(name, arguments, newAlias);
  }
}
