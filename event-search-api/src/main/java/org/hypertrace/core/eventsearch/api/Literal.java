package org.hypertrace.core.eventsearch.api;

import javax.annotation.Nullable;
import lombok.Value;

/** A constant: string, number, boolean, instant, null, or a list of those. */
@Value
public class Literal implements Expression {
  public static final Literal NULL = new Literal(null);

  @Nullable Object value;

  public static Literal of(@Nullable Object value) {
    return value == null ? NULL : new Literal(value);
  }

  @Override
  public ExpressionCase getExpressionCase() {
    return ExpressionCase.LITERAL;
  }

  @Override
  @Nullable
  public String getAlias() {
    return null;
  }
}
