package org.hypertrace.core.eventsearch.function;

import javax.annotation.Nullable;
import org.hypertrace.core.eventsearch.api.Expression;
import org.hypertrace.core.eventsearch.api.Literal;
import org.hypertrace.core.eventsearch.api.ResultType;

/**
 * One declared argument of a function. Normalization validates the raw text an argument was given
 * and converts it to the value substituted into the function's template.
 *
 * <p>Normalizers signal a bad value with an {@link IllegalArgumentException}; the resolver
 * reports it against the function and argument name.
 */
public abstract class FunctionArgument {
  private final String name;
  private boolean hasDefault;
  @Nullable private String defaultValue;

  protected FunctionArgument(String name) {
    this.name = name;
  }

  public String getName() {
    return name;
  }

  public abstract ArgumentKind getKind();

  public boolean hasDefault() {
    return hasDefault;
  }

  /** Marks the argument optional with a fixed raw default. Only used while building registries. */
  public FunctionArgument withDefault(@Nullable String value) {
    this.hasDefault = true;
    this.defaultValue = value;
    return this;
  }

  protected void markDefaulted() {
    this.hasDefault = true;
  }

  /** Raw default, normalized like a value the caller supplied. */
  @Nullable
  public String getDefault(ArgumentContext context) {
    if (!hasDefault) {
      throw new IllegalArgumentException(String.format("%s has no defaults", name));
    }
    return defaultValue;
  }

  @Nullable
  public Object normalize(@Nullable String value, ArgumentContext context) {
    return value;
  }

  /** Semantic type of a normalized value, for functions whose result mirrors an argument. */
  @Nullable
  public ResultType getType(@Nullable Object value) {
    throw new IllegalArgumentException(String.format("%s has no type defined", name));
  }

  /** The expression a normalized value stands for inside a template. */
  public Expression toExpression(@Nullable Object value, ArgumentContext context) {
    if (value instanceof Expression) {
      return (Expression) value;
    }
    return Literal.of(value);
  }

  @Override
  public String toString() {
    return getKind() + "(" + name + ")";
  }
}
