package org.hypertrace.core.eventsearch.api;

import javax.annotation.Nullable;
import lombok.NonNull;
import lombok.Value;

@Value
public class ColumnReference implements Expression {
  @NonNull String name;
  @Nullable String alias;

  public static ColumnReference of(String name) {
    return new ColumnReference(name, null);
  }

  @Override
  public ExpressionCase getExpressionCase() {
    return ExpressionCase.COLUMN;
  }

  public ColumnReference withAlias(String newAlias) {
    return new ColumnReference(name, newAlias);
  }
}
