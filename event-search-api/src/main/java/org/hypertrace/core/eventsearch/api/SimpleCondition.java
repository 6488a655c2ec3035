package org.hypertrace.core.eventsearch.api;

import javax.annotation.Nullable;
import lombok.NonNull;
import lombok.Value;

/** {@code lhs operator rhs}; the right hand side is absent for null checks. */
@Value
public class SimpleCondition implements Condition {
  @NonNull Expression lhs;
  @NonNull ConditionOperator operator;
  @Nullable Expression rhs;

  @Override
  public ConditionCase getConditionCase() {
    return ConditionCase.SIMPLE;
  }
}
