package org.hypertrace.core.eventsearch.api;

import java.util.List;
import lombok.NonNull;
import lombok.Value;

@Value
public class BooleanCondition implements Condition {
  @NonNull LogicalOperator operator;
  @NonNull List<Condition> conditions;

  @Override
  public ConditionCase getConditionCase() {
    return ConditionCase.BOOLEAN;
  }
}
