package org.hypertrace.core.eventsearch.condition;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import org.hypertrace.core.eventsearch.api.BooleanCondition;
import org.hypertrace.core.eventsearch.api.Condition;
import org.hypertrace.core.eventsearch.api.LogicalOperator;

/**
 * Turns nested {@code AND} nodes into the ordered list of conditions a plan carries. {@code OR}
 * nodes stay whole, each one is a single entry of the list.
 */
public final class ConditionFlattener {

  private ConditionFlattener() {}

  public static List<Condition> flatten(Condition condition) {
    List<Condition> flattened = new ArrayList<>();
    collect(condition, flattened);
    return List.copyOf(flattened);
  }

  public static List<Condition> flatten(Collection<Condition> conditions) {
    List<Condition> flattened = new ArrayList<>();
    conditions.forEach(condition -> collect(condition, flattened));
    return List.copyOf(flattened);
  }

  private static void collect(Condition condition, List<Condition> flattened) {
    if (condition instanceof BooleanCondition
        && ((BooleanCondition) condition).getOperator() == LogicalOperator.AND) {
      ((BooleanCondition) condition).getConditions().forEach(child -> collect(child, flattened));
    } else {
      flattened.add(condition);
    }
  }
}
