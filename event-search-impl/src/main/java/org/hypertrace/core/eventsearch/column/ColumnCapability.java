package org.hypertrace.core.eventsearch.column;

import static org.hypertrace.core.eventsearch.api.util.QueryPlanUtil.condition;
import static org.hypertrace.core.eventsearch.api.util.QueryPlanUtil.function;
import static org.hypertrace.core.eventsearch.api.util.QueryPlanUtil.literal;

import java.util.List;
import org.hypertrace.core.eventsearch.api.Condition;
import org.hypertrace.core.eventsearch.api.ConditionOperator;
import org.hypertrace.core.eventsearch.api.Expression;

/**
 * Whether a column holds one value per row or an array of values. Existence, membership and
 * pattern checks are expressed differently for each.
 */
public enum ColumnCapability {
  SCALAR {
    @Override
    public Condition existence(Expression column, boolean present) {
      return condition(
          function("isNull", column), present ? ConditionOperator.NEQ : ConditionOperator.EQ, 1L);
    }

    @Override
    public Condition membership(Expression column, List<Object> values, boolean negated) {
      return condition(
          column, negated ? ConditionOperator.NOT_IN : ConditionOperator.IN, List.copyOf(values));
    }

    @Override
    public Condition pattern(Expression column, String wildcard, boolean negated) {
      return condition(
          function("match", column, literal("(?i)" + WildcardPatterns.toRegex(wildcard))),
          negated ? ConditionOperator.NEQ : ConditionOperator.EQ,
          1L);
    }
  },
  ARRAY {
    @Override
    public Condition existence(Expression column, boolean present) {
      return condition(
          function("notEmpty", column), present ? ConditionOperator.EQ : ConditionOperator.NEQ, 1L);
    }

    @Override
    public Condition membership(Expression column, List<Object> values, boolean negated) {
      return condition(
          function("hasAny", column, literal(List.copyOf(values))),
          negated ? ConditionOperator.NEQ : ConditionOperator.EQ,
          1L);
    }

    @Override
    public Condition pattern(Expression column, String wildcard, boolean negated) {
      return condition(
          column,
          negated ? ConditionOperator.NOT_LIKE : ConditionOperator.LIKE,
          WildcardPatterns.toLikePattern(wildcard));
    }
  };

  /** {@code has:} when present, {@code !has:} otherwise. */
  public abstract Condition existence(Expression column, boolean present);

  public abstract Condition membership(Expression column, List<Object> values, boolean negated);

  public abstract Condition pattern(Expression column, String wildcard, boolean negated);
}
