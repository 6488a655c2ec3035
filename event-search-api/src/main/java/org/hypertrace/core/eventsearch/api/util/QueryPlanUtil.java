package org.hypertrace.core.eventsearch.api.util;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;
import org.hypertrace.core.eventsearch.api.BooleanCondition;
import org.hypertrace.core.eventsearch.api.ColumnReference;
import org.hypertrace.core.eventsearch.api.Condition;
import org.hypertrace.core.eventsearch.api.ConditionOperator;
import org.hypertrace.core.eventsearch.api.Expression;
import org.hypertrace.core.eventsearch.api.FunctionCall;
import org.hypertrace.core.eventsearch.api.Literal;
import org.hypertrace.core.eventsearch.api.LogicalOperator;
import org.hypertrace.core.eventsearch.api.SimpleCondition;

/** Utility methods to create the expressions and conditions of a query plan. */
public class QueryPlanUtil {

  public static ColumnReference column(String columnName) {
    return ColumnReference.of(columnName);
  }

  public static Literal literal(Object value) {
    return Literal.of(value);
  }

  public static FunctionCall function(String functionName, Expression... arguments) {
    return FunctionCall.of(functionName, arguments);
  }

  public static FunctionCall aliasedFunction(
      String functionName, String alias, Expression... arguments) {
    return FunctionCall.of(functionName, arguments).withAlias(alias);
  }

  /** {@code functionName(column1, column2, ...)} */
  public static FunctionCall functionOfColumns(String functionName, String... columnNames) {
    return FunctionCall.of(
        functionName,
        Arrays.stream(columnNames).map(ColumnReference::of).collect(Collectors.toList()));
  }

  public static SimpleCondition condition(Expression lhs, ConditionOperator operator, Object rhs) {
    return new SimpleCondition(lhs, operator, toExpression(rhs));
  }

  public static SimpleCondition columnCondition(
      String columnName, ConditionOperator operator, Object rhs) {
    return condition(column(columnName), operator, rhs);
  }

  public static SimpleCondition isNull(Expression lhs) {
    return new SimpleCondition(lhs, ConditionOperator.IS_NULL, null);
  }

  public static SimpleCondition isNotNull(Expression lhs) {
    return new SimpleCondition(lhs, ConditionOperator.IS_NOT_NULL, null);
  }

  public static Condition and(Condition... conditions) {
    return combine(LogicalOperator.AND, Arrays.asList(conditions));
  }

  public static Condition or(Condition... conditions) {
    return combine(LogicalOperator.OR, Arrays.asList(conditions));
  }

  /** A single condition is returned as is; several are joined under one boolean node. */
  public static Condition combine(LogicalOperator operator, Collection<Condition> conditions) {
    if (conditions.isEmpty()) {
      throw new IllegalArgumentException("Cannot combine an empty list of conditions");
    }
    if (conditions.size() == 1) {
      return conditions.iterator().next();
    }
    return new BooleanCondition(operator, List.copyOf(conditions));
  }

  /** The same expression without its output name, for use inside conditions. */
  public static Expression withoutAlias(Expression expression) {
    if (expression.getAlias() == null) {
      return expression;
    }
    if (expression instanceof FunctionCall) {
      return ((FunctionCall) expression).withAlias(null);
    }
    if (expression instanceof ColumnReference) {
      return ColumnReference.of(((ColumnReference) expression).getName());
    }
    return expression;
  }

  private static Expression toExpression(Object value) {
    if (value instanceof Expression) {
      return (Expression) value;
    }
    return Literal.of(value);
  }
}
