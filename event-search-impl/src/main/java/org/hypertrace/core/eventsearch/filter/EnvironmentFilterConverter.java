package org.hypertrace.core.eventsearch.filter;

import static org.hypertrace.core.eventsearch.api.util.QueryPlanUtil.combine;
import static org.hypertrace.core.eventsearch.api.util.QueryPlanUtil.condition;
import static org.hypertrace.core.eventsearch.api.util.QueryPlanUtil.isNotNull;
import static org.hypertrace.core.eventsearch.api.util.QueryPlanUtil.isNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;
import javax.inject.Singleton;
import org.hypertrace.core.eventsearch.api.Condition;
import org.hypertrace.core.eventsearch.api.ConditionOperator;
import org.hypertrace.core.eventsearch.api.Expression;
import org.hypertrace.core.eventsearch.api.LogicalOperator;
import org.hypertrace.core.eventsearch.api.SearchFilter;
import org.hypertrace.core.eventsearch.column.ColumnCatalog;

/**
 * {@code environment:} filters. The empty environment is stored as null, so {@code ""} in the
 * value list becomes a null check ORed with the membership test on the remaining values.
 */
@Singleton
public class EnvironmentFilterConverter implements SearchFilterConverter {

  @Override
  public Optional<Condition> convert(SearchFilter filter, FilterContext context) {
    Expression column = context.getColumnCatalog().resolve(ColumnCatalog.ENVIRONMENT);
    return Optional.of(toCondition(column, filter.getValue().getValues(), filter.isNegation()));
  }

  /** Also used for the environments of the request scope. */
  public static Condition toCondition(Expression column, List<?> rawValues, boolean negated) {
    TreeSet<String> values = new TreeSet<>();
    rawValues.forEach(value -> values.add(value == null ? "" : String.valueOf(value)));
    boolean includesEmpty = values.remove("");

    List<Condition> conditions = new ArrayList<>();
    if (includesEmpty) {
      conditions.add(negated ? isNotNull(column) : isNull(column));
    }
    if (values.size() == 1) {
      ConditionOperator operator = negated ? ConditionOperator.NEQ : ConditionOperator.EQ;
      conditions.add(condition(column, operator, values.first()));
    } else if (values.size() > 1) {
      conditions.add(
          condition(
              column,
              negated ? ConditionOperator.NOT_IN : ConditionOperator.IN,
              List.copyOf(values)));
    }
    return combine(negated ? LogicalOperator.AND : LogicalOperator.OR, conditions);
  }
}
