package org.hypertrace.core.eventsearch.topevents;

import static org.hypertrace.core.eventsearch.api.util.QueryPlanUtil.and;
import static org.hypertrace.core.eventsearch.api.util.QueryPlanUtil.combine;
import static org.hypertrace.core.eventsearch.api.util.QueryPlanUtil.condition;
import static org.hypertrace.core.eventsearch.api.util.QueryPlanUtil.function;
import static org.hypertrace.core.eventsearch.api.util.QueryPlanUtil.or;
import static org.hypertrace.core.eventsearch.api.util.QueryPlanUtil.withoutAlias;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.hypertrace.core.eventsearch.alias.FieldAliasResolver;
import org.hypertrace.core.eventsearch.api.Condition;
import org.hypertrace.core.eventsearch.api.ConditionOperator;
import org.hypertrace.core.eventsearch.api.Expression;
import org.hypertrace.core.eventsearch.api.LogicalOperator;
import org.hypertrace.core.eventsearch.api.QueryPlan;
import org.hypertrace.core.eventsearch.api.RequestParams;
import org.hypertrace.core.eventsearch.column.ColumnCatalog;

/**
 * Conditions restricting a timeseries query to the events of the top rows of a grouped query, or,
 * negated, to every other event.
 */
@Singleton
public class TopEventsConditionBuilder {
  private final ColumnCatalog columnCatalog;
  private final FieldAliasResolver aliasResolver;

  @Inject
  public TopEventsConditionBuilder(ColumnCatalog columnCatalog, FieldAliasResolver aliasResolver) {
    this.columnCatalog = columnCatalog;
    this.aliasResolver = aliasResolver;
  }

  public QueryPlan restrictToTopEvents(
      QueryPlan plan,
      List<String> fields,
      List<Map<String, Object>> topRows,
      RequestParams params) {
    return plan.toBuilder().whereConditions(topEventsConditions(fields, topRows, params)).build();
  }

  public QueryPlan restrictToOtherEvents(
      QueryPlan plan,
      List<String> fields,
      List<Map<String, Object>> topRows,
      RequestParams params) {
    QueryPlan.QueryPlanBuilder builder = plan.toBuilder();
    otherEventsCondition(fields, topRows, params).ifPresent(builder::whereCondition);
    return builder.build();
  }

  /** One condition per field, all of which an event of the top rows satisfies. */
  public List<Condition> topEventsConditions(
      List<String> fields, List<Map<String, Object>> topRows, RequestParams params) {
    List<Condition> conditions = new ArrayList<>();
    for (String field : fields) {
      String column = outputField(field);
      Set<Object> values = valuesOf(column, topRows);
      if (values.isEmpty()) {
        continue;
      }
      Expression expression = resolve(column, params);
      if (ColumnCatalog.TIMESTAMP.equals(column)) {
        conditions.add(
            combine(
                LogicalOperator.OR,
                values.stream()
                    .map(value -> condition(expression, ConditionOperator.EQ, value))
                    .collect(Collectors.toList())));
      } else if (values.contains(null)) {
        List<Object> present =
            values.stream().filter(value -> value != null).collect(Collectors.toList());
        Condition isNull = condition(function("isNull", expression), ConditionOperator.EQ, 1L);
        conditions.add(
            present.isEmpty()
                ? isNull
                : or(isNull, condition(expression, ConditionOperator.IN, present)));
      } else {
        conditions.add(condition(expression, ConditionOperator.IN, List.copyOf(values)));
      }
    }
    return conditions;
  }

  /**
   * Events outside of the top rows: at least one field takes a value none of the top rows has.
   * Empty when the top rows carry no values to exclude.
   */
  public Optional<Condition> otherEventsCondition(
      List<String> fields, List<Map<String, Object>> topRows, RequestParams params) {
    List<Condition> conditions = new ArrayList<>();
    for (String field : fields) {
      String column = outputField(field);
      Set<Object> values = valuesOf(column, topRows);
      if (values.isEmpty()) {
        continue;
      }
      Expression expression = resolve(column, params);
      if (ColumnCatalog.TIMESTAMP.equals(column)) {
        conditions.add(
            combine(
                LogicalOperator.AND,
                values.stream()
                    .map(value -> condition(expression, ConditionOperator.NEQ, value))
                    .collect(Collectors.toList())));
      } else if (values.contains(null)) {
        List<Object> present =
            values.stream().filter(value -> value != null).collect(Collectors.toList());
        Condition isNotNull = condition(function("isNull", expression), ConditionOperator.EQ, 0L);
        conditions.add(
            present.isEmpty()
                ? isNotNull
                : and(isNotNull, condition(expression, ConditionOperator.NOT_IN, present)));
      } else {
        Condition notIn = condition(expression, ConditionOperator.NOT_IN, List.copyOf(values));
        conditions.add(
            or(condition(function("isNull", expression), ConditionOperator.EQ, 1L), notIn));
      }
    }
    return conditions.isEmpty()
        ? Optional.empty()
        : Optional.of(combine(LogicalOperator.OR, conditions));
  }

  /** The issue alias is returned under the issue id column. */
  static String outputField(String field) {
    return FieldAliasResolver.ISSUE.equals(field) ? FieldAliasResolver.ISSUE_ID : field;
  }

  /** Distinct scalar values of a field; array values cannot be matched and are skipped. */
  private static Set<Object> valuesOf(String field, List<Map<String, Object>> rows) {
    Set<Object> values = new LinkedHashSet<>();
    for (Map<String, Object> row : rows) {
      if (row.containsKey(field) && !(row.get(field) instanceof List)) {
        values.add(row.get(field));
      }
    }
    return values;
  }

  private Expression resolve(String field, RequestParams params) {
    return withoutAlias(
        aliasResolver.resolve(field, params).orElseGet(() -> columnCatalog.resolve(field)));
  }
}
