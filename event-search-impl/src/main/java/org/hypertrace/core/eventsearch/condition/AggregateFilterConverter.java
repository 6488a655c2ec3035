package org.hypertrace.core.eventsearch.condition;

import static org.hypertrace.core.eventsearch.api.util.QueryPlanUtil.condition;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.hypertrace.core.eventsearch.api.AggregateFilter;
import org.hypertrace.core.eventsearch.api.ColumnReference;
import org.hypertrace.core.eventsearch.api.Condition;
import org.hypertrace.core.eventsearch.api.FilterOperator;
import org.hypertrace.core.eventsearch.api.SearchValue;
import org.hypertrace.core.eventsearch.api.util.QueryPlanUtil;
import org.hypertrace.core.eventsearch.function.FunctionCallParser;
import org.hypertrace.core.eventsearch.function.FunctionResolver;
import org.hypertrace.core.eventsearch.function.ResolvedFunction;

/**
 * Having conditions compare the output of a selected aggregate, so the left hand side refers to
 * the aggregate by its alias.
 */
@Singleton
public class AggregateFilterConverter {
  private final FunctionResolver functionResolver;

  @Inject
  public AggregateFilterConverter(FunctionResolver functionResolver) {
    this.functionResolver = functionResolver;
  }

  public Optional<Condition> convert(AggregateFilter filter, AggregateFilterContext context) {
    FilterOperator operator = filter.getOperator();
    SearchValue value = filter.getValue();

    if ((operator == FilterOperator.EQ || operator == FilterOperator.NEQ)
        && value.isEmptyString()) {
      ColumnReference output =
          ColumnReference.of(FunctionCallParser.getFunctionAlias(filter.getFunction()));
      return Optional.of(
          operator == FilterOperator.EQ
              ? QueryPlanUtil.isNull(output)
              : QueryPlanUtil.isNotNull(output));
    }

    ResolvedFunction function =
        functionResolver.resolve(filter.getFunction(), context, context.getFunctionsAcl());
    context.addHavingFunction(function);
    ColumnReference output = ColumnReference.of(function.getAlias());

    if (filter.getOperator().isInOperator()) {
      return Optional.of(
          condition(output, operator.toConditionOperator(), List.copyOf(value.getValues())));
    }
    return Optional.of(condition(output, operator.toConditionOperator(), toComparable(value)));
  }

  /** Dates compare against aggregates as epoch seconds. */
  private static Object toComparable(SearchValue value) {
    if (value.getValue() instanceof Instant) {
      return ((Instant) value.getValue()).getEpochSecond();
    }
    return value.getValue();
  }
}
