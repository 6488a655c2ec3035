package org.hypertrace.core.eventsearch.filter;

import static org.hypertrace.core.eventsearch.api.util.QueryPlanUtil.condition;
import static org.hypertrace.core.eventsearch.api.util.QueryPlanUtil.function;
import static org.hypertrace.core.eventsearch.api.util.QueryPlanUtil.literal;

import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.hypertrace.core.eventsearch.api.Condition;
import org.hypertrace.core.eventsearch.api.ConditionOperator;
import org.hypertrace.core.eventsearch.api.FilterOperator;
import org.hypertrace.core.eventsearch.api.SearchFilter;

/**
 * {@code trace.parent_span} lives in the contexts map, where a root span has no entry at all.
 * Existence is checked on the context keys.
 */
@Singleton
public class TraceParentSpanFilterConverter implements SearchFilterConverter {
  private final DefaultFilterConverter defaultConverter;

  @Inject
  public TraceParentSpanFilterConverter(DefaultFilterConverter defaultConverter) {
    this.defaultConverter = defaultConverter;
  }

  @Override
  public Optional<Condition> convert(SearchFilter filter, FilterContext context) {
    if (Filters.isExistenceCheck(filter)) {
      return Optional.of(
          condition(
              function(
                  "has",
                  context.getColumnCatalog().resolve("contexts.key"),
                  literal("trace.parent_span")),
              filter.getOperator() == FilterOperator.NEQ
                  ? ConditionOperator.EQ
                  : ConditionOperator.NEQ,
              1L));
    }
    return defaultConverter.convert(filter, context);
  }
}
