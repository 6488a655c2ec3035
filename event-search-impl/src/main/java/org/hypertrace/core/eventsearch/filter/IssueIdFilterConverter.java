package org.hypertrace.core.eventsearch.filter;

import static org.hypertrace.core.eventsearch.api.util.QueryPlanUtil.condition;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import javax.inject.Singleton;
import org.hypertrace.core.eventsearch.api.Condition;
import org.hypertrace.core.eventsearch.api.Expression;
import org.hypertrace.core.eventsearch.api.SearchFilter;
import org.hypertrace.core.eventsearch.column.ColumnCatalog;

/**
 * {@code issue.id:} compares the raw group column. Events without an issue carry {@code 0} there,
 * so empty values are compared to zero instead of null.
 */
@Singleton
public class IssueIdFilterConverter implements SearchFilterConverter {

  @Override
  public Optional<Condition> convert(SearchFilter filter, FilterContext context) {
    Expression column = context.getColumnCatalog().resolve(ColumnCatalog.ISSUE_ID);
    if (filter.isInFilter()) {
      List<Object> values =
          filter.getValue().getValues().stream()
              .map(value -> isEmpty(value) ? 0L : value)
              .collect(Collectors.toList());
      return Optional.of(condition(column, filter.getOperator().toConditionOperator(), values));
    }
    Object value = filter.getValue().getValue();
    return Optional.of(
        condition(column, filter.getOperator().toConditionOperator(), isEmpty(value) ? 0L : value));
  }

  private static boolean isEmpty(Object value) {
    return value == null || "".equals(value) || Filters.isZero(value);
  }
}
