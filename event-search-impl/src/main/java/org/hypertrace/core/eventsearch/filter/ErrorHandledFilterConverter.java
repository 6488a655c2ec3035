package org.hypertrace.core.eventsearch.filter;

import static org.hypertrace.core.eventsearch.api.InvalidSearchQueryException.Reason.INVALID_VALUE;
import static org.hypertrace.core.eventsearch.api.util.QueryPlanUtil.condition;
import static org.hypertrace.core.eventsearch.api.util.QueryPlanUtil.function;

import java.util.Optional;
import org.hypertrace.core.eventsearch.api.Condition;
import org.hypertrace.core.eventsearch.api.ConditionOperator;
import org.hypertrace.core.eventsearch.api.FilterOperator;
import org.hypertrace.core.eventsearch.api.InvalidSearchQueryException;
import org.hypertrace.core.eventsearch.api.SearchFilter;

/**
 * {@code error.handled} and {@code error.unhandled}. Both read the mechanism flags of the
 * exception stack; an event is unhandled when any of its exceptions is.
 */
public class ErrorHandledFilterConverter implements SearchFilterConverter {
  private final boolean handled;

  public ErrorHandledFilterConverter(boolean handled) {
    this.handled = handled;
  }

  @Override
  public Optional<Condition> convert(SearchFilter filter, FilterContext context) {
    if (Filters.isExistenceCheck(filter)) {
      boolean present = Filters.isPresenceCheck(filter);
      return Optional.of(isHandled(handled == present ? 1L : 0L));
    }

    Object value = filter.getValue().getValue();
    boolean one = Filters.isOne(value);
    if (!one && !Filters.isZero(value)) {
      throw new InvalidSearchQueryException(
          INVALID_VALUE,
          String.format(
              "Invalid value for %s condition. Accepted values are 1, 0",
              handled ? "error.handled" : "error.unhandled"));
    }
    if (filter.getOperator() == FilterOperator.NEQ) {
      one = !one;
    }
    // asking for handled events is asking for events without unhandled exceptions
    boolean wantsHandled = handled == one;
    return Optional.of(
        condition(
            function(wantsHandled ? "isHandled" : "notHandled"), ConditionOperator.EQ, 1L));
  }

  private static Condition isHandled(long expected) {
    return condition(function("isHandled"), ConditionOperator.EQ, expected);
  }
}
