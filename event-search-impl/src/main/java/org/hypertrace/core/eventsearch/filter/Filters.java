package org.hypertrace.core.eventsearch.filter;

import java.util.List;
import org.hypertrace.core.eventsearch.api.FilterOperator;
import org.hypertrace.core.eventsearch.api.SearchFilter;

final class Filters {

  private Filters() {}

  /** {@code has:field} or {@code !has:field}, an (in)equality against the empty string. */
  static boolean isExistenceCheck(SearchFilter filter) {
    FilterOperator operator = filter.getOperator();
    return (operator == FilterOperator.EQ || operator == FilterOperator.NEQ)
        && filter.getValue().isEmptyString();
  }

  /** {@code has:field} */
  static boolean isPresenceCheck(SearchFilter filter) {
    return isExistenceCheck(filter) && filter.getOperator() == FilterOperator.NEQ;
  }

  static boolean isOne(Object value) {
    return "1".equals(value) || Long.valueOf(1).equals(value) || Integer.valueOf(1).equals(value)
        || Boolean.TRUE.equals(value) || "true".equals(value);
  }

  static boolean isZero(Object value) {
    return "0".equals(value) || Long.valueOf(0).equals(value) || Integer.valueOf(0).equals(value)
        || Boolean.FALSE.equals(value) || "false".equals(value);
  }

  /** {@code a}, {@code a and b}, {@code a, b, and c}. */
  static String oxfordize(List<String> items) {
    if (items.size() <= 1) {
      return String.join("", items);
    }
    if (items.size() == 2) {
      return items.get(0) + " and " + items.get(1);
    }
    return String.join(", ", items.subList(0, items.size() - 1))
        + ", and "
        + items.get(items.size() - 1);
  }
}
