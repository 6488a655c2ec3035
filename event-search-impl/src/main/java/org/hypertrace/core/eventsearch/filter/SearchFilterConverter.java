package org.hypertrace.core.eventsearch.filter;

import java.util.Optional;
import org.hypertrace.core.eventsearch.api.Condition;
import org.hypertrace.core.eventsearch.api.InvalidSearchQueryException;
import org.hypertrace.core.eventsearch.api.SearchFilter;

/** Turns one row level filter into a where condition. */
@FunctionalInterface
public interface SearchFilterConverter {

  /**
   * @return empty when the filter holds for every row and needs no condition
   * @throws InvalidSearchQueryException when the filter value is not valid for its field
   */
  Optional<Condition> convert(SearchFilter filter, FilterContext context);
}
