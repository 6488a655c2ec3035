package org.hypertrace.core.eventsearch.condition;

import java.util.Optional;
import org.hypertrace.core.eventsearch.api.AggregateFilter;
import org.hypertrace.core.eventsearch.api.Condition;
import org.hypertrace.core.eventsearch.api.SearchFilter;

/** Converts the leaves of a search query. An empty result means the term filters nothing. */
public interface TermConverter {

  Optional<Condition> convertFilter(SearchFilter filter);

  Optional<Condition> convertAggregateFilter(AggregateFilter filter);
}
