package org.hypertrace.core.eventsearch.filter;

import java.util.Optional;
import org.hypertrace.core.eventsearch.api.Condition;
import org.hypertrace.core.eventsearch.api.SearchFilter;
import org.hypertrace.core.eventsearch.function.ArgumentContext;

/** What a converter may look at while converting one filter. */
public interface FilterContext extends ArgumentContext {

  /** Converts a rewritten filter with the converter registered for its key. */
  Optional<Condition> convert(SearchFilter filter);
}
