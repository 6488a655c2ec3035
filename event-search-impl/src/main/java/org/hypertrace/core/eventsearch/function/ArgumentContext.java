package org.hypertrace.core.eventsearch.function;

import java.util.Optional;
import org.hypertrace.core.eventsearch.api.Expression;
import org.hypertrace.core.eventsearch.api.RequestParams;
import org.hypertrace.core.eventsearch.column.ColumnCatalog;

/** What argument normalization may look at while resolving one function. */
public interface ArgumentContext {

  RequestParams getParams();

  ColumnCatalog getColumnCatalog();

  /** Expression of a virtual field, when {@code field} names one. */
  Optional<Expression> resolveFieldAlias(String field);

  /** Alias expansion first, then the column catalog. */
  default Expression resolveField(String field) {
    return resolveFieldAlias(field).orElseGet(() -> getColumnCatalog().resolve(field));
  }
}
