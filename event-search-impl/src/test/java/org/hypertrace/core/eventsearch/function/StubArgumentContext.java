package org.hypertrace.core.eventsearch.function;

import java.util.Optional;
import org.hypertrace.core.eventsearch.EventSearchConfig;
import org.hypertrace.core.eventsearch.alias.FieldAliasResolver;
import org.hypertrace.core.eventsearch.api.Expression;
import org.hypertrace.core.eventsearch.api.RequestParams;
import org.hypertrace.core.eventsearch.api.spi.CatalogService;
import org.hypertrace.core.eventsearch.column.ColumnCatalog;

class StubArgumentContext implements ArgumentContext {
  private final RequestParams params;
  private final ColumnCatalog columnCatalog;
  private final FieldAliasResolver aliasResolver;

  StubArgumentContext(RequestParams params, CatalogService catalogService) {
    EventSearchConfig config = EventSearchConfig.defaults();
    this.params = params;
    this.columnCatalog = new ColumnCatalog(config);
    this.aliasResolver = new FieldAliasResolver(catalogService, columnCatalog, config);
  }

  @Override
  public RequestParams getParams() {
    return params;
  }

  @Override
  public ColumnCatalog getColumnCatalog() {
    return columnCatalog;
  }

  @Override
  public Optional<Expression> resolveFieldAlias(String field) {
    return aliasResolver.resolve(field, params);
  }
}
