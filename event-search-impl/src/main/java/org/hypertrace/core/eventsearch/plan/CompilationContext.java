package org.hypertrace.core.eventsearch.plan;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.hypertrace.core.eventsearch.alias.FieldAliasResolver;
import org.hypertrace.core.eventsearch.api.Condition;
import org.hypertrace.core.eventsearch.api.Expression;
import org.hypertrace.core.eventsearch.api.RequestParams;
import org.hypertrace.core.eventsearch.api.SearchFilter;
import org.hypertrace.core.eventsearch.column.ColumnCatalog;
import org.hypertrace.core.eventsearch.condition.AggregateFilterContext;
import org.hypertrace.core.eventsearch.filter.FilterContext;
import org.hypertrace.core.eventsearch.filter.FilterConverterRegistry;
import org.hypertrace.core.eventsearch.function.ResolvedFunction;

/**
 * State of a single compilation. Alias expansions are looked up once per request since some of
 * them go through the catalog. Not shared between threads.
 */
class CompilationContext implements FilterContext, AggregateFilterContext {
  private final RequestParams params;
  private final Collection<String> functionsAcl;
  private final ColumnCatalog columnCatalog;
  private final FieldAliasResolver aliasResolver;
  private final FilterConverterRegistry filterConverters;
  private final Map<String, Optional<Expression>> resolvedAliases = new HashMap<>();
  private final List<ResolvedFunction> havingFunctions = new ArrayList<>();

  CompilationContext(
      RequestParams params,
      Collection<String> functionsAcl,
      ColumnCatalog columnCatalog,
      FieldAliasResolver aliasResolver,
      FilterConverterRegistry filterConverters) {
    this.params = params;
    this.functionsAcl = functionsAcl;
    this.columnCatalog = columnCatalog;
    this.aliasResolver = aliasResolver;
    this.filterConverters = filterConverters;
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
    Optional<Expression> resolved = resolvedAliases.get(field);
    if (resolved == null) {
      resolved = aliasResolver.resolve(field, params);
      resolvedAliases.put(field, resolved);
    }
    return resolved;
  }

  @Override
  public Optional<Condition> convert(SearchFilter filter) {
    return filterConverters.convert(filter, this);
  }

  @Override
  public Collection<String> getFunctionsAcl() {
    return functionsAcl;
  }

  @Override
  public void addHavingFunction(ResolvedFunction function) {
    havingFunctions.add(function);
  }

  List<ResolvedFunction> getHavingFunctions() {
    return havingFunctions;
  }
}
