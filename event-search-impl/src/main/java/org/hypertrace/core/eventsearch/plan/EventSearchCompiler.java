package org.hypertrace.core.eventsearch.plan;

import static org.hypertrace.core.eventsearch.api.InvalidSearchQueryException.Reason.INVALID_ARGUMENT;
import static org.hypertrace.core.eventsearch.api.InvalidSearchQueryException.Reason.INVALID_VALUE;
import static org.hypertrace.core.eventsearch.api.InvalidSearchQueryException.Reason.MALFORMED_QUERY;
import static org.hypertrace.core.eventsearch.api.InvalidSearchQueryException.Reason.MISSING_PARAMETER;
import static org.hypertrace.core.eventsearch.api.util.QueryPlanUtil.columnCondition;

import io.reactivex.rxjava3.core.Single;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.apache.commons.lang3.StringUtils;
import org.hypertrace.core.eventsearch.alias.FieldAliasResolver;
import org.hypertrace.core.eventsearch.api.AggregateFilter;
import org.hypertrace.core.eventsearch.api.ColumnReference;
import org.hypertrace.core.eventsearch.api.Condition;
import org.hypertrace.core.eventsearch.api.ConditionOperator;
import org.hypertrace.core.eventsearch.api.Expression;
import org.hypertrace.core.eventsearch.api.InvalidSearchQueryException;
import org.hypertrace.core.eventsearch.api.OrderBy;
import org.hypertrace.core.eventsearch.api.ParsedTerm;
import org.hypertrace.core.eventsearch.api.QueryPlan;
import org.hypertrace.core.eventsearch.api.RequestParams;
import org.hypertrace.core.eventsearch.api.ResultType;
import org.hypertrace.core.eventsearch.api.SearchFilter;
import org.hypertrace.core.eventsearch.api.SortDirection;
import org.hypertrace.core.eventsearch.api.spi.SearchTokenizer;
import org.hypertrace.core.eventsearch.column.ColumnCatalog;
import org.hypertrace.core.eventsearch.condition.AggregateFilterConverter;
import org.hypertrace.core.eventsearch.condition.BooleanConditionCompiler;
import org.hypertrace.core.eventsearch.condition.ConditionPair;
import org.hypertrace.core.eventsearch.condition.TermConverter;
import org.hypertrace.core.eventsearch.filter.EnvironmentFilterConverter;
import org.hypertrace.core.eventsearch.filter.FilterConverterRegistry;
import org.hypertrace.core.eventsearch.function.FunctionCallParser;
import org.hypertrace.core.eventsearch.function.FunctionResolver;
import org.hypertrace.core.eventsearch.function.ResolvedFunction;
import org.hypertrace.core.eventsearch.validation.PlanValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles a search request into a {@link QueryPlan}: time window and scope conditions, the
 * where and having conditions of the search query, the selected columns and aggregations, group
 * by and order by. The finished plan goes through the registered plan validations.
 */
@Singleton
public class EventSearchCompiler {
  private static final Logger LOG = LoggerFactory.getLogger(EventSearchCompiler.class);

  static final String AUTO_FIELD_ID = "id";

  private final SearchTokenizer tokenizer;
  private final ColumnCatalog columnCatalog;
  private final FieldAliasResolver aliasResolver;
  private final FilterConverterRegistry filterConverters;
  private final FunctionResolver functionResolver;
  private final BooleanConditionCompiler booleanCompiler;
  private final AggregateFilterConverter aggregateFilterConverter;
  private final PlanValidator planValidator;

  @Inject
  public EventSearchCompiler(
      SearchTokenizer tokenizer,
      ColumnCatalog columnCatalog,
      FieldAliasResolver aliasResolver,
      FilterConverterRegistry filterConverters,
      FunctionResolver functionResolver,
      BooleanConditionCompiler booleanCompiler,
      AggregateFilterConverter aggregateFilterConverter,
      PlanValidator planValidator) {
    this.tokenizer = tokenizer;
    this.columnCatalog = columnCatalog;
    this.aliasResolver = aliasResolver;
    this.filterConverters = filterConverters;
    this.functionResolver = functionResolver;
    this.booleanCompiler = booleanCompiler;
    this.aggregateFilterConverter = aggregateFilterConverter;
    this.planValidator = planValidator;
  }

  /**
   * Tokenizes the query text of the request and compiles it.
   *
   * @throws org.hypertrace.core.eventsearch.api.SearchParseException when the text is malformed
   * @throws InvalidSearchQueryException when the request cannot be compiled or the plan is invalid
   */
  public QueryPlan compile(SearchRequest request) {
    return compilePlan(request).blockingGet();
  }

  /** Compiles already tokenized terms; the query text of the request is ignored. */
  public QueryPlan compile(List<ParsedTerm> terms, SearchRequest request) {
    return compilePlan(terms, request).blockingGet();
  }

  public Single<QueryPlan> compilePlan(SearchRequest request) {
    return Single.fromCallable(() -> tokenize(request))
        .flatMap(terms -> compilePlan(terms, request));
  }

  public Single<QueryPlan> compilePlan(List<ParsedTerm> terms, SearchRequest request) {
    return Single.fromCallable(() -> assemble(terms, request))
        .flatMap(plan -> planValidator.validate(plan, request).andThen(Single.just(plan)));
  }

  private List<ParsedTerm> tokenize(SearchRequest request) {
    if (StringUtils.isBlank(request.getQuery())) {
      return List.of();
    }
    return tokenizer.parse(request.getQuery(), request.getParams());
  }

  QueryPlan assemble(List<ParsedTerm> terms, SearchRequest request) {
    RequestParams params = request.getParams();
    if (params.getStart() == null || params.getEnd() == null) {
      throw new InvalidSearchQueryException(
          MISSING_PARAMETER, "Cannot query without a valid date range");
    }
    CompilationContext context =
        new CompilationContext(
            params, request.getFunctionsAcl(), columnCatalog, aliasResolver, filterConverters);
    QueryPlan.QueryPlanBuilder plan = QueryPlan.builder();

    plan.whereCondition(columnCondition("timestamp", ConditionOperator.GTE, params.getStart()));
    plan.whereCondition(columnCondition("timestamp", ConditionOperator.LT, params.getEnd()));

    ConditionPair conditions = booleanCompiler.compile(terms, termConverter(context, request));
    plan.whereConditions(conditions.flattenWhere());
    plan.havingConditions(conditions.flattenHaving());

    if (!params.getProjectIds().isEmpty()) {
      plan.whereCondition(
          columnCondition("project_id", ConditionOperator.IN, List.copyOf(params.getProjectIds())));
    }
    if (!params.getEnvironments().isEmpty()) {
      plan.whereCondition(
          EnvironmentFilterConverter.toCondition(
              columnCatalog.resolve(ColumnCatalog.ENVIRONMENT), params.getEnvironments(), false));
    }

    SelectedFields selected = resolveFields(request, context);
    addHavingAggregates(selected, context, request.isAutoAggregations());

    plan.selectedColumns(selected.columns.values());
    plan.aggregations(selected.aggregations.values());
    if (!selected.aggregations.isEmpty()) {
      plan.groupBy(
          selected.columns.values().stream()
              .map(EventSearchCompiler::outputReference)
              .collect(Collectors.toList()));
    }
    plan.resultTypes(selected.resultTypes);
    plan.orderBy(resolveOrderBy(request.getOrderBy(), selected));
    plan.limit(request.getLimit());
    plan.offset(request.getOffset());

    QueryPlan compiled = plan.build();
    if (LOG.isDebugEnabled()) {
      LOG.debug("Compiled query '{}' to {}", request.getQuery(), compiled);
    }
    return compiled;
  }

  private TermConverter termConverter(CompilationContext context, SearchRequest request) {
    return new TermConverter() {
      @Override
      public Optional<Condition> convertFilter(SearchFilter filter) {
        return context.convert(filter);
      }

      @Override
      public Optional<Condition> convertAggregateFilter(AggregateFilter filter) {
        if (!request.isUseAggregateConditions()) {
          throw new InvalidSearchQueryException(
              MALFORMED_QUERY,
              String.format(
                  "Aggregate filter %s cannot be used in this query", filter.getFunction()));
        }
        return aggregateFilterConverter.convert(filter, context);
      }
    };
  }

  private SelectedFields resolveFields(SearchRequest request, CompilationContext context) {
    SelectedFields selected = new SelectedFields();
    Set<String> fields = new LinkedHashSet<>(request.getSelectedFields());
    List<ResolvedFunction> functions = new ArrayList<>();

    for (String field : fields) {
      if (FunctionCallParser.isFunction(field)
          || context.getParams().getAliases().containsKey(field)) {
        ResolvedFunction function =
            functionResolver.resolve(field, context, request.getFunctionsAcl());
        functions.add(function);
        selected.add(function);
      } else {
        selected.addColumn(field, resolveColumn(field, context));
      }
    }

    if (request.isAutoFields() && selected.aggregations.isEmpty()) {
      for (String field : List.of(AUTO_FIELD_ID, ColumnCatalog.PROJECT_ID)) {
        if (!selected.columns.containsKey(field)) {
          selected.addColumn(field, resolveColumn(field, context));
        }
      }
    }

    for (ResolvedFunction function : functions) {
      Optional<String> column = function.getRedundantGroupingColumn();
      if (column.isPresent() && selected.columns.containsKey(column.get())) {
        List<String> conflicting =
            functions.stream()
                .filter(other -> column.equals(other.getRedundantGroupingColumn()))
                .map(ResolvedFunction::getField)
                .collect(Collectors.toList());
        throw new InvalidSearchQueryException(
            INVALID_ARGUMENT,
            String.format(
                "A single field cannot be used both inside and outside a function in the same"
                    + " query. To use %s you must first remove the function(s): %s",
                column.get(), String.join(", ", conflicting)));
      }
    }
    return selected;
  }

  private SelectedColumn resolveColumn(String field, CompilationContext context) {
    Expression expression =
        context.resolveFieldAlias(field).orElseGet(() -> columnCatalog.resolve(field));
    if (expression.getAlias() == null) {
      expression = FunctionResolver.withAlias(expression, field);
    }
    ResultType resultType =
        aliasResolver.isAlias(field)
            ? aliasResolver.getResultType(field)
            : columnCatalog.getResultType(field);
    return new SelectedColumn(expression, resultType);
  }

  private void addHavingAggregates(
      SelectedFields selected, CompilationContext context, boolean autoAggregations) {
    for (ResolvedFunction function : context.getHavingFunctions()) {
      if (selected.aggregations.containsKey(function.getAlias())) {
        continue;
      }
      if (!autoAggregations) {
        throw new InvalidSearchQueryException(
            INVALID_VALUE,
            String.format(
                "Aggregate %s used in a condition but is not a selected column.",
                function.getField()));
      }
      selected.add(function);
    }
  }

  private static List<OrderBy> resolveOrderBy(List<String> orderBy, SelectedFields selected) {
    List<OrderBy> resolved = new ArrayList<>();
    for (String field : orderBy) {
      SortDirection direction = SortDirection.ASC;
      String name = field.trim();
      if (name.startsWith("-")) {
        direction = SortDirection.DESC;
        name = name.substring(1);
      }
      String alias = FunctionCallParser.getFunctionAlias(name);
      if (!selected.hasOutput(alias)) {
        throw new InvalidSearchQueryException(
            INVALID_VALUE, "Cannot order by a field that is not selected.");
      }
      resolved.add(new OrderBy(ColumnReference.of(alias), direction));
    }
    return resolved;
  }

  private static Expression outputReference(Expression expression) {
    return expression.getAlias() == null ? expression : ColumnReference.of(expression.getAlias());
  }

  private static class SelectedColumn {
    final Expression expression;
    final ResultType resultType;

    SelectedColumn(Expression expression, ResultType resultType) {
      this.expression = expression;
      this.resultType = resultType;
    }
  }

  /** Selected outputs keyed by alias, in request order. */
  private static class SelectedFields {
    final Map<String, Expression> columns = new LinkedHashMap<>();
    final Map<String, Expression> aggregations = new LinkedHashMap<>();
    final Map<String, ResultType> resultTypes = new LinkedHashMap<>();

    void add(ResolvedFunction function) {
      if (function.isAggregate()) {
        aggregations.put(function.getAlias(), function.getExpression());
      } else {
        columns.put(function.getAlias(), function.getExpression());
      }
      if (function.getResultType() != null) {
        resultTypes.put(function.getAlias(), function.getResultType());
      }
    }

    void addColumn(String field, SelectedColumn column) {
      columns.put(field, column.expression);
      resultTypes.put(field, column.resultType);
    }

    boolean hasOutput(String alias) {
      return columns.containsKey(alias) || aggregations.containsKey(alias);
    }
  }
}
