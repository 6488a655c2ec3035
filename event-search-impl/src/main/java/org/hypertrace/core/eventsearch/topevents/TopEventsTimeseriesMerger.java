package org.hypertrace.core.eventsearch.topevents;

import io.reactivex.rxjava3.core.Single;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import javax.annotation.Nullable;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.hypertrace.core.eventsearch.EventSearchConfig;
import org.hypertrace.core.eventsearch.alias.FieldAliasResolver;
import org.hypertrace.core.eventsearch.api.InvalidSearchQueryException;
import org.hypertrace.core.eventsearch.api.QueryPlan;
import org.hypertrace.core.eventsearch.api.spi.CatalogService;
import org.hypertrace.core.eventsearch.api.spi.QueryExecutor;
import org.hypertrace.core.eventsearch.api.spi.QueryResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits a grouped timeseries into one series per top row. Every timeseries row is filed under
 * the key of the top row it belongs to: the values of the grouping fields, joined by commas.
 * When the top rows fill the limit, everything else is counted under the "Other" key.
 */
@Singleton
public class TopEventsTimeseriesMerger {
  private static final Logger LOG = LoggerFactory.getLogger(TopEventsTimeseriesMerger.class);
  static final String UNKNOWN_ISSUE = "unknown";

  private final QueryExecutor executor;
  private final CatalogService catalogService;
  private final TopEventsConditionBuilder conditionBuilder;
  private final String otherKey;

  @Inject
  public TopEventsTimeseriesMerger(
      QueryExecutor executor,
      CatalogService catalogService,
      TopEventsConditionBuilder conditionBuilder,
      EventSearchConfig config) {
    this.executor = executor;
    this.catalogService = catalogService;
    this.conditionBuilder = conditionBuilder;
    this.otherKey = config.getOtherKey();
  }

  /**
   * Series keyed by result key, the "Other" series first when present, then by rank.
   *
   * @throws InvalidSearchQueryException when the rollup is shorter than a second
   */
  public Single<Map<String, TopEventsSeries>> merge(TopEventsQuery query) {
    Zerofill.checkRollup(query.getRollup());
    if (query.getTopEvents().isEmpty()) {
      return Single.just(Map.of());
    }
    QueryPlan topPlan =
        conditionBuilder.restrictToTopEvents(
            query.getTimeseriesPlan(), query.getFields(), query.getTopEvents(), query.getParams());
    Single<QueryResult> timeseries = executor.execute(topPlan);
    Single<Map<Object, String>> issues = Single.fromCallable(() -> resolveIssues(query));

    boolean includeOther =
        query.getOtherPlan() != null && query.getTopEvents().size() >= query.getLimit();
    if (!includeOther) {
      return Single.zip(
          timeseries, issues, (rows, shortIds) -> build(query, rows, null, shortIds));
    }
    QueryPlan otherPlan =
        conditionBuilder.restrictToOtherEvents(
            query.getOtherPlan(), query.getFields(), query.getTopEvents(), query.getParams());
    return Single.zip(
        timeseries,
        executor.execute(otherPlan),
        issues,
        (rows, otherRows, shortIds) -> build(query, rows, otherRows, shortIds));
  }

  private Map<String, TopEventsSeries> build(
      TopEventsQuery query,
      QueryResult timeseries,
      @Nullable QueryResult other,
      Map<Object, String> issues) {
    List<String> keyFields = keyFields(query.getFields());
    Map<String, Integer> order = new LinkedHashMap<>();
    Map<String, List<Map<String, Object>>> rowsByKey = new LinkedHashMap<>();
    if (other != null) {
      order.put(otherKey, query.getTopEvents().size());
      rowsByKey.put(otherKey, new ArrayList<>(other.getRows()));
    }
    List<Map<String, Object>> topEvents = query.getTopEvents();
    for (int rank = 0; rank < topEvents.size(); rank++) {
      String key = resultKey(topEvents.get(rank), keyFields, issues);
      order.putIfAbsent(key, rank);
      rowsByKey.putIfAbsent(key, new ArrayList<>());
    }

    for (Map<String, Object> row : timeseries.getRows()) {
      String key = resultKey(row, keyFields, issues);
      List<Map<String, Object>> rows = rowsByKey.get(key);
      if (rows == null || otherKey.equals(key)) {
        LOG.warn(
            "top-events timeseries key mismatch: {} is not one of {}", key, rowsByKey.keySet());
        continue;
      }
      rows.add(row);
    }

    Map<String, TopEventsSeries> series = new LinkedHashMap<>();
    rowsByKey.forEach(
        (key, rows) ->
            series.put(
                key,
                new TopEventsSeries(
                    order.get(key),
                    Zerofill.zerofill(
                        rows,
                        query.getStart(),
                        query.getEnd(),
                        query.getRollup(),
                        query.isTimeDescending()))));
    return series;
  }

  /** Row values are joined in field name order so both sides build the same key. */
  static List<String> keyFields(Collection<String> fields) {
    return fields.stream()
        .map(TopEventsConditionBuilder::outputField)
        .distinct()
        .sorted()
        .collect(Collectors.toList());
  }

  static String resultKey(
      Map<String, Object> row, List<String> fields, Map<Object, String> issues) {
    List<String> values = new ArrayList<>(fields.size());
    for (String field : fields) {
      Object value = row.get(field);
      if (FieldAliasResolver.ISSUE_ID.equals(field)) {
        Object issueId = normalizeId(value);
        values.add(issueId == null ? UNKNOWN_ISSUE : issues.getOrDefault(issueId, UNKNOWN_ISSUE));
        continue;
      }
      if (value instanceof List) {
        List<?> list = (List<?>) value;
        value = list.isEmpty() ? "" : list.get(list.size() - 1);
      }
      values.add(String.valueOf(value));
    }
    return String.join(",", values);
  }

  private Map<Object, String> resolveIssues(TopEventsQuery query) {
    boolean grouped =
        query.getFields().stream()
            .map(TopEventsConditionBuilder::outputField)
            .anyMatch(FieldAliasResolver.ISSUE_ID::equals);
    if (!grouped) {
      return Collections.emptyMap();
    }
    List<Long> issueIds =
        query.getTopEvents().stream()
            .map(row -> normalizeId(row.get(FieldAliasResolver.ISSUE_ID)))
            .filter(Objects::nonNull)
            .map(Long.class::cast)
            .distinct()
            .collect(Collectors.toList());
    if (issueIds.isEmpty()) {
      return Collections.emptyMap();
    }
    return new LinkedHashMap<>(catalogService.resolveIssueShortIds(issueIds));
  }

  /** Issue ids come back as any integral type; keys are compared as longs. */
  @Nullable
  private static Object normalizeId(@Nullable Object value) {
    return value instanceof Number ? (Object) ((Number) value).longValue() : null;
  }
}
