package org.hypertrace.core.eventsearch.alias;

import static org.hypertrace.core.eventsearch.api.InvalidSearchQueryException.Reason.MISSING_PARAMETER;
import static org.hypertrace.core.eventsearch.api.InvalidSearchQueryException.Reason.TOO_MANY_THRESHOLDS;
import static org.hypertrace.core.eventsearch.api.util.QueryPlanUtil.function;
import static org.hypertrace.core.eventsearch.api.util.QueryPlanUtil.literal;

import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.hypertrace.core.eventsearch.EventSearchConfig;
import org.hypertrace.core.eventsearch.EventSearchConfig.ThresholdDefaultsConfig;
import org.hypertrace.core.eventsearch.api.Expression;
import org.hypertrace.core.eventsearch.api.FunctionCall;
import org.hypertrace.core.eventsearch.api.InvalidSearchQueryException;
import org.hypertrace.core.eventsearch.api.NotImplementedFieldException;
import org.hypertrace.core.eventsearch.api.RequestParams;
import org.hypertrace.core.eventsearch.api.ResultType;
import org.hypertrace.core.eventsearch.api.spi.CatalogService;
import org.hypertrace.core.eventsearch.api.spi.KeyTransaction;
import org.hypertrace.core.eventsearch.api.spi.ProjectThreshold;
import org.hypertrace.core.eventsearch.api.spi.ThresholdConfigs;
import org.hypertrace.core.eventsearch.api.spi.TransactionThreshold;
import org.hypertrace.core.eventsearch.column.ColumnCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Virtual fields: names that expand to an expression instead of a column. Some of them depend on
 * the request scope and are looked up through the {@link CatalogService}.
 */
@Singleton
public class FieldAliasResolver {
  private static final Logger LOG = LoggerFactory.getLogger(FieldAliasResolver.class);

  public static final String PROJECT = "project";
  public static final String PROJECT_NAME = "project.name";
  public static final String ISSUE = "issue";
  public static final String ISSUE_ID = "issue.id";
  public static final String TIMESTAMP_TO_HOUR = "timestamp.to_hour";
  public static final String TIMESTAMP_TO_DAY = "timestamp.to_day";
  public static final String USER_DISPLAY = "user.display";
  public static final String HTTP_STATUS_CODE = "http.status_code";
  public static final String ERROR_HANDLED = "error.handled";
  public static final String ERROR_UNHANDLED = "error.unhandled";
  public static final String TEAM_KEY_TRANSACTION = "team_key_transaction";
  public static final String KEY_TRANSACTION = "key_transaction";
  public static final String PROJECT_THRESHOLD_CONFIG = "project_threshold_config";

  private final CatalogService catalogService;
  private final ColumnCatalog columnCatalog;
  private final ThresholdDefaultsConfig thresholdDefaults;
  private final int maxQueryableThresholds;
  private final Map<String, AliasBuilder> aliases;
  private final Map<String, ResultType> resultTypes;

  @Inject
  public FieldAliasResolver(
      CatalogService catalogService, ColumnCatalog columnCatalog, EventSearchConfig config) {
    this.catalogService = catalogService;
    this.columnCatalog = columnCatalog;
    this.thresholdDefaults = config.getThresholdDefaults();
    this.maxQueryableThresholds = config.getLimits().getMaxQueryableThresholds();
    this.aliases =
        ImmutableMap.<String, AliasBuilder>builder()
            .put(PROJECT, params -> projectSlug(PROJECT, params))
            .put(PROJECT_NAME, params -> projectSlug(PROJECT_NAME, params))
            .put(ISSUE, params -> issueId())
            .put(ISSUE_ID, params -> issueId())
            .put(
                TIMESTAMP_TO_HOUR,
                params -> function("toStartOfHour", column("timestamp")).withAlias(TIMESTAMP_TO_HOUR))
            .put(
                TIMESTAMP_TO_DAY,
                params -> function("toStartOfDay", column("timestamp")).withAlias(TIMESTAMP_TO_DAY))
            .put(
                USER_DISPLAY,
                params ->
                    function(
                            "coalesce",
                            column("user.email"),
                            column("user.username"),
                            column("user.id"),
                            column("user.ip"))
                        .withAlias(USER_DISPLAY))
            .put(
                HTTP_STATUS_CODE,
                params ->
                    function(
                            "coalesce",
                            function("nullif", column(HTTP_STATUS_CODE), literal("")),
                            column("tags[http.status_code]"))
                        .withAlias(HTTP_STATUS_CODE))
            .put(ERROR_HANDLED, params -> function("isHandled").withAlias(ERROR_HANDLED))
            .put(ERROR_UNHANDLED, params -> function("notHandled").withAlias(ERROR_UNHANDLED))
            .put(TEAM_KEY_TRANSACTION, this::teamKeyTransaction)
            .put(
                KEY_TRANSACTION,
                params -> {
                  throw new NotImplementedFieldException(
                      "key_transaction is not supported, use team_key_transaction instead");
                })
            .put(PROJECT_THRESHOLD_CONFIG, this::projectThresholdConfig)
            .build();
    this.resultTypes =
        ImmutableMap.<String, ResultType>builder()
            .put(ISSUE, ResultType.INTEGER)
            .put(ISSUE_ID, ResultType.INTEGER)
            .put(TIMESTAMP_TO_HOUR, ResultType.DATE)
            .put(TIMESTAMP_TO_DAY, ResultType.DATE)
            .put(TEAM_KEY_TRANSACTION, ResultType.BOOLEAN)
            .put(ERROR_HANDLED, ResultType.BOOLEAN)
            .put(ERROR_UNHANDLED, ResultType.BOOLEAN)
            .build();
  }

  public boolean isAlias(String field) {
    return aliases.containsKey(field);
  }

  /**
   * Aliased expression of a virtual field, empty for anything else.
   *
   * @throws InvalidSearchQueryException when the request lacks what the alias needs
   * @throws NotImplementedFieldException for recognised fields that are not supported
   */
  public Optional<Expression> resolve(String field, RequestParams params) {
    AliasBuilder builder = aliases.get(field);
    if (builder == null) {
      return Optional.empty();
    }
    return Optional.of(builder.build(params));
  }

  public ResultType getResultType(String field) {
    return resultTypes.getOrDefault(field, ResultType.STRING);
  }

  private Expression column(String field) {
    return columnCatalog.resolve(field);
  }

  private FunctionCall issueId() {
    return function("coalesce", column(ISSUE_ID), literal(0L)).withAlias(ISSUE_ID);
  }

  /** {@code transform(project_id, [ids], [slugs], '')}, ordered by project id. */
  private Expression projectSlug(String alias, RequestParams params) {
    Map<String, Long> slugs = catalogService.resolveProjectSlugs(params.getProjectIds());
    List<Map.Entry<String, Long>> projects =
        slugs.entrySet().stream()
            .sorted(Map.Entry.comparingByValue())
            .collect(Collectors.toList());
    return function(
            "transform",
            column(ColumnCatalog.PROJECT_ID),
            literal(projects.stream().map(Map.Entry::getValue).collect(Collectors.toList())),
            literal(projects.stream().map(Map.Entry::getKey).collect(Collectors.toList())),
            literal(""))
        .withAlias(alias);
  }

  private Expression teamKeyTransaction(RequestParams params) {
    if (params.getOrganizationId() == null || params.getTeamIds().isEmpty()) {
      throw new InvalidSearchQueryException(
          MISSING_PARAMETER, "Team key transactions parameters cannot be None");
    }
    List<KeyTransaction> keyTransactions =
        catalogService.resolveTeamKeyTransactions(
            params.getOrganizationId(), params.getTeamIds(), params.getProjectIds());
    if (keyTransactions.isEmpty()) {
      return function("toInt8", literal(0L)).withAlias(TEAM_KEY_TRANSACTION);
    }
    List<Expression> keys =
        keyTransactions.stream()
            .map(
                keyTransaction ->
                    function(
                        "tuple",
                        function("toUInt64", literal(keyTransaction.getProjectId())),
                        literal(keyTransaction.getTransaction())))
            .collect(Collectors.toList());
    return function(
            "in",
            function("tuple", column(ColumnCatalog.PROJECT_ID), column("transaction")),
            FunctionCall.of("array", keys))
        .withAlias(TEAM_KEY_TRANSACTION);
  }

  /**
   * The {@code (metric, threshold)} tuple that applies to each event: a transaction override, else
   * a project threshold, else the default. Entries equal to what they override are left out.
   */
  private Expression projectThresholdConfig(RequestParams params) {
    List<Expression> projectKeys = new ArrayList<>();
    List<Expression> projectValues = new ArrayList<>();
    List<Expression> overrideKeys = new ArrayList<>();
    List<Expression> overrideValues = new ArrayList<>();

    if (params.getOrganizationId() != null) {
      ThresholdConfigs configs =
          catalogService.resolveThresholdConfigs(
              params.getOrganizationId(), params.getProjectIds());
      if (configs.size() > maxQueryableThresholds) {
        throw new InvalidSearchQueryException(
            TOO_MANY_THRESHOLDS,
            String.format(
                "Exceeded %d configured transaction thresholds limit, try with fewer Projects.",
                maxQueryableThresholds));
      }
      if (LOG.isDebugEnabled()) {
        LOG.debug(
            "Resolved {} project and {} transaction thresholds",
            configs.getProjectThresholds().size(),
            configs.getTransactionThresholds().size());
      }

      Map<Long, ProjectThreshold> projectThresholds = new HashMap<>();
      for (ProjectThreshold threshold : configs.getProjectThresholds()) {
        if (isDefault(threshold.getMetric(), threshold.getThreshold())) {
          continue;
        }
        projectThresholds.put(threshold.getProjectId(), threshold);
        projectKeys.add(function("toUInt64", literal(threshold.getProjectId())));
        projectValues.add(thresholdTuple(threshold.getMetric(), threshold.getThreshold()));
      }

      for (TransactionThreshold threshold : configs.getTransactionThresholds()) {
        ProjectThreshold projectThreshold = projectThresholds.get(threshold.getProjectId());
        boolean sameAsProject =
            projectThreshold != null
                && projectThreshold.getThreshold() == threshold.getThreshold()
                && projectThreshold.getMetric().equals(threshold.getMetric());
        boolean sameAsDefault =
            projectThreshold == null && isDefault(threshold.getMetric(), threshold.getThreshold());
        if (sameAsProject || sameAsDefault) {
          continue;
        }
        overrideKeys.add(
            function(
                "tuple",
                function("toUInt64", literal(threshold.getProjectId())),
                literal(threshold.getTransaction())));
        overrideValues.add(thresholdTuple(threshold.getMetric(), threshold.getThreshold()));
      }
    }

    Expression projectConfig = defaultThreshold();
    if (!projectKeys.isEmpty()) {
      FunctionCall index =
          function(
              "indexOf", FunctionCall.of("array", projectKeys), column(ColumnCatalog.PROJECT_ID));
      projectConfig =
          function(
              "if",
              function("equals", index, literal(0L)),
              defaultThreshold(),
              function("arrayElement", FunctionCall.of("array", projectValues), index));
    }
    if (overrideKeys.isEmpty()) {
      return ((FunctionCall) projectConfig).withAlias(PROJECT_THRESHOLD_CONFIG);
    }
    FunctionCall overrideIndex =
        function(
            "indexOf",
            FunctionCall.of("array", overrideKeys),
            function("tuple", column(ColumnCatalog.PROJECT_ID), column("transaction")));
    return function(
            "if",
            function("equals", overrideIndex, literal(0L)),
            projectConfig,
            function("arrayElement", FunctionCall.of("array", overrideValues), overrideIndex))
        .withAlias(PROJECT_THRESHOLD_CONFIG);
  }

  private boolean isDefault(String metric, long threshold) {
    return threshold == thresholdDefaults.getThreshold()
        && metric.equals(thresholdDefaults.getMetric());
  }

  private FunctionCall defaultThreshold() {
    return thresholdTuple(thresholdDefaults.getMetric(), thresholdDefaults.getThreshold());
  }

  private static FunctionCall thresholdTuple(String metric, long threshold) {
    return function("tuple", literal(metric), literal(threshold));
  }

  @FunctionalInterface
  private interface AliasBuilder {
    Expression build(RequestParams params);
  }
}
