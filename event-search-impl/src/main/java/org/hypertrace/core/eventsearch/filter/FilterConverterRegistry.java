package org.hypertrace.core.eventsearch.filter;

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.hypertrace.core.eventsearch.EventSearchConfig;
import org.hypertrace.core.eventsearch.alias.FieldAliasResolver;
import org.hypertrace.core.eventsearch.api.Condition;
import org.hypertrace.core.eventsearch.api.SearchFilter;
import org.hypertrace.core.eventsearch.api.spi.CatalogService;
import org.hypertrace.core.eventsearch.api.spi.ReleaseVersionFilter;
import org.hypertrace.core.eventsearch.column.ColumnCatalog;

/**
 * Picks the converter for a filter by the name of its key. Explicit tag keys and fields without
 * special semantics use the {@link DefaultFilterConverter}.
 */
@Singleton
public class FilterConverterRegistry {
  public static final String RELEASE = "release";
  public static final String RELEASE_VERSION = "release.version";
  public static final String RELEASE_PACKAGE = "release.package";
  public static final String RELEASE_BUILD = "release.build";
  public static final String TRANSACTION_STATUS = "transaction.status";
  public static final String TRACE_PARENT_SPAN = "trace.parent_span";
  public static final String MESSAGE = "message";

  private final DefaultFilterConverter defaultConverter;
  private final Map<String, SearchFilterConverter> converters;

  @Inject
  public FilterConverterRegistry(
      CatalogService catalogService,
      EventSearchConfig config,
      DefaultFilterConverter defaultConverter,
      EnvironmentFilterConverter environmentConverter,
      MessageFilterConverter messageConverter,
      ProjectSlugFilterConverter projectSlugConverter,
      IssueFilterConverter issueConverter,
      IssueIdFilterConverter issueIdConverter,
      ReleaseFilterConverter releaseConverter,
      TransactionStatusFilterConverter transactionStatusConverter,
      TeamKeyTransactionFilterConverter teamKeyTransactionConverter,
      TraceParentSpanFilterConverter traceParentSpanConverter) {
    int maxSearchReleases = config.getLimits().getMaxSearchReleases();
    this.defaultConverter = defaultConverter;
    this.converters =
        ImmutableMap.<String, SearchFilterConverter>builder()
            .put(ColumnCatalog.ENVIRONMENT, environmentConverter)
            .put(MESSAGE, messageConverter)
            .put(FieldAliasResolver.PROJECT, projectSlugConverter)
            .put(FieldAliasResolver.PROJECT_NAME, projectSlugConverter)
            .put(FieldAliasResolver.ISSUE, issueConverter)
            .put(FieldAliasResolver.ISSUE_ID, issueIdConverter)
            .put(RELEASE, releaseConverter)
            .put(
                RELEASE_VERSION,
                new SemverFilterConverter(
                    catalogService, ReleaseVersionFilter.Kind.VERSION, maxSearchReleases))
            .put(
                RELEASE_PACKAGE,
                new SemverFilterConverter(
                    catalogService, ReleaseVersionFilter.Kind.PACKAGE, maxSearchReleases))
            .put(
                RELEASE_BUILD,
                new SemverFilterConverter(
                    catalogService, ReleaseVersionFilter.Kind.BUILD, maxSearchReleases))
            .put(TRANSACTION_STATUS, transactionStatusConverter)
            .put(FieldAliasResolver.ERROR_HANDLED, new ErrorHandledFilterConverter(true))
            .put(FieldAliasResolver.ERROR_UNHANDLED, new ErrorHandledFilterConverter(false))
            .put(FieldAliasResolver.TEAM_KEY_TRANSACTION, teamKeyTransactionConverter)
            .put(TRACE_PARENT_SPAN, traceParentSpanConverter)
            .build();
  }

  public SearchFilterConverter getConverter(SearchFilter filter) {
    if (filter.getKey().isTag()) {
      return defaultConverter;
    }
    return converters.getOrDefault(filter.getKey().getName(), defaultConverter);
  }

  public Optional<Condition> convert(SearchFilter filter, FilterContext context) {
    return getConverter(filter).convert(filter, context);
  }
}
