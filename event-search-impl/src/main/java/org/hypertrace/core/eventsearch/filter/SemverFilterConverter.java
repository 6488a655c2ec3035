package org.hypertrace.core.eventsearch.filter;

import static org.hypertrace.core.eventsearch.api.InvalidSearchQueryException.Reason.MISSING_PARAMETER;
import static org.hypertrace.core.eventsearch.api.util.QueryPlanUtil.condition;

import java.util.List;
import java.util.Optional;
import org.hypertrace.core.eventsearch.api.Condition;
import org.hypertrace.core.eventsearch.api.ConditionOperator;
import org.hypertrace.core.eventsearch.api.InvalidSearchQueryException;
import org.hypertrace.core.eventsearch.api.SearchFilter;
import org.hypertrace.core.eventsearch.api.spi.CatalogService;
import org.hypertrace.core.eventsearch.api.spi.ReleaseVersionFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code release.version}, {@code release.package} and {@code release.build} filters. The catalog
 * resolves the filter to concrete release versions. When the lookup hits the cap, the inverted
 * filter is tried and used instead if it matches fewer releases.
 */
public class SemverFilterConverter implements SearchFilterConverter {
  private static final Logger LOG = LoggerFactory.getLogger(SemverFilterConverter.class);

  /** Stands in for an empty version list, which the engine cannot compare against. */
  public static final String EMPTY_RELEASE = "____SENTRY_EMPTY_RELEASE____";

  private final CatalogService catalogService;
  private final ReleaseVersionFilter.Kind kind;
  private final int maxSearchReleases;

  public SemverFilterConverter(
      CatalogService catalogService, ReleaseVersionFilter.Kind kind, int maxSearchReleases) {
    this.catalogService = catalogService;
    this.kind = kind;
    this.maxSearchReleases = maxSearchReleases;
  }

  @Override
  public Optional<Condition> convert(SearchFilter filter, FilterContext context) {
    Long organizationId = context.getParams().getOrganizationId();
    if (organizationId == null) {
      throw new InvalidSearchQueryException(
          MISSING_PARAMETER,
          String.format("Cannot search on %s without an organization", filter.getKey().getName()));
    }
    ReleaseVersionFilter versionFilter =
        new ReleaseVersionFilter(
            kind, filter.getOperator(), filter.getValue().asString(), organizationId);
    List<Long> projectIds = context.getParams().getProjectIds();

    boolean negated = false;
    List<String> versions =
        catalogService.resolveReleaseVersions(versionFilter, projectIds, maxSearchReleases);
    if (versions.size() >= maxSearchReleases) {
      List<String> inverse =
          catalogService.resolveReleaseVersions(
              versionFilter.invert(), projectIds, maxSearchReleases);
      if (!inverse.isEmpty() && inverse.size() < versions.size()) {
        if (LOG.isDebugEnabled()) {
          LOG.debug(
              "Using {} inverted releases instead of {} for {}",
              inverse.size(),
              versions.size(),
              filter.getKey().getName());
        }
        versions = inverse;
        negated = true;
      }
    }
    if (versions.isEmpty()) {
      versions = List.of(EMPTY_RELEASE);
    }

    return Optional.of(
        condition(
            context.getColumnCatalog().resolve("release"),
            negated ? ConditionOperator.NOT_IN : ConditionOperator.IN,
            List.<Object>copyOf(versions)));
  }
}
