package org.hypertrace.core.eventsearch.filter;

import static org.hypertrace.core.eventsearch.api.InvalidSearchQueryException.Reason.MISSING_PARAMETER;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.hypertrace.core.eventsearch.api.Condition;
import org.hypertrace.core.eventsearch.api.FilterOperator;
import org.hypertrace.core.eventsearch.api.InvalidSearchQueryException;
import org.hypertrace.core.eventsearch.api.SearchFilter;
import org.hypertrace.core.eventsearch.api.SearchValue;
import org.hypertrace.core.eventsearch.api.spi.CatalogService;

/** {@code release:} with support for the {@code latest} keyword. */
@Singleton
public class ReleaseFilterConverter implements SearchFilterConverter {
  static final String LATEST = "latest";

  private final CatalogService catalogService;
  private final DefaultFilterConverter defaultConverter;

  @Inject
  public ReleaseFilterConverter(
      CatalogService catalogService, DefaultFilterConverter defaultConverter) {
    this.catalogService = catalogService;
    this.defaultConverter = defaultConverter;
  }

  @Override
  public Optional<Condition> convert(SearchFilter filter, FilterContext context) {
    if (filter.getValue().isEmptyString()) {
      return defaultConverter.convert(filter, context);
    }

    Set<Object> versions = new LinkedHashSet<>();
    boolean hasLatest = false;
    for (Object value : filter.getValue().getValues()) {
      if (LATEST.equals(value)) {
        hasLatest = true;
      } else {
        versions.add(value);
      }
    }
    if (!hasLatest) {
      return defaultConverter.convert(filter, context);
    }

    Long organizationId = context.getParams().getOrganizationId();
    if (organizationId == null) {
      throw new InvalidSearchQueryException(
          MISSING_PARAMETER, "Cannot resolve the latest release without an organization");
    }
    List<String> latest =
        catalogService.resolveLatestReleases(organizationId, context.getParams().getProjectIds());
    // no release at all, match the events without one
    versions.addAll(latest.isEmpty() ? List.of("") : latest);

    FilterOperator operator = filter.getOperator();
    if (operator == FilterOperator.EQ) {
      operator = FilterOperator.IN;
    } else if (operator == FilterOperator.NEQ) {
      operator = FilterOperator.NOT_IN;
    }
    return defaultConverter.convert(
        filter.withOperator(operator).withValue(SearchValue.of(new ArrayList<>(versions))),
        context);
  }
}
