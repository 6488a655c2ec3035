package org.hypertrace.core.eventsearch.filter;

import static org.hypertrace.core.eventsearch.api.InvalidSearchQueryException.Reason.INVALID_VALUE;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.hypertrace.core.eventsearch.api.Condition;
import org.hypertrace.core.eventsearch.api.FilterOperator;
import org.hypertrace.core.eventsearch.api.InvalidSearchQueryException;
import org.hypertrace.core.eventsearch.api.SearchFilter;
import org.hypertrace.core.eventsearch.api.SearchKey;
import org.hypertrace.core.eventsearch.api.SearchValue;
import org.hypertrace.core.eventsearch.api.spi.CatalogService;
import org.hypertrace.core.eventsearch.column.ColumnCatalog;

/** {@code project:slug}, rewritten to a {@code project.id} filter over the request's projects. */
@Singleton
public class ProjectSlugFilterConverter implements SearchFilterConverter {
  private final CatalogService catalogService;

  @Inject
  public ProjectSlugFilterConverter(CatalogService catalogService) {
    this.catalogService = catalogService;
  }

  @Override
  public Optional<Condition> convert(SearchFilter filter, FilterContext context) {
    if (Filters.isExistenceCheck(filter)) {
      if (filter.getOperator() == FilterOperator.EQ) {
        throw new InvalidSearchQueryException(
            INVALID_VALUE, "Invalid query for 'has' search: 'project' cannot be empty.");
      }
      // every event has a project
      return Optional.empty();
    }

    Map<String, Long> slugs =
        catalogService.resolveProjectSlugs(context.getParams().getProjectIds());
    List<Object> projectIds = new ArrayList<>();
    List<String> missing = new ArrayList<>();
    for (Object slug : filter.getValue().getValues()) {
      Long projectId = slugs.get(String.valueOf(slug));
      if (projectId == null) {
        missing.add(String.valueOf(slug));
      } else {
        projectIds.add(projectId);
      }
    }
    if (!missing.isEmpty() && filter.getOperator().isEquality()) {
      throw new InvalidSearchQueryException(
          INVALID_VALUE,
          String.format(
              "Invalid query. Project(s) %s do not exist or are not actively selected.",
              Filters.oxfordize(missing)));
    }
    if (projectIds.isEmpty()) {
      // negating projects outside of the selection filters nothing
      return Optional.empty();
    }

    SearchValue value =
        filter.isInFilter() ? SearchValue.of(projectIds) : SearchValue.of(projectIds.get(0));
    return context.convert(
        new SearchFilter(SearchKey.of(ColumnCatalog.PROJECT_ID), filter.getOperator(), value));
  }
}
