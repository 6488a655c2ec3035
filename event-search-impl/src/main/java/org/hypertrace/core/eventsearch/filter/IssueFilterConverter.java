package org.hypertrace.core.eventsearch.filter;

import static org.hypertrace.core.eventsearch.api.InvalidSearchQueryException.Reason.INVALID_VALUE;
import static org.hypertrace.core.eventsearch.api.InvalidSearchQueryException.Reason.MISSING_PARAMETER;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.hypertrace.core.eventsearch.api.Condition;
import org.hypertrace.core.eventsearch.api.InvalidSearchQueryException;
import org.hypertrace.core.eventsearch.api.SearchFilter;
import org.hypertrace.core.eventsearch.api.SearchKey;
import org.hypertrace.core.eventsearch.api.SearchValue;
import org.hypertrace.core.eventsearch.api.spi.CatalogService;
import org.hypertrace.core.eventsearch.column.ColumnCatalog;

/**
 * {@code issue:} accepts short issue codes, such as {@code PROJ-1A}, and the {@code unknown}
 * token for events without an issue. Codes are resolved to ids and the filter is rewritten to
 * {@code issue.id}.
 */
@Singleton
public class IssueFilterConverter implements SearchFilterConverter {
  static final String UNKNOWN_ISSUE = "unknown";

  private final CatalogService catalogService;

  @Inject
  public IssueFilterConverter(CatalogService catalogService) {
    this.catalogService = catalogService;
  }

  @Override
  public Optional<Condition> convert(SearchFilter filter, FilterContext context) {
    List<String> shortIds =
        filter.getValue().getValues().stream()
            .map(value -> value == null ? "" : String.valueOf(value))
            .filter(value -> !value.isEmpty() && !UNKNOWN_ISSUE.equals(value))
            .collect(Collectors.toList());

    Map<String, Long> issueIds = Map.of();
    if (!shortIds.isEmpty()) {
      Long organizationId = context.getParams().getOrganizationId();
      if (organizationId == null) {
        throw new InvalidSearchQueryException(
            MISSING_PARAMETER, "Cannot resolve issue short ids without an organization");
      }
      issueIds = catalogService.resolveIssueIds(organizationId, shortIds);
    }

    List<Object> values = new ArrayList<>();
    for (Object raw : filter.getValue().getValues()) {
      String value = raw == null ? "" : String.valueOf(raw);
      if (value.isEmpty() || UNKNOWN_ISSUE.equals(value)) {
        values.add(0L);
        continue;
      }
      Long issueId = issueIds.get(value);
      if (issueId == null) {
        throw new InvalidSearchQueryException(
            INVALID_VALUE, String.format("Invalid value '%s' for 'issue:' filter", value));
      }
      values.add(issueId);
    }

    SearchValue value =
        filter.isInFilter() ? SearchValue.of(values) : SearchValue.of(values.get(0));
    return context.convert(
        new SearchFilter(SearchKey.of(ColumnCatalog.ISSUE_ID), filter.getOperator(), value));
  }
}
