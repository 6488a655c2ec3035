package org.hypertrace.core.eventsearch.filter;

import static org.hypertrace.core.eventsearch.api.util.QueryPlanUtil.column;
import static org.hypertrace.core.eventsearch.api.util.QueryPlanUtil.condition;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;
import org.hypertrace.core.eventsearch.api.ConditionOperator;
import org.hypertrace.core.eventsearch.api.FilterOperator;
import org.hypertrace.core.eventsearch.api.InvalidSearchQueryException;
import org.hypertrace.core.eventsearch.api.RequestParams;
import org.hypertrace.core.eventsearch.api.SearchFilter;
import org.hypertrace.core.eventsearch.api.spi.CatalogService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class ProjectSlugFilterConverterTest {
  private CatalogService catalogService;
  private ProjectSlugFilterConverter converter;
  private StubFilterContext context;

  @BeforeEach
  public void setup() {
    catalogService = mock(CatalogService.class);
    when(catalogService.resolveProjectSlugs(any())).thenReturn(Map.of("web", 1L, "api", 2L));
    converter = new ProjectSlugFilterConverter(catalogService);
    context =
        new StubFilterContext(
            RequestParams.builder().projectId(1L).projectId(2L).build(), catalogService);
  }

  @Test
  public void testSlugIsRewrittenToProjectId() {
    assertEquals(
        condition(column("project_id"), ConditionOperator.EQ, 1L),
        converter.convert(SearchFilter.of("project", FilterOperator.EQ, "web"), context).get());
    assertEquals(
        condition(column("project_id"), ConditionOperator.IN, List.of(2L, 1L)),
        converter
            .convert(
                SearchFilter.of("project.name", FilterOperator.IN, List.of("api", "web")),
                context)
            .get());
  }

  @Test
  public void testUnknownSlugs() {
    InvalidSearchQueryException exception =
        assertThrows(
            InvalidSearchQueryException.class,
            () ->
                converter.convert(
                    SearchFilter.of("project", FilterOperator.IN, List.of("web", "foo", "bar")),
                    context));
    assertEquals(
        "Invalid query. Project(s) foo and bar do not exist or are not actively selected.",
        exception.getMessage());
  }

  @Test
  public void testNegatingUnknownSlugFiltersNothing() {
    assertTrue(
        converter
            .convert(SearchFilter.of("project", FilterOperator.NEQ, "foo"), context)
            .isEmpty());
  }

  @Test
  public void testExistence() {
    assertTrue(
        converter.convert(SearchFilter.of("project", FilterOperator.NEQ, ""), context).isEmpty());
    InvalidSearchQueryException exception =
        assertThrows(
            InvalidSearchQueryException.class,
            () -> converter.convert(SearchFilter.of("project", FilterOperator.EQ, ""), context));
    assertEquals(
        "Invalid query for 'has' search: 'project' cannot be empty.", exception.getMessage());
    verify(catalogService, never()).resolveProjectSlugs(any());
  }
}
