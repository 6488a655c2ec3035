package org.hypertrace.core.eventsearch.filter;

import static org.hypertrace.core.eventsearch.api.util.QueryPlanUtil.and;
import static org.hypertrace.core.eventsearch.api.util.QueryPlanUtil.column;
import static org.hypertrace.core.eventsearch.api.util.QueryPlanUtil.condition;
import static org.hypertrace.core.eventsearch.api.util.QueryPlanUtil.isNotNull;
import static org.hypertrace.core.eventsearch.api.util.QueryPlanUtil.isNull;
import static org.hypertrace.core.eventsearch.api.util.QueryPlanUtil.or;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;

import java.util.Arrays;
import java.util.List;
import org.hypertrace.core.eventsearch.api.ConditionOperator;
import org.hypertrace.core.eventsearch.api.FilterOperator;
import org.hypertrace.core.eventsearch.api.RequestParams;
import org.hypertrace.core.eventsearch.api.SearchFilter;
import org.hypertrace.core.eventsearch.api.spi.CatalogService;
import org.junit.jupiter.api.Test;

public class EnvironmentFilterConverterTest {
  private final EnvironmentFilterConverter converter = new EnvironmentFilterConverter();
  private final StubFilterContext context =
      new StubFilterContext(RequestParams.builder().build(), mock(CatalogService.class));

  @Test
  public void testSingleEnvironment() {
    assertEquals(
        condition(column("environment"), ConditionOperator.EQ, "prod"),
        converter
            .convert(SearchFilter.of("environment", FilterOperator.EQ, "prod"), context)
            .orElseThrow());
  }

  @Test
  public void testEmptyEnvironmentIsNull() {
    assertEquals(
        or(
            isNull(column("environment")),
            condition(column("environment"), ConditionOperator.EQ, "prod")),
        converter
            .convert(
                SearchFilter.of("environment", FilterOperator.IN, List.of("prod", "")), context)
            .orElseThrow());
  }

  @Test
  public void testValuesAreSorted() {
    assertEquals(
        condition(column("environment"), ConditionOperator.IN, List.of("dev", "prod", "staging")),
        EnvironmentFilterConverter.toCondition(
            column("environment"), List.of("staging", "prod", "dev", "prod"), false));
  }

  @Test
  public void testNegation() {
    assertEquals(
        and(
            isNotNull(column("environment")),
            condition(column("environment"), ConditionOperator.NOT_IN, List.of("dev", "prod"))),
        EnvironmentFilterConverter.toCondition(
            column("environment"), Arrays.asList("prod", null, "dev"), true));
  }
}
