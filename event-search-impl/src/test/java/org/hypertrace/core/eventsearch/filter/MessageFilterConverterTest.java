package org.hypertrace.core.eventsearch.filter;

import static org.hypertrace.core.eventsearch.api.util.QueryPlanUtil.column;
import static org.hypertrace.core.eventsearch.api.util.QueryPlanUtil.condition;
import static org.hypertrace.core.eventsearch.api.util.QueryPlanUtil.function;
import static org.hypertrace.core.eventsearch.api.util.QueryPlanUtil.literal;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;

import java.util.List;
import org.hypertrace.core.eventsearch.api.Condition;
import org.hypertrace.core.eventsearch.api.ConditionOperator;
import org.hypertrace.core.eventsearch.api.FilterOperator;
import org.hypertrace.core.eventsearch.api.RequestParams;
import org.hypertrace.core.eventsearch.api.SearchFilter;
import org.hypertrace.core.eventsearch.api.spi.CatalogService;
import org.junit.jupiter.api.Test;

public class MessageFilterConverterTest {
  private final MessageFilterConverter converter = new MessageFilterConverter();
  private final StubFilterContext context =
      new StubFilterContext(RequestParams.builder().build(), mock(CatalogService.class));

  @Test
  public void testSubstringSearch() {
    assertEquals(
        condition(
            function("positionCaseInsensitive", column("message"), literal("timeout")),
            ConditionOperator.NEQ,
            0L),
        convert(SearchFilter.of("message", FilterOperator.EQ, "timeout")));
    assertEquals(
        condition(
            function("positionCaseInsensitive", column("message"), literal("timeout")),
            ConditionOperator.EQ,
            0L),
        convert(SearchFilter.of("message", FilterOperator.NEQ, "timeout")));
  }

  @Test
  public void testWildcardIsUnanchored() {
    assertEquals(
        condition(
            function("match", column("message"), literal("(?i)connection.*refused")),
            ConditionOperator.EQ,
            1L),
        convert(SearchFilter.of("message", FilterOperator.EQ, "connection*refused")));
  }

  @Test
  public void testInFilter() {
    assertEquals(
        condition(
            function(
                "multiSearchFirstPositionCaseInsensitive",
                column("message"),
                literal(List.of("a", "b"))),
            ConditionOperator.EQ,
            0L),
        convert(SearchFilter.of("message", FilterOperator.NOT_IN, List.of("a", "b"))));
  }

  @Test
  public void testEmptyMessage() {
    assertEquals(
        condition(function("equals", column("message"), literal("")), ConditionOperator.EQ, 1L),
        convert(SearchFilter.of("message", FilterOperator.EQ, "")));
  }

  private Condition convert(SearchFilter filter) {
    return converter.convert(filter, context).orElseThrow();
  }
}
