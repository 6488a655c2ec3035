package org.hypertrace.core.eventsearch.filter;

import static org.hypertrace.core.eventsearch.api.util.QueryPlanUtil.condition;
import static org.hypertrace.core.eventsearch.api.util.QueryPlanUtil.function;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;

import org.hypertrace.core.eventsearch.api.Condition;
import org.hypertrace.core.eventsearch.api.ConditionOperator;
import org.hypertrace.core.eventsearch.api.FilterOperator;
import org.hypertrace.core.eventsearch.api.InvalidSearchQueryException;
import org.hypertrace.core.eventsearch.api.RequestParams;
import org.hypertrace.core.eventsearch.api.SearchFilter;
import org.hypertrace.core.eventsearch.api.spi.CatalogService;
import org.junit.jupiter.api.Test;

public class ErrorHandledFilterConverterTest {
  private static final Condition HANDLED =
      condition(function("isHandled"), ConditionOperator.EQ, 1L);
  private static final Condition UNHANDLED =
      condition(function("notHandled"), ConditionOperator.EQ, 1L);

  private final ErrorHandledFilterConverter handled = new ErrorHandledFilterConverter(true);
  private final ErrorHandledFilterConverter unhandled = new ErrorHandledFilterConverter(false);
  private final StubFilterContext context =
      new StubFilterContext(RequestParams.builder().build(), mock(CatalogService.class));

  @Test
  public void testHandled() {
    assertEquals(HANDLED, convert(handled, FilterOperator.EQ, 1L));
    assertEquals(UNHANDLED, convert(handled, FilterOperator.EQ, 0L));
    assertEquals(UNHANDLED, convert(handled, FilterOperator.NEQ, "1"));
  }

  @Test
  public void testUnhandled() {
    assertEquals(UNHANDLED, convert(unhandled, FilterOperator.EQ, 1L));
    assertEquals(HANDLED, convert(unhandled, FilterOperator.EQ, "0"));
  }

  @Test
  public void testExistence() {
    assertEquals(
        condition(function("isHandled"), ConditionOperator.EQ, 1L),
        convert(handled, FilterOperator.NEQ, ""));
    assertEquals(
        condition(function("isHandled"), ConditionOperator.EQ, 0L),
        convert(handled, FilterOperator.EQ, ""));
    assertEquals(
        condition(function("isHandled"), ConditionOperator.EQ, 0L),
        convert(unhandled, FilterOperator.NEQ, ""));
  }

  @Test
  public void testInvalidValue() {
    InvalidSearchQueryException exception =
        assertThrows(
            InvalidSearchQueryException.class, () -> convert(unhandled, FilterOperator.EQ, 2L));
    assertEquals(
        "Invalid value for error.unhandled condition. Accepted values are 1, 0",
        exception.getMessage());
  }

  private Condition convert(ErrorHandledFilterConverter converter, FilterOperator op, Object v) {
    String key = converter == handled ? "error.handled" : "error.unhandled";
    return converter.convert(SearchFilter.of(key, op, v), context).orElseThrow();
  }
}
