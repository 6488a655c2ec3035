package org.hypertrace.core.eventsearch.filter;

import static org.hypertrace.core.eventsearch.api.util.QueryPlanUtil.column;
import static org.hypertrace.core.eventsearch.api.util.QueryPlanUtil.condition;
import static org.hypertrace.core.eventsearch.api.util.QueryPlanUtil.function;
import static org.hypertrace.core.eventsearch.api.util.QueryPlanUtil.literal;
import static org.hypertrace.core.eventsearch.api.util.QueryPlanUtil.or;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;

import java.time.Instant;
import java.util.List;
import org.hypertrace.core.eventsearch.api.Condition;
import org.hypertrace.core.eventsearch.api.ConditionOperator;
import org.hypertrace.core.eventsearch.api.FilterOperator;
import org.hypertrace.core.eventsearch.api.InvalidSearchQueryException;
import org.hypertrace.core.eventsearch.api.RequestParams;
import org.hypertrace.core.eventsearch.api.SearchFilter;
import org.hypertrace.core.eventsearch.api.SearchKey;
import org.hypertrace.core.eventsearch.api.SearchValue;
import org.hypertrace.core.eventsearch.api.spi.CatalogService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class DefaultFilterConverterTest {
  private static final Instant START = Instant.parse("2021-01-01T00:00:00Z");
  private static final Instant END = Instant.parse("2021-01-02T00:00:00Z");

  private final DefaultFilterConverter converter = new DefaultFilterConverter();
  private StubFilterContext context;

  @BeforeEach
  public void setup() {
    context =
        new StubFilterContext(
            RequestParams.builder().start(START).end(END).projectId(1L).build(),
            mock(CatalogService.class));
  }

  @Test
  public void testEquality() {
    assertEquals(
        condition(column("transaction_name"), ConditionOperator.EQ, "/api/users"),
        convert(SearchFilter.of("transaction", FilterOperator.EQ, "/api/users")));
  }

  @Test
  public void testNegationMatchesMissingValues() {
    assertEquals(
        or(
            condition(function("isNull", column("transaction_name")), ConditionOperator.EQ, 1L),
            condition(column("transaction_name"), ConditionOperator.NEQ, "/api/users")),
        convert(SearchFilter.of("transaction", FilterOperator.NEQ, "/api/users")));
  }

  @Test
  public void testNegationOnNonNullableField() {
    assertEquals(
        condition(column("type"), ConditionOperator.NEQ, "error"),
        convert(SearchFilter.of("event.type", FilterOperator.NEQ, "error")));
  }

  @Test
  public void testWildcard() {
    assertEquals(
        condition(
            function("match", column("transaction_name"), literal("(?i)^GET .*$")),
            ConditionOperator.EQ,
            1L),
        convert(SearchFilter.of("transaction", FilterOperator.EQ, "GET *")));
  }

  @Test
  public void testInFilter() {
    assertEquals(
        condition(column("platform"), ConditionOperator.IN, List.of("python", "java")),
        convert(SearchFilter.of("platform", FilterOperator.IN, List.of("python", "java"))));
  }

  @Test
  public void testScalarExistence() {
    assertEquals(
        condition(function("isNull", column("email")), ConditionOperator.EQ, 1L),
        convert(SearchFilter.of("user.email", FilterOperator.EQ, "")));
    assertEquals(
        condition(function("isNull", column("email")), ConditionOperator.NEQ, 1L),
        convert(SearchFilter.of("user.email", FilterOperator.NEQ, "")));
  }

  @Test
  public void testTagsCompareWithEmptyString() {
    assertEquals(
        condition(
            function("ifNull", column("tags[browser]"), literal("")), ConditionOperator.NEQ, ""),
        convert(SearchFilter.of("browser", FilterOperator.NEQ, "")));
    assertEquals(
        condition(
            function("ifNull", column("tags[level]"), literal("")), ConditionOperator.EQ, "5"),
        convert(new SearchFilter(SearchKey.tag("level"), FilterOperator.EQ, SearchValue.of(5L))));
  }

  @Test
  public void testArrayColumns() {
    assertEquals(
        condition(
            function(
                "hasAny",
                column("exception_stacks.type"),
                literal(List.of("ValueError", "KeyError"))),
            ConditionOperator.EQ,
            1L),
        convert(
            SearchFilter.of("error.type", FilterOperator.IN, List.of("ValueError", "KeyError"))));
    assertEquals(
        condition(column("exception_stacks.type"), ConditionOperator.NOT_LIKE, "Value%"),
        convert(SearchFilter.of("error.type", FilterOperator.NEQ, "Value*")));
    assertEquals(
        condition(function("notEmpty", column("exception_stacks.type")), ConditionOperator.NEQ, 1L),
        convert(SearchFilter.of("error.type", FilterOperator.EQ, "")));
  }

  @Test
  public void testAliasedField() {
    assertEquals(
        condition(
            function(
                "coalesce",
                column("email"),
                column("username"),
                column("user_id"),
                column("ip_address")),
            ConditionOperator.EQ,
            "jane"),
        convert(SearchFilter.of("user.display", FilterOperator.EQ, "jane")));
  }

  @Test
  public void testInvalidIdentifiers() {
    InvalidSearchQueryException eventId =
        assertThrows(
            InvalidSearchQueryException.class,
            () -> convert(SearchFilter.of("id", FilterOperator.EQ, "not-an-id")));
    assertEquals("Filter ID must be a valid UUID in hex format", eventId.getMessage());
    assertEquals(InvalidSearchQueryException.Reason.INVALID_IDENTIFIER, eventId.getReason());

    InvalidSearchQueryException wildcard =
        assertThrows(
            InvalidSearchQueryException.class,
            () -> convert(SearchFilter.of("trace", FilterOperator.EQ, "abc*")));
    assertEquals("Wildcards not supported in searches on trace", wildcard.getMessage());

    assertThrows(
        InvalidSearchQueryException.class,
        () -> convert(SearchFilter.of("trace.span", FilterOperator.EQ, "1234")));
  }

  @Test
  public void testValidIdentifiers() {
    String eventId = "a1b2c3d4e5f60718293a4b5c6d7e8f90";
    assertEquals(
        condition(column("event_id"), ConditionOperator.EQ, eventId),
        convert(SearchFilter.of("id", FilterOperator.EQ, eventId)));
    assertEquals(
        condition(column("span_id"), ConditionOperator.EQ, "a1b2c3d4e5f60718"),
        convert(SearchFilter.of("trace.span", FilterOperator.EQ, "a1b2c3d4e5f60718")));
  }

  @Test
  public void testTimestampOutsideWindow() {
    InvalidSearchQueryException exception =
        assertThrows(
            InvalidSearchQueryException.class,
            () ->
                convert(
                    SearchFilter.of(
                        "timestamp", FilterOperator.LT, Instant.parse("2020-12-31T00:00:00Z"))));
    assertEquals(
        "Filter on timestamp is outside of the selected date range.", exception.getMessage());
    assertThrows(
        InvalidSearchQueryException.class,
        () ->
            convert(
                SearchFilter.of(
                    "timestamp", FilterOperator.GTE, Instant.parse("2021-01-03T00:00:00Z"))));
  }

  @Test
  public void testTimestampInsideWindow() {
    Instant noon = Instant.parse("2021-01-01T12:00:00Z");
    assertEquals(
        condition(column("timestamp"), ConditionOperator.GT, noon),
        convert(SearchFilter.of("timestamp", FilterOperator.GT, noon)));
  }

  private Condition convert(SearchFilter filter) {
    return converter.convert(filter, context).orElseThrow();
  }
}
