package org.hypertrace.core.eventsearch.function;

import static org.hypertrace.core.eventsearch.api.util.QueryPlanUtil.column;
import static org.hypertrace.core.eventsearch.api.util.QueryPlanUtil.function;
import static org.hypertrace.core.eventsearch.api.util.QueryPlanUtil.literal;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;

import java.time.Instant;
import java.util.Set;
import org.hypertrace.core.eventsearch.api.AccessDeniedException;
import org.hypertrace.core.eventsearch.api.Expression;
import org.hypertrace.core.eventsearch.api.FunctionCall;
import org.hypertrace.core.eventsearch.api.InvalidSearchQueryException;
import org.hypertrace.core.eventsearch.api.InvalidSearchQueryException.Reason;
import org.hypertrace.core.eventsearch.api.RequestParams;
import org.hypertrace.core.eventsearch.api.ResultType;
import org.hypertrace.core.eventsearch.api.spi.CatalogService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class FunctionResolverTest {
  private static final RequestParams HOUR =
      RequestParams.builder()
          .start(Instant.parse("2021-01-01T00:00:00Z"))
          .end(Instant.parse("2021-01-01T01:00:00Z"))
          .projectId(1L)
          .build();

  private final FunctionResolver functionResolver = new FunctionResolver(new FunctionRegistry());
  private CatalogService catalogService;
  private StubArgumentContext context;

  @BeforeEach
  public void setup() {
    catalogService = mock(CatalogService.class);
    context = new StubArgumentContext(HOUR, catalogService);
  }

  @Test
  public void testDefaultColumn() {
    ResolvedFunction p95 = resolve("p95()");
    assertEquals(
        function("quantile(0.95)", column("duration")).withAlias("p95"), p95.getExpression());
    assertEquals("p95", p95.getAlias());
    assertEquals(ResultType.DURATION, p95.getResultType());
    assertTrue(p95.isAggregate());
  }

  @Test
  public void testParametricName() {
    ResolvedFunction percentile = resolve("percentile(transaction.duration, 0.5)");
    assertEquals(
        function("quantile(0.5)", column("duration"))
            .withAlias("percentile_transaction_duration_0_5"),
        percentile.getExpression());
  }

  @Test
  public void testResultTypeFollowsColumn() {
    assertEquals(ResultType.DATE, resolve("max(timestamp)").getResultType());
    assertEquals(ResultType.DURATION, resolve("p50(measurements.lcp)").getResultType());
    assertEquals(ResultType.NUMBER, resolve("avg(measurements.cls)").getResultType());
    assertEquals(ResultType.INTEGER, resolve("count()").getResultType());
  }

  @Test
  public void testExplicitAlias() {
    ResolvedFunction count = resolve("count() AS total");
    assertEquals(function("count").withAlias("total"), count.getExpression());
    assertEquals("total", count.getAlias());
  }

  @Test
  public void testCountColumnExpandsFieldAliasesToStorageColumns() {
    ResolvedFunction countUnique = resolve("count_unique(user.display)");
    assertEquals(
        function(
                "uniq",
                function(
                    "coalesce",
                    column("email"),
                    column("username"),
                    column("user_id"),
                    column("ip_address")))
            .withAlias("count_unique_user_display"),
        countUnique.getExpression());
  }

  @Test
  public void testIntervalDefault() {
    Expression perMinute =
        function("divide", function("count"), function("divide", literal(3600.0), literal(60L)));
    assertEquals(perMinute, ((FunctionCall) resolve("epm()").getExpression()).withAlias(null));
    assertEquals("tpm", resolve("tpm()").getAlias());
    assertEquals(
        function("divide", function("count"), literal(60.0)).withAlias("eps_60"),
        resolve("eps(60)").getExpression());

    StubArgumentContext withoutWindow =
        new StubArgumentContext(RequestParams.builder().build(), catalogService);
    InvalidSearchQueryException exception =
        assertThrows(
            InvalidSearchQueryException.class,
            () -> functionResolver.resolve("epm()", withoutWindow, Set.of()));
    assertEquals(
        "epm(): invalid arguments: function called without default", exception.getMessage());
  }

  @Test
  public void testThresholdFallback() {
    Expression threshold = function("tuple", literal("duration"), literal(300L));
    assertEquals(
        function("apdex", column("duration"), literal(300.0)).withAlias("apdex_300"),
        resolve("apdex(300)").getExpression());
    assertEquals(
        function(
                "apdex",
                function(
                    "multiIf",
                    function(
                        "equals",
                        function("tupleElement", threshold, literal(1L)),
                        literal("lcp")),
                    column("measurements[lcp]"),
                    column("duration")),
                function("tupleElement", threshold, literal(2L)))
            .withAlias("apdex"),
        resolve("apdex()").getExpression());
  }

  @Test
  public void testInvalidArguments() {
    InvalidSearchQueryException range =
        assertThrows(
            InvalidSearchQueryException.class,
            () -> resolve("percentile(transaction.duration, 1.5)"));
    assertEquals(Reason.INVALID_ARGUMENT, range.getReason());
    assertEquals(
        "percentile(transaction.duration, 1.5): percentile argument invalid: 1.5 must be less"
            + " than 1",
        range.getMessage());

    InvalidSearchQueryException column =
        assertThrows(InvalidSearchQueryException.class, () -> resolve("min(user.email)"));
    assertEquals(
        "min(user.email): column argument invalid: user.email is not a numeric column",
        column.getMessage());
  }

  @Test
  public void testArgumentCounts() {
    InvalidSearchQueryException tooMany =
        assertThrows(InvalidSearchQueryException.class, () -> resolve("count(id, user)"));
    assertEquals(Reason.TOO_MANY_ARGUMENTS, tooMany.getReason());
    assertEquals("count(id, user): expected at most 1 argument(s)", tooMany.getMessage());

    InvalidSearchQueryException tooFew =
        assertThrows(
            InvalidSearchQueryException.class, () -> resolve("percentile(transaction.duration)"));
    assertEquals(Reason.TOO_FEW_ARGUMENTS, tooFew.getReason());
    assertEquals("percentile(transaction.duration): expected 2 argument(s)", tooFew.getMessage());
  }

  @Test
  public void testUnknownFunction() {
    InvalidSearchQueryException exception =
        assertThrows(InvalidSearchQueryException.class, () -> resolve("foo(bar)"));
    assertEquals(Reason.UNKNOWN_FUNCTION, exception.getReason());
    assertEquals("foo(bar) is not a valid function", exception.getMessage());
    assertFalse(functionResolver.isFunction("foo(bar)"));
    assertTrue(functionResolver.isFunction("count()"));
  }

  @Test
  public void testPrivateFunctions() {
    AccessDeniedException exception =
        assertThrows(AccessDeniedException.class, () -> resolve("array_join(tags.key)"));
    assertEquals("array_join: no access to private function", exception.getMessage());

    ResolvedFunction arrayJoin =
        functionResolver.resolve("array_join(tags.key)", context, Set.of("array_join"));
    assertEquals(
        function("arrayJoin", column("tags.key")).withAlias("array_join_tags_key"),
        arrayJoin.getExpression());
    assertFalse(arrayJoin.isAggregate());
  }

  @Test
  public void testHistogram() {
    ResolvedFunction histogram =
        functionResolver.resolve(
            "histogram(transaction.duration, 10, 0, 1)", context, Set.of("histogram"));
    Expression bucket =
        function(
            "plus",
            function(
                "multiply",
                function(
                    "floor",
                    function(
                        "divide",
                        function(
                            "minus",
                            function("multiply", column("duration"), literal(1.0)),
                            literal(0.0)),
                        literal(10.0))),
                literal(10.0)),
            literal(0.0));
    assertEquals(
        ((FunctionCall) bucket).withAlias("histogram_transaction_duration_10_0_1"),
        histogram.getExpression());
  }

  @Test
  public void testQuotedStringArgument() {
    ResolvedFunction toOther = resolve("to_other(release, \"a,b\")");
    assertEquals(
        function(
                "if",
                function("equals", column("release"), literal("a,b")),
                literal("this"),
                literal("that"))
            .withAlias("to_other_release__a_b"),
        toOther.getExpression());
  }

  @Test
  public void testRedundantGroupingColumn() {
    assertEquals(
        "transaction.duration",
        resolve("p75(transaction.duration)").getRedundantGroupingColumn().orElseThrow());
    assertTrue(resolve("count_unique(user)").getRedundantGroupingColumn().isEmpty());
  }

  @Test
  public void testPrecomputedAlias() {
    Expression precomputed =
        function("divide", column("count_a"), column("count_b")).withAlias("ratio");
    StubArgumentContext withAliases =
        new StubArgumentContext(
            HOUR.toBuilder().alias("percentage(count_a, count_b)", precomputed).build(),
            catalogService);
    ResolvedFunction percentage =
        functionResolver.resolve("percentage(count_a, count_b)", withAliases, Set.of());
    assertEquals(precomputed, percentage.getExpression());
    assertEquals("ratio", percentage.getAlias());
    assertEquals(ResultType.PERCENTAGE, percentage.getResultType());
    assertTrue(percentage.isAggregate());
  }

  private ResolvedFunction resolve(String field) {
    return functionResolver.resolve(field, context, Set.of());
  }
}
