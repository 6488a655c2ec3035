package org.hypertrace.core.eventsearch.condition;

import static org.hypertrace.core.eventsearch.api.util.QueryPlanUtil.and;
import static org.hypertrace.core.eventsearch.api.util.QueryPlanUtil.column;
import static org.hypertrace.core.eventsearch.api.util.QueryPlanUtil.columnCondition;
import static org.hypertrace.core.eventsearch.api.util.QueryPlanUtil.condition;
import static org.hypertrace.core.eventsearch.api.util.QueryPlanUtil.or;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;
import org.hypertrace.core.eventsearch.api.AggregateFilter;
import org.hypertrace.core.eventsearch.api.BooleanOperator;
import org.hypertrace.core.eventsearch.api.Condition;
import org.hypertrace.core.eventsearch.api.ConditionOperator;
import org.hypertrace.core.eventsearch.api.FilterOperator;
import org.hypertrace.core.eventsearch.api.InvalidSearchQueryException;
import org.hypertrace.core.eventsearch.api.InvalidSearchQueryException.Reason;
import org.hypertrace.core.eventsearch.api.MixedAggregateBooleanException;
import org.hypertrace.core.eventsearch.api.ParenGroup;
import org.hypertrace.core.eventsearch.api.ParsedTerm;
import org.hypertrace.core.eventsearch.api.SearchFilter;
import org.junit.jupiter.api.Test;

public class BooleanConditionCompilerTest {
  private static final SearchFilter A = SearchFilter.of("a", FilterOperator.EQ, 1L);
  private static final SearchFilter B = SearchFilter.of("b", FilterOperator.EQ, 2L);
  private static final SearchFilter C = SearchFilter.of("c", FilterOperator.EQ, 3L);
  private static final SearchFilter SKIPPED = SearchFilter.of("skip", FilterOperator.EQ, 0L);
  private static final AggregateFilter COUNT =
      AggregateFilter.of("count()", FilterOperator.GT, 5L);

  private final BooleanConditionCompiler compiler = new BooleanConditionCompiler();
  private final TermConverter converter =
      new TermConverter() {
        @Override
        public Optional<Condition> convertFilter(SearchFilter filter) {
          if (filter.getKey().getName().equals("skip")) {
            return Optional.empty();
          }
          return Optional.of(toCondition(filter));
        }

        @Override
        public Optional<Condition> convertAggregateFilter(AggregateFilter filter) {
          return Optional.of(
              condition(
                  column("count"),
                  filter.getOperator().toConditionOperator(),
                  filter.getValue().getValue()));
        }
      };

  @Test
  public void testImplicitAnd() {
    ConditionPair pair = compiler.compile(List.of(A, B, BooleanOperator.AND, C), converter);
    assertEquals(and(toCondition(A), and(toCondition(B), toCondition(C))), pair.getWhere());
    assertEquals(List.of(toCondition(A), toCondition(B), toCondition(C)), pair.flattenWhere());
    assertFalse(pair.hasHaving());
  }

  @Test
  public void testAndBindsTighterThanOr() {
    ConditionPair pair = compiler.compile(List.of(A, BooleanOperator.OR, B, C), converter);
    assertEquals(or(toCondition(A), and(toCondition(B), toCondition(C))), pair.getWhere());
    assertEquals(1, pair.flattenWhere().size());
  }

  @Test
  public void testParenGroup() {
    ConditionPair pair =
        compiler.compile(List.of(ParenGroup.of(A, BooleanOperator.OR, B), C), converter);
    assertEquals(
        List.of(or(toCondition(A), toCondition(B)), toCondition(C)), pair.flattenWhere());
  }

  @Test
  public void testAggregateFiltersGoToHaving() {
    ConditionPair having = compiler.compile(List.of(COUNT), converter);
    assertNull(having.getWhere());
    assertEquals(
        List.of(condition(column("count"), ConditionOperator.GT, 5L)), having.flattenHaving());

    ConditionPair both = compiler.compile(List.of(A, COUNT), converter);
    assertEquals(toCondition(A), both.getWhere());
    assertTrue(both.hasHaving());
  }

  @Test
  public void testOrBetweenWhereAndHaving() {
    assertThrows(
        MixedAggregateBooleanException.class,
        () -> compiler.compile(List.of(A, BooleanOperator.OR, COUNT), converter));
    assertThrows(
        MixedAggregateBooleanException.class,
        () ->
            compiler.compile(
                List.of(COUNT, BooleanOperator.OR, ParenGroup.of(A, B)), converter));

    assertThrows(
        MixedAggregateBooleanException.class,
        () ->
            compiler.compile(
                List.of(ParenGroup.of(A, COUNT), BooleanOperator.OR, SKIPPED), converter));

    ConditionPair havingOnly =
        compiler.compile(List.of(COUNT, BooleanOperator.OR, COUNT), converter);
    assertEquals(1, havingOnly.flattenHaving().size());
  }

  @Test
  public void testEmptyConversionsAreDropped() {
    ConditionPair pair = compiler.compile(List.of(SKIPPED, A, SKIPPED), converter);
    assertEquals(toCondition(A), pair.getWhere());

    ConditionPair empty = compiler.compile(List.of(), converter);
    assertFalse(empty.hasWhere());
    assertFalse(empty.hasHaving());
  }

  @Test
  public void testMisplacedOperators() {
    assertMalformed(
        List.of(BooleanOperator.OR, A), "Condition is missing on the left side of 'OR' operator");
    assertMalformed(
        List.of(A, BooleanOperator.AND, BooleanOperator.OR, B),
        "Missing condition in between two condition operators: 'AND OR'");
    assertMalformed(
        List.of(A, BooleanOperator.AND),
        "Condition is missing on the right side of 'AND' operator");
  }

  private void assertMalformed(List<ParsedTerm> terms, String message) {
    InvalidSearchQueryException exception =
        assertThrows(InvalidSearchQueryException.class, () -> compiler.compile(terms, converter));
    assertEquals(Reason.MALFORMED_QUERY, exception.getReason());
    assertEquals(message, exception.getMessage());
  }

  private static Condition toCondition(SearchFilter filter) {
    return columnCondition(
        filter.getKey().getName(),
        filter.getOperator().toConditionOperator(),
        filter.getValue().getValue());
  }
}
