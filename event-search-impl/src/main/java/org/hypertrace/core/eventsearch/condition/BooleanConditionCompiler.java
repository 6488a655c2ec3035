package org.hypertrace.core.eventsearch.condition;

import static org.hypertrace.core.eventsearch.api.InvalidSearchQueryException.Reason.MALFORMED_QUERY;

import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;
import javax.inject.Singleton;
import org.hypertrace.core.eventsearch.api.AggregateFilter;
import org.hypertrace.core.eventsearch.api.BooleanOperator;
import org.hypertrace.core.eventsearch.api.Condition;
import org.hypertrace.core.eventsearch.api.InvalidSearchQueryException;
import org.hypertrace.core.eventsearch.api.LogicalOperator;
import org.hypertrace.core.eventsearch.api.MixedAggregateBooleanException;
import org.hypertrace.core.eventsearch.api.ParenGroup;
import org.hypertrace.core.eventsearch.api.ParsedTerm;
import org.hypertrace.core.eventsearch.api.SearchFilter;
import org.hypertrace.core.eventsearch.api.util.QueryPlanUtil;

/**
 * Builds the condition tree of a tokenized search query and splits it into its where and having
 * parts.
 *
 * <p>Terms without an operator between them are joined by {@code AND}, which binds tighter than
 * {@code OR}: the sequence is split on its first {@code OR}, otherwise into its first term and the
 * rest. A where condition cannot be ORed with a having condition since the two are evaluated
 * before and after aggregation.
 */
@Singleton
public class BooleanConditionCompiler {

  public ConditionPair compile(List<ParsedTerm> terms, TermConverter converter) {
    if (terms.isEmpty()) {
      return ConditionPair.empty();
    }
    return compileTerms(sanitize(terms), converter);
  }

  /** Rejects misplaced operators and drops the implicit {@code AND}s. */
  static List<ParsedTerm> sanitize(List<ParsedTerm> terms) {
    List<ParsedTerm> sanitized = new ArrayList<>();
    ParsedTerm previous = null;
    for (ParsedTerm term : terms) {
      if (previous == null) {
        if (term instanceof BooleanOperator) {
          throw new InvalidSearchQueryException(
              MALFORMED_QUERY,
              String.format("Condition is missing on the left side of '%s' operator", term));
        }
      } else if (previous instanceof BooleanOperator && term instanceof BooleanOperator) {
        throw new InvalidSearchQueryException(
            MALFORMED_QUERY,
            String.format(
                "Missing condition in between two condition operators: '%s %s'", previous, term));
      }
      if (term != BooleanOperator.AND) {
        sanitized.add(term);
      }
      previous = term;
    }
    if (previous instanceof BooleanOperator) {
      throw new InvalidSearchQueryException(
          MALFORMED_QUERY,
          String.format("Condition is missing on the right side of '%s' operator", previous));
    }
    return sanitized;
  }

  private ConditionPair compileTerms(List<ParsedTerm> terms, TermConverter converter) {
    if (terms.size() == 1) {
      return compileTerm(terms.get(0), converter);
    }

    int orIndex = terms.indexOf(BooleanOperator.OR);
    LogicalOperator operator;
    ConditionPair left;
    ConditionPair right;
    if (orIndex >= 0) {
      operator = LogicalOperator.OR;
      left = compileTerms(terms.subList(0, orIndex), converter);
      right = compileTerms(terms.subList(orIndex + 1, terms.size()), converter);
      if ((left.hasWhere() || right.hasWhere()) && (left.hasHaving() || right.hasHaving())) {
        throw new MixedAggregateBooleanException();
      }
    } else {
      operator = LogicalOperator.AND;
      left = compileTerm(terms.get(0), converter);
      right = compileTerms(terms.subList(1, terms.size()), converter);
    }

    return new ConditionPair(
        join(operator, left.getWhere(), right.getWhere()),
        join(operator, left.getHaving(), right.getHaving()));
  }

  private ConditionPair compileTerm(ParsedTerm term, TermConverter converter) {
    switch (term.getTermCase()) {
      case FILTER:
        return converter
            .convertFilter((SearchFilter) term)
            .map(ConditionPair::where)
            .orElse(ConditionPair.empty());
      case AGGREGATE_FILTER:
        return converter
            .convertAggregateFilter((AggregateFilter) term)
            .map(ConditionPair::having)
            .orElse(ConditionPair.empty());
      case PAREN_GROUP:
        return compile(((ParenGroup) term).getChildren(), converter);
      case BOOLEAN_OPERATOR:
      default:
        throw new InvalidSearchQueryException(
            MALFORMED_QUERY, String.format("Unexpected term %s", term));
    }
  }

  @Nullable
  private static Condition join(
      LogicalOperator operator, @Nullable Condition left, @Nullable Condition right) {
    if (left == null) {
      return right;
    }
    if (right == null) {
      return left;
    }
    return QueryPlanUtil.combine(operator, List.of(left, right));
  }
}
