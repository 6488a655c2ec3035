package org.hypertrace.core.eventsearch.filter;

import static org.hypertrace.core.eventsearch.api.util.QueryPlanUtil.condition;
import static org.hypertrace.core.eventsearch.api.util.QueryPlanUtil.function;
import static org.hypertrace.core.eventsearch.api.util.QueryPlanUtil.literal;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import javax.inject.Singleton;
import org.hypertrace.core.eventsearch.api.Condition;
import org.hypertrace.core.eventsearch.api.ConditionOperator;
import org.hypertrace.core.eventsearch.api.Expression;
import org.hypertrace.core.eventsearch.api.SearchFilter;
import org.hypertrace.core.eventsearch.api.SearchValue;
import org.hypertrace.core.eventsearch.column.WildcardPatterns;

/** {@code message:} is a case insensitive substring search rather than an equality. */
@Singleton
public class MessageFilterConverter implements SearchFilterConverter {

  @Override
  public Optional<Condition> convert(SearchFilter filter, FilterContext context) {
    Expression message = context.getColumnCatalog().resolve("message");
    SearchValue value = filter.getValue();
    boolean negated = filter.isNegation();

    if (value.isWildcard()) {
      String regex = WildcardPatterns.toRegex(value.asString());
      // substring semantics, drop the anchors
      regex = regex.substring(1, regex.length() - 1);
      return Optional.of(
          condition(
              function("match", message, literal("(?i)" + regex)),
              negated ? ConditionOperator.NEQ : ConditionOperator.EQ,
              1L));
    }
    if (value.isEmptyString()) {
      return Optional.of(
          condition(
              function("equals", message, literal("")),
              negated ? ConditionOperator.NEQ : ConditionOperator.EQ,
              1L));
    }
    if (filter.isInFilter()) {
      List<Object> needles =
          value.getValues().stream().map(String::valueOf).collect(Collectors.toList());
      return Optional.of(
          condition(
              function("multiSearchFirstPositionCaseInsensitive", message, literal(needles)),
              negated ? ConditionOperator.EQ : ConditionOperator.NEQ,
              0L));
    }
    return Optional.of(
        condition(
            function("positionCaseInsensitive", message, literal(value.asString())),
            negated ? ConditionOperator.EQ : ConditionOperator.NEQ,
            0L));
  }
}
