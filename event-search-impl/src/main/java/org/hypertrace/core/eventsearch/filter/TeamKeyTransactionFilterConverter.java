package org.hypertrace.core.eventsearch.filter;

import static org.hypertrace.core.eventsearch.api.InvalidSearchQueryException.Reason.INVALID_VALUE;
import static org.hypertrace.core.eventsearch.api.util.QueryPlanUtil.condition;
import static org.hypertrace.core.eventsearch.api.util.QueryPlanUtil.withoutAlias;

import java.util.Optional;
import javax.inject.Singleton;
import org.hypertrace.core.eventsearch.alias.FieldAliasResolver;
import org.hypertrace.core.eventsearch.api.Condition;
import org.hypertrace.core.eventsearch.api.ConditionOperator;
import org.hypertrace.core.eventsearch.api.Expression;
import org.hypertrace.core.eventsearch.api.FilterOperator;
import org.hypertrace.core.eventsearch.api.InvalidSearchQueryException;
import org.hypertrace.core.eventsearch.api.SearchFilter;

/** {@code team_key_transaction:1} and {@code team_key_transaction:0}. */
@Singleton
public class TeamKeyTransactionFilterConverter implements SearchFilterConverter {

  @Override
  public Optional<Condition> convert(SearchFilter filter, FilterContext context) {
    Expression keyTransaction =
        withoutAlias(context.resolveField(FieldAliasResolver.TEAM_KEY_TRANSACTION));
    Object value = filter.getValue().getValue();
    boolean negated = filter.getOperator() == FilterOperator.NEQ;

    if (filter.getValue().isEmptyString()) {
      return Optional.of(
          condition(keyTransaction, negated ? ConditionOperator.NEQ : ConditionOperator.EQ, 0L));
    }
    if (Filters.isOne(value) || Filters.isZero(value)) {
      boolean one = Filters.isOne(value) != negated;
      return Optional.of(condition(keyTransaction, ConditionOperator.EQ, one ? 1L : 0L));
    }
    throw new InvalidSearchQueryException(
        INVALID_VALUE, "Invalid value for key_transaction condition. Accepted values are 1, 0");
  }
}
