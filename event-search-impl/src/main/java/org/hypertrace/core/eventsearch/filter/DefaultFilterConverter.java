package org.hypertrace.core.eventsearch.filter;

import static org.hypertrace.core.eventsearch.api.InvalidSearchQueryException.Reason.INVALID_IDENTIFIER;
import static org.hypertrace.core.eventsearch.api.InvalidSearchQueryException.Reason.INVALID_VALUE;
import static org.hypertrace.core.eventsearch.api.util.QueryPlanUtil.condition;
import static org.hypertrace.core.eventsearch.api.util.QueryPlanUtil.function;
import static org.hypertrace.core.eventsearch.api.util.QueryPlanUtil.literal;
import static org.hypertrace.core.eventsearch.api.util.QueryPlanUtil.or;
import static org.hypertrace.core.eventsearch.api.util.QueryPlanUtil.withoutAlias;

import com.google.common.collect.ImmutableSet;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import javax.inject.Singleton;
import org.hypertrace.core.eventsearch.api.Condition;
import org.hypertrace.core.eventsearch.api.ConditionOperator;
import org.hypertrace.core.eventsearch.api.Expression;
import org.hypertrace.core.eventsearch.api.FilterOperator;
import org.hypertrace.core.eventsearch.api.InvalidSearchQueryException;
import org.hypertrace.core.eventsearch.api.RequestParams;
import org.hypertrace.core.eventsearch.api.SearchFilter;
import org.hypertrace.core.eventsearch.api.SearchValue;
import org.hypertrace.core.eventsearch.column.ColumnCapability;
import org.hypertrace.core.eventsearch.column.ColumnCatalog;

/**
 * Conversion for fields without special semantics. Handles array columns, tags, existence
 * checks, wildcards and the null check inequalities need on nullable columns.
 */
@Singleton
public class DefaultFilterConverter implements SearchFilterConverter {
  static final String WILDCARD_NOT_ALLOWED = "Wildcards not supported in searches on %s";
  static final String INVALID_ID_DETAILS = "%s must be a valid UUID in hex format";
  static final String INVALID_SPAN_ID =
      "%s must be a valid 16 character hex (containing only digits, or a-f characters)";

  private static final Set<String> SPAN_ID_FIELDS =
      ImmutableSet.of("trace.span", "trace.parent_span");
  private static final Set<String> EVENT_ID_FIELDS = ImmutableSet.of("id", "trace");
  private static final Set<String> TIMESTAMP_FIELDS =
      ImmutableSet.of(ColumnCatalog.TIMESTAMP, "timestamp.to_hour", "timestamp.to_day");
  private static final Set<String> NON_NULLABLE_FIELDS = ImmutableSet.of("event.type");

  @Override
  public Optional<Condition> convert(SearchFilter filter, FilterContext context) {
    String name = filter.getKey().getName();
    String field = filter.getKey().isTag() ? String.format("tags[%s]", name) : name;
    FilterOperator operator = filter.getOperator();
    SearchValue value = filter.getValue();
    validateIdentifiers(name, value);

    Expression lhs = withoutAlias(context.resolveField(field));
    ColumnCapability capability = context.getColumnCatalog().getCapability(field);
    if (capability == ColumnCapability.ARRAY) {
      if (value.isWildcard()) {
        return Optional.of(
            capability.pattern(lhs, value.asString(), operator == FilterOperator.NEQ));
      } else if (filter.isInFilter()) {
        return Optional.of(
            capability.membership(lhs, value.getValues(), operator == FilterOperator.NOT_IN));
      } else if (value.isEmptyString()) {
        return Optional.of(capability.existence(lhs, operator == FilterOperator.NEQ));
      }
    }

    if (TIMESTAMP_FIELDS.contains(name) && value.getValue() instanceof Instant) {
      validateTimestampWindow(operator, (Instant) value.getValue(), context.getParams());
    }

    Object rhs = value.getValue();
    boolean tagColumn = ColumnCatalog.isTagColumn(lhs);
    if (tagColumn) {
      // tags are never null, a missing tag compares equal to the empty string
      if (!filter.isInFilter() && !(rhs instanceof String)) {
        rhs = String.valueOf(rhs);
      }
      lhs = function("ifNull", lhs, literal(""));
    }

    if (Filters.isExistenceCheck(filter)) {
      if (filter.getKey().isTag() || tagColumn || NON_NULLABLE_FIELDS.contains(name)) {
        return Optional.of(condition(lhs, operator.toConditionOperator(), rhs));
      }
      return Optional.of(
          ColumnCapability.SCALAR.existence(lhs, operator == FilterOperator.NEQ));
    }

    Condition comparison;
    if (value.isWildcard()) {
      comparison =
          ColumnCapability.SCALAR.pattern(lhs, value.asString(), operator == FilterOperator.NEQ);
    } else if (filter.isInFilter()) {
      comparison = condition(lhs, operator.toConditionOperator(), inValues(value, tagColumn));
    } else {
      comparison = condition(lhs, operator.toConditionOperator(), rhs);
    }

    if (operator.isNegation()
        && !filter.getKey().isTag()
        && !tagColumn
        && !NON_NULLABLE_FIELDS.contains(name)) {
      // any comparison with null is null, absent values have to match explicitly
      return Optional.of(
          or(condition(function("isNull", lhs), ConditionOperator.EQ, 1L), comparison));
    }
    return Optional.of(comparison);
  }

  static void validateIdentifiers(String name, SearchValue value) {
    if (SPAN_ID_FIELDS.contains(name)) {
      if (value.isWildcard()) {
        throw new InvalidSearchQueryException(
            INVALID_IDENTIFIER, String.format(WILDCARD_NOT_ALLOWED, name));
      }
      if (!value.isEmptyString() && !value.isSpanId()) {
        throw new InvalidSearchQueryException(
            INVALID_IDENTIFIER, String.format(INVALID_SPAN_ID, name));
      }
    }
    if (EVENT_ID_FIELDS.contains(name)) {
      if (value.isWildcard()) {
        throw new InvalidSearchQueryException(
            INVALID_IDENTIFIER, String.format(WILDCARD_NOT_ALLOWED, name));
      }
      if (!value.isEmptyString() && !value.isEventId()) {
        throw new InvalidSearchQueryException(
            INVALID_IDENTIFIER,
            String.format(INVALID_ID_DETAILS, "id".equals(name) ? "Filter ID" : "Filter Trace ID"));
      }
    }
  }

  private static void validateTimestampWindow(
      FilterOperator operator, Instant value, RequestParams params) {
    boolean beforeStart =
        (operator == FilterOperator.LT || operator == FilterOperator.LTE)
            && params.getStart() != null
            && value.isBefore(params.getStart());
    boolean afterEnd =
        (operator == FilterOperator.GT || operator == FilterOperator.GTE)
            && params.getEnd() != null
            && value.isAfter(params.getEnd());
    if (beforeStart || afterEnd) {
      throw new InvalidSearchQueryException(
          INVALID_VALUE, "Filter on timestamp is outside of the selected date range.");
    }
  }

  private static List<Object> inValues(SearchValue value, boolean tagColumn) {
    if (!tagColumn) {
      return value.getValues();
    }
    return value.getValues().stream().map(String::valueOf).collect(Collectors.toList());
  }
}
