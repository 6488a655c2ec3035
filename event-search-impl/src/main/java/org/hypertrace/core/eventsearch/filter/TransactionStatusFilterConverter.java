package org.hypertrace.core.eventsearch.filter;

import static org.hypertrace.core.eventsearch.api.InvalidSearchQueryException.Reason.INVALID_VALUE;

import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.hypertrace.core.eventsearch.api.Condition;
import org.hypertrace.core.eventsearch.api.InvalidSearchQueryException;
import org.hypertrace.core.eventsearch.api.SearchFilter;
import org.hypertrace.core.eventsearch.api.SearchValue;

/** {@code transaction.status:} takes span status names, stored as their numeric codes. */
@Singleton
public class TransactionStatusFilterConverter implements SearchFilterConverter {
  public static final ImmutableMap<String, Long> SPAN_STATUS_CODES =
      ImmutableMap.<String, Long>builder()
          .put("ok", 0L)
          .put("cancelled", 1L)
          .put("unknown", 2L)
          .put("invalid_argument", 3L)
          .put("deadline_exceeded", 4L)
          .put("not_found", 5L)
          .put("already_exists", 6L)
          .put("permission_denied", 7L)
          .put("resource_exhausted", 8L)
          .put("failed_precondition", 9L)
          .put("aborted", 10L)
          .put("out_of_range", 11L)
          .put("unimplemented", 12L)
          .put("internal_error", 13L)
          .put("unavailable", 14L)
          .put("data_loss", 15L)
          .put("unauthenticated", 16L)
          .build();

  private final DefaultFilterConverter defaultConverter;

  @Inject
  public TransactionStatusFilterConverter(DefaultFilterConverter defaultConverter) {
    this.defaultConverter = defaultConverter;
  }

  @Override
  public Optional<Condition> convert(SearchFilter filter, FilterContext context) {
    if (Filters.isExistenceCheck(filter)) {
      return defaultConverter.convert(filter, context);
    }
    if (filter.getValue().isWildcard()) {
      throw invalidValue(filter.getValue());
    }
    List<Object> codes = new ArrayList<>();
    for (Object status : filter.getValue().getValues()) {
      Long code = SPAN_STATUS_CODES.get(String.valueOf(status));
      if (code == null) {
        throw invalidValue(filter.getValue());
      }
      codes.add(code);
    }
    SearchValue value = filter.isInFilter() ? SearchValue.of(codes) : SearchValue.of(codes.get(0));
    return defaultConverter.convert(filter.withValue(value), context);
  }

  private static InvalidSearchQueryException invalidValue(SearchValue value) {
    return new InvalidSearchQueryException(
        INVALID_VALUE,
        String.format(
            "Invalid value %s for transaction.status condition. Accepted values are %s",
            value.getValue(),
            String.join(", ", SPAN_STATUS_CODES.keySet())));
  }
}
