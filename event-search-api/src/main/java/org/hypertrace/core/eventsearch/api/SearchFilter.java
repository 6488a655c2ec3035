package org.hypertrace.core.eventsearch.api;

import lombok.NonNull;
import lombok.Value;

/** A row level filter such as {@code environment:production} or {@code !has:release}. */
@Value
public class SearchFilter implements ParsedTerm {
  @NonNull SearchKey key;
  @NonNull FilterOperator operator;
  @NonNull SearchValue value;

  public static SearchFilter of(String key, FilterOperator operator, Object value) {
    return new SearchFilter(SearchKey.of(key), operator, SearchValue.of(value));
  }

  @Override
  public TermCase getTermCase() {
    return TermCase.FILTER;
  }

  public boolean isInFilter() {
    return operator.isInOperator();
  }

  public boolean isNegation() {
    return operator.isNegation();
  }

  public SearchFilter withKey(SearchKey newKey) {
    return new SearchFilter(newKey, operator, value);
  }

  public SearchFilter withOperator(FilterOperator newOperator) {
    return new SearchFilter(key, newOperator, value);
  }

  public SearchFilter withValue(SearchValue newValue) {
    return new SearchFilter(key, operator, newValue);
  }
}
