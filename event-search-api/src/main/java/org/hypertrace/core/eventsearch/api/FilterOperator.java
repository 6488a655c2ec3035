package org.hypertrace.core.eventsearch.api;

import java.util.Arrays;

/** Comparison operators a parsed search filter can carry. */
public enum FilterOperator {
  EQ("="),
  NEQ("!="),
  GT(">"),
  GTE(">="),
  LT("<"),
  LTE("<="),
  IN("IN"),
  NOT_IN("NOT IN");

  private final String symbol;

  FilterOperator(String symbol) {
    this.symbol = symbol;
  }

  public String getSymbol() {
    return symbol;
  }

  public boolean isNegation() {
    return this == NEQ || this == NOT_IN;
  }

  public boolean isEquality() {
    return this == EQ || this == IN;
  }

  public boolean isInOperator() {
    return this == IN || this == NOT_IN;
  }

  /** The operator that selects exactly the complement of this one. */
  public FilterOperator negate() {
    switch (this) {
      case EQ:
        return NEQ;
      case NEQ:
        return EQ;
      case GT:
        return LTE;
      case GTE:
        return LT;
      case LT:
        return GTE;
      case LTE:
        return GT;
      case IN:
        return NOT_IN;
      case NOT_IN:
        return IN;
      default:
        throw new UnsupportedOperationException("Unknown operator " + this);
    }
  }

  public ConditionOperator toConditionOperator() {
    return ConditionOperator.valueOf(name());
  }

  public static FilterOperator fromSymbol(String symbol) {
    return Arrays.stream(values())
        .filter(operator -> operator.symbol.equalsIgnoreCase(symbol))
        .findFirst()
        .orElseThrow(
            () -> new IllegalArgumentException(String.format("Unknown operator %s", symbol)));
  }
}
