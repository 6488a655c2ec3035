package org.hypertrace.core.eventsearch.api;

public enum ConditionOperator {
  EQ("="),
  NEQ("!="),
  GT(">"),
  GTE(">="),
  LT("<"),
  LTE("<="),
  IN("IN"),
  NOT_IN("NOT IN"),
  LIKE("LIKE"),
  NOT_LIKE("NOT LIKE"),
  IS_NULL("IS NULL"),
  IS_NOT_NULL("IS NOT NULL");

  private final String symbol;

  ConditionOperator(String symbol) {
    this.symbol = symbol;
  }

  public String getSymbol() {
    return symbol;
  }

  public boolean isUnary() {
    return this == IS_NULL || this == IS_NOT_NULL;
  }
}
