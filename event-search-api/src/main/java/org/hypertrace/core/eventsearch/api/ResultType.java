package org.hypertrace.core.eventsearch.api;

/** Semantic type of a resolved column or function output. */
public enum ResultType {
  INTEGER("integer"),
  NUMBER("number"),
  DURATION("duration"),
  DATE("date"),
  PERCENTAGE("percentage"),
  STRING("string"),
  BOOLEAN("boolean");

  private final String displayName;

  ResultType(String displayName) {
    this.displayName = displayName;
  }

  public String getDisplayName() {
    return displayName;
  }
}
