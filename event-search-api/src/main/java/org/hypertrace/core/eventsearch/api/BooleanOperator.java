package org.hypertrace.core.eventsearch.api;

/** An explicit {@code AND} or {@code OR} written between two search terms. */
public enum BooleanOperator implements ParsedTerm {
  AND,
  OR;

  @Override
  public TermCase getTermCase() {
    return TermCase.BOOLEAN_OPERATOR;
  }
}
