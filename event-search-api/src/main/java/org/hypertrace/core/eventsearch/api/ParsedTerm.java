package org.hypertrace.core.eventsearch.api;

/** One token of a tokenized search query. */
public interface ParsedTerm {

  TermCase getTermCase();

  enum TermCase {
    FILTER,
    AGGREGATE_FILTER,
    PAREN_GROUP,
    BOOLEAN_OPERATOR
  }
}
