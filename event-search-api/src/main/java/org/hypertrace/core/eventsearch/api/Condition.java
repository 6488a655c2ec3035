package org.hypertrace.core.eventsearch.api;

public interface Condition {

  ConditionCase getConditionCase();

  enum ConditionCase {
    SIMPLE,
    BOOLEAN
  }
}
