package org.hypertrace.core.eventsearch.api;

public enum LogicalOperator {
  AND,
  OR
}
