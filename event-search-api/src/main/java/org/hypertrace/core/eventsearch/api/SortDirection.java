package org.hypertrace.core.eventsearch.api;

public enum SortDirection {
  ASC,
  DESC
}
