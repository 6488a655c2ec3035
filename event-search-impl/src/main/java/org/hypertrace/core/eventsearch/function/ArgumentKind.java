package org.hypertrace.core.eventsearch.function;

public enum ArgumentKind {
  /** A reference to the alias of another selected function. */
  ALIAS_REFERENCE,
  FUNCTION_ALIAS,
  NULL_COLUMN,
  COUNT_COLUMN,
  FIELD_COLUMN,
  COLUMN,
  NUMERIC_COLUMN,
  DURATION_COLUMN,
  STRING_ARRAY_COLUMN,
  STRING,
  DATE,
  CONDITION,
  NUMBER_RANGE,
  NULLABLE_NUMBER_RANGE,
  INTERVAL_DEFAULT
}
