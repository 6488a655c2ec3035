package org.hypertrace.core.eventsearch.api;

/** The search query or field list cannot be compiled; the message is meant for the end user. */
public class InvalidSearchQueryException extends RuntimeException {

  public enum Reason {
    UNKNOWN_FIELD,
    UNKNOWN_FUNCTION,
    INVALID_ARGUMENT,
    TOO_FEW_ARGUMENTS,
    TOO_MANY_ARGUMENTS,
    MISSING_PARAMETER,
    MIXED_AGGREGATE_BOOLEAN,
    TOO_MANY_THRESHOLDS,
    INVALID_IDENTIFIER,
    INVALID_VALUE,
    MALFORMED_QUERY
  }

  private final Reason reason;

  public InvalidSearchQueryException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public InvalidSearchQueryException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason getReason() {
    return reason;
  }
}
