package org.hypertrace.core.eventsearch.api;

/** An OR joins a row level filter with an aggregate filter. */
public class MixedAggregateBooleanException extends InvalidSearchQueryException {

  public MixedAggregateBooleanException() {
    super(
        Reason.MIXED_AGGREGATE_BOOLEAN,
        "Having an OR between aggregate filters and normal filters is invalid.");
  }
}
