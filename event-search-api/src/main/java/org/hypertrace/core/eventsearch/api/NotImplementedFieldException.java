package org.hypertrace.core.eventsearch.api;

/**
 * A field or function that is recognised but not supported yet. Kept apart from {@link
 * InvalidSearchQueryException} so callers can tell it from a query that will never work.
 */
public class NotImplementedFieldException extends UnsupportedOperationException {

  public NotImplementedFieldException(String message) {
    super(message);
  }
}
