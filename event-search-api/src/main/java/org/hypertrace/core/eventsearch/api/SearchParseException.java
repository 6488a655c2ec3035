package org.hypertrace.core.eventsearch.api;

public class SearchParseException extends RuntimeException {
  private final int position;

  public SearchParseException(String message, int position) {
    super(String.format("Parse error at '%d': %s", position, message));
    this.position = position;
  }

  /** Zero based column of the query text where parsing failed. */
  public int getPosition() {
    return position;
  }
}
