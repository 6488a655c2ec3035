package org.hypertrace.core.eventsearch.api;

import lombok.NonNull;
import lombok.Value;

@Value
public class SearchKey {
  @NonNull String name;
  /** Set when the key was written in explicit tag form, {@code tags[name]}. */
  boolean tag;

  public static SearchKey of(String name) {
    return new SearchKey(name, false);
  }

  public static SearchKey tag(String name) {
    return new SearchKey(name, true);
  }
}
