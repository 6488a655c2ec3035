package org.hypertrace.core.eventsearch.api;

import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;
import javax.annotation.Nullable;
import lombok.Value;

/**
 * Value side of a parsed filter. The tokenizer hands values over already typed: strings, longs,
 * doubles, booleans, instants or a list of those for {@code IN} filters.
 */
@Value
public class SearchValue {
  private static final Pattern EVENT_ID_PATTERN =
      Pattern.compile("^[0-9a-fA-F]{32}$|^[0-9a-fA-F]{8}(-[0-9a-fA-F]{4}){3}-[0-9a-fA-F]{12}$");
  private static final Pattern SPAN_ID_PATTERN = Pattern.compile("^[0-9a-fA-F]{16}$");

  @Nullable Object value;

  public static SearchValue of(@Nullable Object value) {
    return new SearchValue(value);
  }

  public boolean isList() {
    return value instanceof List;
  }

  @SuppressWarnings("unchecked")
  public List<Object> getValues() {
    if (value instanceof List) {
      return (List<Object>) value;
    }
    return Collections.singletonList(value);
  }

  public String asString() {
    return value == null ? "" : String.valueOf(value);
  }

  public boolean isEmptyString() {
    return "".equals(value);
  }

  /** A string value containing at least one {@code *} not escaped by a backslash. */
  public boolean isWildcard() {
    if (!(value instanceof String)) {
      return false;
    }
    String text = (String) value;
    boolean escaped = false;
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (escaped) {
        escaped = false;
      } else if (c == '\\') {
        escaped = true;
      } else if (c == '*') {
        return true;
      }
    }
    return false;
  }

  public boolean isEventId() {
    return getValues().stream()
        .allMatch(item -> item instanceof String && EVENT_ID_PATTERN.matcher((String) item).matches());
  }

  public boolean isSpanId() {
    return getValues().stream()
        .allMatch(item -> item instanceof String && SPAN_ID_PATTERN.matcher((String) item).matches());
  }
}
