package org.hypertrace.core.eventsearch.column;

/** Translates user wildcards ({@code *}, with {@code \} escapes) to engine patterns. */
public class WildcardPatterns {

  private WildcardPatterns() {}

  /** Anchored, case sensitive regular expression; callers add the {@code (?i)} flag. */
  public static String toRegex(String wildcard) {
    StringBuilder regex = new StringBuilder("^");
    int i = 0;
    while (i < wildcard.length()) {
      char c = wildcard.charAt(i++);
      if (c == '\\' && i < wildcard.length()) {
        appendEscaped(regex, wildcard.charAt(i++));
      } else if (c == '*') {
        regex.append(".*");
      } else {
        appendEscaped(regex, c);
      }
    }
    return regex.append('$').toString();
  }

  /** {@code LIKE} pattern for array element matching. */
  public static String toLikePattern(String wildcard) {
    return wildcard
        .replace("\\", "\\\\")
        .replace("%", "\\%")
        .replace("_", "\\_")
        .replace("*", "%");
  }

  private static void appendEscaped(StringBuilder builder, char c) {
    if (!Character.isLetterOrDigit(c) && c != '_' && !Character.isWhitespace(c)) {
      builder.append('\\');
    }
    builder.append(c);
  }
}
