package org.hypertrace.core.eventsearch.column;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

public class WildcardPatternsTest {

  @Test
  public void testToRegex() {
    assertEquals("^foo.*$", WildcardPatterns.toRegex("foo*"));
    assertEquals("^.*bar.*$", WildcardPatterns.toRegex("*bar*"));
    assertEquals("^a\\.b.*$", WildcardPatterns.toRegex("a.b*"));
    assertEquals("^a\\*b$", WildcardPatterns.toRegex("a\\*b"));
  }

  @Test
  public void testToLikePattern() {
    assertEquals("Value%", WildcardPatterns.toLikePattern("Value*"));
    assertEquals("%\\_id", WildcardPatterns.toLikePattern("*_id"));
    assertEquals("100\\%%", WildcardPatterns.toLikePattern("100%*"));
  }
}
