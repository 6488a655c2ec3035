package org.hypertrace.core.eventsearch.function;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

public class NameFormatterTest {

  @Test
  public void testFormatGeneral() {
    assertEquals("0.5", NameFormatter.formatGeneral(0.5));
    assertEquals("0.95", NameFormatter.formatGeneral(0.95));
    assertEquals("100", NameFormatter.formatGeneral(100.0));
    assertEquals("0", NameFormatter.formatGeneral(0.0));
    assertEquals("1e-05", NameFormatter.formatGeneral(0.00001));
    assertEquals("1.23457e+06", NameFormatter.formatGeneral(1234567.0));
    assertEquals("-2.5", NameFormatter.formatGeneral(-2.5));
  }

  @Test
  public void testFormat() {
    assertEquals(
        "quantile(0.95)",
        NameFormatter.format("quantile({percentile:g})", Map.of("percentile", 0.95)));
    assertEquals(
        "quantileIf(0.50)",
        NameFormatter.format("quantileIf({percentile:.2f})", Map.of("percentile", 0.5)));
    assertEquals("count", NameFormatter.format("count", Map.of()));
    assertEquals("f(abc)", NameFormatter.format("f({name})", Map.of("name", "abc")));
  }

  @Test
  public void testPlaceholders() {
    assertTrue(NameFormatter.hasPlaceholders("quantile({percentile:g})"));
    assertFalse(NameFormatter.hasPlaceholders("quantile(0.5)"));
  }

  @Test
  public void testInvalidFormats() {
    assertThrows(
        IllegalArgumentException.class, () -> NameFormatter.format("f({missing})", Map.of()));
    assertThrows(
        IllegalArgumentException.class,
        () -> NameFormatter.format("f({value:g})", Map.of("value", "text")));
    assertThrows(
        IllegalArgumentException.class,
        () -> NameFormatter.format("f({value:x})", Map.of("value", 1.0)));
  }
}
