package org.hypertrace.core.eventsearch.topevents;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.hypertrace.core.eventsearch.api.InvalidSearchQueryException;
import org.junit.jupiter.api.Test;

public class ZerofillTest {
  private static final long T0 = Instant.parse("2021-01-01T00:00:00Z").getEpochSecond();
  private static final Instant START = Instant.ofEpochSecond(T0 + 10);
  private static final Instant END = Instant.ofEpochSecond(T0 + 300);
  private static final Duration MINUTE = Duration.ofMinutes(1);

  @Test
  public void testFillsEveryBucket() {
    Map<String, Object> row = Map.of("time", T0 + 60, "count", 3L);
    List<Map<String, Object>> filled =
        Zerofill.zerofill(List.of(row), START, END, MINUTE, false);

    assertEquals(6, filled.size());
    assertEquals(Map.of("time", T0), filled.get(0));
    assertEquals(row, filled.get(1));
    assertEquals(Map.of("time", T0 + 300), filled.get(5));
  }

  @Test
  public void testDescending() {
    List<Map<String, Object>> filled = Zerofill.zerofill(List.of(), START, END, MINUTE, true);
    assertEquals(Map.of("time", T0 + 300), filled.get(0));
    assertEquals(Map.of("time", T0), filled.get(5));
  }

  @Test
  public void testRowsSharingABucket() {
    Map<String, Object> first = Map.of("time", T0, "release", "1.0");
    Map<String, Object> second = Map.of("time", T0, "release", "2.0");
    Map<String, Object> untimed = Map.of("release", "3.0");
    List<Map<String, Object>> filled =
        Zerofill.zerofill(List.of(first, second, untimed), START, END, MINUTE, false);

    assertEquals(7, filled.size());
    assertEquals(List.of(first, second), filled.subList(0, 2));
  }

  @Test
  public void testRollupBelowOneSecond() {
    InvalidSearchQueryException exception =
        assertThrows(
            InvalidSearchQueryException.class,
            () -> Zerofill.zerofill(List.of(), START, END, Duration.ofMillis(500), false));
    assertEquals(InvalidSearchQueryException.Reason.INVALID_VALUE, exception.getReason());
    assertThrows(
        InvalidSearchQueryException.class,
        () -> Zerofill.zerofill(List.of(), START, END, Duration.ofMinutes(-1), false));
  }
}
