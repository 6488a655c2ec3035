package org.hypertrace.core.eventsearch.topevents;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.hypertrace.core.eventsearch.api.InvalidSearchQueryException;

/** Fills the gaps of a timeseries with rows holding only their {@code time}. */
public final class Zerofill {
  public static final String TIME = "time";

  private Zerofill() {}

  /**
   * One entry per rollup bucket between {@code start} and {@code end}, both floored to the rollup.
   * Rows of a bucket keep their order; several rows may share a bucket.
   */
  public static List<Map<String, Object>> zerofill(
      List<Map<String, Object>> rows,
      Instant start,
      Instant end,
      Duration rollup,
      boolean timeDescending) {
    checkRollup(rollup);
    long step = rollup.getSeconds();
    long first = Math.floorDiv(start.getEpochSecond(), step) * step;
    long last = Math.floorDiv(end.getEpochSecond(), step) * step + step;

    Map<Long, List<Map<String, Object>>> rowsByTime = new LinkedHashMap<>();
    for (Map<String, Object> row : rows) {
      Object time = row.get(TIME);
      if (time instanceof Number) {
        rowsByTime.computeIfAbsent(((Number) time).longValue(), key -> new ArrayList<>()).add(row);
      }
    }

    List<Map<String, Object>> filled = new ArrayList<>();
    for (long time = first; time < last; time += step) {
      List<Map<String, Object>> bucket = rowsByTime.get(time);
      if (bucket == null || bucket.isEmpty()) {
        filled.add(Map.of(TIME, time));
      } else {
        filled.addAll(bucket);
      }
    }
    if (timeDescending) {
      Collections.reverse(filled);
    }
    return filled;
  }

  /** Rollups are whole buckets of at least one second. */
  static void checkRollup(Duration rollup) {
    if (rollup.getSeconds() < 1) {
      throw new InvalidSearchQueryException(
          InvalidSearchQueryException.Reason.INVALID_VALUE,
          String.format("Rollup must be at least one second, got %s", rollup));
    }
  }
}
