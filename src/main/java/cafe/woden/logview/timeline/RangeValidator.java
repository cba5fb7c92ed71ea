package cafe.woden.logview.timeline;

import java.time.Instant;

/**
 * Validates a proposed effective range. Missing bounds mean "all time" or open-ended and are
 * always valid.
 */
public final class RangeValidator {

  private RangeValidator() {}

  public static boolean isValidRange(
      Instant start, Instant end, Instant now, long minRangeMs, long nowToleranceMs) {
    if (start == null || end == null) return true;
    if (!start.isBefore(end)) return false;
    if (end.toEpochMilli() - start.toEpochMilli() < minRangeMs) return false;
    return !end.isAfter(now.plusMillis(nowToleranceMs));
  }
}
