package cafe.woden.logview.timeline;

import java.time.Instant;
import java.util.Objects;

/** Pads an effective range so the histogram shows context on both sides. */
public final class DisplayPadding {

  private DisplayPadding() {}

  /**
   * Display range around {@code [start ?? fallbackStart, end ?? fallbackEnd]} padded by
   * {@code max(range * ratio, minPaddingMs)} on each side.
   */
  public static DisplayRange around(
      Instant start,
      Instant end,
      Instant fallbackStart,
      Instant fallbackEnd,
      double ratio,
      long minPaddingMs) {
    Objects.requireNonNull(fallbackStart, "fallbackStart");
    Objects.requireNonNull(fallbackEnd, "fallbackEnd");
    long s = (start != null ? start : fallbackStart).toEpochMilli();
    long e = (end != null ? end : fallbackEnd).toEpochMilli();
    if (e < s) {
      // A lone bound can sit on the far side of its fallback partner.
      long t = s;
      s = e;
      e = t;
    }
    long padding = paddingMs(e - s, ratio, minPaddingMs);
    return DisplayRange.ofEpochMillis(s - padding, e + padding);
  }

  public static long paddingMs(long rangeMs, double ratio, long minPaddingMs) {
    return Math.max((long) Math.ceil(Math.max(0, rangeMs) * ratio), minPaddingMs);
  }
}
