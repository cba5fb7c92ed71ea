package cafe.woden.logview.timeline;

import java.util.Optional;

/**
 * Percent geometry of the dimmed areas left and right of the effective range.
 *
 * @param leftWidth width of the left overlay, 0..100
 * @param rightStart where the right overlay begins, 0..100
 * @param rightWidth width of the right overlay, 0..100
 */
public record OverlayPositions(double leftWidth, double rightStart, double rightWidth) {

  public static Optional<OverlayPositions> compute(
      long displayStartMs, long displayEndMs, long effectiveStartMs, long effectiveEndMs) {
    long range = displayEndMs - displayStartMs;
    if (range <= 0) return Optional.empty();
    double left = ((double) (effectiveStartMs - displayStartMs) / range) * 100;
    double rightStart = ((double) (effectiveEndMs - displayStartMs) / range) * 100;
    double rightWidth = 100 - rightStart;
    return Optional.of(
        new OverlayPositions(
            Math.max(0, Math.min(100, left)),
            Math.max(0, Math.min(100, rightStart)),
            Math.max(0, Math.min(100, rightWidth))));
  }

  /** Position of {@code timeMs} in the display range as a percentage. */
  public static double positionPercent(long timeMs, long displayStartMs, long displayEndMs) {
    long range = displayEndMs - displayStartMs;
    if (range <= 0) return 0;
    return ((double) (timeMs - displayStartMs) / range) * 100;
  }
}
