package cafe.woden.logview.timeline;

import java.time.Instant;

/** Limits on panning the display range past the entity's lifetime. */
public final class PanConstraints {

  static final long BOUNDARY_THRESHOLD_MS = 1_000;
  static final long ZOOM_TOLERANCE_MS = 1;
  static final long RUNNING_HEADROOM_MS = 60_000;

  public enum BlockReason {
    RIGHT_BOUNDARY,
    LEFT_BOUNDARY
  }

  private PanConstraints() {}

  /**
   * Right pan boundary: entity end plus padding, or {@code now} plus headroom while the entity is
   * running. {@code null} when the entity start is unknown.
   */
  public static Instant rightBoundary(
      EntityLifecycle entity, Instant now, double ratio, long minPaddingMs) {
    if (entity == null || entity.start() == null) return null;
    if (entity.end() == null) return now.plusMillis(RUNNING_HEADROOM_MS);
    long duration = entity.end().toEpochMilli() - entity.start().toEpochMilli();
    return entity.end().plusMillis(DisplayPadding.paddingMs(duration, ratio, minPaddingMs));
  }

  public static boolean isZoom(long newRangeMs, long currentRangeMs) {
    return Math.abs(newRangeMs - currentRangeMs) > ZOOM_TOLERANCE_MS;
  }

  /**
   * Returns why moving from {@code current} to {@code proposed} is blocked, or {@code null}.
   *
   * @param effectiveStart the start dragger's time, or {@code null} when unbounded
   */
  public static BlockReason check(
      DisplayRange current,
      DisplayRange proposed,
      EntityLifecycle entity,
      Instant now,
      Instant effectiveStart,
      double ratio,
      long minPaddingMs) {
    if (entity == null || entity.start() == null) return null;
    boolean zoom = isZoom(proposed.rangeMs(), current.rangeMs());
    if (zoom) return null;

    Instant boundary = rightBoundary(entity, now, ratio, minPaddingMs);
    long currentEnd = current.end().toEpochMilli();
    boolean panningRight = proposed.end().toEpochMilli() > currentEnd;
    boolean atBoundary = currentEnd >= boundary.toEpochMilli() - BOUNDARY_THRESHOLD_MS;
    if (panningRight && atBoundary) return BlockReason.RIGHT_BOUNDARY;

    if (effectiveStart != null && current.rangeMs() > 0) {
      // The start dragger keeps its screen position while the data slides under it.
      double fraction =
          (double) (effectiveStart.toEpochMilli() - current.start().toEpochMilli())
              / current.rangeMs();
      double draggerTime = proposed.start().toEpochMilli() + fraction * proposed.rangeMs();
      boolean panningLeft = proposed.start().toEpochMilli() < current.start().toEpochMilli();
      if (panningLeft && entity.start().toEpochMilli() > draggerTime) {
        return BlockReason.LEFT_BOUNDARY;
      }
    }
    return null;
  }
}
