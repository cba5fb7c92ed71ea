package cafe.woden.logview.timeline;

import java.time.Instant;
import java.util.Objects;

/**
 * Pointer drag of one range dragger: IDLE, then DRAGGING after {@link #begin()}, then RELEASED.
 *
 * <p>Positions are relative to where the drag began, so the dragger follows the pointer even
 * though each accepted move re-pads the display. Moves are clamped to the display range at the
 * start of the drag; moves the state machine rejects leave the gesture {@linkplain #isBlocked()
 * blocked} at its previous position.
 */
public final class RangeDragGesture {

  private final TimelineRangeStateMachine timeline;
  private final DraggerSide side;

  private DragPhase phase = DragPhase.IDLE;
  private boolean blocked;
  private long originMs;
  private DisplayRange originDisplay;

  public RangeDragGesture(TimelineRangeStateMachine timeline, DraggerSide side) {
    this.timeline = Objects.requireNonNull(timeline, "timeline");
    this.side = Objects.requireNonNull(side, "side");
  }

  public DraggerSide side() {
    return side;
  }

  public synchronized DragPhase phase() {
    return phase;
  }

  public synchronized boolean isBlocked() {
    return blocked;
  }

  public synchronized void begin() {
    originDisplay = timeline.currentDisplay();
    Instant bound = timeline.currentEffectiveBound(side);
    if (bound == null) {
      bound = side == DraggerSide.START ? originDisplay.start() : originDisplay.end();
    }
    originMs = bound.toEpochMilli();
    blocked = false;
    phase = DragPhase.DRAGGING;
  }

  /** Drag by a pixel offset from the starting point over a track {@code trackWidth} wide. */
  public synchronized boolean dragByPixels(double pixelDelta, double trackWidth) {
    if (phase != DragPhase.DRAGGING || trackWidth <= 0) return false;
    double msPerPixel = originDisplay.rangeMs() / trackWidth;
    return dragTo(Instant.ofEpochMilli(originMs + Math.round(pixelDelta * msPerPixel)));
  }

  public synchronized boolean dragTo(Instant time) {
    Objects.requireNonNull(time, "time");
    if (phase != DragPhase.DRAGGING) return false;
    long clamped =
        Math.max(
            originDisplay.start().toEpochMilli(),
            Math.min(originDisplay.end().toEpochMilli(), time.toEpochMilli()));
    boolean accepted = timeline.moveDragger(side, Instant.ofEpochMilli(clamped));
    blocked = !accepted;
    return accepted;
  }

  public synchronized void release() {
    if (phase == DragPhase.DRAGGING) {
      phase = DragPhase.RELEASED;
    }
  }

  /** Back to IDLE; the pending edit, if any, is left for apply or cancel. */
  public synchronized void reset() {
    phase = DragPhase.IDLE;
    blocked = false;
    originDisplay = null;
  }
}
