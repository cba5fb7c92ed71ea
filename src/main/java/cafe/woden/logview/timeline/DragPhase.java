package cafe.woden.logview.timeline;

public enum DragPhase {
  IDLE,
  DRAGGING,
  RELEASED
}
