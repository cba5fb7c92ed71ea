package cafe.woden.logview.selection;

/** Pointer gesture progress, independent of any input framework. */
public enum PointerGesturePhase {
  IDLE,
  DRAGGING,
  RELEASED
}
