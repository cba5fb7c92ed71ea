package cafe.woden.logview.timeline;

public enum RangeEditState {
  COMMITTED,
  EDITING
}
