package cafe.woden.logview.timeline;

/** Which edge of the effective range a dragger controls. */
public enum DraggerSide {
  START,
  END
}
