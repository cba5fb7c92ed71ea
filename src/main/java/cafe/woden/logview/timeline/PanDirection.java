package cafe.woden.logview.timeline;

public enum PanDirection {
  LEFT(-1),
  RIGHT(1);

  private final int sign;

  PanDirection(int sign) {
    this.sign = sign;
  }

  public int sign() {
    return sign;
  }
}
