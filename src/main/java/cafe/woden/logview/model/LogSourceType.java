package cafe.woden.logview.model;

import java.util.Locale;
import java.util.Objects;

/** Whether a line came from the user's workload or from the platform itself. */
public enum LogSourceType {
  USER("user"),
  OSMO("osmo");

  private final String label;

  LogSourceType(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }

  /** Returns {@code null} for blank or unknown labels. */
  public static LogSourceType fromLabel(String raw) {
    String s = Objects.toString(raw, "").trim().toLowerCase(Locale.ROOT);
    for (LogSourceType t : values()) {
      if (t.label.equals(s)) return t;
    }
    return null;
  }
}
