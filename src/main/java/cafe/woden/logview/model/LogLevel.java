package cafe.woden.logview.model;

import java.util.Locale;
import java.util.Objects;

/** Log severity, ordered from least to most severe. */
public enum LogLevel {
  DEBUG("debug", "Debug"),
  INFO("info", "Info"),
  WARN("warn", "Warning"),
  ERROR("error", "Error"),
  FATAL("fatal", "Fatal");

  private final String label;
  private final String displayName;

  LogLevel(String label, String displayName) {
    this.label = label;
    this.displayName = displayName;
  }

  /** Lower-case wire label, e.g. {@code "warn"}. */
  public String label() {
    return label;
  }

  public String displayName() {
    return displayName;
  }

  public int severity() {
    return ordinal();
  }

  public boolean isAtLeast(LogLevel other) {
    return other == null || severity() >= other.severity();
  }

  /**
   * Parses a level label. Accepts common aliases ({@code warning}, {@code err}, {@code critical});
   * anything unknown or blank is {@link #INFO}.
   */
  public static LogLevel fromLabel(String raw) {
    String s = Objects.toString(raw, "").trim().toLowerCase(Locale.ROOT);
    return switch (s) {
      case "debug", "trace" -> DEBUG;
      case "warn", "warning" -> WARN;
      case "error", "err" -> ERROR;
      case "fatal", "critical", "crit" -> FATAL;
      default -> INFO;
    };
  }
}
