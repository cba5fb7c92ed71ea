package cafe.woden.logview.model;

import java.util.Locale;
import java.util.Objects;

/** Output stream a log line was captured from. */
public enum LogIoType {
  STDOUT("stdout", LogSourceType.USER),
  STDERR("stderr", LogSourceType.USER),
  OSMO_CTRL("osmo_ctrl", LogSourceType.OSMO),
  DOWNLOAD("download", LogSourceType.OSMO),
  UPLOAD("upload", LogSourceType.OSMO),
  DUMP("dump", LogSourceType.USER);

  private final String label;
  private final LogSourceType source;

  LogIoType(String label, LogSourceType source) {
    this.label = label;
    this.source = source;
  }

  public String label() {
    return label;
  }

  /** User output vs. infrastructure output. */
  public LogSourceType source() {
    return source;
  }

  /** Returns {@code null} for blank or unknown labels. */
  public static LogIoType fromLabel(String raw) {
    String s = Objects.toString(raw, "").trim().toLowerCase(Locale.ROOT);
    for (LogIoType t : values()) {
      if (t.label.equals(s)) return t;
    }
    return null;
  }
}
