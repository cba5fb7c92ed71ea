package cafe.woden.logview.model;

import java.time.Instant;
import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * A single immutable log line.
 *
 * <p>Identity is {@link #id()}; ordering key is {@link #timestamp()}.
 */
@ValueObject
public record LogEntry(
    String id, Instant timestamp, LogLevel level, String message, LogLabels labels) {

  public LogEntry {
    id = Objects.toString(id, "").trim();
    if (id.isEmpty()) {
      throw new IllegalArgumentException("log entry id is required");
    }
    Objects.requireNonNull(timestamp, "timestamp");
    if (level == null) level = LogLevel.INFO;
    message = Objects.toString(message, "");
    if (labels == null) labels = LogLabels.NONE;
  }

  public LogEntry(String id, Instant timestamp, LogLevel level, String message) {
    this(id, timestamp, level, message, LogLabels.NONE);
  }

  public long epochMs() {
    return timestamp.toEpochMilli();
  }
}
