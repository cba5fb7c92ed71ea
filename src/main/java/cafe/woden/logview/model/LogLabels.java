package cafe.woden.logview.model;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * Structured labels attached to a log line.
 *
 * <p>{@code task}, {@code retry} and {@code ioType} are optional and normalized to {@code ""} /
 * {@code null}; {@code extra} carries any further labels keyed by lower-case name.
 */
@ValueObject
public record LogLabels(String task, String retry, LogIoType ioType, Map<String, String> extra) {

  public static final LogLabels NONE = new LogLabels("", "", null, Map.of());

  public LogLabels {
    task = Objects.toString(task, "").trim();
    retry = Objects.toString(retry, "").trim();
    extra = normalizeExtra(extra);
  }

  public LogLabels(String task, String retry, LogIoType ioType) {
    this(task, retry, ioType, Map.of());
  }

  /** Source origin derived from the io type; {@code null} when the io type is unknown. */
  public LogSourceType source() {
    if (ioType == null) {
      return LogSourceType.fromLabel(extra.get("source"));
    }
    return ioType.source();
  }

  /**
   * Looks up a label by its wire name ({@code task}, {@code retry}, {@code io_type}, {@code
   * source}, or any extra key). Returns {@code ""} when absent.
   */
  public String get(String key) {
    String k = Objects.toString(key, "").trim().toLowerCase(Locale.ROOT);
    return switch (k) {
      case "task" -> task;
      case "retry" -> retry;
      case "io_type" -> ioType == null ? "" : ioType.label();
      case "source" -> {
        LogSourceType s = source();
        yield s == null ? "" : s.label();
      }
      default -> Objects.toString(extra.get(k), "");
    };
  }

  private static Map<String, String> normalizeExtra(Map<String, String> raw) {
    if (raw == null || raw.isEmpty()) return Map.of();
    LinkedHashMap<String, String> out = new LinkedHashMap<>();
    for (Map.Entry<String, String> e : raw.entrySet()) {
      String key = Objects.toString(e.getKey(), "").trim().toLowerCase(Locale.ROOT);
      if (key.isEmpty()) continue;
      out.put(key, Objects.toString(e.getValue(), ""));
    }
    if (out.isEmpty()) return Map.of();
    return java.util.Collections.unmodifiableMap(out);
  }
}
