package cafe.woden.logview.parse;

import cafe.woden.logview.model.LogEntry;
import cafe.woden.logview.model.LogIoType;
import cafe.woden.logview.model.LogLabels;
import cafe.woden.logview.model.LogLevel;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses raw transport lines into {@link LogEntry} values.
 *
 * <p>Recognized shapes, in order:
 * <ul>
 *   <li>JSON objects ({@code {"timestamp":...,"message":...}}), see {@link JsonLogLineDecoder}
 *   <li>{@code YYYY/MM/DD HH:mm:ss [task] message}, optionally {@code [task retry-N]} and a
 *       {@code [osmo]} marker for platform control lines (timestamps are UTC)
 *   <li>anything else is a "dump" line stamped with the parser's clock
 * </ul>
 *
 * <p>Instances are thread-safe; ids are unique per parser instance.
 */
public final class LogLineParser {

  private static final Pattern TIMESTAMP_RE =
      Pattern.compile("^(\\d{4})/(\\d{2})/(\\d{2}) (\\d{2}):(\\d{2}):(\\d{2})");
  private static final Pattern TASK_RE = Pattern.compile("^\\[([^\\]\\s]+)(?:\\s+retry-(\\d+))?]");
  private static final String OSMO_MARKER = "[osmo]";
  private static final Pattern ANSI_RE = Pattern.compile("\u001B\\[[0-9;]*m");

  // "YYYY/MM/DD HH:MM:SS " is 20 characters.
  private static final int TIMESTAMP_PREFIX_LENGTH = 20;

  private final Clock clock;
  private final JsonLogLineDecoder json;
  private final AtomicLong idCounter = new AtomicLong();

  public LogLineParser(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.json = new JsonLogLineDecoder(this::nextId);
  }

  public LogLineParser() {
    this(Clock.systemUTC());
  }

  /** Returns {@code null} for blank lines. */
  public LogEntry parseLine(String line) {
    if (line == null || line.isBlank()) return null;

    char first = line.charAt(0);
    if (first == '{') {
      LogEntry decoded = json.decode(line);
      return decoded != null ? decoded : parseDumpLine(line);
    }
    if (first < '0' || first > '9') {
      return parseDumpLine(line);
    }

    Matcher ts = TIMESTAMP_RE.matcher(line);
    if (!ts.find() || line.length() < TIMESTAMP_PREFIX_LENGTH) {
      return parseDumpLine(line);
    }

    Instant timestamp;
    try {
      timestamp =
          LocalDateTime.of(
                  Integer.parseInt(ts.group(1)),
                  Integer.parseInt(ts.group(2)),
                  Integer.parseInt(ts.group(3)),
                  Integer.parseInt(ts.group(4)),
                  Integer.parseInt(ts.group(5)),
                  Integer.parseInt(ts.group(6)))
              .toInstant(ZoneOffset.UTC);
    } catch (java.time.DateTimeException e) {
      return parseDumpLine(line);
    }

    int pos = TIMESTAMP_PREFIX_LENGTH;
    Matcher task = TASK_RE.matcher(line.substring(pos));
    if (!task.find()) {
      return parseDumpLine(line);
    }
    String taskName = task.group(1);
    String retry = task.group(2) != null ? task.group(2) : "0";
    pos += task.end();

    boolean osmo = line.startsWith(OSMO_MARKER, pos);
    if (osmo) pos += OSMO_MARKER.length();

    String message = stripAnsi(line.substring(pos));
    if (message.startsWith(" ")) message = message.substring(1);

    LogIoType ioType = osmo ? LogIoType.OSMO_CTRL : LogIoType.STDOUT;
    return new LogEntry(
        nextId(timestamp),
        timestamp,
        LogLevel.INFO,
        message,
        new LogLabels(taskName, retry, ioType));
  }

  /** Parses newline-separated text, skipping blank lines, in input order. */
  public List<LogEntry> parseBatch(String text) {
    if (text == null || text.isEmpty()) return List.of();
    String[] lines = text.split("\r?\n");
    ArrayList<LogEntry> out = new ArrayList<>(lines.length);
    for (String line : lines) {
      LogEntry e = parseLine(line);
      if (e != null) out.add(e);
    }
    return List.copyOf(out);
  }

  private LogEntry parseDumpLine(String line) {
    Instant now = clock.instant();
    return new LogEntry(
        "dump-" + nextId(now),
        now,
        LogLevel.INFO,
        stripAnsi(line),
        new LogLabels("", "", LogIoType.DUMP));
  }

  private String nextId(Instant timestamp) {
    return timestamp.toEpochMilli() + "-" + idCounter.incrementAndGet();
  }

  static String stripAnsi(String s) {
    if (s.indexOf('\u001B') < 0) return s;
    return ANSI_RE.matcher(s).replaceAll("");
  }
}
