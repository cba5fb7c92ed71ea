package cafe.woden.logview.parse;

import cafe.woden.logview.model.LogEntry;
import cafe.woden.logview.stream.BatchLogSource;
import cafe.woden.logview.stream.LiveLogSource;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.core.Single;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/** Adapts raw text transports to the engine's batch and live sources. */
public final class ParsedLogSources {

  private ParsedLogSources() {}

  /**
   * A batch source over a full text dump. Each fetch re-reads the text, keeps entries inside
   * {@code [start, end)} (a null bound is open) and returns them in timestamp order.
   */
  public static BatchLogSource batch(LogLineParser parser, Supplier<String> text) {
    Objects.requireNonNull(parser, "parser");
    Objects.requireNonNull(text, "text");
    return (start, end) ->
        Single.fromCallable(
            () -> {
              List<LogEntry> parsed = parser.parseBatch(text.get());
              List<LogEntry> out = new ArrayList<>(parsed.size());
              for (LogEntry e : parsed) {
                if (inRange(e.timestamp(), start, end)) out.add(e);
              }
              out.sort(Comparator.comparing(LogEntry::timestamp));
              return out;
            });
  }

  /**
   * A live source over a line stream; blank lines are skipped. Subscribing to the line stream
   * counts as connecting.
   */
  public static LiveLogSource live(LogLineParser parser, Supplier<Flowable<String>> lines) {
    Objects.requireNonNull(parser, "parser");
    Objects.requireNonNull(lines, "lines");
    return LiveLogSource.fromEntries(
        () -> lines.get().mapOptional(line -> Optional.ofNullable(parser.parseLine(line))));
  }

  static boolean inRange(Instant ts, Instant start, Instant end) {
    if (start != null && ts.isBefore(start)) return false;
    return end == null || ts.isBefore(end);
  }
}
