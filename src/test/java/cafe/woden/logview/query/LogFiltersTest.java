package cafe.woden.logview.query;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import cafe.woden.logview.model.LogEntry;
import cafe.woden.logview.model.LogIoType;
import cafe.woden.logview.model.LogLabels;
import cafe.woden.logview.model.LogLevel;
import cafe.woden.logview.model.LogSourceType;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import org.junit.jupiter.api.Test;

class LogFiltersTest {

  private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

  private final LogEntry trainInfo =
      entry("1", 0, LogLevel.INFO, "epoch 3 loss=0.12", "train", LogIoType.STDOUT);
  private final LogEntry trainError =
      entry("2", 10, LogLevel.ERROR, "CUDA out of memory", "train", LogIoType.STDERR);
  private final LogEntry prepCtrl =
      entry("3", 20, LogLevel.INFO, "Downloading dataset", "prep", LogIoType.OSMO_CTRL);
  private final List<LogEntry> all = List.of(trainInfo, trainError, prepCtrl);

  @Test
  void emptyFilterMatchesEverythingAndReturnsInputList() {
    assertTrue(LogFilter.NONE.isEmpty());
    assertSame(all, LogFilters.apply(all, LogFilter.NONE));
  }

  @Test
  void criteriaAreAndedValuesAreOred() {
    LogFilter filter =
        new LogFilter(
            Set.of(LogLevel.INFO, LogLevel.ERROR),
            Set.of("train"),
            Set.of(),
            Set.of(LogSourceType.USER),
            "",
            null,
            null,
            null);

    assertEquals(List.of(trainInfo, trainError), LogFilters.apply(all, filter));
  }

  @Test
  void containsIsCaseInsensitive() {
    LogFilter filter = LogFilter.NONE.withSearch("cuda", LogSearchMode.CONTAINS);

    assertEquals(List.of(trainError), LogFilters.apply(all, filter));
  }

  @Test
  void globAndRegexSearch() {
    assertEquals(
        List.of(trainInfo),
        LogFilters.apply(all, LogFilter.NONE.withSearch("loss=0.?2", LogSearchMode.GLOB)));
    assertEquals(
        List.of(trainInfo, prepCtrl),
        LogFilters.apply(all, LogFilter.NONE.withSearch("^(epoch|down)", LogSearchMode.REGEX)));
  }

  @Test
  void badRegexFailsAtCompileTime() {
    LogFilter filter = LogFilter.NONE.withSearch("(unclosed", LogSearchMode.REGEX);

    assertThrows(IllegalArgumentException.class, () -> LogFilters.compile(filter));
  }

  @Test
  void timeBoundsAreInclusiveAndSwappedWhenInverted() {
    LogFilter filter = LogFilter.NONE.withRange(T0.plusSeconds(20), T0.plusSeconds(10));
    Predicate<LogEntry> p = LogFilters.compile(filter);

    assertEquals(T0.plusSeconds(10), filter.start());
    assertFalse(p.test(trainInfo));
    assertTrue(p.test(trainError));
    assertTrue(p.test(prepCtrl));
  }

  @Test
  void levelShortcut() {
    LogFilter filter = LogFilter.NONE.withLevels(LogLevel.ERROR);

    assertEquals(List.of(trainError), LogFilters.apply(all, filter));
  }

  private static LogEntry entry(
      String id, long seconds, LogLevel level, String message, String task, LogIoType io) {
    return new LogEntry(id, T0.plusSeconds(seconds), level, message, new LogLabels(task, "0", io));
  }
}
