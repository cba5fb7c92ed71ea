package cafe.woden.logview.query;

import cafe.woden.logview.model.LogLevel;
import cafe.woden.logview.model.LogSourceType;
import java.time.Instant;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Filter parameters for log entries.
 *
 * <p>All criteria are AND-ed; values inside one multi-value criterion are OR-ed. Empty sets mean
 * "no constraint". Time bounds are inclusive and optional.
 */
public record LogFilter(
    Set<LogLevel> levels,
    Set<String> tasks,
    Set<String> retries,
    Set<LogSourceType> sources,
    String search,
    LogSearchMode searchMode,
    Instant start,
    Instant end) {

  public static final LogFilter NONE =
      new LogFilter(Set.of(), Set.of(), Set.of(), Set.of(), "", LogSearchMode.CONTAINS, null, null);

  public LogFilter {
    levels = levels == null || levels.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(levels));
    tasks = normalize(tasks);
    retries = normalize(retries);
    sources = sources == null || sources.isEmpty() ? Set.of() : Set.copyOf(sources);
    search = Objects.toString(search, "");
    if (searchMode == null) searchMode = LogSearchMode.CONTAINS;

    if (start != null && end != null && start.isAfter(end)) {
      Instant tmp = start;
      start = end;
      end = tmp;
    }
  }

  public boolean isEmpty() {
    return levels.isEmpty()
        && tasks.isEmpty()
        && retries.isEmpty()
        && sources.isEmpty()
        && search.isBlank()
        && start == null
        && end == null;
  }

  public LogFilter withRange(Instant newStart, Instant newEnd) {
    return new LogFilter(levels, tasks, retries, sources, search, searchMode, newStart, newEnd);
  }

  public LogFilter withLevels(LogLevel... newLevels) {
    Set<LogLevel> lv = newLevels == null ? Set.of() : Set.copyOf(Arrays.asList(newLevels));
    return new LogFilter(lv, tasks, retries, sources, search, searchMode, start, end);
  }

  public LogFilter withSearch(String newSearch, LogSearchMode mode) {
    return new LogFilter(levels, tasks, retries, sources, newSearch, mode, start, end);
  }

  private static Set<String> normalize(Set<String> raw) {
    if (raw == null || raw.isEmpty()) return Set.of();
    List<String> cleaned =
        raw.stream()
            .map(s -> Objects.toString(s, "").trim())
            .filter(s -> !s.isEmpty())
            .toList();
    return Set.copyOf(cleaned);
  }
}
