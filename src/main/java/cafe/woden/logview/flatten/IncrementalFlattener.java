package cafe.woden.logview.flatten;

import cafe.woden.logview.model.LogEntry;
import cafe.woden.logview.util.AppendOnlyList;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns the entry sequence into a flat item list with a date separator before each UTC day.
 *
 * <p>When the generation is unchanged and entries were only appended, only the new suffix is
 * walked, continuing from the prior list's last date. Anything else rebuilds. Both paths produce
 * the same items for the same final entries.
 */
public final class IncrementalFlattener {

  private IncrementalFlattener() {}

  public static FlatList flatten(List<LogEntry> entries, long generation, FlatList prior) {
    Objects.requireNonNull(entries, "entries");
    if (prior == null
        || prior == FlatList.EMPTY && !entries.isEmpty()
        || prior.generation() != generation
        || entries.size() < prior.entryCount()) {
      return rebuild(entries, generation);
    }
    if (entries.size() == prior.entryCount()) {
      return prior.withoutRebuildFlag();
    }
    return extend(entries, prior);
  }

  /** Full O(n) pass. */
  public static FlatList rebuild(List<LogEntry> entries, long generation) {
    ArrayList<FlatItem> items = new ArrayList<>(entries.size() + 8);
    ArrayList<FlatItem.SeparatorItem> separators = new ArrayList<>();
    LocalDate last = appendRange(entries, 0, null, items, separators, 0);
    return new FlatList(
        AppendOnlyList.copyOf(items),
        AppendOnlyList.copyOf(separators),
        generation,
        entries.size(),
        last,
        true);
  }

  private static FlatList extend(List<LogEntry> entries, FlatList prior) {
    int from = prior.entryCount();
    ArrayList<FlatItem> items = new ArrayList<>(entries.size() - from + 2);
    ArrayList<FlatItem.SeparatorItem> separators = new ArrayList<>(2);
    LocalDate last =
        appendRange(entries, from, prior.lastDateKey(), items, separators, prior.size());
    return new FlatList(
        appendAll(prior.items(), items),
        appendAll(prior.separators(), separators),
        prior.generation(),
        entries.size(),
        last,
        false);
  }

  private static LocalDate appendRange(
      List<LogEntry> entries,
      int from,
      LocalDate lastKey,
      List<FlatItem> items,
      List<FlatItem.SeparatorItem> separators,
      int flatOffset) {
    LocalDate current = lastKey;
    for (int i = from; i < entries.size(); i++) {
      LocalDate key = dateKey(entries.get(i).timestamp());
      if (!key.equals(current)) {
        FlatItem.SeparatorItem sep =
            new FlatItem.SeparatorItem(key, i, flatOffset + items.size());
        items.add(sep);
        separators.add(sep);
        current = key;
      }
      items.add(new FlatItem.EntryItem(i, flatOffset + items.size()));
    }
    return current;
  }

  private static <T> List<T> appendAll(List<T> base, List<T> more) {
    if (more.isEmpty()) return base;
    if (base instanceof AppendOnlyList<T> list) return list.appendAll(more);
    ArrayList<T> copy = new ArrayList<>(base.size() + more.size());
    copy.addAll(base);
    copy.addAll(more);
    return AppendOnlyList.copyOf(copy);
  }

  public static LocalDate dateKey(Instant timestamp) {
    return LocalDate.ofInstant(timestamp, ZoneOffset.UTC);
  }
}
