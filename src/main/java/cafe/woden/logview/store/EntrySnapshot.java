package cafe.woden.logview.store;

import cafe.woden.logview.model.LogEntry;
import java.util.List;
import java.util.Objects;

/**
 * Immutable view of the combined entry sequence at one point in time.
 *
 * @param entries time-ordered combined entries; never mutated after publication
 * @param generation reset generation the entries belong to
 * @param reset whether this snapshot started a new generation
 * @param appended entries added by the change that produced this snapshot
 */
public record EntrySnapshot(List<LogEntry> entries, long generation, boolean reset, int appended) {

  public static final EntrySnapshot EMPTY = new EntrySnapshot(List.of(), 0, false, 0);

  public EntrySnapshot {
    Objects.requireNonNull(entries, "entries");
    if (generation < 0) throw new IllegalArgumentException("generation must be >= 0");
    appended = Math.max(0, appended);
  }

  public int size() {
    return entries.size();
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }
}
