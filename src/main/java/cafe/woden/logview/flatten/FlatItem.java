package cafe.woden.logview.flatten;

import java.time.LocalDate;
import java.util.Objects;

/** One renderable row of the flattened log list. */
public sealed interface FlatItem {

  /** Position of this item in the flat list. */
  int flatIndex();

  /** A log line; {@code entryIndex} addresses the entry sequence, not the flat list. */
  record EntryItem(int entryIndex, int flatIndex) implements FlatItem {
    public EntryItem {
      if (entryIndex < 0) throw new IllegalArgumentException("entryIndex must be >= 0");
      if (flatIndex < 0) throw new IllegalArgumentException("flatIndex must be >= 0");
    }
  }

  /**
   * Date header emitted before the first entry of each UTC calendar day.
   *
   * @param precedingEntryIndex index of the entry this separator precedes
   */
  record SeparatorItem(LocalDate date, int precedingEntryIndex, int flatIndex)
      implements FlatItem {
    public SeparatorItem {
      Objects.requireNonNull(date, "date");
      if (precedingEntryIndex < 0) {
        throw new IllegalArgumentException("precedingEntryIndex must be >= 0");
      }
      if (flatIndex < 0) throw new IllegalArgumentException("flatIndex must be >= 0");
    }
  }
}
