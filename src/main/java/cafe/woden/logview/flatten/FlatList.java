package cafe.woden.logview.flatten;

import cafe.woden.logview.util.AppendOnlyList;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * Result of one flatten pass.
 *
 * @param items entries interleaved with date separators
 * @param separators every separator in flat order, for sticky header lookup
 * @param generation entry store generation the items were built from
 * @param entryCount number of entries covered by {@code items}
 * @param lastDateKey date of the last entry, or {@code null} when empty
 * @param rebuilt whether this pass rebuilt from scratch rather than extending the prior list
 */
public record FlatList(
    List<FlatItem> items,
    List<FlatItem.SeparatorItem> separators,
    long generation,
    int entryCount,
    LocalDate lastDateKey,
    boolean rebuilt) {

  public static final FlatList EMPTY =
      new FlatList(AppendOnlyList.empty(), AppendOnlyList.empty(), 0, 0, null, false);

  public FlatList {
    Objects.requireNonNull(items, "items");
    Objects.requireNonNull(separators, "separators");
    if (entryCount < 0) throw new IllegalArgumentException("entryCount must be >= 0");
  }

  public int size() {
    return items.size();
  }

  public FlatItem get(int flatIndex) {
    return items.get(flatIndex);
  }

  public boolean isEmpty() {
    return items.isEmpty();
  }

  FlatList withoutRebuildFlag() {
    if (!rebuilt) return this;
    return new FlatList(items, separators, generation, entryCount, lastDateKey, false);
  }
}
