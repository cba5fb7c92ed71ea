package cafe.woden.logview.window;

import cafe.woden.logview.config.LogViewProperties;
import cafe.woden.logview.flatten.FlatItem;
import cafe.woden.logview.flatten.FlatList;
import cafe.woden.logview.model.LogEntry;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.IntToLongFunction;

/**
 * Exposes a {@link FlatList} to a {@link WindowedViewHost}.
 *
 * <p>Row sizes are static by item kind, so {@link #estimateSize(int)} never measures anything.
 * Measurements are invalidated when the flat list was rebuilt or an entry's expanded state
 * changed; plain appends only report the new item count.
 */
public final class WindowedViewProvider {

  private final WindowedViewHost host;
  private final LogViewProperties.Rows rows;
  private final Set<String> expandedEntryIds = new HashSet<>();

  private FlatList flat = FlatList.EMPTY;
  private List<LogEntry> entries = List.of();

  public WindowedViewProvider(WindowedViewHost host, LogViewProperties.Rows rows) {
    this.host = Objects.requireNonNull(host, "host");
    this.rows = Objects.requireNonNull(rows, "rows");
  }

  public synchronized void update(FlatList next, List<LogEntry> nextEntries) {
    Objects.requireNonNull(next, "next");
    if (next == flat) return;
    int previousCount = flat.size();
    boolean rebuilt = next.rebuilt();
    this.flat = next;
    this.entries = nextEntries == null ? List.of() : nextEntries;
    if (rebuilt) {
      host.invalidateMeasurements();
    }
    if (rebuilt || next.size() != previousCount) {
      host.itemCountChanged(next.size());
    }
  }

  public synchronized int itemCount() {
    return flat.size();
  }

  public synchronized FlatItem item(int flatIndex) {
    return flat.get(flatIndex);
  }

  public synchronized FlatList flatList() {
    return flat;
  }

  public synchronized int estimateSize(int flatIndex) {
    if (flatIndex < 0 || flatIndex >= flat.size()) return rows.entryHeight();
    FlatItem item = flat.get(flatIndex);
    if (item instanceof FlatItem.SeparatorItem) return rows.separatorHeight();
    FlatItem.EntryItem e = (FlatItem.EntryItem) item;
    if (!expandedEntryIds.isEmpty() && e.entryIndex() < entries.size()) {
      String id = entries.get(e.entryIndex()).id();
      if (expandedEntryIds.contains(id)) return rows.expandedEntryHeight();
    }
    return rows.entryHeight();
  }

  /** Flips the expanded state of one entry; returns the new state. */
  public boolean toggleExpanded(String entryId) {
    Objects.requireNonNull(entryId, "entryId");
    boolean expanded;
    synchronized (this) {
      expanded = expandedEntryIds.add(entryId);
      if (!expanded) expandedEntryIds.remove(entryId);
    }
    host.invalidateMeasurements();
    return expanded;
  }

  public synchronized boolean isExpanded(String entryId) {
    return expandedEntryIds.contains(entryId);
  }

  public void collapseAll() {
    boolean changed;
    synchronized (this) {
      changed = !expandedEntryIds.isEmpty();
      expandedEntryIds.clear();
    }
    if (changed) host.invalidateMeasurements();
  }

  /** The separator heading the group that contains {@code flatIndex}. */
  public synchronized Optional<FlatItem.SeparatorItem> separatorAtOrBefore(int flatIndex) {
    List<FlatItem.SeparatorItem> seps = flat.separators();
    int lo = 0;
    int hi = seps.size() - 1;
    int found = -1;
    while (lo <= hi) {
      int mid = (lo + hi) >>> 1;
      if (seps.get(mid).flatIndex() <= flatIndex) {
        found = mid;
        lo = mid + 1;
      } else {
        hi = mid - 1;
      }
    }
    return found < 0 ? Optional.empty() : Optional.of(seps.get(found));
  }

  public synchronized Optional<FlatItem.SeparatorItem> nextSeparatorAfter(int flatIndex) {
    List<FlatItem.SeparatorItem> seps = flat.separators();
    int lo = 0;
    int hi = seps.size();
    while (lo < hi) {
      int mid = (lo + hi) >>> 1;
      if (seps.get(mid).flatIndex() <= flatIndex) {
        lo = mid + 1;
      } else {
        hi = mid;
      }
    }
    return lo < seps.size() ? Optional.of(seps.get(lo)) : Optional.empty();
  }

  /**
   * Computes the floating date header for a scroll offset.
   *
   * @param offsetForIndex the host's pixel offset of a flat index
   */
  public synchronized StickyHeader stickyHeader(
      long scrollOffset, IntToLongFunction offsetForIndex) {
    List<FlatItem.SeparatorItem> seps = flat.separators();
    if (seps.isEmpty()) return StickyHeader.NONE;

    FlatItem.SeparatorItem current = null;
    FlatItem.SeparatorItem next = null;
    for (int i = 0; i < seps.size(); i++) {
      FlatItem.SeparatorItem sep = seps.get(i);
      if (offsetForIndex.applyAsLong(sep.flatIndex()) <= scrollOffset) {
        current = sep;
        next = i + 1 < seps.size() ? seps.get(i + 1) : null;
      } else {
        break;
      }
    }
    if (current == null) return StickyHeader.NONE;

    long pushOffset = 0;
    if (next != null) {
      long distance = offsetForIndex.applyAsLong(next.flatIndex()) - scrollOffset;
      if (distance < rows.separatorHeight()) {
        pushOffset = distance - rows.separatorHeight();
      }
    }
    boolean visible = scrollOffset > offsetForIndex.applyAsLong(seps.get(0).flatIndex());
    return new StickyHeader(current, visible, pushOffset);
  }
}
