package cafe.woden.logview.selection;

import cafe.woden.logview.model.LogEntry;
import cafe.woden.logview.store.EntrySnapshot;
import cafe.woden.logview.store.EntryStore;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Terminal-style range selection over entry indices.
 *
 * <p>Every selection is tagged with the store generation it was made in. Once the store resets,
 * the stale selection reads as absent without anyone clearing it.
 */
public final class SelectionModel {
  private static final Logger log = LoggerFactory.getLogger(SelectionModel.class);

  private final Supplier<EntrySnapshot> source;

  private SelectionRange range;
  private PointerGesturePhase phase = PointerGesturePhase.IDLE;

  public SelectionModel(EntryStore store) {
    this(Objects.requireNonNull(store, "store")::snapshot);
  }

  public SelectionModel(Supplier<EntrySnapshot> source) {
    this.source = Objects.requireNonNull(source, "source");
  }

  public synchronized void pointerDown(int index) {
    EntrySnapshot snap = source.get();
    if (index < 0 || index >= snap.size()) {
      log.debug("[logview] pointer down outside entries ({} of {}); ignored", index, snap.size());
      return;
    }
    range = new SelectionRange(index, index, snap.generation());
    phase = PointerGesturePhase.DRAGGING;
  }

  public synchronized void pointerDragTo(int index) {
    if (phase != PointerGesturePhase.DRAGGING) return;
    EntrySnapshot snap = source.get();
    if (!isLive(snap)) {
      phase = PointerGesturePhase.IDLE;
      return;
    }
    int focus = Math.max(0, Math.min(index, snap.size() - 1));
    range = new SelectionRange(range.anchorIndex(), focus, range.epoch());
  }

  public synchronized void pointerUp() {
    if (phase == PointerGesturePhase.DRAGGING) {
      phase = PointerGesturePhase.RELEASED;
    }
  }

  /** Extends a live selection to {@code index}; without one, anchors there. */
  public synchronized void shiftClick(int index) {
    EntrySnapshot snap = source.get();
    if (index < 0 || index >= snap.size()) return;
    if (isLive(snap)) {
      range = new SelectionRange(range.anchorIndex(), index, range.epoch());
    } else {
      range = new SelectionRange(index, index, snap.generation());
    }
    phase = PointerGesturePhase.RELEASED;
  }

  public synchronized void selectAll() {
    EntrySnapshot snap = source.get();
    if (snap.isEmpty()) return;
    range = new SelectionRange(0, snap.size() - 1, snap.generation());
    phase = PointerGesturePhase.RELEASED;
  }

  public synchronized void clear() {
    range = null;
    phase = PointerGesturePhase.IDLE;
  }

  public synchronized Optional<SelectionRange> currentSelection() {
    EntrySnapshot snap = source.get();
    return isLive(snap) ? Optional.of(range) : Optional.empty();
  }

  public synchronized PointerGesturePhase phase() {
    return phase;
  }

  /** Messages of the selected entries joined with newlines. */
  public Optional<String> selectedText() {
    EntrySnapshot snap;
    SelectionRange r;
    synchronized (this) {
      snap = source.get();
      if (!isLive(snap)) return Optional.empty();
      r = range;
    }
    List<LogEntry> entries = snap.entries();
    StringBuilder sb = new StringBuilder(textCapacity(r.length()));
    for (int i = r.min(); i <= r.max(); i++) {
      if (i > r.min()) sb.append('\n');
      sb.append(entries.get(i).message());
    }
    return Optional.of(sb.toString());
  }

  /** Returns whether anything was copied. */
  public boolean copySelection(ClipboardSink sink) {
    Objects.requireNonNull(sink, "sink");
    Optional<String> text = selectedText();
    if (text.isEmpty()) return false;
    sink.copy(text.get());
    return true;
  }

  /** Initial buffer size for {@code rows} selected lines; bounded so it cannot overflow. */
  static int textCapacity(int rows) {
    return Math.min(Math.max(rows, 1), 1 << 16) * 64;
  }

  private boolean isLive(EntrySnapshot snap) {
    return range != null && range.epoch() == snap.generation() && range.max() < snap.size();
  }
}
