package cafe.woden.logview.store;

import cafe.woden.logview.model.LogEntry;
import cafe.woden.logview.util.AppendOnlyList;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.processors.BehaviorProcessor;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Merges a historical batch with live entries into one time-ordered sequence.
 *
 * <p>A batch that differs by identity from the last one seen resets the sequence and increments
 * the reset generation. Live entries are only kept when their timestamp is strictly after the
 * newest batch entry, which drops redeliveries of lines the batch already covers. Live entries
 * survive a reset: the ones accepted so far are filtered against the new batch and re-appended,
 * so lines that stream in while a batch is being fetched are not lost.
 *
 * <p>The store can be driven two ways: {@link #merge(List, List)} with the whole accumulated live
 * list on every call, or {@link #replaceBatch(List)} plus {@link #appendLive(List)} with just the
 * newly pushed entries. Every published sequence is an immutable snapshot.
 *
 * <p>When an append overflows the capacity, the oldest entries are dropped down to 90% of it in
 * one step, so a full store resets once per tenth of its capacity rather than on every line.
 */
public final class EntryStore {
  private static final Logger log = LoggerFactory.getLogger(EntryStore.class);

  private static final int TRIM_SLACK_DIVISOR = 10;

  private final int maxEntries;
  private final BehaviorProcessor<EntrySnapshot> updates =
      BehaviorProcessor.createDefault(EntrySnapshot.EMPTY);

  private List<LogEntry> batchRef;
  private Instant batchHorizon;
  private int observedLive;
  private AppendOnlyList<LogEntry> combined = AppendOnlyList.empty();
  private final ArrayList<LogEntry> liveKept = new ArrayList<>();
  private long generation;
  private Predicate<LogEntry> liveFilter = e -> true;

  public EntryStore(int maxEntries) {
    if (maxEntries <= 0) throw new IllegalArgumentException("maxEntries must be > 0");
    this.maxEntries = maxEntries;
  }

  /**
   * Returns the combined sequence for {@code batch} plus the entries of {@code liveAppends} newer
   * than the batch. Calling it twice with identical arguments yields the same sequence.
   */
  public synchronized List<LogEntry> merge(List<LogEntry> batch, List<LogEntry> liveAppends) {
    List<LogEntry> live = liveAppends == null ? List.of() : liveAppends;
    if (batchRef == null || batch != batchRef) {
      resetLocked(batch, live);
      observedLive = live.size();
      return combined;
    }

    if (live.size() < observedLive) {
      // The caller replaced or trimmed its live buffer; everything in it now counts as seen.
      log.debug(
          "[logview] live list shrank from {} to {}; skipping re-observation",
          observedLive,
          live.size());
      observedLive = live.size();
      return combined;
    }
    if (live.size() == observedLive) return combined;

    List<LogEntry> fresh = live.subList(observedLive, live.size());
    observedLive = live.size();
    appendLocked(fresh);
    return combined;
  }

  /**
   * Starts a new generation holding {@code batch} followed by the live entries kept so far that
   * are newer than it and pass the current live filter.
   */
  public synchronized EntrySnapshot replaceBatch(List<LogEntry> batch) {
    resetLocked(batch, new ArrayList<>(liveKept));
    observedLive = 0;
    return snapshotLocked(true, combined.size());
  }

  /** Appends newly pushed live entries that pass the batch horizon and the live filter. */
  public synchronized EntrySnapshot appendLive(List<LogEntry> pushed) {
    if (pushed == null || pushed.isEmpty()) return snapshotLocked(false, 0);
    return appendLocked(pushed);
  }

  /**
   * Predicate applied to live entries before they are appended, so streamed lines honor the same
   * filters the batch was fetched with. Entries already in the sequence are re-checked on the next
   * reset.
   */
  public synchronized void setLiveFilter(Predicate<LogEntry> filter) {
    this.liveFilter = filter == null ? e -> true : filter;
  }

  public synchronized EntrySnapshot snapshot() {
    return new EntrySnapshot(combined, generation, false, 0);
  }

  public synchronized long generation() {
    return generation;
  }

  /** Newest timestamp of the current batch, or {@code null} when the batch is empty. */
  public synchronized Instant batchHorizon() {
    return batchHorizon;
  }

  /** Publishes every change; late subscribers receive the latest snapshot first. */
  public Flowable<EntrySnapshot> updates() {
    return updates.onBackpressureLatest();
  }

  private void resetLocked(List<LogEntry> batch, List<LogEntry> live) {
    List<LogEntry> b = batch == null ? List.of() : batch;
    batchRef = b;
    Instant horizon = null;
    for (LogEntry e : b) {
      if (horizon == null || e.timestamp().isAfter(horizon)) horizon = e.timestamp();
    }
    batchHorizon = horizon;

    List<LogEntry> carried = acceptLocked(live);
    liveKept.clear();
    liveKept.addAll(carried);

    ArrayList<LogEntry> merged = new ArrayList<>(b.size() + carried.size());
    merged.addAll(b);
    merged.addAll(carried);
    int total = merged.size();
    combined =
        AppendOnlyList.copyOf(
            total > maxEntries ? merged.subList(total - maxEntries, total) : merged);
    trimLiveKeptLocked();
    generation++;
    log.debug(
        "[logview] entry store reset: {} entries ({} carried live), generation {}",
        combined.size(),
        carried.size(),
        generation);
    updates.onNext(new EntrySnapshot(combined, generation, true, combined.size()));
  }

  private List<LogEntry> acceptLocked(List<LogEntry> candidates) {
    ArrayList<LogEntry> accepted = new ArrayList<>(candidates.size());
    for (LogEntry e : candidates) {
      if (e == null) continue;
      if (batchHorizon != null && !e.timestamp().isAfter(batchHorizon)) continue;
      if (!liveFilter.test(e)) continue;
      accepted.add(e);
    }
    return accepted;
  }

  private EntrySnapshot appendLocked(List<LogEntry> candidates) {
    List<LogEntry> accepted = acceptLocked(candidates);
    if (accepted.isEmpty()) return snapshotLocked(false, 0);
    liveKept.addAll(accepted);
    trimLiveKeptLocked();

    int total = combined.size() + accepted.size();
    if (total <= maxEntries) {
      combined = combined.appendAll(accepted);
      return publishLocked(false, accepted.size());
    }

    // Over capacity: indices shift, so downstream state must treat this as a reset.
    int keep = trimTarget();
    ArrayList<LogEntry> merged = new ArrayList<>(total);
    merged.addAll(combined);
    merged.addAll(accepted);
    combined = AppendOnlyList.copyOf(merged.subList(total - keep, total));
    generation++;
    log.debug(
        "[logview] entry store over capacity ({} > {}); dropped {} oldest, generation {}",
        total,
        maxEntries,
        total - keep,
        generation);
    return publishLocked(true, accepted.size());
  }

  private void trimLiveKeptLocked() {
    if (liveKept.size() <= maxEntries) return;
    liveKept.subList(0, liveKept.size() - trimTarget()).clear();
  }

  private int trimTarget() {
    return Math.max(1, maxEntries - maxEntries / TRIM_SLACK_DIVISOR);
  }

  private EntrySnapshot publishLocked(boolean reset, int appended) {
    EntrySnapshot snap = snapshotLocked(reset, appended);
    updates.onNext(snap);
    return snap;
  }

  private EntrySnapshot snapshotLocked(boolean reset, int appended) {
    return new EntrySnapshot(combined, generation, reset, appended);
  }
}
