package cafe.woden.logview.session;

import cafe.woden.logview.config.LogViewProperties;
import cafe.woden.logview.flatten.FlatList;
import cafe.woden.logview.flatten.IncrementalFlattener;
import cafe.woden.logview.histogram.HistogramAggregator;
import cafe.woden.logview.histogram.HistogramBucket;
import cafe.woden.logview.histogram.HistogramRequest;
import cafe.woden.logview.model.LogEntry;
import cafe.woden.logview.query.FieldFacet;
import cafe.woden.logview.query.LogFacets;
import cafe.woden.logview.query.LogFilter;
import cafe.woden.logview.query.LogFilters;
import cafe.woden.logview.selection.ClipboardSink;
import cafe.woden.logview.selection.SelectionModel;
import cafe.woden.logview.selection.SelectionRange;
import cafe.woden.logview.store.EntrySnapshot;
import cafe.woden.logview.store.EntryStore;
import cafe.woden.logview.stream.BatchLogSource;
import cafe.woden.logview.stream.LiveLogSource;
import cafe.woden.logview.stream.StreamReconnector;
import cafe.woden.logview.stream.StreamState;
import cafe.woden.logview.timeline.EntityLifecycle;
import cafe.woden.logview.timeline.RangeCommit;
import cafe.woden.logview.timeline.TimeRange;
import cafe.woden.logview.timeline.TimelineRangeStateMachine;
import cafe.woden.logview.window.TailFollowState;
import cafe.woden.logview.window.WindowedViewHost;
import cafe.woden.logview.window.WindowedViewProvider;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.disposables.CompositeDisposable;
import io.reactivex.rxjava3.disposables.SerialDisposable;
import io.reactivex.rxjava3.processors.BehaviorProcessor;
import io.reactivex.rxjava3.processors.FlowableProcessor;
import io.reactivex.rxjava3.processors.PublishProcessor;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One log view: a batch query for the committed range plus the live tail, merged, flattened,
 * bucketed and selectable.
 *
 * <p>All store, flatten and histogram work runs on the session's view scheduler, which must be
 * single-threaded. Batch fetches run on the I/O scheduler and hop back. Live entries are queued
 * and drained in bursts so a fast stream does not recompute once per line.
 */
public final class LogViewSession implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(LogViewSession.class);

  private final LogViewProperties props;
  private final BatchLogSource batchSource;
  private final Scheduler viewScheduler;
  private final Scheduler ioScheduler;

  private final EntryStore store;
  private final WindowedViewProvider viewProvider;
  private final SelectionModel selection;
  private final TimelineRangeStateMachine timeline;
  private final TailFollowState tailFollow;
  private final StreamReconnector reconnector;

  private final BehaviorProcessor<FlatList> flatLists =
      BehaviorProcessor.createDefault(FlatList.EMPTY);
  private final BehaviorProcessor<List<HistogramBucket>> histograms =
      BehaviorProcessor.createDefault(List.of());
  private final BehaviorProcessor<Optional<List<HistogramBucket>>> pendingHistograms =
      BehaviorProcessor.createDefault(Optional.empty());
  private final FlowableProcessor<Throwable> batchErrors =
      PublishProcessor.<Throwable>create().toSerialized();

  private final CompositeDisposable disposables = new CompositeDisposable();
  private final SerialDisposable inFlightFetch = new SerialDisposable();
  private final AtomicLong fetchSeq = new AtomicLong();
  private final AtomicBoolean started = new AtomicBoolean(false);
  private final AtomicBoolean closed = new AtomicBoolean(false);
  private final List<Runnable> closeHooks = new CopyOnWriteArrayList<>();

  private final ConcurrentLinkedQueue<LogEntry> liveQueue = new ConcurrentLinkedQueue<>();
  private final AtomicBoolean drainScheduled = new AtomicBoolean(false);

  private volatile FlatList flat = FlatList.EMPTY;
  private volatile LogFilter filter = LogFilter.NONE;

  public LogViewSession(
      LogViewProperties props,
      BatchLogSource batchSource,
      LiveLogSource liveSource,
      WindowedViewHost host,
      Clock clock,
      Scheduler viewScheduler,
      Scheduler ioScheduler,
      Scheduler timerScheduler) {
    this.props = Objects.requireNonNull(props, "props");
    this.batchSource = Objects.requireNonNull(batchSource, "batchSource");
    this.viewScheduler = Objects.requireNonNull(viewScheduler, "viewScheduler");
    this.ioScheduler = Objects.requireNonNull(ioScheduler, "ioScheduler");
    Objects.requireNonNull(host, "host");
    Objects.requireNonNull(clock, "clock");
    Objects.requireNonNull(timerScheduler, "timerScheduler");

    this.store = new EntryStore(props.store().maxEntries());
    this.viewProvider = new WindowedViewProvider(host, props.rows());
    this.selection = new SelectionModel(store);
    this.timeline = new TimelineRangeStateMachine(props.timeline(), clock);
    this.tailFollow = new TailFollowState(props.rows().scrollBottomThreshold(), true);
    this.reconnector =
        liveSource == null
            ? null
            : new StreamReconnector(liveSource, props.stream(), timerScheduler);
    disposables.add(inFlightFetch);
  }

  /** Fetches the committed range and opens the live tail when the range is open-ended. */
  public void start() {
    if (closed.get()) throw new IllegalStateException("session is closed");
    if (!started.compareAndSet(false, true)) return;

    disposables.add(
        timeline
            .commits()
            .observeOn(viewScheduler)
            .subscribe(
                this::onRangeCommit,
                err -> log.error("[logview] range commit handling failed", err)));
    disposables.add(
        timeline
            .ranges()
            .skip(1)
            .observeOn(viewScheduler)
            .subscribe(
                r -> recomputeHistograms(),
                err -> log.error("[logview] histogram update failed", err)));
    if (reconnector != null) {
      disposables.add(
          reconnector
              .entries()
              .subscribe(
                  this::enqueueLive,
                  err -> log.error("[logview] live entry handling failed", err)));
    }

    refetch();
    updateLiveTail(timeline.committed());
  }

  // --- inputs ---

  public void setEntityLifecycle(EntityLifecycle lifecycle) {
    timeline.setEntityLifecycle(lifecycle);
    runOnView(this::seedTimeline);
  }

  /** Replaces the client-side filter; the batch is refetched and the flat list rebuilt. */
  public void setFilter(LogFilter next) {
    LogFilter f = next == null ? LogFilter.NONE : next;
    LogFilters.compile(f); // fail fast on a bad pattern, before anything changes
    this.filter = f;
    if (started.get()) refetch();
  }

  public LogFilter filter() {
    return filter;
  }

  /** Refetches the batch for the committed range. */
  public void refetch() {
    if (closed.get()) return;
    TimeRange committed = timeline.committed();
    long seq = fetchSeq.incrementAndGet();
    LogFilter ranged = filter.withRange(committed.effectiveStart(), committed.effectiveEnd());
    Predicate<LogEntry> predicate = LogFilters.compile(ranged);
    inFlightFetch.set(
        batchSource
            .fetch(committed.effectiveStart(), committed.effectiveEnd())
            .subscribeOn(ioScheduler)
            .observeOn(viewScheduler)
            .subscribe(
                batch -> onBatch(seq, batch, predicate),
                err -> onBatchError(seq, err)));
  }

  // --- outputs ---

  public FlatList flatList() {
    return flat;
  }

  public Flowable<FlatList> flatLists() {
    return flatLists.onBackpressureLatest();
  }

  public int estimateSize(int flatIndex) {
    return viewProvider.estimateSize(flatIndex);
  }

  public WindowedViewProvider viewProvider() {
    return viewProvider;
  }

  public TailFollowState tailFollow() {
    return tailFollow;
  }

  public List<LogEntry> entries() {
    return store.snapshot().entries();
  }

  public SelectionModel selection() {
    return selection;
  }

  public Optional<SelectionRange> currentSelection() {
    return selection.currentSelection();
  }

  public boolean copySelection(ClipboardSink sink) {
    return selection.copySelection(sink);
  }

  public TimelineRangeStateMachine timeline() {
    return timeline;
  }

  public TimeRange committedRange() {
    return timeline.committed();
  }

  public TimeRange currentRange() {
    return timeline.current();
  }

  public List<HistogramBucket> histogram() {
    return histograms.getValue();
  }

  public Flowable<List<HistogramBucket>> histograms() {
    return histograms.onBackpressureLatest();
  }

  /** Buckets over the pending display range while an edit is in progress. */
  public Optional<List<HistogramBucket>> pendingHistogram() {
    return pendingHistograms.getValue();
  }

  public Flowable<Optional<List<HistogramBucket>>> pendingHistograms() {
    return pendingHistograms.onBackpressureLatest();
  }

  public List<FieldFacet> facets() {
    return LogFacets.compute(entries(), LogFacets.DEFAULT_FIELDS);
  }

  public StreamState streamState() {
    return reconnector == null ? StreamState.IDLE : reconnector.state();
  }

  public Flowable<StreamState> streamStates() {
    return reconnector == null ? Flowable.just(StreamState.IDLE) : reconnector.states();
  }

  /** Restarts the live tail after ERROR or COMPLETE. */
  public void restartStream() {
    if (reconnector != null && !closed.get()) reconnector.restart();
  }

  public void pauseStream() {
    if (reconnector != null) reconnector.pause();
  }

  public void resumeStream() {
    if (reconnector != null) reconnector.resume();
  }

  /** Failed batch fetches; the previous entries stay visible. */
  public Flowable<Throwable> batchErrors() {
    return batchErrors.onBackpressureLatest();
  }

  public boolean isClosed() {
    return closed.get();
  }

  void onClose(Runnable hook) {
    closeHooks.add(Objects.requireNonNull(hook, "hook"));
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) return;
    if (reconnector != null) reconnector.stop();
    disposables.dispose();
    liveQueue.clear();
    for (Runnable hook : closeHooks) {
      try {
        hook.run();
      } catch (RuntimeException e) {
        log.warn("[logview] session close hook failed", e);
      }
    }
    log.debug("[logview] session closed");
  }

  // --- view-thread work ---

  private void onRangeCommit(RangeCommit commit) {
    if (closed.get()) return;
    log.debug("[logview] refetching for commit #{}", commit.sequence());
    refetch();
    updateLiveTail(timeline.committed());
  }

  private void onBatch(long seq, List<LogEntry> batch, Predicate<LogEntry> predicate) {
    if (closed.get() || seq != fetchSeq.get()) return;
    List<LogEntry> visible = filterBatch(batch, predicate);
    store.setLiveFilter(predicate);
    EntrySnapshot snap = store.replaceBatch(visible);
    log.debug("[logview] batch loaded: {} of {} entries kept", visible.size(), batch.size());
    publish(snap);
    seedTimeline();
  }

  private void onBatchError(long seq, Throwable err) {
    if (closed.get() || seq != fetchSeq.get()) return;
    log.warn("[logview] batch fetch failed: {}", err.toString());
    batchErrors.onNext(err);
  }

  private void enqueueLive(LogEntry entry) {
    if (closed.get()) return;
    liveQueue.add(entry);
    if (drainScheduled.compareAndSet(false, true)) {
      viewScheduler.scheduleDirect(this::drainLive);
    }
  }

  private void drainLive() {
    drainScheduled.set(false);
    if (closed.get()) {
      liveQueue.clear();
      return;
    }
    ArrayList<LogEntry> burst = new ArrayList<>();
    LogEntry e;
    while ((e = liveQueue.poll()) != null) {
      burst.add(e);
    }
    if (burst.isEmpty()) return;
    EntrySnapshot snap = store.appendLive(burst);
    if (snap.appended() > 0) publish(snap);
  }

  private void publish(EntrySnapshot snap) {
    FlatList next = IncrementalFlattener.flatten(snap.entries(), snap.generation(), flat);
    flat = next;
    viewProvider.update(next, snap.entries());
    flatLists.onNext(next);
    recomputeHistograms();
  }

  private void recomputeHistograms() {
    if (closed.get()) return;
    List<LogEntry> entries = store.snapshot().entries();
    int n = props.histogram().numBuckets();

    TimeRange committed = timeline.committed();
    histograms.onNext(
        HistogramAggregator.computeHistogram(
            entries,
            new HistogramRequest(
                n,
                committed.displayStart(),
                committed.displayEnd(),
                committed.effectiveStart(),
                committed.effectiveEnd())));

    TimeRange current = timeline.current();
    if (current.editing()) {
      pendingHistograms.onNext(
          Optional.of(
              HistogramAggregator.computeHistogram(
                  entries,
                  new HistogramRequest(
                      n,
                      current.displayStart(),
                      current.displayEnd(),
                      current.pendingStart(),
                      current.pendingEnd()))));
    } else if (pendingHistograms.getValue().isPresent()) {
      pendingHistograms.onNext(Optional.empty());
    }
  }

  private void seedTimeline() {
    if (timeline.current().editing()) return;
    List<LogEntry> entries = store.snapshot().entries();
    if (entries.isEmpty()) {
      timeline.seedFromData(null, null);
    } else {
      timeline.seedFromData(
          entries.get(0).timestamp(), entries.get(entries.size() - 1).timestamp());
    }
  }

  private void updateLiveTail(TimeRange committed) {
    if (reconnector == null || closed.get()) return;
    if (committed.isOpenEnded()) {
      reconnector.start();
    } else if (reconnector.isRunning()) {
      log.debug("[logview] range closed at {}; stopping live tail", committed.effectiveEnd());
      reconnector.stop();
    }
  }

  private void runOnView(Runnable task) {
    if (closed.get()) return;
    viewScheduler.scheduleDirect(
        () -> {
          if (!closed.get()) task.run();
        });
  }

  private static List<LogEntry> filterBatch(List<LogEntry> batch, Predicate<LogEntry> predicate) {
    if (batch == null || batch.isEmpty()) return List.of();
    ArrayList<LogEntry> out = new ArrayList<>(batch.size());
    for (LogEntry e : batch) {
      if (e != null && predicate.test(e)) out.add(e);
    }
    return out;
  }
}
