package cafe.woden.logview.stream;

import cafe.woden.logview.config.LogViewProperties;
import cafe.woden.logview.model.LogEntry;
import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.disposables.Disposable;
import io.reactivex.rxjava3.processors.BehaviorProcessor;
import io.reactivex.rxjava3.processors.FlowableProcessor;
import io.reactivex.rxjava3.processors.PublishProcessor;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps a {@link LiveLogSource} subscription alive through transient failures.
 *
 * <p>Transient failures are retried after a {@link RetryBackoff} delay, up to the configured
 * attempt cap; the failure after that, and any fatal failure, ends in {@link StreamPhase#ERROR}
 * until {@link #restart()}. A connection is successful once it signals {@link
 * LiveEvent.Connected} (or delivers its first entry); that moves the phase to STREAMING and resets
 * the attempt counter, so a quiet connection that is later dropped starts over at the first
 * delay. Each connection is tagged; entries or failures from a connection that was stopped or
 * replaced are dropped.
 *
 * <p>After a reconnect the source may replay lines it already delivered. Until the first new line
 * arrives, entries older than the last delivered timestamp, or equal to it with an already seen
 * id, are skipped.
 */
public final class StreamReconnector {
  private static final Logger log = LoggerFactory.getLogger(StreamReconnector.class);

  private final LiveLogSource source;
  private final LogViewProperties.Stream cfg;
  private final RetryBackoff backoff;
  private final Scheduler timerScheduler;

  private final BehaviorProcessor<StreamState> states =
      BehaviorProcessor.createDefault(StreamState.IDLE);
  private final FlowableProcessor<LogEntry> entries =
      PublishProcessor.<LogEntry>create().toSerialized();

  private final ArrayDeque<LogEntry> pausedBuffer = new ArrayDeque<>();

  private boolean running;
  private boolean paused;
  private boolean connected;
  private long connectionSeq;
  private int attempt;
  private StreamState state = StreamState.IDLE;
  private Disposable connection;
  private Disposable retryTimer;

  private boolean guardReplay;
  private Instant lastDelivered;
  private final Set<String> idsAtLastDelivered = new HashSet<>();

  public StreamReconnector(
      LiveLogSource source, LogViewProperties.Stream cfg, Scheduler timerScheduler) {
    this(source, cfg, timerScheduler, new RetryBackoff(cfg.reconnect()));
  }

  public StreamReconnector(
      LiveLogSource source,
      LogViewProperties.Stream cfg,
      Scheduler timerScheduler,
      RetryBackoff backoff) {
    this.source = Objects.requireNonNull(source, "source");
    this.cfg = Objects.requireNonNull(cfg, "cfg");
    this.timerScheduler = Objects.requireNonNull(timerScheduler, "timerScheduler");
    this.backoff = Objects.requireNonNull(backoff, "backoff");
  }

  /** Connection status; late subscribers get the current state first. */
  public Flowable<StreamState> states() {
    return states.onBackpressureLatest();
  }

  /** Delivered entries in arrival order. Nothing is emitted while paused or after stop. */
  public Flowable<LogEntry> entries() {
    return entries.onBackpressureBuffer();
  }

  public synchronized StreamState state() {
    return state;
  }

  public synchronized boolean isRunning() {
    return running;
  }

  public synchronized void start() {
    if (running) return;
    running = true;
    attempt = 0;
    lastDelivered = null;
    idsAtLastDelivered.clear();
    connectLocked();
  }

  /** Aborts the connection and any pending retry. Later pushes from it are discarded. */
  public synchronized void stop() {
    boolean wasRunning = running;
    running = false;
    connectionSeq++;
    disposeLocked();
    pausedBuffer.clear();
    paused = false;
    connected = false;
    attempt = 0;
    if (wasRunning || state.phase() != StreamPhase.IDLE) {
      log.debug("[logview] live stream stopped");
      setStateLocked(StreamState.IDLE);
    }
  }

  /** Leaves ERROR or COMPLETE (or resets a live stream) with a fresh attempt counter. */
  public synchronized void restart() {
    stop();
    start();
  }

  /** Holds entries back while keeping the connection. */
  public synchronized void pause() {
    if (paused) return;
    paused = true;
    if (state.phase() == StreamPhase.STREAMING) {
      setStateLocked(new StreamState(StreamPhase.PAUSED, attempt, 0, null));
    }
  }

  /** Flushes held entries in arrival order, then continues streaming. */
  public synchronized void resume() {
    if (!paused) return;
    paused = false;
    List<LogEntry> held = new ArrayList<>(pausedBuffer);
    pausedBuffer.clear();
    for (LogEntry e : held) {
      entries.onNext(e);
    }
    if (state.phase() == StreamPhase.PAUSED) {
      setStateLocked(new StreamState(StreamPhase.STREAMING, attempt, 0, null));
    }
  }

  public synchronized boolean isPaused() {
    return paused;
  }

  public synchronized int pausedBufferSize() {
    return pausedBuffer.size();
  }

  private void connectLocked() {
    long seq = ++connectionSeq;
    connected = false;
    setStateLocked(new StreamState(StreamPhase.CONNECTING, attempt, 0, state.error()));
    guardReplay = lastDelivered != null;
    Disposable d =
        Flowable.defer(source::open)
            .subscribe(ev -> onEvent(seq, ev), err -> onFailure(seq, err), () -> onComplete(seq));
    // A synchronous source may already have failed or completed inside subscribe().
    if (isCurrent(seq) && connection == null && retryTimer == null) {
      connection = d;
    } else if (!isCurrent(seq)) {
      d.dispose();
    }
  }

  private synchronized void onEvent(long seq, LiveEvent event) {
    if (!isCurrent(seq)) {
      log.trace("[logview] dropping {} from stale connection", event);
      return;
    }
    if (!connected) markConnectedLocked();
    if (event instanceof LiveEvent.Received r) onEntryLocked(r.entry());
  }

  private void markConnectedLocked() {
    connected = true;
    if (attempt > 0) log.info("[logview] live stream reconnected after {} attempt(s)", attempt);
    attempt = 0;
    setStateLocked(
        new StreamState(paused ? StreamPhase.PAUSED : StreamPhase.STREAMING, 0, 0, null));
  }

  private void onEntryLocked(LogEntry entry) {
    if (isReplay(entry)) {
      log.trace("[logview] skipping replayed entry after reconnect: {}", entry.id());
      return;
    }
    guardReplay = false;
    markDelivered(entry);

    if (paused) {
      pausedBuffer.addLast(entry);
      while (pausedBuffer.size() > cfg.maxBufferSize()) {
        pausedBuffer.removeFirst();
      }
      return;
    }
    entries.onNext(entry);
  }

  private synchronized void onFailure(long seq, Throwable err) {
    if (!isCurrent(seq)) {
      log.debug("[logview] ignoring failure from stale connection: {}", err.toString());
      return;
    }
    connection = null;
    connected = false;

    if (!StreamErrorClassifier.isTransient(err)) {
      log.warn("[logview] live stream failed (not retrying): {}", err.toString());
      failLocked(err);
      return;
    }
    if (!Boolean.TRUE.equals(cfg.reconnect().enabled())) {
      log.warn("[logview] live stream failed and reconnect is disabled: {}", err.toString());
      failLocked(err);
      return;
    }

    int next = attempt + 1;
    if (next > backoff.maxAttempts()) {
      log.warn(
          "[logview] live stream failed after {} reconnect attempt(s): {}",
          attempt,
          err.toString());
      failLocked(err);
      return;
    }
    attempt = next;
    long delayMs = backoff.delayMs(attempt);
    log.info(
        "[logview] live stream interrupted ({}); reconnect attempt {} in {}ms",
        err.toString(),
        attempt,
        delayMs);
    setStateLocked(new StreamState(StreamPhase.RECONNECTING, attempt, delayMs, err));

    disposeTimerLocked();
    retryTimer =
        Completable.timer(delayMs, TimeUnit.MILLISECONDS, timerScheduler)
            .subscribe(() -> onRetryTimer(seq));
  }

  private synchronized void onRetryTimer(long seq) {
    if (!isCurrent(seq)) return;
    retryTimer = null;
    connectLocked();
  }

  private synchronized void onComplete(long seq) {
    if (!isCurrent(seq)) return;
    connection = null;
    running = false;
    log.debug("[logview] live stream completed");
    setStateLocked(new StreamState(StreamPhase.COMPLETE, 0, 0, null));
  }

  private void failLocked(Throwable err) {
    running = false;
    connectionSeq++;
    disposeLocked();
    setStateLocked(new StreamState(StreamPhase.ERROR, attempt, 0, err));
  }

  private boolean isCurrent(long seq) {
    return running && seq == connectionSeq;
  }

  private boolean isReplay(LogEntry e) {
    if (!guardReplay || lastDelivered == null) return false;
    int cmp = e.timestamp().compareTo(lastDelivered);
    if (cmp < 0) return true;
    return cmp == 0 && idsAtLastDelivered.contains(e.id());
  }

  private void markDelivered(LogEntry e) {
    if (lastDelivered == null || e.timestamp().isAfter(lastDelivered)) {
      lastDelivered = e.timestamp();
      idsAtLastDelivered.clear();
    }
    idsAtLastDelivered.add(e.id());
  }

  private void setStateLocked(StreamState next) {
    state = next;
    states.onNext(next);
  }

  private void disposeLocked() {
    Disposable c = connection;
    connection = null;
    if (c != null && !c.isDisposed()) c.dispose();
    disposeTimerLocked();
  }

  private void disposeTimerLocked() {
    Disposable t = retryTimer;
    retryTimer = null;
    if (t != null && !t.isDisposed()) t.dispose();
  }
}
