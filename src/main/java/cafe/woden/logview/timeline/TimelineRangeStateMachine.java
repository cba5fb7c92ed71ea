package cafe.woden.logview.timeline;

import cafe.woden.logview.config.LogViewProperties;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.processors.BehaviorProcessor;
import io.reactivex.rxjava3.processors.FlowableProcessor;
import io.reactivex.rxjava3.processors.PublishProcessor;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the display, effective and pending time ranges and the apply/cancel protocol.
 *
 * <p>COMMITTED has no pending bounds. Any proposal (range edit, pan, zoom, dragger nudge) moves to
 * EDITING. {@link #apply()} validates the pending range and either commits it, which publishes a
 * {@link RangeCommit}, or discards it exactly like {@link #cancel()}. Invalid input never throws.
 */
public final class TimelineRangeStateMachine {
  private static final Logger log = LoggerFactory.getLogger(TimelineRangeStateMachine.class);

  private final LogViewProperties.Timeline cfg;
  private final Clock clock;

  private final BehaviorProcessor<TimeRange> ranges;
  private final FlowableProcessor<RangeCommit> commits =
      PublishProcessor.<RangeCommit>create().toSerialized();

  private EntityLifecycle entity = EntityLifecycle.UNKNOWN;
  private DisplayRange committedDisplay;
  private Instant effectiveStart;
  private Instant effectiveEnd;

  private boolean editing;
  private Instant pendingStart;
  private Instant pendingEnd;
  private DisplayRange pendingDisplay;

  private long commitSequence;

  public TimelineRangeStateMachine(LogViewProperties.Timeline cfg, Clock clock) {
    this.cfg = Objects.requireNonNull(cfg, "cfg");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.committedDisplay = paddedDisplay(null, null);
    this.ranges = BehaviorProcessor.createDefault(snapshotLocked(true));
  }

  // --- observation ---

  /** Current range (pending bounds and pending display included) on every change. */
  public Flowable<TimeRange> ranges() {
    return ranges.onBackpressureLatest();
  }

  /** Successful commits; each one is a refetch signal. */
  public Flowable<RangeCommit> commits() {
    return commits.onBackpressureBuffer();
  }

  public synchronized RangeEditState state() {
    return editing ? RangeEditState.EDITING : RangeEditState.COMMITTED;
  }

  /** What the user sees right now, pending edits included. */
  public synchronized TimeRange current() {
    return snapshotLocked(true);
  }

  /** The last committed range; drives batch refetches. */
  public synchronized TimeRange committed() {
    return snapshotLocked(false);
  }

  public synchronized DisplayRange currentDisplay() {
    return pendingDisplay != null ? pendingDisplay : committedDisplay;
  }

  public synchronized EntityLifecycle entity() {
    return entity;
  }

  // --- proposals ---

  /**
   * Starts or continues an edit of the effective range. The display is recomputed around the
   * proposal; a missing bound falls back to the entity lifecycle or the last hour.
   */
  public synchronized void proposeRange(Instant start, Instant end) {
    editing = true;
    pendingStart = start;
    pendingEnd = end;
    pendingDisplay = paddedDisplay(start, end);
    publishLocked();
  }

  /** Pan/zoom edit: only the display moves; the effective bounds are frozen as pending. */
  public synchronized void proposeDisplay(Instant start, Instant end) {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
    if (end.isBefore(start)) {
      log.debug("[logview] ignoring inverted display proposal {} .. {}", start, end);
      return;
    }
    DisplayRange next = new DisplayRange(start, end);
    if (!editing) {
      editing = true;
      pendingStart = effectiveStart;
      pendingEnd = effectiveEnd;
    }
    pendingDisplay = next;
    publishLocked();
  }

  /**
   * Commits the pending range if it is valid; otherwise discards it. Returns whether a commit
   * happened.
   */
  public boolean apply() {
    RangeCommit commit;
    synchronized (this) {
      if (!editing) return false;
      Instant now = clock.instant();
      if (!RangeValidator.isValidRange(
          pendingStart, pendingEnd, now, cfg.minRangeMs(), cfg.nowToleranceMs())) {
        log.debug(
            "[logview] discarding invalid range proposal {} .. {} (now {})",
            pendingStart,
            pendingEnd,
            now);
        cancelLocked();
        return false;
      }
      commit = commitLocked(pendingStart, pendingEnd, pendingDisplay);
    }
    publishCommit(commit);
    return true;
  }

  public synchronized void cancel() {
    if (!editing) return;
    cancelLocked();
  }

  /**
   * Computes {@code [now - duration, open]} and commits it without a visible edit phase. A pending
   * edit is replaced.
   */
  public boolean applyPreset(TimelinePreset preset) {
    Objects.requireNonNull(preset, "preset");
    RangeCommit commit;
    synchronized (this) {
      Instant now = clock.instant();
      Instant start = preset.startFrom(now);
      if (!RangeValidator.isValidRange(
          start, null, now, cfg.minRangeMs(), cfg.nowToleranceMs())) {
        log.debug("[logview] preset {} produced an invalid range from {}", preset, start);
        return false;
      }
      commit = commitLocked(start, null, null);
    }
    publishCommit(commit);
    return true;
  }

  private RangeCommit commitLocked(Instant start, Instant end, DisplayRange shown) {
    effectiveStart = start;
    effectiveEnd = end;
    committedDisplay =
        shown != null && containsEffectiveLocked(shown) ? shown : paddedDisplay(start, end);
    editing = false;
    pendingStart = null;
    pendingEnd = null;
    pendingDisplay = null;
    RangeCommit commit = new RangeCommit(effectiveStart, effectiveEnd, ++commitSequence);
    publishLocked();
    return commit;
  }

  private void publishCommit(RangeCommit commit) {
    log.debug("[logview] committed range {} .. {}", commit.effectiveStart(), commit.effectiveEnd());
    commits.onNext(commit);
  }

  // --- pan / zoom / nudge ---

  /** Pans the display by the configured fraction of its width. Returns false when blocked. */
  public synchronized boolean pan(PanDirection direction) {
    Objects.requireNonNull(direction, "direction");
    DisplayRange current = currentDisplay();
    long delta = Math.max(1, Math.round(current.rangeMs() * cfg.panFactor())) * direction.sign();
    DisplayRange next = current.shiftedBy(delta);
    PanConstraints.BlockReason reason =
        PanConstraints.check(
            current,
            next,
            entity,
            clock.instant(),
            editing ? pendingStart : effectiveStart,
            cfg.paddingRatio(),
            cfg.minPaddingMs());
    if (reason != null) {
      log.debug("[logview] pan {} blocked: {}", direction, reason);
      return false;
    }
    proposeDisplay(next.start(), next.end());
    return true;
  }

  public synchronized boolean zoomIn() {
    return zoom(cfg.zoomInFactor());
  }

  public synchronized boolean zoomOut() {
    return zoom(cfg.zoomOutFactor());
  }

  private boolean zoom(double factor) {
    DisplayRange current = currentDisplay();
    long newRange = Math.round(current.rangeMs() * factor);
    if (factor < 1 && newRange < cfg.minRangeMs()) {
      log.debug("[logview] zoom in blocked: {}ms below minimum {}ms", newRange, cfg.minRangeMs());
      return false;
    }
    if (factor > 1 && newRange > cfg.maxRangeMs()) {
      log.debug("[logview] zoom out blocked: {}ms above maximum {}ms", newRange, cfg.maxRangeMs());
      return false;
    }
    long center = current.start().toEpochMilli() + current.rangeMs() / 2;
    long half = newRange / 2;
    proposeDisplay(
        Instant.ofEpochMilli(center - half), Instant.ofEpochMilli(center - half + newRange));
    return true;
  }

  /** Keyboard nudge of one dragger by the configured step. */
  public synchronized boolean nudge(DraggerSide side, int direction) {
    Objects.requireNonNull(side, "side");
    if (direction == 0) return false;
    Instant t = currentEffectiveBound(side);
    if (t == null) return false;
    return moveDragger(side, t.plusMillis(Long.signum(direction) * cfg.nudgeMs()));
  }

  /**
   * Moves one edge of the effective range to {@code time} as a pending edit. Rejected when the
   * end would pass now plus the tolerance on a live range, or when the range would become shorter
   * than the minimum.
   */
  public synchronized boolean moveDragger(DraggerSide side, Instant time) {
    Objects.requireNonNull(side, "side");
    Objects.requireNonNull(time, "time");
    Instant now = clock.instant();
    if (side == DraggerSide.END
        && isEndTimeNowLocked(now)
        && time.isAfter(now.plusMillis(cfg.nowToleranceMs()))) {
      log.debug("[logview] end dragger blocked past now: {}", time);
      return false;
    }
    Instant start = side == DraggerSide.START ? time : currentEffectiveBound(DraggerSide.START);
    Instant end = side == DraggerSide.END ? time : currentEffectiveBound(DraggerSide.END);
    if (start != null
        && end != null
        && end.toEpochMilli() - start.toEpochMilli() < cfg.minRangeMs()) {
      log.debug("[logview] {} dragger blocked: range {} .. {} below minimum", side, start, end);
      return false;
    }
    proposeRange(start, end);
    return true;
  }

  /** Pending bound while editing, else the committed one. */
  public synchronized Instant currentEffectiveBound(DraggerSide side) {
    if (side == DraggerSide.START) return editing ? pendingStart : effectiveStart;
    return editing ? pendingEnd : effectiveEnd;
  }

  /** Whether the effective end is open or within the tolerance of now. */
  public synchronized boolean isEndTimeNow() {
    return isEndTimeNowLocked(clock.instant());
  }

  // --- seeding ---

  public synchronized void setEntityLifecycle(EntityLifecycle lifecycle) {
    this.entity = lifecycle == null ? EntityLifecycle.UNKNOWN : lifecycle;
  }

  /**
   * Recomputes the committed display from, in order of preference: the effective bounds, the
   * entity lifecycle, the first and last loaded entries, the last hour.
   */
  public synchronized void seedFromData(Instant firstEntry, Instant lastEntry) {
    Instant now = clock.instant();
    Instant start =
        firstNonNull(
            effectiveStart, entity.start(), firstEntry, now.minusMillis(cfg.defaultDurationMs()));
    Instant end = firstNonNull(effectiveEnd, entity.end(), lastEntry, now);
    committedDisplay =
        DisplayPadding.around(start, end, start, end, cfg.paddingRatio(), cfg.minPaddingMs());
    publishLocked();
  }

  /** Dimmed overlay geometry for the current display and effective bounds. */
  public synchronized Optional<OverlayPositions> overlay() {
    DisplayRange d = currentDisplay();
    Instant s = currentEffectiveBound(DraggerSide.START);
    Instant e = currentEffectiveBound(DraggerSide.END);
    return OverlayPositions.compute(
        d.start().toEpochMilli(),
        d.end().toEpochMilli(),
        (s != null ? s : d.start()).toEpochMilli(),
        (e != null ? e : d.end()).toEpochMilli());
  }

  // --- internals ---

  private DisplayRange paddedDisplay(Instant start, Instant end) {
    Instant now = clock.instant();
    Instant fallbackStart =
        entity.start() != null ? entity.start() : now.minusMillis(cfg.defaultDurationMs());
    Instant fallbackEnd = entity.end() != null ? entity.end() : now;
    return DisplayPadding.around(
        start, end, fallbackStart, fallbackEnd, cfg.paddingRatio(), cfg.minPaddingMs());
  }

  private boolean containsEffectiveLocked(DisplayRange display) {
    long floor = cfg.minPaddingMs();
    if (effectiveStart != null && effectiveStart.minusMillis(floor).isBefore(display.start())) {
      return false;
    }
    return effectiveEnd == null || !effectiveEnd.plusMillis(floor).isAfter(display.end());
  }

  private boolean isEndTimeNowLocked(Instant now) {
    Instant end = currentEffectiveBound(DraggerSide.END);
    if (end == null) return true;
    return Math.abs(now.toEpochMilli() - end.toEpochMilli()) < cfg.nowToleranceMs();
  }

  private void cancelLocked() {
    editing = false;
    pendingStart = null;
    pendingEnd = null;
    pendingDisplay = null;
    publishLocked();
  }

  private TimeRange snapshotLocked(boolean includePending) {
    boolean pending = includePending && editing;
    DisplayRange d = pending && pendingDisplay != null ? pendingDisplay : committedDisplay;
    return new TimeRange(
        d.start(),
        d.end(),
        effectiveStart,
        effectiveEnd,
        pending ? pendingStart : null,
        pending ? pendingEnd : null,
        pending);
  }

  private void publishLocked() {
    ranges.onNext(snapshotLocked(true));
  }

  @SafeVarargs
  private static <T> T firstNonNull(T... candidates) {
    for (T c : candidates) {
      if (c != null) return c;
    }
    return null;
  }
}
