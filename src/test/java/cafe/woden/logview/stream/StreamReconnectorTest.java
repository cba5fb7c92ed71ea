package cafe.woden.logview.stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import cafe.woden.logview.config.LogViewProperties;
import cafe.woden.logview.model.LogEntry;
import cafe.woden.logview.model.LogLevel;
import io.reactivex.rxjava3.processors.PublishProcessor;
import io.reactivex.rxjava3.schedulers.TestScheduler;
import io.reactivex.rxjava3.subscribers.TestSubscriber;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class StreamReconnectorTest {

  private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

  private final List<PublishProcessor<LiveEvent>> connections = new ArrayList<>();
  private final LiveLogSource source =
      () -> {
        PublishProcessor<LiveEvent> p = PublishProcessor.create();
        connections.add(p);
        return p;
      };
  private final TestScheduler scheduler = new TestScheduler();

  private StreamReconnector reconnector;
  private TestSubscriber<LogEntry> entries;
  private TestSubscriber<StreamState> states;

  @BeforeEach
  void setUp() {
    reconnector = newReconnector(LogViewProperties.defaults().stream());
  }

  @Test
  void transientFailuresBackOffExponentiallyThenFail() {
    reconnector.start();

    List<Long> delays = new ArrayList<>();
    for (int attempt = 1; attempt <= 5; attempt++) {
      last().onError(new IOException("connection reset"));
      StreamState s = reconnector.state();
      assertEquals(StreamPhase.RECONNECTING, s.phase());
      assertEquals(attempt, s.retryAttempt());
      delays.add(s.retryDelayMs());

      scheduler.advanceTimeBy(s.retryDelayMs() - 1, TimeUnit.MILLISECONDS);
      assertEquals(attempt, connections.size());
      scheduler.advanceTimeBy(1, TimeUnit.MILLISECONDS);
      assertEquals(attempt + 1, connections.size());
    }
    assertEquals(List.of(1_000L, 2_000L, 4_000L, 8_000L, 16_000L), delays);

    last().onError(new IOException("connection reset"));

    StreamState terminal = reconnector.state();
    assertEquals(StreamPhase.ERROR, terminal.phase());
    assertTrue(terminal.isTerminal());
    assertInstanceOf(IOException.class, terminal.error());
    assertFalse(reconnector.isRunning());
    scheduler.advanceTimeBy(1, TimeUnit.HOURS);
    assertEquals(6, connections.size());
  }

  @Test
  void firstEntryWithoutConnectedSignalAlsoResetsAttempts() {
    reconnector.start();
    last().onError(new IOException("broken pipe"));
    scheduler.advanceTimeBy(1, TimeUnit.SECONDS);

    push(entry("a", 0));

    assertEquals(StreamPhase.STREAMING, reconnector.state().phase());
    assertEquals(0, reconnector.state().retryAttempt());
    last().onError(new IOException("broken pipe"));
    assertEquals(1_000, reconnector.state().retryDelayMs());
  }

  @Test
  void clientErrorIsFatal() {
    reconnector.start();

    last().onError(new StreamHttpException(404, "Not Found"));

    assertEquals(StreamPhase.ERROR, reconnector.state().phase());
    scheduler.advanceTimeBy(1, TimeUnit.MINUTES);
    assertEquals(1, connections.size());
  }

  @Test
  void serverErrorIsRetried() {
    reconnector.start();

    last().onError(new StreamHttpException(503, "Service Unavailable"));

    assertTrue(reconnector.state().isReconnecting());
  }

  @Test
  void disabledReconnectFailsOnFirstTransientError() {
    StreamReconnector noRetry =
        newReconnector(
            new LogViewProperties.Stream(
                new LogViewProperties.Reconnect(false, 0, 0, 0, 0, 0), 0));
    noRetry.start();

    last().onError(new IOException("connection reset"));

    assertEquals(StreamPhase.ERROR, noRetry.state().phase());
  }

  @Test
  void normalEndIsComplete() {
    reconnector.start();

    last().onComplete();

    assertEquals(StreamPhase.COMPLETE, reconnector.state().phase());
    assertFalse(reconnector.isRunning());
  }

  @Test
  void restartLeavesErrorWithFreshCounter() {
    reconnector.start();
    last().onError(new StreamHttpException(401, "Unauthorized"));

    reconnector.restart();

    assertEquals(StreamPhase.CONNECTING, reconnector.state().phase());
    assertEquals(0, reconnector.state().retryAttempt());
    assertEquals(2, connections.size());
  }

  @Test
  void stopAbortsConnectionAndPendingRetry() {
    reconnector.start();
    push(entry("a", 0));
    PublishProcessor<LiveEvent> first = last();

    reconnector.stop();

    assertFalse(first.hasSubscribers());
    assertEquals(StreamState.IDLE, reconnector.state());
    first.onNext(LiveEvent.of(entry("b", 1)));
    entries.assertValueCount(1);

    reconnector.start();
    last().onError(new IOException("timed out"));
    reconnector.stop();
    scheduler.advanceTimeBy(1, TimeUnit.MINUTES);
    assertEquals(2, connections.size());
  }

  @Test
  void pauseHoldsEntriesAndResumeFlushesInOrder() {
    reconnector.start();
    push(entry("a", 0));

    reconnector.pause();
    assertEquals(StreamPhase.PAUSED, reconnector.state().phase());
    push(entry("b", 1));
    push(entry("c", 2));
    entries.assertValueCount(1);
    assertEquals(2, reconnector.pausedBufferSize());

    reconnector.resume();

    assertEquals(List.of("a", "b", "c"), ids(entries.values()));
    assertEquals(StreamPhase.STREAMING, reconnector.state().phase());
    assertEquals(0, reconnector.pausedBufferSize());
  }

  @Test
  void pausedBufferDropsOldest() {
    StreamReconnector small = newReconnector(new LogViewProperties.Stream(null, 2));
    small.start();
    small.pause();

    push(entry("a", 0));
    push(entry("b", 1));
    push(entry("c", 2));
    small.resume();

    assertEquals(List.of("b", "c"), ids(entries.values()));
  }

  @Test
  void replayedLinesAfterReconnectAreSkipped() {
    reconnector.start();
    push(entry("a", 0));
    push(entry("b", 1));
    last().onError(new IOException("stream was reset"));
    scheduler.advanceTimeBy(1, TimeUnit.SECONDS);

    push(entry("a", 0));
    push(entry("b", 1));
    push(entry("c", 2));
    push(entry("late", 1));

    assertEquals(List.of("a", "b", "c", "late"), ids(entries.values()));
  }

  @Test
  void statesStartIdleAndTrackTransitions() {
    reconnector.start();
    push(entry("a", 0));

    List<StreamPhase> phases = states.values().stream().map(StreamState::phase).toList();
    assertEquals(
        List.of(StreamPhase.IDLE, StreamPhase.CONNECTING, StreamPhase.STREAMING), phases);
  }

  @Test
  void connectedSignalStartsStreamingBeforeAnyEntry() {
    reconnector.start();

    last().onNext(LiveEvent.connected());

    assertEquals(StreamPhase.STREAMING, reconnector.state().phase());
    entries.assertNoValues();
  }

  @Test
  void quietConnectionsDroppedByIdleTimeoutNeverExhaustRetries() {
    reconnector.start();

    for (int drop = 1; drop <= 8; drop++) {
      last().onNext(LiveEvent.connected());
      scheduler.advanceTimeBy(10, TimeUnit.MINUTES);
      assertEquals(StreamPhase.STREAMING, reconnector.state().phase());

      last().onError(new IOException("connection reset"));

      assertEquals(StreamPhase.RECONNECTING, reconnector.state().phase());
      assertEquals(1, reconnector.state().retryAttempt());
      assertEquals(1_000, reconnector.state().retryDelayMs());
      scheduler.advanceTimeBy(1, TimeUnit.SECONDS);
    }

    assertEquals(9, connections.size());
    assertTrue(reconnector.isRunning());
  }

  private StreamReconnector newReconnector(LogViewProperties.Stream cfg) {
    StreamReconnector r =
        new StreamReconnector(source, cfg, scheduler, new RetryBackoff(cfg.reconnect(), () -> 0.5));
    entries = r.entries().test();
    states = r.states().test();
    return r;
  }

  private void push(LogEntry e) {
    last().onNext(LiveEvent.of(e));
  }

  private PublishProcessor<LiveEvent> last() {
    return connections.get(connections.size() - 1);
  }

  private static List<String> ids(List<LogEntry> list) {
    return list.stream().map(LogEntry::id).toList();
  }

  private static LogEntry entry(String id, long seconds) {
    return new LogEntry(id, T0.plusSeconds(seconds), LogLevel.INFO, id);
  }
}
