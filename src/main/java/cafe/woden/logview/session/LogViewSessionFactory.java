package cafe.woden.logview.session;

import cafe.woden.logview.config.ExecutorConfig;
import cafe.woden.logview.config.LogViewProperties;
import cafe.woden.logview.stream.BatchLogSource;
import cafe.woden.logview.stream.LiveLogSource;
import cafe.woden.logview.util.NamedThreads;
import cafe.woden.logview.window.WindowedViewHost;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.schedulers.Schedulers;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Creates {@link LogViewSession}s wired to the app-owned executors.
 *
 * <p>Every session gets its own single-threaded view executor; batch fetches and reconnect timers
 * share the pools from {@link ExecutorConfig}. Sessions still open at shutdown are closed.
 */
@Component
public class LogViewSessionFactory {
  private static final Logger log = LoggerFactory.getLogger(LogViewSessionFactory.class);

  private final LogViewProperties props;
  private final Scheduler ioScheduler;
  private final Scheduler timerScheduler;
  private final AtomicInteger sessionSeq = new AtomicInteger();
  private final Set<LogViewSession> open = ConcurrentHashMap.newKeySet();

  public LogViewSessionFactory(
      LogViewProperties props,
      @Qualifier(ExecutorConfig.LOG_BATCH_FETCH_EXECUTOR) ExecutorService batchFetchExecutor,
      @Qualifier(ExecutorConfig.LOG_STREAM_RECONNECT_SCHEDULER)
          ScheduledExecutorService reconnectScheduler) {
    this.props = Objects.requireNonNull(props, "props");
    this.ioScheduler = Schedulers.from(batchFetchExecutor);
    this.timerScheduler = Schedulers.from(reconnectScheduler);
  }

  public LogViewSession create(
      BatchLogSource batchSource, LiveLogSource liveSource, WindowedViewHost host) {
    return create(batchSource, liveSource, host, Clock.systemUTC());
  }

  /** {@code liveSource} may be null for views that never tail. */
  public LogViewSession create(
      BatchLogSource batchSource, LiveLogSource liveSource, WindowedViewHost host, Clock clock) {
    int n = sessionSeq.incrementAndGet();
    ExecutorService viewExec = NamedThreads.newSingleThreadExecutor("logview-view-" + n);
    LogViewSession session =
        new LogViewSession(
            props,
            batchSource,
            liveSource,
            host,
            clock,
            Schedulers.from(viewExec),
            ioScheduler,
            timerScheduler);
    open.add(session);
    session.onClose(
        () -> {
          open.remove(session);
          viewExec.shutdownNow();
        });
    log.debug("[logview] created session #{}", n);
    return session;
  }

  public int openSessions() {
    return open.size();
  }

  @PreDestroy
  void closeAll() {
    List<LogViewSession> sessions = new ArrayList<>(open);
    if (sessions.isEmpty()) return;
    log.info("[logview] closing {} open session(s)", sessions.size());
    for (LogViewSession s : sessions) {
      s.close();
    }
  }
}
