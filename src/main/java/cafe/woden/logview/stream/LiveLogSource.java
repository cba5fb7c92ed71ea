package cafe.woden.logview.stream;

import cafe.woden.logview.model.LogEntry;
import io.reactivex.rxjava3.core.Flowable;
import java.util.Objects;
import java.util.function.Supplier;
import org.jmolecules.architecture.layered.ApplicationLayer;

/**
 * Transport port for the live tail.
 *
 * <p>Each call to {@link #open()} describes one connection: subscribing connects, cancelling the
 * subscription aborts it. A connection emits {@link LiveEvent.Connected} once the server has
 * accepted it, then one {@link LiveEvent.Received} per line. The flowable completes when the
 * server ends the stream and signals an error when the connection fails.
 */
@ApplicationLayer
@FunctionalInterface
public interface LiveLogSource {
  Flowable<LiveEvent> open();

  /** For transports without a handshake: the subscription itself counts as the connection. */
  static LiveLogSource fromEntries(Supplier<? extends Flowable<LogEntry>> entries) {
    Objects.requireNonNull(entries, "entries");
    return () -> entries.get().map(LiveEvent::of).startWithItem(LiveEvent.connected());
  }
}
