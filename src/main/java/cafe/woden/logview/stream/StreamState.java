package cafe.woden.logview.stream;

import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * Connection status for UI indication.
 *
 * @param retryAttempt consecutive failed connection attempts; 0 after a successful connect
 * @param retryDelayMs pending backoff delay while {@link StreamPhase#RECONNECTING}, else 0
 * @param error the surfaced failure in {@link StreamPhase#ERROR}, or the failure being retried
 */
@ValueObject
public record StreamState(StreamPhase phase, int retryAttempt, long retryDelayMs, Throwable error) {

  public static final StreamState IDLE = new StreamState(StreamPhase.IDLE, 0, 0, null);

  public StreamState {
    Objects.requireNonNull(phase, "phase");
    if (retryAttempt < 0) retryAttempt = 0;
    if (retryDelayMs < 0) retryDelayMs = 0;
  }

  public boolean isStreaming() {
    return phase == StreamPhase.STREAMING;
  }

  public boolean isReconnecting() {
    return phase == StreamPhase.RECONNECTING;
  }

  public boolean isTerminal() {
    return phase == StreamPhase.ERROR || phase == StreamPhase.COMPLETE;
  }
}
