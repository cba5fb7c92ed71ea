package cafe.woden.logview.stream;

import cafe.woden.logview.model.LogEntry;
import io.reactivex.rxjava3.core.Single;
import java.time.Instant;
import java.util.List;
import org.jmolecules.architecture.layered.ApplicationLayer;

/** Transport port for the one-shot historical query. */
@ApplicationLayer
@FunctionalInterface
public interface BatchLogSource {

  /**
   * Fetches entries in {@code [start, end]}, ordered by timestamp.
   *
   * @param start inclusive lower bound, or {@code null} for unbounded
   * @param end inclusive upper bound, or {@code null} for "now"
   */
  Single<List<LogEntry>> fetch(Instant start, Instant end);
}
