package cafe.woden.logview.timeline;

import java.time.Instant;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * Start and end of the workflow or task whose logs are shown.
 *
 * @param start when the entity started, or {@code null} if unknown
 * @param end when it finished, or {@code null} while it is still running
 */
@ValueObject
public record EntityLifecycle(Instant start, Instant end) {

  public static final EntityLifecycle UNKNOWN = new EntityLifecycle(null, null);

  public EntityLifecycle {
    if (start != null && end != null && end.isBefore(start)) {
      throw new IllegalArgumentException("entity end " + end + " is before start " + start);
    }
  }

  public static EntityLifecycle running(Instant start) {
    return new EntityLifecycle(start, null);
  }

  public boolean isRunning() {
    return end == null;
  }
}
