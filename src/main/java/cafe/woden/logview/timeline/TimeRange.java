package cafe.woden.logview.timeline;

import java.time.Instant;
import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * Display, effective and pending bounds as seen by collaborators.
 *
 * <p>{@code null} effective bounds mean unbounded (start) or open/now (end). Pending bounds are
 * only meaningful while {@code editing}; an edit to "all time" has both pending bounds
 * {@code null}.
 */
@ValueObject
public record TimeRange(
    Instant displayStart,
    Instant displayEnd,
    Instant effectiveStart,
    Instant effectiveEnd,
    Instant pendingStart,
    Instant pendingEnd,
    boolean editing) {

  public TimeRange {
    Objects.requireNonNull(displayStart, "displayStart");
    Objects.requireNonNull(displayEnd, "displayEnd");
    if (!editing && (pendingStart != null || pendingEnd != null)) {
      throw new IllegalArgumentException("pending bounds set outside of an edit");
    }
  }

  public DisplayRange display() {
    return new DisplayRange(displayStart, displayEnd);
  }

  public boolean isOpenEnded() {
    return effectiveEnd == null;
  }
}
