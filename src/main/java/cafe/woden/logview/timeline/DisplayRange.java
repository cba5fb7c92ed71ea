package cafe.woden.logview.timeline;

import java.time.Instant;
import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/** Visible window of the histogram, padding included. */
@ValueObject
public record DisplayRange(Instant start, Instant end) {

  public DisplayRange {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
    if (end.isBefore(start)) {
      throw new IllegalArgumentException("display end " + end + " is before start " + start);
    }
  }

  public static DisplayRange ofEpochMillis(long startMs, long endMs) {
    return new DisplayRange(Instant.ofEpochMilli(startMs), Instant.ofEpochMilli(endMs));
  }

  public long rangeMs() {
    return end.toEpochMilli() - start.toEpochMilli();
  }

  public DisplayRange shiftedBy(long deltaMs) {
    return new DisplayRange(start.plusMillis(deltaMs), end.plusMillis(deltaMs));
  }

  /** Whether {@code t} lies in {@code [start, end]}. */
  public boolean contains(Instant t) {
    return !t.isBefore(start) && !t.isAfter(end);
  }
}
