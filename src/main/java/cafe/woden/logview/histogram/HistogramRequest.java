package cafe.woden.logview.histogram;

import java.time.Instant;
import java.util.Objects;

/**
 * Parameters for one histogram pass.
 *
 * @param effectiveStart committed start, or {@code null} for unbounded
 * @param effectiveEnd committed end, or {@code null} for open/now
 */
public record HistogramRequest(
    int numBuckets,
    Instant displayStart,
    Instant displayEnd,
    Instant effectiveStart,
    Instant effectiveEnd) {

  public HistogramRequest {
    Objects.requireNonNull(displayStart, "displayStart");
    Objects.requireNonNull(displayEnd, "displayEnd");
  }

  public HistogramRequest(int numBuckets, Instant displayStart, Instant displayEnd) {
    this(numBuckets, displayStart, displayEnd, null, null);
  }

  /** No buckets or an empty display range. */
  public boolean isDegenerate() {
    return numBuckets <= 0 || !displayEnd.isAfter(displayStart);
  }
}
