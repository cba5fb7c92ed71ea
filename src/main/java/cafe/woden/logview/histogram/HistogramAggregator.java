package cafe.woden.logview.histogram;

import cafe.woden.logview.model.LogEntry;
import cafe.woden.logview.model.LogLevel;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Objects;

/**
 * Buckets entries across the display range.
 *
 * <p>Bucket {@code i} covers {@code [start + i*span/n, start + (i+1)*span/n)} in whole
 * milliseconds; an entry at offset {@code d} lands in {@code floor(d*n/span)}. Entries outside
 * {@code [displayStart, displayEnd)}, compared at full {@link Instant} precision, are not
 * counted.
 */
public final class HistogramAggregator {

  private HistogramAggregator() {}

  public static List<HistogramBucket> computeHistogram(
      List<LogEntry> entries, HistogramRequest request) {
    Objects.requireNonNull(entries, "entries");
    Objects.requireNonNull(request, "request");
    if (request.isDegenerate()) return List.of();

    int n = request.numBuckets();
    Instant displayStart = request.displayStart();
    Instant displayEnd = request.displayEnd();
    long start = displayStart.toEpochMilli();
    long end = Math.max(start + 1, displayEnd.toEpochMilli());
    long span = end - start;

    @SuppressWarnings("unchecked")
    EnumMap<LogLevel, Integer>[] counts = new EnumMap[n];
    for (LogEntry e : entries) {
      // Bounds are compared at full precision; only the bucket index uses whole milliseconds.
      Instant ts = e.timestamp();
      if (ts.isBefore(displayStart) || !ts.isBefore(displayEnd)) continue;
      long t = e.epochMs();
      int idx = Math.min(bucketIndex(t - start, span, n), n - 1);
      EnumMap<LogLevel, Integer> m = counts[idx];
      if (m == null) {
        m = new EnumMap<>(LogLevel.class);
        counts[idx] = m;
      }
      m.merge(e.level(), 1, Integer::sum);
    }

    Instant es = request.effectiveStart();
    Instant ee = request.effectiveEnd();
    Long effStart = es == null ? null : es.toEpochMilli();
    Long effEnd = ee == null ? null : ee.toEpochMilli();

    ArrayList<HistogramBucket> out = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      long bStart = start + bucketOffset(i, span, n);
      long bEnd = i == n - 1 ? end : start + bucketOffset(i + 1, span, n);
      boolean inEffective =
          (effStart == null || bStart >= effStart) && (effEnd == null || bEnd <= effEnd);
      out.add(
          new HistogramBucket(
              Instant.ofEpochMilli(bStart), Instant.ofEpochMilli(bEnd), counts[i], inEffective));
    }
    return List.copyOf(out);
  }

  /** Sum of bucket totals. */
  public static int total(List<HistogramBucket> buckets) {
    int sum = 0;
    for (HistogramBucket b : buckets) sum += b.total();
    return sum;
  }

  static int bucketIndex(long offset, long span, int n) {
    if (offset <= Long.MAX_VALUE / n) {
      return (int) (offset * n / span);
    }
    return (int) Math.floor((double) offset / ((double) span / n));
  }

  // Smallest millisecond offset whose index is >= i.
  static long bucketOffset(int i, long span, int n) {
    if (span <= Long.MAX_VALUE / n) {
      long scaled = (long) i * span;
      return (scaled + n - 1) / n;
    }
    return (long) Math.ceil(((double) span / n) * i);
  }
}
