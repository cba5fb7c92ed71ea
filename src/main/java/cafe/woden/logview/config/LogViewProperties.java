package cafe.woden.logview.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Log view engine configuration.
 *
 * <p>Example YAML:
 * <pre>
 * logview:
 *   store:
 *     max-entries: 100000
 *   stream:
 *     reconnect:
 *       initial-delay-ms: 1000
 *       max-attempts: 5
 * </pre>
 */
@ConfigurationProperties(prefix = "logview")
public record LogViewProperties(
    Store store, Rows rows, Histogram histogram, Timeline timeline, Stream stream) {

  /** Entry store capacity. */
  public record Store(
      /** Hard cap on combined entries; exceeding it drops the oldest lines. Default: 100000. */
      int maxEntries) {
    public Store {
      if (maxEntries <= 0) maxEntries = 100_000;
    }
  }

  /** Fixed row heights reported to the windowed rendering host. */
  public record Rows(
      int entryHeight, int expandedEntryHeight, int separatorHeight, int scrollBottomThreshold) {
    public Rows {
      if (entryHeight <= 0) entryHeight = 24;
      if (expandedEntryHeight <= 0) expandedEntryHeight = 120;
      if (expandedEntryHeight < entryHeight) expandedEntryHeight = entryHeight;
      if (separatorHeight <= 0) separatorHeight = 32;
      if (scrollBottomThreshold <= 0) scrollBottomThreshold = 50;
    }
  }

  public record Histogram(int numBuckets) {
    public Histogram {
      if (numBuckets <= 0) numBuckets = 50;
      if (numBuckets > 1_000) numBuckets = 1_000;
    }
  }

  /** Time range editing constants. */
  public record Timeline(
      double paddingRatio,
      long minPaddingMs,
      long minRangeMs,
      long maxRangeMs,
      long nowToleranceMs,
      long defaultDurationMs,
      double panFactor,
      double zoomInFactor,
      double zoomOutFactor,
      long nudgeMs) {
    public Timeline {
      if (paddingRatio <= 0 || paddingRatio >= 1) paddingRatio = 0.075;
      if (minPaddingMs <= 0) minPaddingMs = 30_000;
      if (minRangeMs <= 0) minRangeMs = 60_000;
      if (maxRangeMs <= 0) maxRangeMs = 30L * 24 * 60 * 60 * 1000;
      if (maxRangeMs < minRangeMs) maxRangeMs = minRangeMs;
      if (nowToleranceMs <= 0) nowToleranceMs = 60_000;
      if (defaultDurationMs <= 0) defaultDurationMs = 60L * 60 * 1000;
      if (panFactor <= 0 || panFactor >= 1) panFactor = 0.1;
      if (zoomInFactor <= 0 || zoomInFactor >= 1) zoomInFactor = 0.8;
      if (zoomOutFactor <= 1) zoomOutFactor = 1.25;
      if (nudgeMs <= 0) nudgeMs = 5L * 60 * 1000;
    }
  }

  /** Live stream resilience and buffering. */
  public record Stream(Reconnect reconnect, int maxBufferSize) {
    public Stream {
      if (reconnect == null) reconnect = new Reconnect(true, 1_000, 30_000, 2.0, 0.25, 5);
      if (maxBufferSize <= 0) maxBufferSize = 10_000;
    }
  }

  public record Reconnect(
      /** Master toggle for automatic reconnects. Default: true. */
      Boolean enabled,
      long initialDelayMs,
      long maxDelayMs,
      double multiplier,
      double jitterPct,
      int maxAttempts) {
    public Reconnect {
      if (enabled == null) enabled = Boolean.TRUE;
      if (initialDelayMs <= 0) initialDelayMs = 1_000;
      if (maxDelayMs <= 0) maxDelayMs = 30_000;
      if (maxDelayMs < initialDelayMs) maxDelayMs = initialDelayMs;
      if (multiplier < 1.1) multiplier = 2.0;
      if (jitterPct < 0) jitterPct = 0;
      if (jitterPct > 0.75) jitterPct = 0.75;
      if (maxAttempts <= 0) maxAttempts = 5;
    }
  }

  public LogViewProperties {
    if (store == null) store = new Store(0);
    if (rows == null) rows = new Rows(0, 0, 0, 0);
    if (histogram == null) histogram = new Histogram(0);
    if (timeline == null) timeline = new Timeline(0, 0, 0, 0, 0, 0, 0, 0, 0, 0);
    if (stream == null) stream = new Stream(null, 0);
  }

  /** All defaults; what an empty {@code logview} section binds to. */
  public static LogViewProperties defaults() {
    return new LogViewProperties(null, null, null, null, null);
  }
}
