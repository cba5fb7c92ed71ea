package cafe.woden.logview.timeline;

import java.time.Duration;
import java.time.Instant;

/** Quick "last N" ranges. Presets always leave the end open so the view stays live. */
public enum TimelinePreset {
  LAST_5_MINUTES("Last 5 minutes", Duration.ofMinutes(5)),
  LAST_15_MINUTES("Last 15 minutes", Duration.ofMinutes(15)),
  LAST_HOUR("Last hour", Duration.ofHours(1)),
  LAST_6_HOURS("Last 6 hours", Duration.ofHours(6)),
  LAST_24_HOURS("Last 24 hours", Duration.ofHours(24)),
  ALL("All time", null);

  private final String label;
  private final Duration duration;

  TimelinePreset(String label, Duration duration) {
    this.label = label;
    this.duration = duration;
  }

  public String label() {
    return label;
  }

  /** {@code null} for {@link #ALL}. */
  public Duration duration() {
    return duration;
  }

  /** Start bound relative to {@code now}, or {@code null} for unbounded. */
  public Instant startFrom(Instant now) {
    return duration == null ? null : now.minus(duration);
  }
}
