package cafe.woden.logview.histogram;

import cafe.woden.logview.model.LogLevel;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * Entry counts for one time slice.
 *
 * @param countsByLevel levels with at least one entry
 * @param inEffectiveRange the whole slice lies inside the committed range; presentation only
 */
@ValueObject
public record HistogramBucket(
    Instant bucketStart,
    Instant bucketEnd,
    Map<LogLevel, Integer> countsByLevel,
    boolean inEffectiveRange) {

  public HistogramBucket {
    Objects.requireNonNull(bucketStart, "bucketStart");
    Objects.requireNonNull(bucketEnd, "bucketEnd");
    EnumMap<LogLevel, Integer> copy = new EnumMap<>(LogLevel.class);
    if (countsByLevel != null) {
      countsByLevel.forEach(
          (level, count) -> {
            if (level != null && count != null && count > 0) copy.put(level, count);
          });
    }
    countsByLevel = Collections.unmodifiableMap(copy);
  }

  public int total() {
    int sum = 0;
    for (int c : countsByLevel.values()) sum += c;
    return sum;
  }

  public int count(LogLevel level) {
    return countsByLevel.getOrDefault(level, 0);
  }
}
