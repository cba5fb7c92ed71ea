package cafe.woden.logview.stream;

import cafe.woden.logview.config.LogViewProperties;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with symmetric jitter: {@code min(initial * multiplier^(attempt-1), max)}
 * scaled by a random factor in {@code [1 - jitter, 1 + jitter)}.
 */
public final class RetryBackoff {

  static final long MIN_DELAY_MS = 250;

  private final LogViewProperties.Reconnect policy;
  private final DoubleSupplier random;

  public RetryBackoff(LogViewProperties.Reconnect policy) {
    this(policy, () -> ThreadLocalRandom.current().nextDouble());
  }

  /**
   * @param random source of uniform values in {@code [0, 1)}
   */
  public RetryBackoff(LogViewProperties.Reconnect policy, DoubleSupplier random) {
    this.policy = Objects.requireNonNull(policy, "policy");
    this.random = Objects.requireNonNull(random, "random");
  }

  /** Delay before the given 1-based attempt. */
  public long delayMs(int attempt) {
    long capped = baseDelayMs(attempt);
    double jitter = policy.jitterPct();
    if (jitter <= 0) return capped;

    double factor = 1.0 + (random.getAsDouble() * 2 - 1) * jitter;
    long withJitter = (long) Math.max(0, capped * factor);
    return Math.max(MIN_DELAY_MS, withJitter);
  }

  /** Delay before jitter. */
  public long baseDelayMs(int attempt) {
    double mult = Math.pow(policy.multiplier(), Math.max(0, attempt - 1));
    double raw = policy.initialDelayMs() * mult;
    return (long) Math.min(raw, (double) policy.maxDelayMs());
  }

  public int maxAttempts() {
    return policy.maxAttempts();
  }
}
