package io.intellixity.sqlbridge.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable retry settings for one logical operation (a statement or a whole transaction).\n
 *
 * Delay before attempt {@code n+1} is drawn uniformly from {@code [0, ceiling(n)]}, where the
 * ceiling starts at {@code baseBackoff}, doubles per attempt and never exceeds {@code maxBackoff}.\n
 */
public record RetryPolicy(int maxAttempts, Duration baseBackoff, Duration maxBackoff) {
  /** Single attempt, no retries. */
  public static final RetryPolicy NONE = new RetryPolicy(1, Duration.ZERO, Duration.ZERO);

  public RetryPolicy {
    if (maxAttempts <= 0) throw new IllegalArgumentException("maxAttempts must be > 0");
    Objects.requireNonNull(baseBackoff, "baseBackoff");
    Objects.requireNonNull(maxBackoff, "maxBackoff");
    if (baseBackoff.isNegative()) throw new IllegalArgumentException("baseBackoff must be >= 0");
    if (maxBackoff.compareTo(baseBackoff) < 0) throw new IllegalArgumentException("maxBackoff must be >= baseBackoff");
  }

  public static RetryPolicy defaults() {
    return new RetryPolicy(3, Duration.ofMillis(50), Duration.ofSeconds(2));
  }

  public static RetryPolicy of(int maxAttempts, Duration baseBackoff, Duration maxBackoff) {
    return new RetryPolicy(maxAttempts, baseBackoff, maxBackoff);
  }

  /** Upper bound of the delay after the given failed attempt (1-based). */
  public long backoffCeilingMillis(int failedAttempt) {
    long base = baseBackoff.toMillis();
    long max = maxBackoff.toMillis();
    if (base == 0) return 0;
    int shift = Math.min(Math.max(failedAttempt - 1, 0), 30);
    long ceiling = base << shift;
    return (ceiling <= 0 || ceiling > max) ? max : ceiling;
  }
}
