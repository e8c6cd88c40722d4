package de.ialistannen.rex.fetch;

import java.time.Duration;
import java.util.Optional;

/**
 * Bounded exponential backoff for rate limited registry calls.
 *
 * @param maxAttempts how often a call is tried in total, at least 1
 * @param initialBackoff the wait after the first failed attempt
 * @param maxBackoff the longest we ever wait between attempts
 * @param honorRetryAfter whether a {@code Retry-After} hint from the registry may lengthen the wait
 */
public record RetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff, boolean honorRetryAfter) {

  public RetryPolicy {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("At least one attempt is needed, got " + maxAttempts);
    }
    if (initialBackoff.isNegative() || maxBackoff.isNegative()) {
      throw new IllegalArgumentException("Backoff durations must not be negative");
    }
  }

  public static RetryPolicy defaults() {
    return new RetryPolicy(4, Duration.ofSeconds(1), Duration.ofSeconds(30), true);
  }

  public static RetryPolicy noRetries() {
    return new RetryPolicy(1, Duration.ZERO, Duration.ZERO, false);
  }

  /**
   * @param failedAttempts how many attempts failed so far, starting at 1
   * @param retryAfter the wait the registry asked for
   * @return how long to wait before the next attempt
   */
  public Duration backoff(int failedAttempts, Optional<Duration> retryAfter) {
    Duration wait = initialBackoff.multipliedBy(1L << Math.min(Math.max(failedAttempts - 1, 0), 20));
    if (honorRetryAfter && retryAfter.isPresent() && retryAfter.get().compareTo(wait) > 0) {
      wait = retryAfter.get();
    }
    if (wait.compareTo(maxBackoff) > 0) {
      return maxBackoff;
    }
    return wait;
  }
}
