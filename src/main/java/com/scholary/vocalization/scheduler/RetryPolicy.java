package com.scholary.vocalization.scheduler;

import java.time.Duration;

/**
 * Exponential backoff for transient inference failures.
 *
 * <p>{@code nextDelay(n) = min(baseDelay * 2^(n-1), maxDelay)} where {@code n} is the attempt that
 * just failed. No jitter, so delays are reproducible.
 *
 * @param maxAttempts total attempts allowed, including the first
 * @param baseDelay delay after the first failure
 * @param maxDelay cap on any single delay
 */
public record RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay) {

  public RetryPolicy {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
    }
    if (baseDelay == null || baseDelay.isNegative() || maxDelay == null || maxDelay.isNegative()) {
      throw new IllegalArgumentException("delays must be non-negative");
    }
  }

  /**
   * @param failedAttempt 1-based number of the attempt that just failed
   * @return how long to wait before the next attempt
   */
  public Duration nextDelay(int failedAttempt) {
    if (failedAttempt < 1) {
      throw new IllegalArgumentException("failedAttempt must be >= 1, got " + failedAttempt);
    }
    long factor = 1L << Math.min(failedAttempt - 1, 30);
    long baseMillis = baseDelay.toMillis();
    long maxMillis = maxDelay.toMillis();
    if (baseMillis > 0 && baseMillis > maxMillis / factor) {
      return maxDelay;
    }
    return Duration.ofMillis(Math.min(baseMillis * factor, maxMillis));
  }

  /** @return true if another attempt may follow {@code failedAttempt} */
  public boolean shouldRetry(int failedAttempt) {
    return failedAttempt < maxAttempts;
  }
}
