package io.changefeed.resilience;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Retry policy using exponential backoff with symmetric jitter.
 *
 * <p>Delay formula: {@code min(baseDelay * multiplier^(attempt-1), maxDelay)}, then
 * shifted by a random fraction in {@code [-jitter, +jitter]} of itself. The result is
 * never below {@code baseDelay}.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
  private final long baseDelayMs;
  private final long maxDelayMs;
  private final double multiplier;
  private final double jitter;

  /**
   * Creates a policy with multiplier {@code 2.0} and jitter {@code 0.25}.
   *
   * @param baseDelayMs base delay for the first retry (milliseconds)
   * @param maxDelayMs  maximum delay before jitter (milliseconds)
   */
  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs) {
    this(baseDelayMs, maxDelayMs, 2.0, 0.25);
  }

  /**
   * @param baseDelayMs base delay for the first retry (milliseconds)
   * @param maxDelayMs  maximum delay before jitter (milliseconds)
   * @param multiplier  growth factor per attempt (&ge; 1)
   * @param jitter      jitter fraction in {@code [0, 1)}
   */
  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs, double multiplier, double jitter) {
    if (baseDelayMs <= 0) {
      throw new IllegalArgumentException("baseDelayMs must be > 0, got: " + baseDelayMs);
    }
    if (maxDelayMs < baseDelayMs) {
      throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs);
    }
    if (multiplier < 1.0) {
      throw new IllegalArgumentException("multiplier must be >= 1, got: " + multiplier);
    }
    if (jitter < 0.0 || jitter >= 1.0) {
      throw new IllegalArgumentException("jitter must be in [0, 1), got: " + jitter);
    }
    this.baseDelayMs = baseDelayMs;
    this.maxDelayMs = maxDelayMs;
    this.multiplier = multiplier;
    this.jitter = jitter;
  }

  @Override
  public long computeDelayMs(int attempts) {
    if (attempts <= 0) {
      return 0L;
    }
    // pow overflows to Infinity for large attempts, which min() then caps
    double expDelay = baseDelayMs * Math.pow(multiplier, attempts - 1);
    double capped = Math.min((double) maxDelayMs, expDelay);
    double offset = jitter == 0.0 ? 0.0 : capped * ThreadLocalRandom.current().nextDouble(-jitter, jitter);
    return Math.max(baseDelayMs, Math.round(capped + offset));
  }

  public long baseDelayMs() {
    return baseDelayMs;
  }

  public long maxDelayMs() {
    return maxDelayMs;
  }
}
