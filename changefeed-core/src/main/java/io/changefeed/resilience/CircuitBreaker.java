package io.changefeed.resilience;

import io.changefeed.spi.MetricsExporter;
import io.changefeed.spi.TimerService;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Three-state circuit breaker guarding the remote cache.
 *
 * <p>One instance is shared by every {@link RetryExecutor} call of an aggregator, so
 * all remote operations see the same state. Transitions:
 * <ul>
 *   <li>CLOSED &rarr; OPEN once {@code failureThreshold} failures have been recorded.</li>
 *   <li>OPEN &rarr; HALF_OPEN on the first {@link #allow()} call made more than
 *       {@code openTimeout} after the last failure.</li>
 *   <li>HALF_OPEN &rarr; CLOSED after {@code successThreshold} successes; any failure
 *       returns to OPEN.</li>
 * </ul>
 *
 * <p>In CLOSED state a failure arriving more than {@code monitorWindow} after the
 * previous one restarts the failure count, so sparse failures never trip the circuit.
 *
 * <p>Time is read from the {@link TimerService}. All methods are thread-safe.
 */
public final class CircuitBreaker {
  private static final Logger logger = Logger.getLogger(CircuitBreaker.class.getName());

  private final TimerService timer;
  private final MetricsExporter metrics;
  private final int failureThreshold;
  private final int successThreshold;
  private final long openTimeoutMs;
  private final long monitorWindowMs;

  private CircuitState state = CircuitState.CLOSED;
  private int failureCount;
  private int successCount;
  private long lastFailureTime;

  private CircuitBreaker(Builder builder) {
    this.timer = Objects.requireNonNull(builder.timer, "timer");
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    if (builder.failureThreshold < 1) {
      throw new IllegalArgumentException("failureThreshold must be >= 1");
    }
    if (builder.successThreshold < 1) {
      throw new IllegalArgumentException("successThreshold must be >= 1");
    }
    if (builder.openTimeoutMs < 0) {
      throw new IllegalArgumentException("openTimeoutMs must be >= 0");
    }
    if (builder.monitorWindowMs < 0) {
      throw new IllegalArgumentException("monitorWindowMs must be >= 0");
    }
    this.failureThreshold = builder.failureThreshold;
    this.successThreshold = builder.successThreshold;
    this.openTimeoutMs = builder.openTimeoutMs;
    this.monitorWindowMs = builder.monitorWindowMs;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns whether an operation may be attempted now. May move OPEN to HALF_OPEN.
   *
   * @return {@code false} only while the circuit is OPEN and the timeout has not elapsed
   */
  public synchronized boolean allow() {
    switch (state) {
      case CLOSED:
      case HALF_OPEN:
        return true;
      case OPEN:
        if (timer.currentTimeMillis() - lastFailureTime > openTimeoutMs) {
          successCount = 0;
          transition(CircuitState.HALF_OPEN);
          return true;
        }
        return false;
      default:
        throw new IllegalStateException("Unknown state: " + state);
    }
  }

  /** Records a successful operation. */
  public synchronized void recordSuccess() {
    successCount++;
    if (state == CircuitState.HALF_OPEN && successCount >= successThreshold) {
      failureCount = 0;
      successCount = 0;
      transition(CircuitState.CLOSED);
    }
  }

  /** Records a failed operation. */
  public synchronized void recordFailure() {
    long now = timer.currentTimeMillis();
    if (state == CircuitState.CLOSED && monitorWindowMs > 0 && failureCount > 0
        && now - lastFailureTime > monitorWindowMs) {
      failureCount = 0;
    }
    failureCount++;
    successCount = 0;
    lastFailureTime = now;
    if (state == CircuitState.HALF_OPEN || failureCount >= failureThreshold) {
      if (state != CircuitState.OPEN) {
        logger.log(Level.WARNING, "Circuit opened after {0} failures", failureCount);
      }
      transition(CircuitState.OPEN);
    }
  }

  public synchronized CircuitState state() {
    return state;
  }

  public synchronized CircuitBreakerSnapshot snapshot() {
    return new CircuitBreakerSnapshot(state, failureCount, successCount, lastFailureTime);
  }

  /** Forces the breaker back to CLOSED with all counters cleared. */
  public synchronized void reset() {
    failureCount = 0;
    successCount = 0;
    lastFailureTime = 0L;
    transition(CircuitState.CLOSED);
    logger.info("Circuit breaker reset");
  }

  private void transition(CircuitState next) {
    if (state == next) {
      return;
    }
    logger.log(Level.INFO, "Circuit {0} -> {1}", new Object[]{state, next});
    state = next;
    metrics.recordCircuitState(next);
  }

  /** Builder for {@link CircuitBreaker}. */
  public static final class Builder {
    private TimerService timer;
    private MetricsExporter metrics;
    private int failureThreshold = 5;
    private int successThreshold = 3;
    private long openTimeoutMs = 60_000L;
    private long monitorWindowMs = 300_000L;

    private Builder() {}

    /**
     * Sets the clock source.
     *
     * <p><b>Required.</b>
     *
     * @param timer the timer service
     * @return this builder
     */
    public Builder timer(TimerService timer) {
      this.timer = timer;
      return this;
    }

    /**
     * Sets the metrics exporter.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets the number of failures that opens the circuit.
     *
     * <p>Optional. Defaults to {@code 5}. Must be &ge; 1.
     *
     * @param failureThreshold failures before opening
     * @return this builder
     */
    public Builder failureThreshold(int failureThreshold) {
      this.failureThreshold = failureThreshold;
      return this;
    }

    /**
     * Sets the number of HALF_OPEN successes that closes the circuit.
     *
     * <p>Optional. Defaults to {@code 3}. Must be &ge; 1.
     *
     * @param successThreshold successes before closing
     * @return this builder
     */
    public Builder successThreshold(int successThreshold) {
      this.successThreshold = successThreshold;
      return this;
    }

    /**
     * Sets how long the circuit stays OPEN after the last failure.
     *
     * <p>Optional. Defaults to {@code 60000} (60 seconds). Must be &ge; 0.
     *
     * @param openTimeoutMs open timeout in milliseconds
     * @return this builder
     */
    public Builder openTimeoutMs(long openTimeoutMs) {
      this.openTimeoutMs = openTimeoutMs;
      return this;
    }

    /**
     * Sets the window after which an old CLOSED-state failure count is discarded.
     *
     * <p>Optional. Defaults to {@code 300000} (5 minutes). {@code 0} disables the window.
     *
     * @param monitorWindowMs monitor window in milliseconds
     * @return this builder
     */
    public Builder monitorWindowMs(long monitorWindowMs) {
      this.monitorWindowMs = monitorWindowMs;
      return this;
    }

    /**
     * Builds the circuit breaker in CLOSED state.
     *
     * @return a new {@link CircuitBreaker}
     * @throws NullPointerException if {@code timer} is null
     * @throws IllegalArgumentException if a threshold is &lt; 1 or a duration is negative
     */
    public CircuitBreaker build() {
      return new CircuitBreaker(this);
    }
  }
}
