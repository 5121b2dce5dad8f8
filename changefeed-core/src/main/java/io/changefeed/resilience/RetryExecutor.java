package io.changefeed.resilience;

import io.changefeed.spi.Cancellable;
import io.changefeed.spi.MetricsExporter;
import io.changefeed.spi.TimerService;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs remote operations with a per-attempt timeout, exponential backoff between
 * attempts, and a shared {@link CircuitBreaker}.
 *
 * <p>The returned future never fails: it completes with the operation's result, or
 * with {@code null} when the circuit is open or every attempt failed. Callers must
 * treat {@code null} as "value unavailable".
 *
 * <p>The breaker is consulted once per {@link #execute} call, before the first
 * attempt. Success is recorded once per successful call; failure once per call whose
 * attempts are exhausted. Timeouts and backoff waits are scheduled on the
 * {@link TimerService} and never block a thread.
 *
 * @see RetryExecutor.Builder
 */
public final class RetryExecutor {
  private static final Logger logger = Logger.getLogger(RetryExecutor.class.getName());

  private final TimerService timer;
  private final CircuitBreaker circuitBreaker;
  private final RetryPolicy retryPolicy;
  private final int maxAttempts;
  private final Map<OperationKind, Long> timeouts;
  private final MetricsExporter metrics;

  private RetryExecutor(Builder builder) {
    this.timer = Objects.requireNonNull(builder.timer, "timer");
    this.circuitBreaker = Objects.requireNonNull(builder.circuitBreaker, "circuitBreaker");
    this.retryPolicy = builder.retryPolicy != null
        ? builder.retryPolicy : new ExponentialBackoffRetryPolicy(500, 2_000);
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    if (builder.maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    this.maxAttempts = builder.maxAttempts;
    this.timeouts = new EnumMap<>(OperationKind.class);
    for (OperationKind kind : OperationKind.values()) {
      Long override = builder.timeouts.get(kind);
      timeouts.put(kind, override != null ? override : kind.defaultTimeoutMs());
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Executes {@code operation} with the timeout configured for {@code kind}.
   *
   * @param operation supplies a fresh stage for each attempt
   * @param kind      operation category
   * @param <T>       result type
   * @return future completing with the result, or {@code null} on open circuit or exhaustion
   */
  public <T> CompletableFuture<T> execute(Supplier<? extends CompletionStage<T>> operation, OperationKind kind) {
    Objects.requireNonNull(kind, "kind");
    return execute(operation, kind, timeouts.get(kind));
  }

  /**
   * Executes {@code operation} with an explicit per-attempt timeout.
   *
   * @param operation supplies a fresh stage for each attempt
   * @param kind      operation category, used for logging
   * @param timeoutMs per-attempt timeout in milliseconds (must be &gt; 0)
   * @param <T>       result type
   * @return future completing with the result, or {@code null} on open circuit or exhaustion
   */
  public <T> CompletableFuture<T> execute(Supplier<? extends CompletionStage<T>> operation,
      OperationKind kind, long timeoutMs) {
    Objects.requireNonNull(operation, "operation");
    Objects.requireNonNull(kind, "kind");
    if (timeoutMs <= 0) {
      throw new IllegalArgumentException("timeoutMs must be > 0, got: " + timeoutMs);
    }
    if (!circuitBreaker.allow()) {
      metrics.incrementCircuitRejected();
      logger.log(Level.FINE, "Circuit open; skipping {0} operation", kind);
      return CompletableFuture.completedFuture(null);
    }
    CompletableFuture<T> result = new CompletableFuture<>();
    attempt(operation, kind, timeoutMs, 1, result);
    return result;
  }

  public long timeoutMs(OperationKind kind) {
    return timeouts.get(kind);
  }

  public int maxAttempts() {
    return maxAttempts;
  }

  public CircuitBreaker circuitBreaker() {
    return circuitBreaker;
  }

  private <T> void attempt(Supplier<? extends CompletionStage<T>> operation, OperationKind kind,
      long timeoutMs, int attempt, CompletableFuture<T> result) {
    metrics.incrementOperationAttempts();
    CompletableFuture<T> race = new CompletableFuture<>();
    Cancellable timeout = timer.schedule(() -> race.completeExceptionally(
        new OperationTimeoutException(kind + " operation timed out after " + timeoutMs + "ms")), timeoutMs);

    CompletionStage<T> stage;
    try {
      stage = Objects.requireNonNull(operation.get(), "operation returned a null stage");
    } catch (Throwable t) {
      stage = CompletableFuture.failedFuture(t);
    }
    stage.whenComplete((value, error) -> {
      if (error == null) {
        race.complete(value);
      } else {
        race.completeExceptionally(error);
      }
    });

    race.whenComplete((value, error) -> {
      timeout.cancel();
      if (error == null) {
        circuitBreaker.recordSuccess();
        metrics.incrementOperationSuccess();
        result.complete(value);
        return;
      }
      Throwable cause = unwrap(error);
      if (cause instanceof OperationTimeoutException) {
        metrics.incrementOperationTimeouts();
      }
      if (attempt < maxAttempts) {
        long delayMs = retryPolicy.computeDelayMs(attempt);
        logger.log(Level.FINE, "{0} attempt {1} failed ({2}); retrying in {3}ms",
            new Object[]{kind, attempt, cause.toString(), delayMs});
        timer.schedule(() -> attempt(operation, kind, timeoutMs, attempt + 1, result), delayMs);
      } else {
        circuitBreaker.recordFailure();
        metrics.incrementOperationFailure();
        logger.log(Level.SEVERE, kind + " operation failed after " + attempt + " attempts", cause);
        result.complete(null);
      }
    });
  }

  private static Throwable unwrap(Throwable error) {
    Throwable current = error;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  /** Builder for {@link RetryExecutor}. */
  public static final class Builder {
    private TimerService timer;
    private CircuitBreaker circuitBreaker;
    private RetryPolicy retryPolicy;
    private int maxAttempts = 3;
    private final Map<OperationKind, Long> timeouts = new EnumMap<>(OperationKind.class);
    private MetricsExporter metrics;

    private Builder() {}

    /**
     * Sets the timer used for timeouts and backoff waits.
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
     * Sets the shared circuit breaker.
     *
     * <p><b>Required.</b>
     *
     * @param circuitBreaker the circuit breaker
     * @return this builder
     */
    public Builder circuitBreaker(CircuitBreaker circuitBreaker) {
      this.circuitBreaker = circuitBreaker;
      return this;
    }

    /**
     * Sets the backoff policy.
     *
     * <p>Optional. Defaults to {@link ExponentialBackoffRetryPolicy} with base 500ms,
     * max 2000ms, multiplier 2 and 25% jitter.
     *
     * @param retryPolicy the retry policy
     * @return this builder
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Sets the total number of attempts per call, including the first.
     *
     * <p>Optional. Defaults to {@code 3}. Must be &ge; 1.
     *
     * @param maxAttempts max attempts
     * @return this builder
     */
    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    /**
     * Overrides the per-attempt timeout of one operation kind.
     *
     * <p>Optional. Defaults to {@link OperationKind#defaultTimeoutMs()}. Must be &gt; 0.
     *
     * @param kind      operation kind
     * @param timeoutMs timeout in milliseconds
     * @return this builder
     */
    public Builder timeout(OperationKind kind, long timeoutMs) {
      Objects.requireNonNull(kind, "kind");
      if (timeoutMs <= 0) {
        throw new IllegalArgumentException("timeoutMs must be > 0, got: " + timeoutMs);
      }
      this.timeouts.put(kind, timeoutMs);
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
     * Builds the executor.
     *
     * @return a new {@link RetryExecutor}
     * @throws NullPointerException if {@code timer} or {@code circuitBreaker} is null
     * @throws IllegalArgumentException if {@code maxAttempts < 1}
     */
    public RetryExecutor build() {
      return new RetryExecutor(this);
    }
  }
}
