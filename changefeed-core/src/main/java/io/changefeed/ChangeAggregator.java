package io.changefeed;

import io.changefeed.batch.BatchingEngine;
import io.changefeed.cache.ReadThroughCache;
import io.changefeed.cache.ResilientCacheClient;
import io.changefeed.cache.ValueCodec;
import io.changefeed.dedupe.RequestDeduplicator;
import io.changefeed.model.PriorityTier;
import io.changefeed.model.SubscriptionSpec;
import io.changefeed.pool.ConnectionPool;
import io.changefeed.resilience.CircuitBreaker;
import io.changefeed.resilience.ExponentialBackoffRetryPolicy;
import io.changefeed.resilience.OperationKind;
import io.changefeed.resilience.RetryExecutor;
import io.changefeed.spi.ChangeFeed;
import io.changefeed.spi.ErrorHandler;
import io.changefeed.spi.MetricsExporter;
import io.changefeed.spi.RemoteCacheClient;
import io.changefeed.spi.TimerService;
import io.changefeed.util.ScheduledTimerService;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Entry point of changefeed: batched, pooled change subscriptions plus a resilient
 * read-through cache.
 *
 * <p>Owns one instance of every component: the {@link ConnectionPool} and
 * {@link BatchingEngine} behind {@link #subscribe}, and the {@link CircuitBreaker},
 * {@link RetryExecutor} and {@link RequestDeduplicator} behind {@link #readThroughCache}.
 * Build one per application and share it.
 *
 * <pre>{@code
 * try (ChangeAggregator aggregator = ChangeAggregator.builder()
 *     .feed(realtimeFeed)
 *     .remoteCache(new LettuceRemoteCacheClient(redisClient))
 *     .build()) {
 *
 *   Subscription likes = aggregator.subscribe("likes-42",
 *       SubscriptionSpec.builder("likes").filter("post_id=eq.42")
 *           .priority(PriorityTier.HIGH).build(),
 *       delivery -> refreshCounters(delivery.events()));
 *
 *   aggregator.readThroughCache("profile:42", profileCodec,
 *       () -> profiles.load(42), Duration.ofMinutes(5));
 *
 *   likes.close();
 * }
 * }</pre>
 *
 * @see ChangeAggregator.Builder
 */
public final class ChangeAggregator implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(ChangeAggregator.class.getName());

  private final TimerService timer;
  private final boolean ownsTimer;
  private final MetricsExporter metrics;
  private final BatchingEngine batchingEngine;
  private final ConnectionPool connectionPool;
  private final CircuitBreaker circuitBreaker;
  private final RetryExecutor retryExecutor;
  private final RequestDeduplicator deduplicator;
  private final ResilientCacheClient cacheClient;
  private final ReadThroughCache readThroughCache;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  private ChangeAggregator(Builder builder) {
    ChangeFeed feed = Objects.requireNonNull(builder.feed, "feed");
    AggregatorConfig config = builder.config != null ? builder.config : new AggregatorConfig();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    ErrorHandler errorHandler = builder.errorHandler != null ? builder.errorHandler : ErrorHandler.NOOP;
    this.ownsTimer = builder.timer == null;
    this.timer = builder.timer != null ? builder.timer : new ScheduledTimerService();

    try {
      this.batchingEngine = new BatchingEngine(timer, metrics, errorHandler);
      ConnectionPool.Builder pool = ConnectionPool.builder()
          .feed(feed)
          .timer(timer)
          .batchingEngine(batchingEngine)
          .metrics(metrics)
          .errorHandler(errorHandler)
          .maxConnections(config.getMaxConnections())
          .idleTimeoutMs(config.getIdleTimeoutMs())
          .sweepIntervalMs(config.getPoolSweepIntervalMs())
          .maxConnectionErrors(config.getMaxConnectionErrors());
      for (PriorityTier tier : PriorityTier.values()) {
        pool.tierSettings(tier, config.getTierSettings(tier));
      }
      this.connectionPool = pool.build();

      this.circuitBreaker = CircuitBreaker.builder()
          .timer(timer)
          .metrics(metrics)
          .failureThreshold(config.getFailureThreshold())
          .successThreshold(config.getSuccessThreshold())
          .openTimeoutMs(config.getOpenTimeoutMs())
          .monitorWindowMs(config.getMonitorWindowMs())
          .build();

      RetryExecutor.Builder retry = RetryExecutor.builder()
          .timer(timer)
          .circuitBreaker(circuitBreaker)
          .metrics(metrics)
          .maxAttempts(config.getRetryMaxAttempts())
          .retryPolicy(new ExponentialBackoffRetryPolicy(config.getRetryBaseDelayMs(),
              config.getRetryMaxDelayMs(), config.getRetryMultiplier(), config.getRetryJitter()));
      for (OperationKind kind : OperationKind.values()) {
        retry.timeout(kind, config.getOperationTimeoutMs(kind));
      }
      this.retryExecutor = retry.build();

      this.deduplicator = RequestDeduplicator.builder()
          .timer(timer)
          .metrics(metrics)
          .pendingTimeout(Duration.ofMillis(config.getPendingTimeoutMs()))
          .defaultTtl(Duration.ofMillis(config.getDedupeTtlMs()))
          .sweepInterval(Duration.ofMillis(config.getDedupeSweepIntervalMs()))
          .build();

      RemoteCacheClient remote = builder.remoteCache;
      this.cacheClient = remote != null ? new ResilientCacheClient(remote, retryExecutor) : null;
      this.readThroughCache = new ReadThroughCache(deduplicator, cacheClient,
          Duration.ofMillis(config.getReadThroughTtlMs()));
    } catch (RuntimeException e) {
      if (ownsTimer) {
        timer.close();
      }
      throw e;
    }

    connectionPool.start();
    deduplicator.start();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Subscribes to batched changes. Never throws on pool exhaustion: a deferred
   * subscription returns {@link Subscription#NOOP}.
   *
   * @param channelName unique channel name; reusing a live name replaces it
   * @param spec        table, filter, event kind and priority
   * @param listener    receives one event or a batch per flush
   * @return handle whose {@code close()} unsubscribes
   */
  public Subscription subscribe(String channelName, SubscriptionSpec spec, ChangeListener listener) {
    ensureOpen();
    return connectionPool.acquire(channelName, spec, listener);
  }

  /**
   * Reads {@code key} through the in-memory and remote caches with the default TTL.
   *
   * @see #readThroughCache(String, ValueCodec, Supplier, Duration)
   */
  public <T> CompletableFuture<T> readThroughCache(String key, ValueCodec<T> codec,
      Supplier<? extends CompletionStage<T>> fetchFn) {
    ensureOpen();
    return readThroughCache.get(key, codec, fetchFn);
  }

  /**
   * Reads {@code key}: concurrent reads share one lookup, a fresh in-memory value is
   * returned directly, then the remote cache is consulted, then {@code fetchFn}. A
   * fetched value is written back to the remote cache.
   *
   * @param key     cache key
   * @param codec   converts the value for the remote cache
   * @param fetchFn loads the value from the source of truth
   * @param ttl     how long the value stays cached
   * @param <T>     value type
   * @return future completing with the value; fails only if {@code fetchFn} fails
   */
  public <T> CompletableFuture<T> readThroughCache(String key, ValueCodec<T> codec,
      Supplier<? extends CompletionStage<T>> fetchFn, Duration ttl) {
    ensureOpen();
    return readThroughCache.get(key, codec, fetchFn, ttl);
  }

  /**
   * Drops {@code key} from the in-memory and remote caches.
   */
  public CompletableFuture<Void> invalidate(String key) {
    ensureOpen();
    return readThroughCache.invalidate(key);
  }

  /**
   * Pings the remote cache.
   *
   * @return {@code true} if healthy; {@code false} if degraded or not configured
   */
  public CompletableFuture<Boolean> checkHealth() {
    if (cacheClient == null) {
      return CompletableFuture.completedFuture(false);
    }
    return cacheClient.checkHealth();
  }

  public AggregatorStats stats() {
    return new AggregatorStats(connectionPool.metrics(), connectionPool.deferredCount(),
        circuitBreaker.snapshot(), deduplicator.stats());
  }

  /** Forces the circuit breaker closed. */
  public void resetCircuitBreaker() {
    circuitBreaker.reset();
  }

  public ConnectionPool connectionPool() {
    return connectionPool;
  }

  public BatchingEngine batchingEngine() {
    return batchingEngine;
  }

  public CircuitBreaker circuitBreaker() {
    return circuitBreaker;
  }

  public RetryExecutor retryExecutor() {
    return retryExecutor;
  }

  public RequestDeduplicator deduplicator() {
    return deduplicator;
  }

  /**
   * Returns the resilient remote cache client, or {@code null} if no remote cache was configured.
   */
  public ResilientCacheClient cacheClient() {
    return cacheClient;
  }

  /**
   * Tears down every subscription, stops sweeps and, if the aggregator created it,
   * the event loop. A {@link MetricsExporter} that is {@link AutoCloseable} is closed too.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    RuntimeException first = null;
    try {
      connectionPool.close();
    } catch (RuntimeException e) {
      first = e;
    }
    try {
      batchingEngine.clearAll();
    } catch (RuntimeException e) {
      if (first == null) first = e; else first.addSuppressed(e);
    }
    try {
      deduplicator.close();
    } catch (RuntimeException e) {
      if (first == null) first = e; else first.addSuppressed(e);
    }
    if (ownsTimer) {
      try {
        timer.close();
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    logger.fine("ChangeAggregator closed");
    if (first != null) {
      throw first;
    }
  }

  private void ensureOpen() {
    if (closed.get()) {
      throw new IllegalStateException("ChangeAggregator has been closed");
    }
  }

  /** Builder for {@link ChangeAggregator}. */
  public static final class Builder {
    private ChangeFeed feed;
    private RemoteCacheClient remoteCache;
    private TimerService timer;
    private MetricsExporter metrics;
    private ErrorHandler errorHandler;
    private AggregatorConfig config;

    private Builder() {}

    /**
     * Sets the backend change feed.
     *
     * <p><b>Required.</b>
     *
     * @param feed the change feed
     * @return this builder
     */
    public Builder feed(ChangeFeed feed) {
      this.feed = feed;
      return this;
    }

    /**
     * Sets the remote cache client.
     *
     * <p>Optional. Without it {@link ChangeAggregator#readThroughCache} caches in memory only.
     *
     * @param remoteCache the remote cache client
     * @return this builder
     */
    public Builder remoteCache(RemoteCacheClient remoteCache) {
      this.remoteCache = remoteCache;
      return this;
    }

    /**
     * Sets the event loop and clock.
     *
     * <p>Optional. Defaults to a {@link ScheduledTimerService} owned and closed by the aggregator.
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
     * Sets the hook for subscription, listener and validation failures.
     *
     * <p>Optional. Defaults to {@link ErrorHandler#NOOP}; failures are logged either way.
     *
     * @param errorHandler the error handler
     * @return this builder
     */
    public Builder errorHandler(ErrorHandler errorHandler) {
      this.errorHandler = errorHandler;
      return this;
    }

    /**
     * Sets tuning parameters.
     *
     * <p>Optional. Defaults to {@code new AggregatorConfig()}.
     *
     * @param config the configuration
     * @return this builder
     */
    public Builder config(AggregatorConfig config) {
      this.config = config;
      return this;
    }

    /**
     * Builds and starts the aggregator.
     *
     * @return a running {@link ChangeAggregator}
     * @throws NullPointerException if {@code feed} is null
     * @throws IllegalArgumentException if a configuration value is out of range
     */
    public ChangeAggregator build() {
      return new ChangeAggregator(this);
    }
  }
}
