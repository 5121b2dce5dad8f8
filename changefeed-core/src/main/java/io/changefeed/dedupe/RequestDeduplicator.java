package io.changefeed.dedupe;

import io.changefeed.resilience.OperationTimeoutException;
import io.changefeed.spi.Cancellable;
import io.changefeed.spi.MetricsExporter;
import io.changefeed.spi.TimerService;

import java.time.Duration;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Collapses concurrent identical requests into one in-flight call and remembers
 * successful results for a short time.
 *
 * <p>For a given key the factory runs at most once at a time: callers arriving while a
 * request is pending join it. Non-null results are cached for the call's TTL. A request
 * still pending after {@code pendingTimeout} is evicted and its waiters fail with
 * {@link OperationTimeoutException}, so the next caller starts a fresh request.
 *
 * <p>Expired entries are dropped when read and by a periodic sweep started with
 * {@link #start()}. Thread-safe; the factory is always invoked outside internal locks.
 *
 * @see RequestDeduplicator.Builder
 * @see CacheKeys
 */
public final class RequestDeduplicator implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(RequestDeduplicator.class.getName());

  private final TimerService timer;
  private final MetricsExporter metrics;
  private final long pendingTimeoutMs;
  private final long defaultTtlMs;
  private final long sweepIntervalMs;

  private final Object lock = new Object();
  private final Map<String, PendingRequest> pending = new HashMap<>();
  private final Map<String, CacheEntry> cache = new HashMap<>();

  private Cancellable sweepTask;
  private boolean closed;

  private RequestDeduplicator(Builder builder) {
    this.timer = Objects.requireNonNull(builder.timer, "timer");
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    if (builder.pendingTimeout.isNegative() || builder.pendingTimeout.isZero()) {
      throw new IllegalArgumentException("pendingTimeout must be > 0");
    }
    if (builder.defaultTtl.isNegative() || builder.defaultTtl.isZero()) {
      throw new IllegalArgumentException("defaultTtl must be > 0");
    }
    if (builder.sweepInterval.isNegative() || builder.sweepInterval.isZero()) {
      throw new IllegalArgumentException("sweepInterval must be > 0");
    }
    this.pendingTimeoutMs = builder.pendingTimeout.toMillis();
    this.defaultTtlMs = builder.defaultTtl.toMillis();
    this.sweepIntervalMs = builder.sweepInterval.toMillis();
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Starts the periodic sweep. Subsequent calls are no-ops. */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("RequestDeduplicator has been closed");
    }
    if (sweepTask != null) {
      return;
    }
    sweepTask = timer.scheduleWithFixedDelay(this::sweep, sweepIntervalMs, sweepIntervalMs);
  }

  public <T> CompletableFuture<T> dedupe(String key, Supplier<? extends CompletionStage<T>> factory) {
    return dedupe(key, factory, DedupeOptions.defaults());
  }

  /**
   * Returns a cached value, joins an in-flight request, or starts a new one.
   *
   * @param key     request key, usually from {@link CacheKeys}
   * @param factory starts the underlying request; invoked at most once per call
   * @param options TTL and cache bypass flags
   * @param <T>     result type
   * @return future completing with the shared result
   */
  @SuppressWarnings("unchecked")
  public <T> CompletableFuture<T> dedupe(String key, Supplier<? extends CompletionStage<T>> factory,
      DedupeOptions options) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(factory, "factory");
    Objects.requireNonNull(options, "options");
    long ttlMs = options.ttl() != null ? options.ttl().toMillis() : defaultTtlMs;

    PendingRequest request;
    synchronized (lock) {
      long now = timer.currentTimeMillis();
      if (!options.skipCache()) {
        CacheEntry entry = cache.get(key);
        if (entry != null && !entry.isFresh(now)) {
          cache.remove(key);
          entry = null;
        }
        if (entry != null && !options.forceRefresh()) {
          metrics.incrementCacheHit();
          return CompletableFuture.completedFuture((T) entry.value());
        }
      }
      PendingRequest existing = pending.get(key);
      if (existing != null) {
        metrics.incrementDedupeJoined();
        return (CompletableFuture<T>) existing.future.copy();
      }
      metrics.incrementCacheMiss();
      request = new PendingRequest(key, now);
      PendingRequest scheduled = request;
      request.timeout = timer.schedule(() -> expire(scheduled), pendingTimeoutMs);
      pending.put(key, request);
      metrics.recordPendingRequests(pending.size());
    }

    PendingRequest started = request;

    CompletionStage<T> stage;
    try {
      stage = Objects.requireNonNull(factory.get(), "factory returned a null stage");
    } catch (Throwable t) {
      stage = CompletableFuture.failedFuture(t);
    }
    stage.whenComplete((value, error) -> settle(started, value, error, ttlMs, options.skipCache()));
    return (CompletableFuture<T>) started.future.copy();
  }

  /**
   * Drops the cached value for {@code key}. An in-flight request is left running.
   *
   * @param key request key
   * @return {@code true} if an entry was removed
   */
  public boolean invalidate(String key) {
    synchronized (lock) {
      return cache.remove(key) != null;
    }
  }

  /**
   * Forgets every in-flight request and cached value whose key starts with {@code prefix}.
   * Callers already waiting still receive the original result, and the forgotten request
   * is no longer evicted after the pending timeout; new callers start fresh.
   *
   * @param prefix key prefix, see {@link CacheKeys#prefix(String, String)}
   * @return number of pending requests and entries removed
   */
  public int invalidatePrefix(String prefix) {
    Objects.requireNonNull(prefix, "prefix");
    int removed = 0;
    synchronized (lock) {
      Iterator<PendingRequest> pendingIt = pending.values().iterator();
      while (pendingIt.hasNext()) {
        PendingRequest request = pendingIt.next();
        if (request.key.startsWith(prefix)) {
          pendingIt.remove();
          request.cancelTimeout();
          removed++;
        }
      }
      removed += removeMatching(cache, prefix);
      metrics.recordPendingRequests(pending.size());
    }
    if (removed > 0) {
      logger.log(Level.FINE, "Invalidated {0} requests with prefix {1}", new Object[]{removed, prefix});
    }
    return removed;
  }

  /** Forgets all pending requests and cached values. */
  public void clear() {
    synchronized (lock) {
      for (PendingRequest request : pending.values()) {
        request.cancelTimeout();
      }
      pending.clear();
      cache.clear();
      metrics.recordPendingRequests(0);
    }
  }

  public DedupeStats stats() {
    synchronized (lock) {
      long now = timer.currentTimeMillis();
      long oldest = 0L;
      for (PendingRequest request : pending.values()) {
        oldest = Math.max(oldest, now - request.createdAt);
      }
      return new DedupeStats(pending.size(), cache.size(), oldest);
    }
  }

  public int pendingCount() {
    synchronized (lock) {
      return pending.size();
    }
  }

  /**
   * Removes expired cache entries and pending requests older than the pending timeout.
   *
   * <p>Runs periodically after {@link #start()}; may be invoked directly.
   *
   * @return number of items removed
   */
  public int sweep() {
    int removed = 0;
    synchronized (lock) {
      long now = timer.currentTimeMillis();
      Iterator<CacheEntry> entries = cache.values().iterator();
      while (entries.hasNext()) {
        if (!entries.next().isFresh(now)) {
          entries.remove();
          removed++;
        }
      }
      Iterator<PendingRequest> requests = pending.values().iterator();
      while (requests.hasNext()) {
        if (now - requests.next().createdAt >= pendingTimeoutMs) {
          requests.remove();
          removed++;
        }
      }
      metrics.recordPendingRequests(pending.size());
    }
    if (removed > 0) {
      logger.log(Level.FINE, "Swept {0} expired requests", removed);
    }
    return removed;
  }

  /** Stops the sweep and forgets all state. */
  @Override
  public synchronized void close() {
    closed = true;
    if (sweepTask != null) {
      sweepTask.cancel();
      sweepTask = null;
    }
    clear();
  }

  private void settle(PendingRequest request, Object value, Throwable error, long ttlMs, boolean skipCache) {
    synchronized (lock) {
      if (pending.get(request.key) == request) {
        pending.remove(request.key);
        metrics.recordPendingRequests(pending.size());
        if (error == null && value != null && !skipCache) {
          cache.put(request.key, new CacheEntry(request.key, value, timer.currentTimeMillis(), ttlMs));
        }
      }
    }
    request.cancelTimeout();
    if (error == null) {
      request.future.complete(value);
    } else {
      request.future.completeExceptionally(error);
    }
  }

  private void expire(PendingRequest request) {
    synchronized (lock) {
      if (pending.get(request.key) == request) {
        pending.remove(request.key);
        metrics.recordPendingRequests(pending.size());
      }
    }
    if (request.future.completeExceptionally(new OperationTimeoutException(
        "Request " + request.key + " still pending after " + pendingTimeoutMs + "ms"))) {
      logger.log(Level.WARNING, "Evicted stuck request {0}", request.key);
    }
  }

  private static int removeMatching(Map<String, ?> map, String prefix) {
    int removed = 0;
    Iterator<String> keys = map.keySet().iterator();
    while (keys.hasNext()) {
      if (keys.next().startsWith(prefix)) {
        keys.remove();
        removed++;
      }
    }
    return removed;
  }

  private static final class PendingRequest {
    final String key;
    final long createdAt;
    final CompletableFuture<Object> future = new CompletableFuture<>();
    volatile Cancellable timeout;

    PendingRequest(String key, long createdAt) {
      this.key = key;
      this.createdAt = createdAt;
    }

    void cancelTimeout() {
      Cancellable scheduled = timeout;
      if (scheduled != null) {
        scheduled.cancel();
      }
    }
  }

  /** Builder for {@link RequestDeduplicator}. */
  public static final class Builder {
    private TimerService timer;
    private MetricsExporter metrics;
    private Duration pendingTimeout = Duration.ofSeconds(30);
    private Duration defaultTtl = Duration.ofSeconds(5);
    private Duration sweepInterval = Duration.ofSeconds(60);

    private Builder() {}

    /**
     * Sets the clock and scheduler.
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
     * Sets how long a request may stay pending before it is evicted.
     *
     * <p>Optional. Defaults to {@code 30s}. Must be &gt; 0.
     *
     * @param pendingTimeout pending timeout
     * @return this builder
     */
    public Builder pendingTimeout(Duration pendingTimeout) {
      this.pendingTimeout = Objects.requireNonNull(pendingTimeout, "pendingTimeout");
      return this;
    }

    /**
     * Sets the TTL used when a call does not specify one.
     *
     * <p>Optional. Defaults to {@code 5s}. Must be &gt; 0.
     *
     * @param defaultTtl default TTL
     * @return this builder
     */
    public Builder defaultTtl(Duration defaultTtl) {
      this.defaultTtl = Objects.requireNonNull(defaultTtl, "defaultTtl");
      return this;
    }

    /**
     * Sets the interval of the expiry sweep.
     *
     * <p>Optional. Defaults to {@code 60s}. Must be &gt; 0.
     *
     * @param sweepInterval sweep interval
     * @return this builder
     */
    public Builder sweepInterval(Duration sweepInterval) {
      this.sweepInterval = Objects.requireNonNull(sweepInterval, "sweepInterval");
      return this;
    }

    /**
     * Builds the deduplicator. Call {@link RequestDeduplicator#start()} to enable the sweep.
     *
     * @return a new {@link RequestDeduplicator}
     */
    public RequestDeduplicator build() {
      return new RequestDeduplicator(this);
    }
  }
}
