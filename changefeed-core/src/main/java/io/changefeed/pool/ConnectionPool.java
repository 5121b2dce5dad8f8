package io.changefeed.pool;

import io.changefeed.ChangeListener;
import io.changefeed.Subscription;
import io.changefeed.batch.BatchingEngine;
import io.changefeed.model.ChangeEvent;
import io.changefeed.model.EventKind;
import io.changefeed.model.MalformedChangeException;
import io.changefeed.model.PriorityTier;
import io.changefeed.model.SubscriptionSpec;
import io.changefeed.model.TierSettings;
import io.changefeed.spi.Cancellable;
import io.changefeed.spi.ChangeFeed;
import io.changefeed.spi.ErrorHandler;
import io.changefeed.spi.FeedListener;
import io.changefeed.spi.FeedSubscription;
import io.changefeed.spi.MetricsExporter;
import io.changefeed.spi.RawChange;
import io.changefeed.spi.TimerService;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Bounded pool of live {@link ChangeFeed} subscriptions, multiplexed by
 * {@code (table, filter)}.
 *
 * <h2>Acquire</h2>
 * <ul>
 *   <li>If the global ceiling is reached the request is deferred: a warning is logged and
 *       {@link Subscription#NOOP} returned.</li>
 *   <li>Otherwise, if a live connection has the same {@linkplain SubscriptionSpec#poolKey() pool key},
 *       the new channel is attached to it and the returned handle only detaches that
 *       channel. The connection closes when its last channel detaches.</li>
 *   <li>Otherwise, if the tier's connection limit is reached, the request is deferred
 *       the same way.</li>
 *   <li>Otherwise a new backend subscription is opened. Its handle tears down the whole
 *       connection, including every attached channel.</li>
 * </ul>
 *
 * <h2>Delivery</h2>
 * <p>Feed callbacks are handed to the {@link TimerService} loop, validated into
 * {@link ChangeEvent}s and passed to the {@link BatchingEngine} for each attached channel
 * whose event kind matches. Malformed changes are dropped and reported.
 *
 * <h2>Eviction</h2>
 * <p>A connection is torn down when idle longer than {@code idleTimeout} (checked every
 * {@code sweepInterval} after {@link #start()}) or when it has reported
 * {@code maxConnectionErrors} errors. Torn down connections are never reopened.
 *
 * @see ConnectionPool.Builder
 */
public final class ConnectionPool implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(ConnectionPool.class.getName());

  private final ChangeFeed feed;
  private final TimerService timer;
  private final BatchingEngine batchingEngine;
  private final MetricsExporter metrics;
  private final ErrorHandler errorHandler;
  private final Map<PriorityTier, TierSettings> tierSettings;
  private final int maxConnections;
  private final long idleTimeoutMs;
  private final long sweepIntervalMs;
  private final int maxConnectionErrors;

  private final Map<String, PooledConnection> connections = new LinkedHashMap<>();
  private long deferredCount;
  private Cancellable sweepTask;
  private boolean closed;

  private ConnectionPool(Builder builder) {
    this.feed = Objects.requireNonNull(builder.feed, "feed");
    this.timer = Objects.requireNonNull(builder.timer, "timer");
    this.batchingEngine = Objects.requireNonNull(builder.batchingEngine, "batchingEngine");
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.errorHandler = builder.errorHandler != null ? builder.errorHandler : ErrorHandler.NOOP;
    if (builder.maxConnections < 1) {
      throw new IllegalArgumentException("maxConnections must be >= 1");
    }
    if (builder.idleTimeoutMs <= 0) {
      throw new IllegalArgumentException("idleTimeoutMs must be > 0");
    }
    if (builder.sweepIntervalMs <= 0) {
      throw new IllegalArgumentException("sweepIntervalMs must be > 0");
    }
    if (builder.maxConnectionErrors < 1) {
      throw new IllegalArgumentException("maxConnectionErrors must be >= 1");
    }
    this.maxConnections = builder.maxConnections;
    this.idleTimeoutMs = builder.idleTimeoutMs;
    this.sweepIntervalMs = builder.sweepIntervalMs;
    this.maxConnectionErrors = builder.maxConnectionErrors;
    this.tierSettings = new EnumMap<>(PriorityTier.class);
    for (PriorityTier tier : PriorityTier.values()) {
      TierSettings override = builder.tierSettings.get(tier);
      tierSettings.put(tier, override != null ? override : tier.defaults());
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Starts the idle sweep. Subsequent calls are no-ops. */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("ConnectionPool has been closed");
    }
    if (sweepTask != null) {
      return;
    }
    sweepTask = timer.scheduleWithFixedDelay(this::sweepIdle, sweepIntervalMs, sweepIntervalMs);
  }

  /**
   * Subscribes {@code channelName} to changes matching {@code spec}. Never throws on
   * pool exhaustion or feed failure; both yield {@link Subscription#NOOP}.
   *
   * <p>If {@code channelName} is already live it is released first.
   *
   * @param channelName unique channel name
   * @param spec        what to listen to
   * @param listener    receives batched deliveries
   * @return cleanup handle
   */
  public Subscription acquire(String channelName, SubscriptionSpec spec, ChangeListener listener) {
    Objects.requireNonNull(channelName, "channelName");
    Objects.requireNonNull(spec, "spec");
    Objects.requireNonNull(listener, "listener");
    release(channelName);

    FeedSubscription opened;
    PooledConnection connection;
    synchronized (this) {
      if (closed) {
        throw new IllegalStateException("ConnectionPool has been closed");
      }
      if (connections.size() >= maxConnections) {
        return defer(channelName, "global limit of " + maxConnections + " connections reached");
      }
      TierSettings settings = tierSettings.get(spec.priority());
      PooledConnection existing = findByPoolKey(spec.poolKey());
      if (existing != null) {
        PooledConnection.Observer observer = new PooledConnection.Observer(channelName, spec.eventKind());
        existing.observers.add(observer);
        existing.refCount++;
        existing.lastActivity = timer.currentTimeMillis();
        batchingEngine.register(channelName, spec.priority(), settings, listener);
        metrics.incrementConnectionsReused();
        logger.log(Level.FINE, "Channel {0} reuses connection {1} ({2} subscribers)",
            new Object[]{channelName, existing.channelName, existing.refCount});
        return once(() -> detach(existing, observer));
      }

      if (countAtTier(spec.priority()) >= settings.maxConnections()) {
        return defer(channelName, spec.priority() + " limit of " + settings.maxConnections()
            + " connections reached");
      }

      connection = new PooledConnection(channelName, spec, timer.currentTimeMillis());
      connection.observers.add(new PooledConnection.Observer(channelName, spec.eventKind()));
      connection.refCount = 1;
      connections.put(channelName, connection);
      batchingEngine.register(channelName, spec.priority(), settings, listener);
    }

    SubscriptionSpec feedSpec = new SubscriptionSpec(spec.table(), spec.filter(), EventKind.ANY, spec.priority());
    try {
      opened = feed.subscribe(channelName, feedSpec, new ConnectionListener(connection));
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Failed to open subscription for channel " + channelName, e);
      List<String> attached;
      synchronized (this) {
        connections.remove(channelName, connection);
        attached = markClosed(connection);
      }
      clearChannels(attached);
      metrics.incrementConnectionErrors();
      errorHandler.onSubscriptionError(channelName, e);
      return Subscription.NOOP;
    }

    boolean closedMeanwhile;
    synchronized (this) {
      connection.subscription = opened;
      closedMeanwhile = connection.closed;
      if (!closedMeanwhile) {
        metrics.incrementConnectionsOpened();
        metrics.recordPoolSize(connections.size());
      }
    }
    if (closedMeanwhile) {
      closeQuietly(connection.channelName, opened);
      return Subscription.NOOP;
    }
    logger.log(Level.FINE, "Opened connection {0} for {1}", new Object[]{channelName, spec.poolKey()});
    PooledConnection owned = connection;
    return once(() -> teardown(owned, "unsubscribed"));
  }

  /**
   * Releases a live channel: tears down the connection it owns, or detaches it from
   * the connection it shares.
   *
   * @param channelName channel name
   * @return {@code true} if the channel was live
   */
  public boolean release(String channelName) {
    PooledConnection owned;
    PooledConnection shared = null;
    PooledConnection.Observer observer = null;
    synchronized (this) {
      owned = connections.get(channelName);
      if (owned == null) {
        for (PooledConnection connection : connections.values()) {
          observer = connection.find(channelName);
          if (observer != null) {
            shared = connection;
            break;
          }
        }
      }
    }
    if (owned != null) {
      teardown(owned, "replaced");
      return true;
    }
    if (shared != null) {
      detach(shared, observer);
      return true;
    }
    return false;
  }

  /**
   * Tears down every connection idle longer than the idle timeout.
   *
   * <p>Runs periodically after {@link #start()}; may be invoked directly.
   *
   * @return number of connections removed
   */
  public int sweepIdle() {
    List<PooledConnection> idle = new ArrayList<>();
    synchronized (this) {
      long now = timer.currentTimeMillis();
      for (PooledConnection connection : connections.values()) {
        if (now - connection.lastActivity > idleTimeoutMs) {
          idle.add(connection);
        }
      }
    }
    for (PooledConnection connection : idle) {
      teardown(connection, "idle");
    }
    if (!idle.isEmpty()) {
      logger.log(Level.INFO, "Closed {0} idle connections", idle.size());
    }
    return idle.size();
  }

  public synchronized List<ConnectionMetrics> metrics() {
    List<ConnectionMetrics> snapshot = new ArrayList<>(connections.size());
    for (PooledConnection connection : connections.values()) {
      snapshot.add(connection.snapshot());
    }
    return snapshot;
  }

  public synchronized int liveConnections() {
    return connections.size();
  }

  public synchronized long deferredCount() {
    return deferredCount;
  }

  public TierSettings tierSettings(PriorityTier tier) {
    return tierSettings.get(tier);
  }

  /** Tears down every connection. The pool stays usable. */
  public void closeAll() {
    List<PooledConnection> all;
    synchronized (this) {
      all = new ArrayList<>(connections.values());
    }
    for (PooledConnection connection : all) {
      teardown(connection, "closeAll");
    }
  }

  /** Stops the sweep and tears down every connection. */
  @Override
  public void close() {
    synchronized (this) {
      if (closed) {
        return;
      }
      closed = true;
      if (sweepTask != null) {
        sweepTask.cancel();
        sweepTask = null;
      }
    }
    closeAll();
  }

  private Subscription defer(String channelName, String reason) {
    deferredCount++;
    metrics.incrementSubscriptionsDeferred();
    logger.log(Level.WARNING, "Deferring subscription {0}: {1}", new Object[]{channelName, reason});
    return Subscription.NOOP;
  }

  private PooledConnection findByPoolKey(String poolKey) {
    for (PooledConnection connection : connections.values()) {
      if (connection.poolKey.equals(poolKey)) {
        return connection;
      }
    }
    return null;
  }

  private int countAtTier(PriorityTier tier) {
    int count = 0;
    for (PooledConnection connection : connections.values()) {
      if (connection.tier == tier) {
        count++;
      }
    }
    return count;
  }

  private void detach(PooledConnection connection, PooledConnection.Observer observer) {
    boolean last;
    synchronized (this) {
      if (connection.closed || !connection.observers.remove(observer)) {
        return;
      }
      connection.refCount--;
      last = connection.refCount <= 0;
    }
    batchingEngine.clear(observer.channelName);
    if (last) {
      teardown(connection, "last subscriber left");
    }
  }

  private void teardown(PooledConnection connection, String reason) {
    FeedSubscription subscription;
    List<String> attached;
    synchronized (this) {
      if (connection.closed) {
        return;
      }
      connections.remove(connection.channelName, connection);
      attached = markClosed(connection);
      subscription = connection.subscription;
      metrics.incrementConnectionsClosed();
      metrics.recordPoolSize(connections.size());
    }
    clearChannels(attached);
    logger.log(Level.FINE, "Closed connection {0} ({1})", new Object[]{connection.channelName, reason});
    if (subscription != null) {
      closeQuietly(connection.channelName, subscription);
    }
  }

  /** Marks the connection closed and detaches every channel; caller holds the pool lock. */
  private List<String> markClosed(PooledConnection connection) {
    connection.closed = true;
    List<String> attached = new ArrayList<>(connection.observers.size());
    for (PooledConnection.Observer observer : connection.observers) {
      attached.add(observer.channelName);
    }
    connection.observers.clear();
    connection.refCount = 0;
    return attached;
  }

  // Must not hold the pool lock: clear may wait on a running listener.
  private void clearChannels(List<String> channelNames) {
    for (String channelName : channelNames) {
      batchingEngine.clear(channelName);
    }
  }

  private void onChange(PooledConnection connection, RawChange raw) {
    ChangeEvent event;
    MalformedChangeException rejected = null;
    synchronized (this) {
      if (connection.closed) {
        return;
      }
      try {
        event = ChangeEvent.from(raw, connection.table);
      } catch (MalformedChangeException e) {
        event = null;
        rejected = e;
      }
      if (event != null) {
        connection.lastActivity = timer.currentTimeMillis();
        connection.messageCount++;
      }
    }
    if (rejected != null) {
      metrics.incrementEventsRejected();
      logger.log(Level.WARNING, "Rejected malformed change on {0}: {1}",
          new Object[]{connection.channelName, rejected.getMessage()});
      errorHandler.onRejectedChange(connection.channelName, rejected);
      return;
    }
    metrics.incrementEventsReceived();
    for (PooledConnection.Observer observer : connection.observers) {
      if (observer.eventKind.matches(event.kind())) {
        batchingEngine.onEvent(observer.channelName, event);
      }
    }
  }

  private void onError(PooledConnection connection, Throwable error) {
    boolean exhausted;
    int errors;
    synchronized (this) {
      if (connection.closed) {
        return;
      }
      errors = ++connection.errorCount;
      exhausted = errors >= maxConnectionErrors;
    }
    metrics.incrementConnectionErrors();
    logger.log(Level.WARNING, "Subscription error on " + connection.channelName + " (" + errors + ")", error);
    errorHandler.onSubscriptionError(connection.channelName, error);
    if (exhausted) {
      logger.log(Level.WARNING, "Closing connection {0} after {1} errors",
          new Object[]{connection.channelName, errors});
      teardown(connection, "too many errors");
    }
  }

  private static void closeQuietly(String channelName, FeedSubscription subscription) {
    try {
      subscription.close();
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Failed to close subscription " + channelName, e);
    }
  }

  private static Subscription once(Runnable cleanup) {
    return new Subscription() {
      private boolean done;

      @Override
      public void close() {
        synchronized (this) {
          if (done) {
            return;
          }
          done = true;
        }
        cleanup.run();
      }
    };
  }

  private final class ConnectionListener implements FeedListener {
    private final PooledConnection connection;

    ConnectionListener(PooledConnection connection) {
      this.connection = connection;
    }

    @Override
    public void onChange(RawChange change) {
      timer.execute(() -> ConnectionPool.this.onChange(connection, change));
    }

    @Override
    public void onError(Throwable error) {
      timer.execute(() -> ConnectionPool.this.onError(connection, error));
    }
  }

  /** Builder for {@link ConnectionPool}. */
  public static final class Builder {
    private ChangeFeed feed;
    private TimerService timer;
    private BatchingEngine batchingEngine;
    private MetricsExporter metrics;
    private ErrorHandler errorHandler;
    private final Map<PriorityTier, TierSettings> tierSettings = new EnumMap<>(PriorityTier.class);
    private int maxConnections = 10;
    private long idleTimeoutMs = 300_000L;
    private long sweepIntervalMs = 30_000L;
    private int maxConnectionErrors = 5;

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
     * Sets the event loop and clock.
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
     * Sets the engine that batches deliveries per channel.
     *
     * <p><b>Required.</b>
     *
     * @param batchingEngine the batching engine
     * @return this builder
     */
    public Builder batchingEngine(BatchingEngine batchingEngine) {
      this.batchingEngine = batchingEngine;
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
     * Sets the hook notified of subscription errors and rejected changes.
     *
     * <p>Optional. Defaults to {@link ErrorHandler#NOOP}.
     *
     * @param errorHandler the error handler
     * @return this builder
     */
    public Builder errorHandler(ErrorHandler errorHandler) {
      this.errorHandler = errorHandler;
      return this;
    }

    /**
     * Overrides the settings of one priority tier.
     *
     * <p>Optional. Defaults to {@link PriorityTier#defaults()}.
     *
     * @param tier     the tier
     * @param settings its settings
     * @return this builder
     */
    public Builder tierSettings(PriorityTier tier, TierSettings settings) {
      this.tierSettings.put(Objects.requireNonNull(tier, "tier"), Objects.requireNonNull(settings, "settings"));
      return this;
    }

    /**
     * Sets the global ceiling on live connections.
     *
     * <p>Optional. Defaults to {@code 10}. Must be &ge; 1.
     *
     * @param maxConnections connection ceiling
     * @return this builder
     */
    public Builder maxConnections(int maxConnections) {
      this.maxConnections = maxConnections;
      return this;
    }

    /**
     * Sets how long a connection may go without activity before the sweep closes it.
     *
     * <p>Optional. Defaults to {@code 300000} (5 minutes). Must be &gt; 0.
     *
     * @param idleTimeoutMs idle timeout in milliseconds
     * @return this builder
     */
    public Builder idleTimeoutMs(long idleTimeoutMs) {
      this.idleTimeoutMs = idleTimeoutMs;
      return this;
    }

    /**
     * Sets the interval of the idle sweep.
     *
     * <p>Optional. Defaults to {@code 30000} (30 seconds). Must be &gt; 0.
     *
     * @param sweepIntervalMs sweep interval in milliseconds
     * @return this builder
     */
    public Builder sweepIntervalMs(long sweepIntervalMs) {
      this.sweepIntervalMs = sweepIntervalMs;
      return this;
    }

    /**
     * Sets the number of subscription errors after which a connection is closed.
     *
     * <p>Optional. Defaults to {@code 5}. Must be &ge; 1.
     *
     * @param maxConnectionErrors error limit
     * @return this builder
     */
    public Builder maxConnectionErrors(int maxConnectionErrors) {
      this.maxConnectionErrors = maxConnectionErrors;
      return this;
    }

    /**
     * Builds the pool. Call {@link ConnectionPool#start()} to enable the idle sweep.
     *
     * @return a new {@link ConnectionPool}
     * @throws NullPointerException if {@code feed}, {@code timer} or {@code batchingEngine} is null
     * @throws IllegalArgumentException if a limit or interval is out of range
     */
    public ConnectionPool build() {
      return new ConnectionPool(this);
    }
  }
}
