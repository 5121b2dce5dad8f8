package io.changefeed.micrometer;

import io.changefeed.model.PriorityTier;
import io.changefeed.resilience.CircuitState;
import io.changefeed.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters, gauges and summaries with a {@link MeterRegistry} for export to
 * Prometheus, Grafana, Datadog, and other monitoring backends.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code changefeed.events.received} / {@code .events.rejected}: changes accepted or dropped as malformed</li>
 *   <li>{@code changefeed.listener.failures}: listener invocations that threw</li>
 *   <li>{@code changefeed.connections.opened} / {@code .reused} / {@code .closed}</li>
 *   <li>{@code changefeed.connections.errors}: backend subscription errors</li>
 *   <li>{@code changefeed.subscriptions.deferred}: subscriptions refused by a full pool</li>
 *   <li>{@code changefeed.operations.attempts} / {@code .success} / {@code .failure} / {@code .timeouts}</li>
 *   <li>{@code changefeed.circuit.rejected}: operations skipped by an open circuit</li>
 *   <li>{@code changefeed.dedupe.joined}: requests that joined an in-flight one</li>
 *   <li>{@code changefeed.cache.hit} / {@code .miss}</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code changefeed.pool.connections}: live pooled connections</li>
 *   <li>{@code changefeed.circuit.state}: 0 closed, 1 half-open, 2 open</li>
 *   <li>{@code changefeed.dedupe.pending}: in-flight deduplicated requests</li>
 * </ul>
 *
 * <h3>Distribution Summaries</h3>
 * <ul>
 *   <li>{@code changefeed.flush.batch.size}, tagged {@code tier} and {@code trigger}
 *       ({@code size} or {@code debounce}): events per delivery</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

    private final MeterRegistry registry;
    private final List<Meter> meters = new ArrayList<>();
    private final Counter eventsReceived;
    private final Counter eventsRejected;
    private final Counter listenerFailures;
    private final Counter connectionsOpened;
    private final Counter connectionsReused;
    private final Counter connectionsClosed;
    private final Counter connectionErrors;
    private final Counter subscriptionsDeferred;
    private final Counter operationAttempts;
    private final Counter operationSuccess;
    private final Counter operationFailure;
    private final Counter operationTimeouts;
    private final Counter circuitRejected;
    private final Counter dedupeJoined;
    private final Counter cacheHit;
    private final Counter cacheMiss;
    private final Map<PriorityTier, DistributionSummary> sizeFlushes = new EnumMap<>(PriorityTier.class);
    private final Map<PriorityTier, DistributionSummary> debounceFlushes = new EnumMap<>(PriorityTier.class);

    private final AtomicInteger poolSize = new AtomicInteger();
    private final AtomicInteger circuitState = new AtomicInteger();
    private final AtomicInteger pendingRequests = new AtomicInteger();
    private volatile boolean closed;

    /**
     * Creates an exporter with the default metric name prefix {@code "changefeed"}.
     *
     * @param registry the Micrometer meter registry
     */
    public MicrometerMetricsExporter(MeterRegistry registry) {
        this(registry, "changefeed");
    }

    /**
     * Creates an exporter with a custom metric name prefix for multi-instance use.
     *
     * @param registry   the Micrometer meter registry
     * @param namePrefix prefix for all meter names (e.g. {@code "feed.changefeed"})
     */
    public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(namePrefix, "namePrefix");
        if (namePrefix.isEmpty()) {
            throw new IllegalArgumentException("namePrefix must not be empty");
        }
        if (namePrefix.endsWith(".")) {
            throw new IllegalArgumentException("namePrefix must not end with '.'");
        }

        this.registry = registry;
        this.eventsReceived = counter(namePrefix + ".events.received", "Changes accepted from the feed");
        this.eventsRejected = counter(namePrefix + ".events.rejected", "Malformed changes dropped");
        this.listenerFailures = counter(namePrefix + ".listener.failures", "Listener invocations that threw");
        this.connectionsOpened = counter(namePrefix + ".connections.opened", "Backend subscriptions opened");
        this.connectionsReused = counter(namePrefix + ".connections.reused", "Subscriptions attached to a live connection");
        this.connectionsClosed = counter(namePrefix + ".connections.closed", "Backend subscriptions closed");
        this.connectionErrors = counter(namePrefix + ".connections.errors", "Backend subscription errors");
        this.subscriptionsDeferred = counter(namePrefix + ".subscriptions.deferred", "Subscriptions refused by a full pool");
        this.operationAttempts = counter(namePrefix + ".operations.attempts", "Remote operation attempts");
        this.operationSuccess = counter(namePrefix + ".operations.success", "Remote operations that succeeded");
        this.operationFailure = counter(namePrefix + ".operations.failure", "Remote operations that exhausted retries");
        this.operationTimeouts = counter(namePrefix + ".operations.timeouts", "Remote operation attempts that timed out");
        this.circuitRejected = counter(namePrefix + ".circuit.rejected", "Remote operations skipped by an open circuit");
        this.dedupeJoined = counter(namePrefix + ".dedupe.joined", "Requests that joined an in-flight request");
        this.cacheHit = counter(namePrefix + ".cache.hit", "Requests served from memory");
        this.cacheMiss = counter(namePrefix + ".cache.miss", "Requests that started a new lookup");

        meters.add(Gauge.builder(namePrefix + ".pool.connections", poolSize, AtomicInteger::get)
                .description("Live pooled connections")
                .register(registry));
        meters.add(Gauge.builder(namePrefix + ".circuit.state", circuitState, AtomicInteger::get)
                .description("Circuit breaker state: 0 closed, 1 half-open, 2 open")
                .register(registry));
        meters.add(Gauge.builder(namePrefix + ".dedupe.pending", pendingRequests, AtomicInteger::get)
                .description("In-flight deduplicated requests")
                .register(registry));

        for (PriorityTier tier : PriorityTier.values()) {
            sizeFlushes.put(tier, flushSummary(namePrefix, tier, "size"));
            debounceFlushes.put(tier, flushSummary(namePrefix, tier, "debounce"));
        }
    }

    private Counter counter(String name, String description) {
        Counter counter = Counter.builder(name).description(description).register(registry);
        meters.add(counter);
        return counter;
    }

    private DistributionSummary flushSummary(String namePrefix, PriorityTier tier, String trigger) {
        DistributionSummary summary = DistributionSummary.builder(namePrefix + ".flush.batch.size")
                .description("Events per delivery")
                .tag("tier", tier.name().toLowerCase(Locale.ROOT))
                .tag("trigger", trigger)
                .register(registry);
        meters.add(summary);
        return summary;
    }

    @Override
    public void incrementEventsReceived() {
        if (closed) return;
        eventsReceived.increment();
    }

    @Override
    public void incrementEventsRejected() {
        if (closed) return;
        eventsRejected.increment();
    }

    @Override
    public void recordFlush(PriorityTier tier, int batchSize, boolean sizeTriggered) {
        if (closed) return;
        (sizeTriggered ? sizeFlushes : debounceFlushes).get(tier).record(batchSize);
    }

    @Override
    public void incrementListenerFailures() {
        if (closed) return;
        listenerFailures.increment();
    }

    @Override
    public void incrementConnectionsOpened() {
        if (closed) return;
        connectionsOpened.increment();
    }

    @Override
    public void incrementConnectionsReused() {
        if (closed) return;
        connectionsReused.increment();
    }

    @Override
    public void incrementConnectionsClosed() {
        if (closed) return;
        connectionsClosed.increment();
    }

    @Override
    public void incrementSubscriptionsDeferred() {
        if (closed) return;
        subscriptionsDeferred.increment();
    }

    @Override
    public void incrementConnectionErrors() {
        if (closed) return;
        connectionErrors.increment();
    }

    @Override
    public void recordPoolSize(int liveConnections) {
        if (closed) return;
        poolSize.set(liveConnections);
    }

    @Override
    public void recordCircuitState(CircuitState state) {
        if (closed) return;
        circuitState.set(state == CircuitState.OPEN ? 2 : state == CircuitState.HALF_OPEN ? 1 : 0);
    }

    @Override
    public void incrementOperationAttempts() {
        if (closed) return;
        operationAttempts.increment();
    }

    @Override
    public void incrementOperationSuccess() {
        if (closed) return;
        operationSuccess.increment();
    }

    @Override
    public void incrementOperationFailure() {
        if (closed) return;
        operationFailure.increment();
    }

    @Override
    public void incrementOperationTimeouts() {
        if (closed) return;
        operationTimeouts.increment();
    }

    @Override
    public void incrementCircuitRejected() {
        if (closed) return;
        circuitRejected.increment();
    }

    @Override
    public void incrementDedupeJoined() {
        if (closed) return;
        dedupeJoined.increment();
    }

    @Override
    public void incrementCacheHit() {
        if (closed) return;
        cacheHit.increment();
    }

    @Override
    public void incrementCacheMiss() {
        if (closed) return;
        cacheMiss.increment();
    }

    @Override
    public void recordPendingRequests(int pending) {
        if (closed) return;
        pendingRequests.set(pending);
    }

    /**
     * Removes all meters registered by this exporter from the registry.
     *
     * <p>{@link io.changefeed.ChangeAggregator#close()} calls this, so gauges do not
     * outlive the aggregator.
     */
    @Override
    public void close() {
        closed = true;
        RuntimeException first = null;
        for (Meter meter : meters) {
            try {
                registry.remove(meter);
            } catch (RuntimeException e) {
                if (first == null) first = e;
                else first.addSuppressed(e);
            }
        }
        if (first != null) throw first;
    }
}
