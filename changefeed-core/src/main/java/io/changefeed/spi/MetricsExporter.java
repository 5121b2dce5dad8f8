package io.changefeed.spi;

import io.changefeed.model.PriorityTier;
import io.changefeed.resilience.CircuitState;

/**
 * Observability hook for exporting changefeed counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of raw changes accepted from the feed.
     */
    void incrementEventsReceived();

    /**
     * Increments the count of raw changes dropped because they failed validation.
     */
    void incrementEventsRejected();

    /**
     * Records one flushed delivery.
     *
     * @param tier          priority tier of the flushed channel
     * @param batchSize     number of events delivered
     * @param sizeTriggered {@code true} if the flush was caused by reaching the max batch size
     */
    void recordFlush(PriorityTier tier, int batchSize, boolean sizeTriggered);

    /**
     * Increments the count of listener invocations that threw.
     */
    default void incrementListenerFailures() {
    }

    /**
     * Increments the count of new backend subscriptions opened.
     */
    void incrementConnectionsOpened();

    /**
     * Increments the count of subscriptions served by an existing pooled connection.
     */
    void incrementConnectionsReused();

    /**
     * Increments the count of pooled connections torn down.
     */
    void incrementConnectionsClosed();

    /**
     * Increments the count of subscriptions deferred because a connection ceiling was reached.
     */
    void incrementSubscriptionsDeferred();

    /**
     * Increments the count of subscription-level errors reported by the feed.
     */
    default void incrementConnectionErrors() {
    }

    /**
     * Records the number of live pooled connections.
     *
     * @param liveConnections current pool size
     */
    void recordPoolSize(int liveConnections);

    /**
     * Records a circuit breaker state change.
     *
     * @param state the new state
     */
    default void recordCircuitState(CircuitState state) {
    }

    /**
     * Increments the count of remote operation attempts, including retries.
     */
    default void incrementOperationAttempts() {
    }

    /**
     * Increments the count of remote operations that eventually succeeded.
     */
    void incrementOperationSuccess();

    /**
     * Increments the count of remote operations that exhausted their attempts.
     */
    void incrementOperationFailure();

    /**
     * Increments the count of attempts that lost the timeout race.
     */
    default void incrementOperationTimeouts() {
    }

    /**
     * Increments the count of operations rejected without an attempt because the circuit was open.
     */
    default void incrementCircuitRejected() {
    }

    /**
     * Increments the count of callers that joined an in-flight request.
     */
    default void incrementDedupeJoined() {
    }

    /**
     * Increments the count of requests served from the short-TTL cache.
     */
    default void incrementCacheHit() {
    }

    /**
     * Increments the count of requests that missed the short-TTL cache.
     */
    default void incrementCacheMiss() {
    }

    /**
     * Records the number of in-flight deduplicated requests.
     *
     * @param pending number of pending requests
     */
    default void recordPendingRequests(int pending) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementEventsReceived() {
        }

        @Override
        public void incrementEventsRejected() {
        }

        @Override
        public void recordFlush(PriorityTier tier, int batchSize, boolean sizeTriggered) {
        }

        @Override
        public void incrementConnectionsOpened() {
        }

        @Override
        public void incrementConnectionsReused() {
        }

        @Override
        public void incrementConnectionsClosed() {
        }

        @Override
        public void incrementSubscriptionsDeferred() {
        }

        @Override
        public void recordPoolSize(int liveConnections) {
        }

        @Override
        public void incrementOperationSuccess() {
        }

        @Override
        public void incrementOperationFailure() {
        }
    }
}
