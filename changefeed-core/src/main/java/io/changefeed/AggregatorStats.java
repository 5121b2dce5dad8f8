package io.changefeed;

import io.changefeed.dedupe.DedupeStats;
import io.changefeed.pool.ConnectionMetrics;
import io.changefeed.resilience.CircuitBreakerSnapshot;

import java.util.List;

/**
 * Snapshot returned by {@link ChangeAggregator#stats()}.
 *
 * @param connections           one entry per live pooled connection
 * @param deferredSubscriptions subscriptions deferred since start because the pool was full
 * @param circuitBreaker        remote cache breaker state
 * @param requests              deduplicator state
 */
public record AggregatorStats(List<ConnectionMetrics> connections, long deferredSubscriptions,
               CircuitBreakerSnapshot circuitBreaker, DedupeStats requests) {

  public int liveConnections() {
    return connections.size();
  }
}
