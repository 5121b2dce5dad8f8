package io.changefeed.model;

/**
 * Batching and connection limits for one {@link PriorityTier}.
 *
 * @param debounceMs     quiet period after the last event before a flush, in milliseconds
 * @param maxBatchSize   queue length that triggers an immediate flush
 * @param maxConnections maximum live pooled connections opened at this tier
 */
public record TierSettings(long debounceMs, int maxBatchSize, int maxConnections) {

    public TierSettings {
        if (debounceMs < 0) {
            throw new IllegalArgumentException("debounceMs must be >= 0, got: " + debounceMs);
        }
        if (maxBatchSize < 1) {
            throw new IllegalArgumentException("maxBatchSize must be >= 1, got: " + maxBatchSize);
        }
        if (maxConnections < 1) {
            throw new IllegalArgumentException("maxConnections must be >= 1, got: " + maxConnections);
        }
    }
}
