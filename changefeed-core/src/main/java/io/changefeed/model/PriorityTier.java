package io.changefeed.model;

/**
 * Urgency class of a subscription. Each tier carries default batching and
 * connection limits; see {@link #defaults()}.
 */
public enum PriorityTier {
    /** Near-immediate delivery: 50 ms debounce, batches of 3, 1 connection. */
    CRITICAL(new TierSettings(50, 3, 1)),
    /** 200 ms debounce, batches of 5, 2 connections. */
    HIGH(new TierSettings(200, 5, 2)),
    /** 1 s debounce, batches of 10, 3 connections. */
    MEDIUM(new TierSettings(1000, 10, 3)),
    /** 5 s debounce, batches of 20, 5 connections. */
    LOW(new TierSettings(5000, 20, 5));

    private final TierSettings defaults;

    PriorityTier(TierSettings defaults) {
        this.defaults = defaults;
    }

    public TierSettings defaults() {
        return defaults;
    }
}
