package io.changefeed.spi;

import io.changefeed.model.MalformedChangeException;

/**
 * Hook for failures that never propagate to the caller of
 * {@link io.changefeed.ChangeAggregator#subscribe}.
 *
 * <p>Components log every failure themselves; this hook lets the application react
 * (show a degraded banner, trigger a resync). The {@link #NOOP} instance ignores them.
 */
public interface ErrorHandler {

    /**
     * Handler that ignores all failures.
     */
    ErrorHandler NOOP = new ErrorHandler() {
    };

    /**
     * Called when a live backend subscription reports an error.
     *
     * @param channelName the pooled channel that failed
     * @param error       the failure
     */
    default void onSubscriptionError(String channelName, Throwable error) {
    }

    /**
     * Called when a listener throws while handling a flushed delivery.
     *
     * @param channelName the channel whose listener failed
     * @param error       the failure
     */
    default void onListenerError(String channelName, Throwable error) {
    }

    /**
     * Called when a raw change cannot be converted into a typed event and is dropped.
     *
     * @param channelName the channel that received the change
     * @param error       the validation failure
     */
    default void onRejectedChange(String channelName, MalformedChangeException error) {
    }
}
