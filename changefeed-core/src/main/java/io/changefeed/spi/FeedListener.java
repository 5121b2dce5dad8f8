package io.changefeed.spi;

/**
 * Callback registered with a {@link ChangeFeed} subscription.
 *
 * <p>Both methods may be invoked on any thread owned by the feed implementation.
 */
public interface FeedListener {

    /**
     * Called for every row change matching the subscription.
     *
     * @param change the raw change
     */
    void onChange(RawChange change);

    /**
     * Called when the subscription itself fails (channel error, lost connection).
     * The feed does not reopen the subscription.
     *
     * @param error the failure
     */
    void onError(Throwable error);
}
