package io.changefeed.spi;

/**
 * Live subscription handle returned by {@link ChangeFeed#subscribe}.
 */
public interface FeedSubscription extends AutoCloseable {

    /**
     * Stops delivery and releases the backend channel. Idempotent.
     */
    @Override
    void close();
}
