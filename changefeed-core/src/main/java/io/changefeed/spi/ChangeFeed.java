package io.changefeed.spi;

import io.changefeed.model.SubscriptionSpec;

/**
 * Backend change feed: the source of row-level insert/update/delete notifications.
 *
 * <p>Each call opens one live backend channel. The connection pool is the only
 * caller and keeps the number of open channels bounded.
 */
public interface ChangeFeed {

    /**
     * Opens a live subscription.
     *
     * @param channelName unique name of the backend channel
     * @param spec        table, filter and event kind to listen for
     * @param listener    callback for changes and subscription errors
     * @return handle that closes the subscription
     */
    FeedSubscription subscribe(String channelName, SubscriptionSpec spec, FeedListener listener);
}
