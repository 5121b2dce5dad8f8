package io.changefeed.pool;

import io.changefeed.model.PriorityTier;

import java.util.List;

/**
 * Snapshot of one pooled connection.
 *
 * @param channelName      channel that opened the connection
 * @param poolKey          {@code table:filter} key shared by its subscribers
 * @param tier             priority tier the connection counts against
 * @param refCount         number of attached subscribers, including the owner
 * @param lastActivity     epoch millis of the last change or subscription
 * @param errorCount       subscription errors reported so far
 * @param messageCount     changes received so far
 * @param channels         names of all attached channels, owner first
 */
public record ConnectionMetrics(String channelName, String poolKey, PriorityTier tier, int refCount,
                                long lastActivity, int errorCount, long messageCount, List<String> channels) {
}
