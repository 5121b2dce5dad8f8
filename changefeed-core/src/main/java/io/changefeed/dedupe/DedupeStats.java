package io.changefeed.dedupe;

/**
 * Snapshot of a {@link RequestDeduplicator}.
 *
 * @param pending            in-flight requests
 * @param cached             cache entries, including expired ones not yet swept
 * @param oldestPendingAgeMs age of the oldest in-flight request, {@code 0} if none
 */
public record DedupeStats(int pending, int cached, long oldestPendingAgeMs) {
}
