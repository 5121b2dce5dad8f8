package io.changefeed.spi;

import java.time.Duration;
import java.util.concurrent.CompletionStage;

/**
 * Asynchronous key-value client for the remote cache.
 *
 * <p>Every call made by this library goes through
 * {@link io.changefeed.resilience.RetryExecutor}, so implementations should simply
 * fail their stage on error and not retry on their own.
 */
public interface RemoteCacheClient {

    /**
     * Reads a value.
     *
     * @param key cache key
     * @return stage completing with the value, or {@code null} if absent
     */
    CompletionStage<String> get(String key);

    /**
     * Writes a value with an expiry.
     *
     * @param key   cache key
     * @param value value to store
     * @param ttl   time to live
     * @return stage completing with {@code true} when the write was acknowledged
     */
    CompletionStage<Boolean> set(String key, String value, Duration ttl);

    /**
     * Deletes keys.
     *
     * @param keys keys to delete
     * @return stage completing with the number of keys removed
     */
    CompletionStage<Long> del(String... keys);

    /**
     * Pings the server.
     *
     * @return stage completing with the server's reply, {@code PONG} when healthy
     */
    CompletionStage<String> ping();
}
