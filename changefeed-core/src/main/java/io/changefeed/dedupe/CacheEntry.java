package io.changefeed.dedupe;

/**
 * A value remembered by {@link RequestDeduplicator} for a short time.
 *
 * @param key       cache key
 * @param value     cached value (never null)
 * @param timestamp epoch millis when the value was stored
 * @param ttlMs     time to live in milliseconds
 */
public record CacheEntry(String key, Object value, long timestamp, long ttlMs) {

  /**
   * Returns whether the entry is still usable at {@code now}.
   *
   * @param now current epoch millis
   * @return {@code true} if {@code now - timestamp < ttlMs}
   */
  public boolean isFresh(long now) {
    return now - timestamp < ttlMs;
  }
}
