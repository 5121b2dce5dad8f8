package io.changefeed.dedupe;

import java.time.Duration;

/**
 * Per-call options for {@link RequestDeduplicator#dedupe}.
 *
 * @param ttl          how long a successful result stays cached; {@code null} uses the
 *                     deduplicator's default
 * @param forceRefresh ignore a cached value (an in-flight request is still joined)
 * @param skipCache    neither read nor write the cache; only collapse concurrent calls
 */
public record DedupeOptions(Duration ttl, boolean forceRefresh, boolean skipCache) {

  private static final DedupeOptions DEFAULTS = new DedupeOptions(null, false, false);

  public DedupeOptions {
    if (ttl != null && (ttl.isNegative() || ttl.isZero())) {
      throw new IllegalArgumentException("ttl must be > 0, got: " + ttl);
    }
  }

  public static DedupeOptions defaults() {
    return DEFAULTS;
  }

  public static DedupeOptions ttl(Duration ttl) {
    return new DedupeOptions(ttl, false, false);
  }

  public DedupeOptions withForceRefresh() {
    return new DedupeOptions(ttl, true, skipCache);
  }

  public DedupeOptions withSkipCache() {
    return new DedupeOptions(ttl, forceRefresh, true);
  }
}
