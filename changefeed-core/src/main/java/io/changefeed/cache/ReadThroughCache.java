package io.changefeed.cache;

import io.changefeed.dedupe.DedupeOptions;
import io.changefeed.dedupe.RequestDeduplicator;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Cache-aside reads: in-memory deduplication, then the remote cache, then the loader.
 *
 * <p>Concurrent reads of one key share a single lookup. A remote miss, an unavailable
 * remote cache, or a value the codec cannot decode all fall through to the loader; a
 * non-null loaded value is written back to the remote cache in the background. Without
 * a remote client the cache is memory-only.
 */
public final class ReadThroughCache {
  private static final Logger logger = Logger.getLogger(ReadThroughCache.class.getName());

  private final RequestDeduplicator deduplicator;
  private final ResilientCacheClient remote;
  private final Duration defaultTtl;

  /**
   * @param deduplicator collapses concurrent reads and keeps results in memory
   * @param remote       remote cache, or {@code null} for memory-only operation
   * @param defaultTtl   TTL used when a read does not specify one
   */
  public ReadThroughCache(RequestDeduplicator deduplicator, ResilientCacheClient remote, Duration defaultTtl) {
    this.deduplicator = Objects.requireNonNull(deduplicator, "deduplicator");
    this.remote = remote;
    this.defaultTtl = Objects.requireNonNull(defaultTtl, "defaultTtl");
    if (defaultTtl.isNegative() || defaultTtl.isZero()) {
      throw new IllegalArgumentException("defaultTtl must be > 0");
    }
  }

  public <T> CompletableFuture<T> get(String key, ValueCodec<T> codec, Supplier<? extends CompletionStage<T>> loader) {
    return get(key, codec, loader, defaultTtl);
  }

  /**
   * Reads {@code key}, loading and caching it on a miss.
   *
   * @param key    cache key
   * @param codec  converts values for the remote cache
   * @param loader fetches the value from the source of truth
   * @param ttl    how long the value is kept, in memory and remotely
   * @param <T>    value type
   * @return future completing with the value; fails only if the loader fails
   */
  public <T> CompletableFuture<T> get(String key, ValueCodec<T> codec,
      Supplier<? extends CompletionStage<T>> loader, Duration ttl) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(codec, "codec");
    Objects.requireNonNull(loader, "loader");
    Objects.requireNonNull(ttl, "ttl");
    return deduplicator.dedupe(key, () -> load(key, codec, loader, ttl), DedupeOptions.ttl(ttl));
  }

  /**
   * Drops {@code key} from memory and from the remote cache.
   *
   * @param key cache key
   * @return future completing when the remote delete finished (or degraded)
   */
  public CompletableFuture<Void> invalidate(String key) {
    deduplicator.invalidate(key);
    if (remote == null) {
      return CompletableFuture.completedFuture(null);
    }
    return remote.del(key).thenAccept(removed -> { });
  }

  public boolean hasRemote() {
    return remote != null;
  }

  private <T> CompletionStage<T> load(String key, ValueCodec<T> codec,
      Supplier<? extends CompletionStage<T>> loader, Duration ttl) {
    if (remote == null) {
      return loader.get();
    }
    return remote.get(key).<T>thenCompose(cached -> {
      if (cached != null) {
        try {
          return CompletableFuture.completedFuture(codec.decode(cached));
        } catch (RuntimeException e) {
          logger.log(Level.WARNING, "Discarding undecodable cache entry " + key, e);
        }
      }
      return loader.get().thenApply(value -> {
        if (value != null) {
          writeBack(key, codec, value, ttl);
        }
        return value;
      });
    });
  }

  private <T> void writeBack(String key, ValueCodec<T> codec, T value, Duration ttl) {
    String encoded;
    try {
      encoded = codec.encode(value);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Failed to encode value for " + key + "; not caching", e);
      return;
    }
    remote.set(key, encoded, ttl).thenAccept(stored -> {
      if (!stored) {
        logger.log(Level.FINE, "Write-back of {0} was not acknowledged", key);
      }
    });
  }
}
