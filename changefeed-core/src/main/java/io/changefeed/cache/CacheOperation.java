package io.changefeed.cache;

import io.changefeed.spi.RemoteCacheClient;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletionStage;

/**
 * One command of a {@link ResilientCacheClient#batch(List)} call.
 */
public sealed interface CacheOperation permits CacheOperation.Get, CacheOperation.Set, CacheOperation.Del {

  static Get get(String key) {
    return new Get(key);
  }

  static Set set(String key, String value, Duration ttl) {
    return new Set(key, value, ttl);
  }

  static Del del(String... keys) {
    return new Del(List.of(keys));
  }

  /**
   * Issues the command.
   *
   * @param client the raw client
   * @return stage completing with the command's reply
   */
  CompletionStage<?> apply(RemoteCacheClient client);

  /** Reads a key; replies with the value or {@code null}. */
  record Get(String key) implements CacheOperation {
    public Get {
      Objects.requireNonNull(key, "key");
    }

    @Override
    public CompletionStage<String> apply(RemoteCacheClient client) {
      return client.get(key);
    }
  }

  /** Writes a key with a TTL; replies with {@code true} on acknowledgement. */
  record Set(String key, String value, Duration ttl) implements CacheOperation {
    public Set {
      Objects.requireNonNull(key, "key");
      Objects.requireNonNull(value, "value");
      Objects.requireNonNull(ttl, "ttl");
    }

    @Override
    public CompletionStage<Boolean> apply(RemoteCacheClient client) {
      return client.set(key, value, ttl);
    }
  }

  /** Deletes keys; replies with the number removed. */
  record Del(List<String> keys) implements CacheOperation {
    public Del {
      keys = List.copyOf(keys);
    }

    @Override
    public CompletionStage<Long> apply(RemoteCacheClient client) {
      return client.del(keys.toArray(new String[0]));
    }
  }
}
