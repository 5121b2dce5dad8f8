package io.changefeed.cache;

import io.changefeed.resilience.OperationKind;
import io.changefeed.resilience.RetryExecutor;
import io.changefeed.spi.RemoteCacheClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * {@link RemoteCacheClient} wrapper whose calls never fail.
 *
 * <p>Every call goes through the {@link RetryExecutor} and so shares its circuit breaker.
 * A degraded call (open circuit, timeouts, errors) yields {@code null}, {@code false}
 * or {@code 0} instead of an exception.
 */
public final class ResilientCacheClient {
  private static final String PONG = "PONG";

  private final RemoteCacheClient client;
  private final RetryExecutor retryExecutor;

  public ResilientCacheClient(RemoteCacheClient client, RetryExecutor retryExecutor) {
    this.client = Objects.requireNonNull(client, "client");
    this.retryExecutor = Objects.requireNonNull(retryExecutor, "retryExecutor");
  }

  /**
   * @return the value, or {@code null} if absent or unavailable
   */
  public CompletableFuture<String> get(String key) {
    Objects.requireNonNull(key, "key");
    return retryExecutor.execute(() -> client.get(key), OperationKind.GET);
  }

  /**
   * @return {@code true} only when the write was acknowledged
   */
  public CompletableFuture<Boolean> set(String key, String value, Duration ttl) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");
    Objects.requireNonNull(ttl, "ttl");
    return retryExecutor.execute(() -> client.set(key, value, ttl), OperationKind.SET)
        .thenApply(Boolean.TRUE::equals);
  }

  /**
   * @return number of keys removed, {@code 0} when unavailable
   */
  public CompletableFuture<Long> del(String... keys) {
    if (keys.length == 0) {
      return CompletableFuture.completedFuture(0L);
    }
    String[] copy = keys.clone();
    return retryExecutor.execute(() -> client.del(copy), OperationKind.DEL)
        .thenApply(removed -> removed != null ? removed : 0L);
  }

  /**
   * Issues all operations concurrently as one {@link OperationKind#BATCH} call. The batch
   * is retried as a whole if any operation fails.
   *
   * @param operations operations to run
   * @return replies in operation order, or {@code null} when unavailable
   */
  public CompletableFuture<List<Object>> batch(List<? extends CacheOperation> operations) {
    List<CacheOperation> ops = List.copyOf(operations);
    if (ops.isEmpty()) {
      return CompletableFuture.completedFuture(List.of());
    }
    return retryExecutor.execute(() -> {
      List<CompletableFuture<?>> replies = new ArrayList<>(ops.size());
      for (CacheOperation op : ops) {
        replies.add(op.apply(client).toCompletableFuture());
      }
      return CompletableFuture.allOf(replies.toArray(new CompletableFuture<?>[0]))
          .thenApply(ignored -> {
            List<Object> results = new ArrayList<>(replies.size());
            for (CompletableFuture<?> reply : replies) {
              results.add(reply.join());
            }
            return results;
          });
    }, OperationKind.BATCH);
  }

  /**
   * Pings the remote cache.
   *
   * @return {@code true} iff the server answered {@code PONG}
   */
  public CompletableFuture<Boolean> checkHealth() {
    return retryExecutor.execute(client::ping, OperationKind.HEALTH_CHECK)
        .thenApply(PONG::equals);
  }

  public RetryExecutor retryExecutor() {
    return retryExecutor;
  }
}
