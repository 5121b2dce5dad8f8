package io.changefeed.support;

import io.changefeed.spi.RemoteCacheClient;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory {@link RemoteCacheClient} with programmable failures.
 *
 * <p>{@link #failures} makes the next N calls fail; {@link #hang} makes calls never complete.
 */
public final class StubRemoteCacheClient implements RemoteCacheClient {

  public final Map<String, String> store = new HashMap<>();
  public final Map<String, Duration> ttls = new HashMap<>();
  public final AtomicInteger getCalls = new AtomicInteger();
  public final AtomicInteger setCalls = new AtomicInteger();
  public final AtomicInteger delCalls = new AtomicInteger();
  public final AtomicInteger pingCalls = new AtomicInteger();
  public final AtomicInteger failures = new AtomicInteger();
  public volatile boolean hang;
  public volatile String pingReply = "PONG";

  @Override
  public CompletionStage<String> get(String key) {
    getCalls.incrementAndGet();
    return reply(() -> store.get(key));
  }

  @Override
  public CompletionStage<Boolean> set(String key, String value, Duration ttl) {
    setCalls.incrementAndGet();
    return reply(() -> {
      store.put(key, value);
      ttls.put(key, ttl);
      return Boolean.TRUE;
    });
  }

  @Override
  public CompletionStage<Long> del(String... keys) {
    delCalls.incrementAndGet();
    return reply(() -> {
      long removed = 0;
      for (String key : keys) {
        if (store.remove(key) != null) {
          removed++;
        }
      }
      return removed;
    });
  }

  @Override
  public CompletionStage<String> ping() {
    pingCalls.incrementAndGet();
    return reply(() -> pingReply);
  }

  private synchronized <T> CompletionStage<T> reply(java.util.function.Supplier<T> action) {
    if (hang) {
      return new CompletableFuture<>();
    }
    if (failures.get() > 0) {
      failures.decrementAndGet();
      return CompletableFuture.failedFuture(new IllegalStateException("remote cache unavailable"));
    }
    return CompletableFuture.completedFuture(action.get());
  }
}
