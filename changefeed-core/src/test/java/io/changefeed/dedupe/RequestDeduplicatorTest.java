package io.changefeed.dedupe;

import io.changefeed.resilience.OperationTimeoutException;
import io.changefeed.support.ManualTimerService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RequestDeduplicatorTest {

  private ManualTimerService timer;
  private RequestDeduplicator deduplicator;

  @BeforeEach
  void setUp() {
    timer = new ManualTimerService();
    deduplicator = RequestDeduplicator.builder().timer(timer).build();
  }

  @AfterEach
  void tearDown() {
    deduplicator.close();
  }

  @Test
  void concurrentCallersShareOneFactoryInvocation() {
    AtomicInteger calls = new AtomicInteger();
    CompletableFuture<String> source = new CompletableFuture<>();

    CompletableFuture<String> first = deduplicator.dedupe("k", () -> {
      calls.incrementAndGet();
      return source;
    });
    CompletableFuture<String> second = deduplicator.dedupe("k", () -> {
      calls.incrementAndGet();
      return CompletableFuture.completedFuture("other");
    });

    assertEquals(1, calls.get());
    assertFalse(second.isDone());
    source.complete("shared");
    assertEquals("shared", first.join());
    assertEquals("shared", second.join());
  }

  @Test
  void concurrentThreadsInvokeFactoryOnce() throws Exception {
    AtomicInteger calls = new AtomicInteger();
    CompletableFuture<Integer> source = new CompletableFuture<>();
    int threads = 8;
    CountDownLatch start = new CountDownLatch(1);
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    try {
      List<Future<CompletableFuture<Integer>>> results = new ArrayList<>();
      for (int i = 0; i < threads; i++) {
        results.add(pool.submit(() -> {
          start.await();
          return deduplicator.dedupe("profile:1", () -> {
            calls.incrementAndGet();
            return source;
          });
        }));
      }
      start.countDown();
      List<CompletableFuture<Integer>> futures = new ArrayList<>();
      for (Future<CompletableFuture<Integer>> result : results) {
        futures.add(result.get(5, TimeUnit.SECONDS));
      }
      source.complete(42);
      for (CompletableFuture<Integer> future : futures) {
        assertEquals(42, future.join());
      }
      assertEquals(1, calls.get());
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void freshCachedValueSkipsFactory() {
    AtomicInteger calls = new AtomicInteger();
    DedupeOptions options = DedupeOptions.ttl(Duration.ofSeconds(300));

    deduplicator.dedupe("profile:42", () -> {
      calls.incrementAndGet();
      return CompletableFuture.completedFuture("alice");
    }, options).join();
    timer.advance(299_000);
    String again = deduplicator.<String>dedupe("profile:42", () -> {
      calls.incrementAndGet();
      return CompletableFuture.completedFuture("bob");
    }, options).join();

    assertEquals("alice", again);
    assertEquals(1, calls.get());
  }

  @Test
  void expiredValueIsFetchedAgain() {
    AtomicInteger calls = new AtomicInteger();

    deduplicator.dedupe("k", () -> CompletableFuture.completedFuture(calls.incrementAndGet())).join();
    timer.advance(5_000);
    int second = deduplicator.<Integer>dedupe("k",
        () -> CompletableFuture.completedFuture(calls.incrementAndGet())).join();

    assertEquals(2, second);
  }

  @Test
  void forceRefreshBypassesCacheButStillJoinsPending() {
    deduplicator.dedupe("k", () -> CompletableFuture.completedFuture("old")).join();

    CompletableFuture<String> source = new CompletableFuture<>();
    CompletableFuture<String> refreshed = deduplicator.dedupe("k", () -> source,
        DedupeOptions.defaults().withForceRefresh());
    CompletableFuture<String> joined = deduplicator.dedupe("k",
        () -> CompletableFuture.completedFuture("never"), DedupeOptions.defaults().withForceRefresh());
    source.complete("new");

    assertEquals("new", refreshed.join());
    assertEquals("new", joined.join());
    assertEquals("new", deduplicator.<String>dedupe("k", CompletableFuture::new).join());
  }

  @Test
  void skipCacheDoesNotStoreResult() {
    AtomicInteger calls = new AtomicInteger();
    DedupeOptions skip = DedupeOptions.defaults().withSkipCache();

    deduplicator.dedupe("k", () -> CompletableFuture.completedFuture(calls.incrementAndGet()), skip).join();
    deduplicator.dedupe("k", () -> CompletableFuture.completedFuture(calls.incrementAndGet()), skip).join();

    assertEquals(2, calls.get());
    assertEquals(0, deduplicator.stats().cached());
  }

  @Test
  void nullResultIsNotCached() {
    AtomicInteger calls = new AtomicInteger();

    deduplicator.dedupe("k", () -> {
      calls.incrementAndGet();
      return CompletableFuture.completedFuture(null);
    }).join();
    deduplicator.dedupe("k", () -> {
      calls.incrementAndGet();
      return CompletableFuture.completedFuture(null);
    }).join();

    assertEquals(2, calls.get());
  }

  @Test
  void failurePropagatesToAllWaitersAndIsNotCached() {
    CompletableFuture<String> source = new CompletableFuture<>();
    CompletableFuture<String> first = deduplicator.dedupe("k", () -> source);
    CompletableFuture<String> second = deduplicator.dedupe("k", () -> source);

    source.completeExceptionally(new IllegalStateException("down"));

    CompletionException e1 = assertThrows(CompletionException.class, first::join);
    assertInstanceOf(IllegalStateException.class, e1.getCause());
    assertThrows(CompletionException.class, second::join);
    assertEquals(0, deduplicator.pendingCount());
    assertEquals("ok", deduplicator.<String>dedupe("k",
        () -> CompletableFuture.completedFuture("ok")).join());
  }

  @Test
  void factoryThrowingSynchronouslyFailsTheFuture() {
    CompletableFuture<String> result = deduplicator.dedupe("k", () -> {
      throw new IllegalArgumentException("bad request");
    });

    assertThrows(CompletionException.class, result::join);
    assertEquals(0, deduplicator.pendingCount());
  }

  @Test
  void stuckRequestIsEvictedAfterPendingTimeout() {
    CompletableFuture<String> stuck = deduplicator.dedupe("k", CompletableFuture::new);

    timer.advance(29_999);
    assertFalse(stuck.isDone());
    timer.advance(1);

    CompletionException e = assertThrows(CompletionException.class, stuck::join);
    assertInstanceOf(OperationTimeoutException.class, e.getCause());
    assertEquals(0, deduplicator.pendingCount());

    AtomicInteger calls = new AtomicInteger();
    deduplicator.dedupe("k", () -> {
      calls.incrementAndGet();
      return CompletableFuture.completedFuture("fresh");
    }).join();
    assertEquals(1, calls.get());
  }

  @Test
  void completedRequestCancelsItsPendingTimeout() {
    deduplicator.dedupe("k", () -> CompletableFuture.completedFuture("v")).join();

    assertEquals(0, timer.pendingTasks());
  }

  @Test
  void callerCancellingItsFutureDoesNotAffectOthers() {
    CompletableFuture<String> source = new CompletableFuture<>();
    CompletableFuture<String> first = deduplicator.dedupe("k", () -> source);
    CompletableFuture<String> second = deduplicator.dedupe("k", () -> source);

    first.cancel(true);
    source.complete("v");

    assertEquals("v", second.join());
  }

  @Test
  void invalidateDropsCachedValue() {
    deduplicator.dedupe("k", () -> CompletableFuture.completedFuture("v1")).join();

    assertTrue(deduplicator.invalidate("k"));

    assertEquals("v2", deduplicator.<String>dedupe("k",
        () -> CompletableFuture.completedFuture("v2")).join());
  }

  @Test
  void invalidatePrefixForgetsPendingAndCachedEntries() {
    String posts = CacheKeys.of("posts", "select", java.util.Map.of("page", 1));
    String postsPending = CacheKeys.of("posts", "select", java.util.Map.of("page", 2));
    String users = CacheKeys.of("users", "select");
    deduplicator.dedupe(posts, () -> CompletableFuture.completedFuture("p1")).join();
    CompletableFuture<String> pending = deduplicator.dedupe(postsPending, CompletableFuture::new);
    deduplicator.dedupe(users, () -> CompletableFuture.completedFuture("u")).join();

    int removed = deduplicator.invalidatePrefix(CacheKeys.prefix("posts", "select"));

    assertEquals(2, removed);
    DedupeStats stats = deduplicator.stats();
    assertEquals(0, stats.pending());
    assertEquals(1, stats.cached());
    assertFalse(pending.isDone());
  }

  @Test
  void forgottenRequestIsNoLongerEvicted() {
    CompletableFuture<String> source = new CompletableFuture<>();
    CompletableFuture<String> waiter = deduplicator.dedupe("posts:select:page=1", () -> source);
    assertEquals(1, timer.pendingTasks());

    deduplicator.invalidatePrefix("posts:");

    assertEquals(0, timer.pendingTasks());
    timer.advance(Duration.ofSeconds(31).toMillis());
    assertFalse(waiter.isDone());
    source.complete("late");
    assertEquals("late", waiter.join());
    assertEquals(0, deduplicator.stats().cached());
  }

  @Test
  void statsReportOldestPendingAge() {
    deduplicator.dedupe("a", CompletableFuture::new);
    timer.advance(1_000);
    deduplicator.dedupe("b", CompletableFuture::new);
    timer.advance(500);

    DedupeStats stats = deduplicator.stats();
    assertEquals(2, stats.pending());
    assertEquals(1_500, stats.oldestPendingAgeMs());
  }

  @Test
  void sweepRemovesExpiredEntries() {
    deduplicator.dedupe("short", () -> CompletableFuture.completedFuture("s"),
        DedupeOptions.ttl(Duration.ofSeconds(1))).join();
    deduplicator.dedupe("long", () -> CompletableFuture.completedFuture("l"),
        DedupeOptions.ttl(Duration.ofMinutes(10))).join();
    timer.advance(2_000);

    assertEquals(1, deduplicator.sweep());
    assertEquals(1, deduplicator.stats().cached());
  }

  @Test
  void periodicSweepRunsAfterStart() {
    deduplicator.dedupe("k", () -> CompletableFuture.completedFuture("v")).join();
    deduplicator.start();

    timer.advance(60_000);

    assertEquals(0, deduplicator.stats().cached());
  }

  @Test
  void clearForgetsEverything() {
    deduplicator.dedupe("a", () -> CompletableFuture.completedFuture("v")).join();
    deduplicator.dedupe("b", CompletableFuture::new);

    deduplicator.clear();

    assertEquals(new DedupeStats(0, 0, 0), deduplicator.stats());
    assertEquals(0, timer.pendingTasks());
  }

  @Test
  void startAfterCloseFails() {
    deduplicator.close();

    assertThrows(IllegalStateException.class, deduplicator::start);
  }

  @Test
  void rejectsInvalidConfiguration() {
    assertThrows(NullPointerException.class, () -> RequestDeduplicator.builder().build());
    assertThrows(IllegalArgumentException.class,
        () -> RequestDeduplicator.builder().timer(timer).pendingTimeout(Duration.ZERO).build());
    assertThrows(IllegalArgumentException.class,
        () -> RequestDeduplicator.builder().timer(timer).defaultTtl(Duration.ofSeconds(-1)).build());
    assertThrows(IllegalArgumentException.class, () -> DedupeOptions.ttl(Duration.ZERO));
  }
}
