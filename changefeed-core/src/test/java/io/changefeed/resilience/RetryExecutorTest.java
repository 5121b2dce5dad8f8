package io.changefeed.resilience;

import io.changefeed.support.ManualTimerService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetryExecutorTest {

  private ManualTimerService timer;
  private CircuitBreaker breaker;

  @BeforeEach
  void setUp() {
    timer = new ManualTimerService();
    breaker = CircuitBreaker.builder().timer(timer).build();
  }

  private RetryExecutor executor(int maxAttempts) {
    return RetryExecutor.builder()
        .timer(timer)
        .circuitBreaker(breaker)
        .maxAttempts(maxAttempts)
        .retryPolicy(attempts -> 100L * attempts)
        .build();
  }

  private static CompletableFuture<String> failing() {
    return CompletableFuture.failedFuture(new IllegalStateException("boom"));
  }

  @Test
  void returnsResultOfFirstSuccessfulAttempt() {
    RetryExecutor executor = executor(3);

    CompletableFuture<String> result = executor.execute(
        () -> CompletableFuture.completedFuture("value"), OperationKind.GET);

    assertEquals("value", result.join());
    assertEquals(1, breaker.snapshot().successCount());
    assertEquals(0, timer.pendingTasks(), "timeout timer must be cancelled");
  }

  @Test
  void retriesWithBackoffUntilSuccess() {
    RetryExecutor executor = executor(3);
    AtomicInteger calls = new AtomicInteger();

    CompletableFuture<String> result = executor.execute(() -> calls.incrementAndGet() < 3
        ? failing() : CompletableFuture.completedFuture("third"), OperationKind.GET);

    assertEquals(1, calls.get());
    timer.advance(99);
    assertEquals(1, calls.get(), "first backoff is 100ms");
    timer.advance(1);
    assertEquals(2, calls.get());
    timer.advance(200);
    assertEquals(3, calls.get());

    assertEquals("third", result.join());
    assertEquals(0, breaker.snapshot().failureCount());
  }

  @Test
  void exhaustedAttemptsYieldNullAndOneBreakerFailure() {
    RetryExecutor executor = executor(3);
    AtomicInteger calls = new AtomicInteger();

    CompletableFuture<String> result = executor.execute(() -> {
      calls.incrementAndGet();
      return failing();
    }, OperationKind.SET);
    timer.advance(1_000);

    assertTrue(result.isDone());
    assertNull(result.join());
    assertEquals(3, calls.get());
    assertEquals(1, breaker.snapshot().failureCount());
  }

  @Test
  void attemptLosesRaceAgainstTimeout() {
    RetryExecutor executor = executor(1);

    CompletableFuture<String> result = executor.execute(CompletableFuture::new, OperationKind.GET);

    timer.advance(3_999);
    assertFalse(result.isDone());
    timer.advance(1);
    assertNull(result.join());
    assertEquals(1, breaker.snapshot().failureCount());
  }

  @Test
  void timeoutDependsOnOperationKind() {
    RetryExecutor executor = executor(1);

    CompletableFuture<String> batch = executor.execute(CompletableFuture::new, OperationKind.BATCH);
    CompletableFuture<String> critical = executor.execute(CompletableFuture::new, OperationKind.CRITICAL);

    timer.advance(6_000);
    assertTrue(critical.isDone());
    assertFalse(batch.isDone());
    timer.advance(4_000);
    assertTrue(batch.isDone());
  }

  @Test
  void customTimeoutOverridesKindDefault() {
    RetryExecutor executor = executor(1);

    CompletableFuture<String> result = executor.execute(CompletableFuture::new, OperationKind.GET, 250);

    timer.advance(250);
    assertTrue(result.isDone());
  }

  @Test
  void builderTimeoutOverride() {
    RetryExecutor executor = RetryExecutor.builder()
        .timer(timer)
        .circuitBreaker(breaker)
        .timeout(OperationKind.GET, 1_500)
        .build();

    assertEquals(1_500, executor.timeoutMs(OperationKind.GET));
    assertEquals(4_000, executor.timeoutMs(OperationKind.SET));
    assertEquals(5_000, executor.timeoutMs(OperationKind.HEALTH_CHECK));
    assertEquals(3, executor.maxAttempts());
  }

  @Test
  void lateCompletionAfterTimeoutIsIgnored() {
    RetryExecutor executor = executor(1);
    CompletableFuture<String> slow = new CompletableFuture<>();

    CompletableFuture<String> result = executor.execute(() -> slow, OperationKind.GET);
    timer.advance(4_000);
    slow.complete("too late");

    assertNull(result.join());
    assertEquals(0, breaker.snapshot().successCount());
  }

  @Test
  void synchronousThrowCountsAsFailedAttempt() {
    RetryExecutor executor = executor(2);
    AtomicInteger calls = new AtomicInteger();

    CompletableFuture<String> result = executor.execute(() -> {
      if (calls.incrementAndGet() == 1) {
        throw new IllegalStateException("sync failure");
      }
      return CompletableFuture.completedFuture("ok");
    }, OperationKind.GET);
    timer.advance(100);

    assertEquals("ok", result.join());
  }

  @Test
  void openCircuitShortCircuitsWithoutAttempt() {
    RetryExecutor executor = executor(1);
    for (int i = 0; i < 5; i++) {
      breaker.recordFailure();
    }
    AtomicInteger calls = new AtomicInteger();

    CompletableFuture<String> result = executor.execute(() -> {
      calls.incrementAndGet();
      return CompletableFuture.completedFuture("x");
    }, OperationKind.GET);

    assertTrue(result.isDone());
    assertNull(result.join());
    assertEquals(0, calls.get());
  }

  @Test
  void fiveFailedOperationsOpenTheCircuitForTheSixth() {
    RetryExecutor executor = executor(3);
    AtomicInteger calls = new AtomicInteger();

    for (int i = 0; i < 5; i++) {
      CompletableFuture<String> result = executor.execute(() -> {
        calls.incrementAndGet();
        return failing();
      }, OperationKind.GET);
      timer.advance(1_000);
      assertNull(result.join());
    }
    assertEquals(15, calls.get());
    assertEquals(CircuitState.OPEN, breaker.state());

    CompletableFuture<String> sixth = executor.execute(() -> {
      calls.incrementAndGet();
      return CompletableFuture.completedFuture("x");
    }, OperationKind.GET);
    assertNull(sixth.join());
    assertEquals(15, calls.get());

    timer.advance(60_001);
    CompletableFuture<String> probe = executor.execute(
        () -> CompletableFuture.completedFuture("recovered"), OperationKind.GET);
    assertEquals("recovered", probe.join());
    assertEquals(CircuitState.HALF_OPEN, breaker.state());
  }

  @Test
  void rejectsInvalidConfiguration() {
    assertThrows(NullPointerException.class, () -> RetryExecutor.builder().timer(timer).build());
    assertThrows(IllegalArgumentException.class,
        () -> RetryExecutor.builder().timer(timer).circuitBreaker(breaker).maxAttempts(0).build());
    assertThrows(IllegalArgumentException.class,
        () -> RetryExecutor.builder().timeout(OperationKind.GET, 0));
    assertThrows(IllegalArgumentException.class,
        () -> executor(1).execute(CompletableFuture::new, OperationKind.GET, 0));
  }
}
