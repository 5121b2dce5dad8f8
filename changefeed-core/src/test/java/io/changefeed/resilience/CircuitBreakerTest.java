package io.changefeed.resilience;

import io.changefeed.support.ManualTimerService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CircuitBreakerTest {

  private ManualTimerService timer;
  private CircuitBreaker breaker;

  @BeforeEach
  void setUp() {
    timer = new ManualTimerService();
    breaker = CircuitBreaker.builder().timer(timer).build();
  }

  private void fail(int times) {
    for (int i = 0; i < times; i++) {
      breaker.recordFailure();
    }
  }

  @Test
  void startsClosed() {
    assertEquals(CircuitState.CLOSED, breaker.state());
    assertTrue(breaker.allow());
  }

  @Test
  void staysClosedBelowThreshold() {
    fail(4);

    assertEquals(CircuitState.CLOSED, breaker.state());
    assertTrue(breaker.allow());
    assertEquals(4, breaker.snapshot().failureCount());
  }

  @Test
  void opensAtThresholdAndRejectsUntilTimeout() {
    fail(5);

    assertEquals(CircuitState.OPEN, breaker.state());
    assertFalse(breaker.allow());

    timer.advance(60_000);
    assertFalse(breaker.allow(), "timeout must strictly elapse");

    timer.advance(1);
    assertTrue(breaker.allow());
    assertEquals(CircuitState.HALF_OPEN, breaker.state());
  }

  @Test
  void halfOpenClosesAfterSuccessThreshold() {
    fail(5);
    timer.advance(60_001);
    assertTrue(breaker.allow());

    breaker.recordSuccess();
    breaker.recordSuccess();
    assertEquals(CircuitState.HALF_OPEN, breaker.state());

    breaker.recordSuccess();
    CircuitBreakerSnapshot snapshot = breaker.snapshot();
    assertEquals(CircuitState.CLOSED, snapshot.state());
    assertEquals(0, snapshot.failureCount());
    assertEquals(0, snapshot.successCount());
  }

  @Test
  void failureInHalfOpenReopens() {
    fail(5);
    timer.advance(60_001);
    assertTrue(breaker.allow());
    breaker.recordSuccess();
    breaker.recordSuccess();

    breaker.recordFailure();

    assertEquals(CircuitState.OPEN, breaker.state());
    assertEquals(0, breaker.snapshot().successCount());
    assertFalse(breaker.allow());
  }

  @Test
  void reopenedCircuitWaitsAFullTimeoutAgain() {
    fail(5);
    timer.advance(60_001);
    breaker.allow();
    breaker.recordFailure();

    timer.advance(30_000);
    assertFalse(breaker.allow());
    timer.advance(30_001);
    assertTrue(breaker.allow());
  }

  @Test
  void failuresOutsideMonitorWindowRestartTheCount() {
    fail(4);
    timer.advance(300_001);

    fail(3);
    assertEquals(CircuitState.CLOSED, breaker.state());
    assertEquals(3, breaker.snapshot().failureCount());

    fail(2);
    assertEquals(CircuitState.OPEN, breaker.state());
  }

  @Test
  void zeroMonitorWindowNeverForgetsFailures() {
    CircuitBreaker noWindow = CircuitBreaker.builder().timer(timer).monitorWindowMs(0).build();
    for (int i = 0; i < 5; i++) {
      noWindow.recordFailure();
      timer.advance(600_000);
    }

    assertEquals(CircuitState.OPEN, noWindow.state());
  }

  @Test
  void resetClosesAndClearsCounters() {
    fail(5);

    breaker.reset();

    CircuitBreakerSnapshot snapshot = breaker.snapshot();
    assertEquals(CircuitState.CLOSED, snapshot.state());
    assertEquals(0, snapshot.failureCount());
    assertEquals(0L, snapshot.lastFailureTime());
    assertTrue(breaker.allow());
  }

  @Test
  void snapshotReportsLastFailureTime() {
    breaker.recordFailure();

    assertEquals(timer.currentTimeMillis(), breaker.snapshot().lastFailureTime());
    assertFalse(breaker.snapshot().isOpen());
    assertFalse(breaker.snapshot().isHalfOpen());
  }

  @Test
  void customThresholds() {
    CircuitBreaker custom = CircuitBreaker.builder()
        .timer(timer)
        .failureThreshold(2)
        .successThreshold(1)
        .openTimeoutMs(1_000)
        .build();

    custom.recordFailure();
    custom.recordFailure();
    assertEquals(CircuitState.OPEN, custom.state());

    timer.advance(1_001);
    assertTrue(custom.allow());
    custom.recordSuccess();
    assertEquals(CircuitState.CLOSED, custom.state());
  }

  // ── Builder validation ───────────────────────────────────────────

  @Test
  void rejectsMissingTimer() {
    assertThrows(NullPointerException.class, () -> CircuitBreaker.builder().build());
  }

  @Test
  void rejectsInvalidThresholds() {
    assertThrows(IllegalArgumentException.class,
        () -> CircuitBreaker.builder().timer(timer).failureThreshold(0).build());
    assertThrows(IllegalArgumentException.class,
        () -> CircuitBreaker.builder().timer(timer).successThreshold(0).build());
    assertThrows(IllegalArgumentException.class,
        () -> CircuitBreaker.builder().timer(timer).openTimeoutMs(-1).build());
    assertThrows(IllegalArgumentException.class,
        () -> CircuitBreaker.builder().timer(timer).monitorWindowMs(-1).build());
  }
}
