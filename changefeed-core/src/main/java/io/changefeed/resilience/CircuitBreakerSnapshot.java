package io.changefeed.resilience;

/**
 * Point-in-time view of a {@link CircuitBreaker}.
 *
 * @param state           current state
 * @param failureCount    failures counted toward tripping
 * @param successCount    successes since the last failure
 * @param lastFailureTime epoch millis of the last failure, {@code 0} if none
 */
public record CircuitBreakerSnapshot(CircuitState state, int failureCount, int successCount,
                  long lastFailureTime) {

  public boolean isOpen() {
    return state == CircuitState.OPEN;
  }

  public boolean isHalfOpen() {
    return state == CircuitState.HALF_OPEN;
  }
}
