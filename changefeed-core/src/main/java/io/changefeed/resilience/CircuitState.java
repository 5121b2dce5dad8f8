package io.changefeed.resilience;

/**
 * State of a {@link CircuitBreaker}.
 */
public enum CircuitState {
  /** Operations flow normally. */
  CLOSED,
  /** Operations are rejected until the open timeout elapses. */
  OPEN,
  /** Trial operations are allowed; enough successes close the circuit, any failure reopens it. */
  HALF_OPEN
}
