/**
 * Failure isolation for remote operations: a shared
 * {@linkplain io.changefeed.resilience.CircuitBreaker circuit breaker} and a
 * {@linkplain io.changefeed.resilience.RetryExecutor retry executor} that races every
 * attempt against a timeout and backs off exponentially between attempts.
 *
 * <p>Nothing in this package throws to the caller on a remote failure. An open circuit
 * or an exhausted retry budget completes the caller's future with {@code null}.
 */
package io.changefeed.resilience;
