package io.changefeed;

/**
 * Cleanup handle returned by {@link ChangeAggregator#subscribe}.
 *
 * <p>{@link #close()} synchronously cancels any pending flush for the channel and
 * detaches its listener; no delivery happens after it returns. Calling it more than
 * once is a no-op.
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable {

  /**
   * Handle returned when a subscription was deferred because the pool was full.
   */
  Subscription NOOP = () -> { };

  @Override
  void close();
}
