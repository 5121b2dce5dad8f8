package io.changefeed;

import io.changefeed.model.ChangeBatch;
import io.changefeed.model.ChangeEvent;
import io.changefeed.model.Delivery;

/**
 * Application callback for a subscription.
 *
 * <h2>Execution Model</h2>
 * <p>Listeners are invoked on the event-loop thread of the
 * {@link io.changefeed.spi.TimerService}, one flush at a time. A slow listener delays
 * every other channel's flush, so hand heavy work off to another executor.
 *
 * <h2>Payload</h2>
 * <p>A flush of one event delivers the {@link ChangeEvent} itself; a flush of several
 * delivers a {@link ChangeBatch}. {@link Delivery#events()} works for both.
 *
 * <h2>Error Handling</h2>
 * <p>An exception thrown here is logged and passed to
 * {@link io.changefeed.spi.ErrorHandler#onListenerError}. The delivered events are not
 * redelivered and the next batch is unaffected.
 *
 * <pre>{@code
 * aggregator.subscribe("likes-42", spec, delivery -> {
 *   for (ChangeEvent event : delivery.events()) {
 *     counters.apply(event);
 *   }
 * });
 * }</pre>
 */
@FunctionalInterface
public interface ChangeListener {

  /**
   * Handles one flushed delivery.
   *
   * @param delivery a single event or a batch
   * @throws Exception if handling fails; reported to the error handler
   */
  void onChange(Delivery delivery) throws Exception;
}
