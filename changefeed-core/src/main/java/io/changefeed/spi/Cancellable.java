package io.changefeed.spi;

/**
 * Handle for a scheduled task returned by {@link TimerService}.
 */
@FunctionalInterface
public interface Cancellable {

    /**
     * Cancels the task if it has not yet run.
     *
     * @return {@code true} if this call prevented the task from running
     */
    boolean cancel();
}
