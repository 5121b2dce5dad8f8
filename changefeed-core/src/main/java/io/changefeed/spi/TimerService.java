package io.changefeed.spi;

/**
 * Clock and scheduler shared by every changefeed component.
 *
 * <p>Implementations run all submitted tasks on a single logical event loop, so
 * debounce timers, retry waits, feed deliveries and sweeps never run concurrently
 * with each other. {@link #currentTimeMillis()} is the only time source the
 * components read; substituting a virtual clock makes every timing rule testable.
 *
 * @see io.changefeed.util.ScheduledTimerService
 */
public interface TimerService extends AutoCloseable {

    /**
     * Returns the current time in epoch milliseconds.
     *
     * @return current time in milliseconds
     */
    long currentTimeMillis();

    /**
     * Runs {@code task} once after {@code delayMs} milliseconds.
     *
     * @param task    the task to run
     * @param delayMs delay in milliseconds; values &le; 0 run as soon as possible
     * @return a handle that cancels the task
     */
    Cancellable schedule(Runnable task, long delayMs);

    /**
     * Runs {@code task} repeatedly with a fixed delay between the end of one run
     * and the start of the next.
     *
     * @param task           the task to run
     * @param initialDelayMs delay before the first run in milliseconds
     * @param delayMs        delay between runs in milliseconds (must be &gt; 0)
     * @return a handle that cancels further runs
     */
    Cancellable scheduleWithFixedDelay(Runnable task, long initialDelayMs, long delayMs);

    /**
     * Hands {@code task} to the event loop for execution as soon as possible.
     *
     * @param task the task to run
     */
    void execute(Runnable task);

    /**
     * Stops the event loop. Pending tasks are discarded.
     */
    @Override
    void close();
}
