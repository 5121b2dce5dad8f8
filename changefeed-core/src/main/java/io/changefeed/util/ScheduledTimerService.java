package io.changefeed.util;

import io.changefeed.spi.Cancellable;
import io.changefeed.spi.TimerService;

import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Default {@link TimerService}: a single daemon thread that runs every task in
 * submission and deadline order.
 *
 * <p>A task that throws is logged and does not cancel a fixed-delay schedule.
 * Tasks submitted after {@link #close()} are dropped.
 */
public final class ScheduledTimerService implements TimerService {
  private static final Logger logger = Logger.getLogger(ScheduledTimerService.class.getName());

  private final ScheduledThreadPoolExecutor executor;

  public ScheduledTimerService() {
    this("changefeed-loop-");
  }

  /**
   * @param threadPrefix name prefix of the event-loop thread
   */
  public ScheduledTimerService(String threadPrefix) {
    this.executor = new ScheduledThreadPoolExecutor(1, new DaemonThreadFactory(threadPrefix));
    this.executor.setRemoveOnCancelPolicy(true);
    this.executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
  }

  @Override
  public long currentTimeMillis() {
    return System.currentTimeMillis();
  }

  @Override
  public Cancellable schedule(Runnable task, long delayMs) {
    Objects.requireNonNull(task, "task");
    try {
      ScheduledFuture<?> future = executor.schedule(guard(task), Math.max(0L, delayMs), TimeUnit.MILLISECONDS);
      return () -> future.cancel(false);
    } catch (RejectedExecutionException e) {
      logger.log(Level.FINE, "Timer closed; dropping scheduled task", e);
      return () -> false;
    }
  }

  @Override
  public Cancellable scheduleWithFixedDelay(Runnable task, long initialDelayMs, long delayMs) {
    Objects.requireNonNull(task, "task");
    if (delayMs <= 0) {
      throw new IllegalArgumentException("delayMs must be > 0, got: " + delayMs);
    }
    try {
      ScheduledFuture<?> future = executor.scheduleWithFixedDelay(
          guard(task), Math.max(0L, initialDelayMs), delayMs, TimeUnit.MILLISECONDS);
      return () -> future.cancel(false);
    } catch (RejectedExecutionException e) {
      logger.log(Level.FINE, "Timer closed; dropping periodic task", e);
      return () -> false;
    }
  }

  @Override
  public void execute(Runnable task) {
    Objects.requireNonNull(task, "task");
    try {
      executor.execute(guard(task));
    } catch (RejectedExecutionException e) {
      logger.log(Level.FINE, "Timer closed; dropping task", e);
    }
  }

  public boolean isClosed() {
    return executor.isShutdown();
  }

  @Override
  public void close() {
    executor.shutdownNow();
    try {
      executor.awaitTermination(5, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  private static Runnable guard(Runnable task) {
    return () -> {
      try {
        task.run();
      } catch (Throwable t) {
        logger.log(Level.SEVERE, "Timer task failed", t);
      }
    };
  }
}
