package io.changefeed.support;

import io.changefeed.spi.Cancellable;
import io.changefeed.spi.TimerService;

import java.util.PriorityQueue;

/**
 * Virtual-time {@link TimerService}. Time only moves in {@link #advance(long)}; due tasks
 * run on the calling thread in deadline order. {@link #execute(Runnable)} runs inline.
 */
public final class ManualTimerService implements TimerService {

  private final PriorityQueue<Task> queue = new PriorityQueue<>();
  private long now;
  private long sequence;
  private boolean closed;

  public ManualTimerService() {
    this(1_000_000L);
  }

  public ManualTimerService(long startMillis) {
    this.now = startMillis;
  }

  @Override
  public synchronized long currentTimeMillis() {
    return now;
  }

  @Override
  public synchronized Cancellable schedule(Runnable task, long delayMs) {
    return enqueue(task, now + Math.max(0L, delayMs), 0L);
  }

  @Override
  public synchronized Cancellable scheduleWithFixedDelay(Runnable task, long initialDelayMs, long delayMs) {
    if (delayMs <= 0) {
      throw new IllegalArgumentException("delayMs must be > 0");
    }
    return enqueue(task, now + Math.max(0L, initialDelayMs), delayMs);
  }

  @Override
  public void execute(Runnable task) {
    synchronized (this) {
      if (closed) {
        return;
      }
    }
    task.run();
  }

  /**
   * Moves the clock forward, running every task that falls due on the way.
   */
  public void advance(long millis) {
    long target;
    synchronized (this) {
      target = now + millis;
    }
    while (true) {
      Task next;
      synchronized (this) {
        next = queue.peek();
        if (next == null || next.deadline > target) {
          now = target;
          return;
        }
        queue.poll();
        if (next.cancelled) {
          continue;
        }
        now = next.deadline;
        if (next.period > 0) {
          next.deadline = now + next.period;
          next.seq = sequence++;
          queue.add(next);
        }
      }
      next.runnable.run();
    }
  }

  /** Runs tasks due at the current time. */
  public void runDue() {
    advance(0L);
  }

  public synchronized int pendingTasks() {
    int count = 0;
    for (Task task : queue) {
      if (!task.cancelled) {
        count++;
      }
    }
    return count;
  }

  public synchronized boolean isClosed() {
    return closed;
  }

  @Override
  public synchronized void close() {
    closed = true;
    queue.clear();
  }

  private Cancellable enqueue(Runnable runnable, long deadline, long period) {
    Task task = new Task(runnable, deadline, period, sequence++);
    if (!closed) {
      queue.add(task);
    }
    return () -> {
      synchronized (ManualTimerService.this) {
        if (task.cancelled) {
          return false;
        }
        task.cancelled = true;
        queue.remove(task);
        return true;
      }
    };
  }

  private static final class Task implements Comparable<Task> {
    final Runnable runnable;
    final long period;
    long deadline;
    long seq;
    boolean cancelled;

    Task(Runnable runnable, long deadline, long period, long seq) {
      this.runnable = runnable;
      this.deadline = deadline;
      this.period = period;
      this.seq = seq;
    }

    @Override
    public int compareTo(Task other) {
      int byDeadline = Long.compare(deadline, other.deadline);
      return byDeadline != 0 ? byDeadline : Long.compare(seq, other.seq);
    }
  }
}
