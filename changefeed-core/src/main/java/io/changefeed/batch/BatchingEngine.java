package io.changefeed.batch;

import io.changefeed.ChangeListener;
import io.changefeed.model.ChangeBatch;
import io.changefeed.model.ChangeEvent;
import io.changefeed.model.Delivery;
import io.changefeed.model.PriorityTier;
import io.changefeed.model.TierSettings;
import io.changefeed.spi.Cancellable;
import io.changefeed.spi.ErrorHandler;
import io.changefeed.spi.MetricsExporter;
import io.changefeed.spi.TimerService;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Per-channel accumulation of change events with a debounce timer and a batch-size
 * threshold.
 *
 * <p>Each event restarts the channel's debounce timer; the queue is flushed when the
 * timer fires or as soon as it reaches the tier's max batch size. A flush of one event
 * delivers the event itself, a flush of more delivers a {@link ChangeBatch}.
 *
 * <p>The queue and timer are cleared under the engine lock before the listener is
 * invoked, so every event is delivered exactly once and a listener may safely call
 * back into the engine. Superseded timers carry a stale generation and do nothing
 * when they fire.
 *
 * <p>Each channel's listener runs under that channel's own monitor. {@link #clear}
 * takes the monitor after detaching, so it returns only once a delivery running on
 * another thread has finished.
 */
public final class BatchingEngine {
  private static final Logger logger = Logger.getLogger(BatchingEngine.class.getName());

  private final TimerService timer;
  private final MetricsExporter metrics;
  private final ErrorHandler errorHandler;
  private final Map<String, Channel> channels = new HashMap<>();

  public BatchingEngine(TimerService timer, MetricsExporter metrics, ErrorHandler errorHandler) {
    this.timer = Objects.requireNonNull(timer, "timer");
    this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
    this.errorHandler = errorHandler != null ? errorHandler : ErrorHandler.NOOP;
  }

  /**
   * Registers a channel, replacing (and discarding the queue of) any channel with the
   * same name.
   *
   * @param channelName channel name
   * @param tier        priority tier, reported with flush metrics
   * @param settings    debounce interval and batch size
   * @param listener    receives flushed deliveries
   */
  public void register(String channelName, PriorityTier tier, TierSettings settings, ChangeListener listener) {
    Objects.requireNonNull(channelName, "channelName");
    Channel channel = new Channel(channelName,
        Objects.requireNonNull(tier, "tier"),
        Objects.requireNonNull(settings, "settings"),
        Objects.requireNonNull(listener, "listener"));
    synchronized (this) {
      Channel previous = channels.put(channelName, channel);
      if (previous != null) {
        previous.drain();
        previous.detached = true;
      }
    }
  }

  /**
   * Queues an event for a registered channel. Events for unknown channels are dropped.
   *
   * @param channelName channel name
   * @param event       the event
   */
  public void onEvent(String channelName, ChangeEvent event) {
    Objects.requireNonNull(event, "event");
    Channel channel;
    List<ChangeEvent> drained = null;
    synchronized (this) {
      channel = channels.get(channelName);
      if (channel == null) {
        logger.log(Level.FINE, "Dropping event for unregistered channel {0}", channelName);
        return;
      }
      channel.queue.add(event);
      if (channel.queue.size() >= channel.settings.maxBatchSize()) {
        drained = channel.drain();
      } else {
        channel.cancelTimer();
        long generation = ++channel.generation;
        Channel scheduled = channel;
        channel.flushTimer = timer.schedule(
            () -> onTimer(scheduled, generation), channel.settings.debounceMs());
      }
    }
    if (drained != null) {
      deliver(channel, drained, true);
    }
  }

  /**
   * Flushes a channel now, regardless of its timer.
   *
   * @param channelName channel name
   * @return {@code true} if anything was delivered
   */
  public boolean flush(String channelName) {
    Channel channel;
    List<ChangeEvent> drained;
    synchronized (this) {
      channel = channels.get(channelName);
      if (channel == null || channel.queue.isEmpty()) {
        return false;
      }
      drained = channel.drain();
    }
    deliver(channel, drained, false);
    return true;
  }

  /**
   * Cancels the channel's timer, drops its queue and detaches its listener.
   *
   * <p>When this returns the listener is not running and will not be called again,
   * unless this is called from that listener itself, which then finishes normally.
   * Must not be called while holding a lock the listener may take.
   *
   * @param channelName channel name
   * @return number of queued events discarded
   */
  public int clear(String channelName) {
    Channel channel;
    int discarded;
    synchronized (this) {
      channel = channels.remove(channelName);
      if (channel == null) {
        return 0;
      }
      discarded = channel.drain().size();
      channel.detached = true;
    }
    channel.awaitIdle();
    if (discarded > 0) {
      logger.log(Level.FINE, "Discarded {0} queued events for channel {1}",
          new Object[]{discarded, channelName});
    }
    return discarded;
  }

  /** Clears every channel, waiting for running listeners like {@link #clear}. */
  public void clearAll() {
    List<Channel> removed;
    synchronized (this) {
      removed = new ArrayList<>(channels.values());
      channels.clear();
      for (Channel channel : removed) {
        channel.drain();
        channel.detached = true;
      }
    }
    for (Channel channel : removed) {
      channel.awaitIdle();
    }
  }

  public synchronized int pendingCount(String channelName) {
    Channel channel = channels.get(channelName);
    return channel == null ? 0 : channel.queue.size();
  }

  public synchronized boolean isRegistered(String channelName) {
    return channels.containsKey(channelName);
  }

  public synchronized int channelCount() {
    return channels.size();
  }

  private void onTimer(Channel channel, long generation) {
    List<ChangeEvent> drained;
    synchronized (this) {
      if (channels.get(channel.name) != channel || channel.generation != generation) {
        return;
      }
      channel.flushTimer = null;
      drained = channel.drain();
    }
    deliver(channel, drained, false);
  }

  private void deliver(Channel channel, List<ChangeEvent> events, boolean sizeTriggered) {
    if (events.isEmpty()) {
      return;
    }
    Delivery delivery = events.size() == 1 ? events.get(0) : new ChangeBatch(events);
    synchronized (channel) {
      if (channel.detached) {
        return;
      }
      try {
        channel.listener.onChange(delivery);
      } catch (Exception e) {
        metrics.incrementListenerFailures();
        logger.log(Level.WARNING, "Listener failed on channel " + channel.name, e);
        errorHandler.onListenerError(channel.name, e);
      }
    }
    metrics.recordFlush(channel.tier, events.size(), sizeTriggered);
  }

  private static final class Channel {
    final String name;
    final PriorityTier tier;
    final TierSettings settings;
    final ChangeListener listener;
    final List<ChangeEvent> queue = new ArrayList<>();
    Cancellable flushTimer;
    long generation;
    volatile boolean detached;

    Channel(String name, PriorityTier tier, TierSettings settings, ChangeListener listener) {
      this.name = name;
      this.tier = tier;
      this.settings = settings;
      this.listener = listener;
    }

    void cancelTimer() {
      if (flushTimer != null) {
        flushTimer.cancel();
        flushTimer = null;
      }
    }

    /** Blocks until a listener call running on another thread returns. */
    void awaitIdle() {
      synchronized (this) {
        // acquiring the monitor is the wait
      }
    }

    /** Cancels the timer, invalidates in-flight timers and empties the queue. */
    List<ChangeEvent> drain() {
      cancelTimer();
      generation++;
      List<ChangeEvent> drained = new ArrayList<>(queue);
      queue.clear();
      return drained;
    }
  }
}
