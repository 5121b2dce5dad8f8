package io.changefeed.pool;

import io.changefeed.model.EventKind;
import io.changefeed.model.PriorityTier;
import io.changefeed.model.SubscriptionSpec;
import io.changefeed.spi.FeedSubscription;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * One live backend subscription and the channels fanned out from it.
 * Guarded by the owning {@link ConnectionPool}'s lock, except {@link #observers}
 * which is safe to iterate without it.
 */
final class PooledConnection {
  final String channelName;
  final String poolKey;
  final String table;
  final PriorityTier tier;
  final List<Observer> observers = new CopyOnWriteArrayList<>();

  FeedSubscription subscription;
  int refCount;
  long lastActivity;
  int errorCount;
  long messageCount;
  boolean closed;

  PooledConnection(String channelName, SubscriptionSpec spec, long now) {
    this.channelName = channelName;
    this.poolKey = spec.poolKey();
    this.table = spec.table();
    this.tier = spec.priority();
    this.lastActivity = now;
  }

  Observer find(String channel) {
    for (Observer observer : observers) {
      if (observer.channelName.equals(channel)) {
        return observer;
      }
    }
    return null;
  }

  ConnectionMetrics snapshot() {
    List<String> channels = new ArrayList<>(observers.size());
    for (Observer observer : observers) {
      channels.add(observer.channelName);
    }
    return new ConnectionMetrics(channelName, poolKey, tier, refCount, lastActivity, errorCount,
        messageCount, List.copyOf(channels));
  }

  /** A channel attached to this connection. */
  static final class Observer {
    final String channelName;
    final EventKind eventKind;

    Observer(String channelName, EventKind eventKind) {
      this.channelName = channelName;
      this.eventKind = eventKind;
    }
  }
}
