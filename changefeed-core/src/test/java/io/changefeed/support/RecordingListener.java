package io.changefeed.support;

import io.changefeed.ChangeListener;
import io.changefeed.model.Delivery;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link ChangeListener} that records deliveries and the virtual time they arrived at.
 */
public final class RecordingListener implements ChangeListener {

  public final List<Delivery> deliveries = new ArrayList<>();
  public final List<Long> times = new ArrayList<>();
  private final ManualTimerService timer;

  public RecordingListener(ManualTimerService timer) {
    this.timer = timer;
  }

  @Override
  public synchronized void onChange(Delivery delivery) {
    deliveries.add(delivery);
    times.add(timer.currentTimeMillis());
  }

  public synchronized int count() {
    return deliveries.size();
  }

  public synchronized Delivery last() {
    return deliveries.get(deliveries.size() - 1);
  }
}
