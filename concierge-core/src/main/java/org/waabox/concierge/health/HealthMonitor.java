package org.waabox.concierge.health;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Aggregates cycle outcomes of one channel into a {@link HealthSnapshot}.
 *
 * <p>Cycles may come from this instance polling or from events fanned out
 * by the leader; both count. The monitor has no influence on scheduling.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class HealthMonitor {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(HealthMonitor.class);

  /** The channel this monitor belongs to. */
  private final String channel;

  /** The clock used to timestamp outcomes. */
  private final Clock clock;

  /** The current snapshot. */
  private final AtomicReference<HealthSnapshot> current =
      new AtomicReference<>(HealthSnapshot.initial());

  /** The registered listeners. */
  private final List<HealthListener> listeners = new CopyOnWriteArrayList<>();

  /**
   * Creates a new monitor.
   *
   * @param theChannel the channel name, never null
   * @param theClock the clock, never null
   */
  public HealthMonitor(final String theChannel, final Clock theClock) {
    channel = Objects.requireNonNull(theChannel, "channel must not be null");
    clock = Objects.requireNonNull(theClock, "clock must not be null");
  }

  /** Records a cycle that delivered events. */
  public void recordEvents() {
    final Instant now = clock.instant();
    replace(new HealthSnapshot(true, now, now, 0));
  }

  /** Records a successful cycle without events. */
  public void recordEmpty() {
    final Instant now = clock.instant();
    final HealthSnapshot previous = current.get();
    replace(new HealthSnapshot(true, previous.lastEventAt(), now, 0));
  }

  /** Records a failed cycle. */
  public void recordFailure() {
    final HealthSnapshot previous = current.get();
    replace(new HealthSnapshot(false, previous.lastEventAt(),
        previous.lastSuccessAt(), previous.consecutiveFailures() + 1));
  }

  /** Marks the channel as not live without counting a failure. */
  public void markIdle() {
    final HealthSnapshot previous = current.get();
    if (previous.isLive()) {
      replace(new HealthSnapshot(false, previous.lastEventAt(),
          previous.lastSuccessAt(), previous.consecutiveFailures()));
    }
  }

  /**
   * Returns the current snapshot.
   *
   * @return the snapshot, never null
   */
  public HealthSnapshot snapshot() {
    return current.get();
  }

  /**
   * Registers a listener for new snapshots.
   *
   * @param listener the listener, never null
   */
  public void onHealth(final HealthListener listener) {
    Objects.requireNonNull(listener, "listener must not be null");
    listeners.add(listener);
  }

  /**
   * Swaps in a new snapshot and notifies the listeners.
   *
   * @param snapshot the new snapshot, never null
   */
  private void replace(final HealthSnapshot snapshot) {
    current.set(snapshot);
    for (final HealthListener listener : listeners) {
      try {
        listener.onHealth(channel, snapshot);
      } catch (final Exception e) {
        log.error("Health listener failed for channel '{}'", channel, e);
      }
    }
  }
}
