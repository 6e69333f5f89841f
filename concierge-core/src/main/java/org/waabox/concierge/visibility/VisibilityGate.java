package org.waabox.concierge.visibility;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tracks whether this process is in the foreground.
 *
 * <p>Channels stop scheduling cycles while the process is in the background
 * and cancel the request in flight. Foreground transitions resume them
 * immediately, but repeated foreground triggers inside the debounce window
 * are ignored so that focus/blur storms do not restart polling over and
 * over.
 *
 * <p>A gate starts in the foreground. This class is thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class VisibilityGate {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(VisibilityGate.class);

  /** The clock used for the debounce and background duration. */
  private final Clock clock;

  /** The window in which repeated foreground triggers are ignored. */
  private final Duration debounce;

  /** The registered listeners. */
  private final List<VisibilityListener> listeners =
      new CopyOnWriteArrayList<>();

  /** Whether the process is in the foreground. */
  private boolean foreground = true;

  /** When the process went to background, null while in foreground. */
  private Instant backgroundedAt;

  /** When the last foreground trigger was accepted. */
  private Instant lastResumeAt;

  /**
   * Creates a new gate.
   *
   * @param theClock the clock, never null
   * @param theDebounce the foreground debounce window, never null
   */
  public VisibilityGate(final Clock theClock, final Duration theDebounce) {
    clock = Objects.requireNonNull(theClock, "clock must not be null");
    debounce = Objects.requireNonNull(theDebounce,
        "debounce must not be null");
  }

  /**
   * Moves the process to the background.
   *
   * <p>Has no effect if it is already in the background.
   */
  public void background() {
    synchronized (this) {
      if (!foreground) {
        return;
      }
      foreground = false;
      backgroundedAt = clock.instant();
    }
    log.debug("Process moved to background");
    notifyListeners(false);
  }

  /**
   * Signals a foreground trigger.
   *
   * <p>The gate always records the foreground state, but listeners are only
   * notified if the previous accepted trigger is older than the debounce
   * window. Channels pick up a debounced resume on their next parked
   * check.
   *
   * @return true if the trigger was accepted and listeners were notified
   */
  public boolean foreground() {
    synchronized (this) {
      if (foreground) {
        return false;
      }
      foreground = true;
      backgroundedAt = null;
      final Instant now = clock.instant();
      if (lastResumeAt != null
          && Duration.between(lastResumeAt, now).compareTo(debounce) < 0) {
        log.debug("Foreground trigger debounced");
        return false;
      }
      lastResumeAt = now;
    }
    log.debug("Process moved to foreground");
    notifyListeners(true);
    return true;
  }

  /**
   * Returns whether the process is in the foreground.
   *
   * @return true while in the foreground
   */
  public synchronized boolean isForeground() {
    return foreground;
  }

  /**
   * Returns for how long the process has been in the background.
   *
   * @return the background duration, {@link Duration#ZERO} while in the
   *         foreground, never null
   */
  public synchronized Duration backgroundedFor() {
    if (foreground || backgroundedAt == null) {
      return Duration.ZERO;
    }
    return Duration.between(backgroundedAt, clock.instant());
  }

  /**
   * Returns the window in which repeated foreground triggers are ignored.
   *
   * @return the debounce, never null
   */
  public Duration debounce() {
    return debounce;
  }

  /**
   * Registers a listener.
   *
   * @param listener the listener, never null
   */
  public void onVisibilityChange(final VisibilityListener listener) {
    Objects.requireNonNull(listener, "listener must not be null");
    listeners.add(listener);
  }

  /**
   * Removes a listener.
   *
   * @param listener the listener to remove, never null
   */
  public void removeListener(final VisibilityListener listener) {
    listeners.remove(listener);
  }

  /**
   * Notifies the listeners of a transition.
   *
   * @param isForeground the new state
   */
  private void notifyListeners(final boolean isForeground) {
    for (final VisibilityListener listener : listeners) {
      try {
        listener.onVisibilityChange(isForeground);
      } catch (final Exception e) {
        log.error("Error notifying visibility listener", e);
      }
    }
  }
}
