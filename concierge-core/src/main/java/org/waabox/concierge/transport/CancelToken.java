package org.waabox.concierge.transport;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A one-shot cancellation signal for a single poll cycle.
 *
 * <p>Callbacks registered through {@link #onCancel(Runnable)} run once when
 * the token is cancelled, or immediately if it was already cancelled.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class CancelToken {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(CancelToken.class);

  /** Whether the token has been cancelled. */
  private final AtomicBoolean cancelled = new AtomicBoolean(false);

  /** The callbacks to run on cancellation. */
  private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

  /**
   * Cancels the token and runs the registered callbacks.
   *
   * <p>Calling this method more than once has no further effect.
   */
  public void cancel() {
    if (!cancelled.compareAndSet(false, true)) {
      return;
    }
    for (final Runnable callback : callbacks) {
      run(callback);
    }
  }

  /**
   * Returns whether the token has been cancelled.
   *
   * @return true once {@link #cancel()} was called
   */
  public boolean isCancelled() {
    return cancelled.get();
  }

  /**
   * Registers a callback to run on cancellation.
   *
   * @param callback the callback, never null
   */
  public void onCancel(final Runnable callback) {
    Objects.requireNonNull(callback, "callback must not be null");
    callbacks.add(callback);
    if (cancelled.get() && callbacks.remove(callback)) {
      run(callback);
    }
  }

  /**
   * Runs a callback, logging any failure.
   *
   * @param callback the callback to run
   */
  private static void run(final Runnable callback) {
    try {
      callback.run();
    } catch (final RuntimeException e) {
      log.error("Error running cancel callback", e);
    }
  }
}
