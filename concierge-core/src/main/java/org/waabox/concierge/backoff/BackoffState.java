package org.waabox.concierge.backoff;

import java.time.Duration;

/**
 * The delay a channel waits before its next poll cycle.
 *
 * @param currentDelayMs the delay in milliseconds, never negative
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record BackoffState(long currentDelayMs) {

  /** Rejects negative delays. */
  public BackoffState {
    if (currentDelayMs < 0) {
      throw new IllegalArgumentException(
          "currentDelayMs must not be negative, got: " + currentDelayMs);
    }
  }

  /**
   * Returns the delay as a {@link Duration}.
   *
   * @return the current delay, never null
   */
  public Duration currentDelay() {
    return Duration.ofMillis(currentDelayMs);
  }
}
