package org.waabox.concierge.health;

import java.time.Instant;

/**
 * A point-in-time view of the health of a realtime channel.
 *
 * <p>Snapshots are immutable; the {@link HealthMonitor} replaces the
 * current one after every cycle.
 *
 * @param isLive              whether the last cycle succeeded
 * @param lastEventAt         when events were last delivered, null if never
 * @param lastSuccessAt       when a cycle last succeeded, null if never
 * @param consecutiveFailures the number of failed cycles since the last
 *                            success
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record HealthSnapshot(
    boolean isLive,
    Instant lastEventAt,
    Instant lastSuccessAt,
    int consecutiveFailures
) {

  /**
   * Returns the snapshot of a channel that has not completed any cycle.
   *
   * @return the initial snapshot, never null
   */
  public static HealthSnapshot initial() {
    return new HealthSnapshot(false, null, null, 0);
  }
}
