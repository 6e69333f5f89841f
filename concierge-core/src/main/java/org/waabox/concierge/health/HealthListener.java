package org.waabox.concierge.health;

/**
 * Receives every new health snapshot of a channel, typically to drive a
 * "live" indicator.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface HealthListener {

  /**
   * Called after the snapshot of a channel was replaced.
   *
   * @param channel  the channel name, never null
   * @param snapshot the new snapshot, never null
   */
  void onHealth(String channel, HealthSnapshot snapshot);
}
