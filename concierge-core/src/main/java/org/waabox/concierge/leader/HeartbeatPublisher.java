package org.waabox.concierge.leader;

import java.time.Instant;

/**
 * Announces that the leader is alive.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface HeartbeatPublisher {

  /**
   * Publishes a heartbeat.
   *
   * @param at the instant of the heartbeat, never null
   */
  void publishHeartbeat(Instant at);
}
