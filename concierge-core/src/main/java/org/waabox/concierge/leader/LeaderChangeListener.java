package org.waabox.concierge.leader;

/**
 * A listener notified when this instance gains or loses the lease of a
 * channel scope.
 *
 * <p>The realtime channel uses it to switch between polling and listening
 * to the fanout.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface LeaderChangeListener {

  /**
   * Called on every transition into or out of {@link LeaderRole#LEADER}.
   *
   * @param isLeader {@code true} if this instance became the leader,
   *                 {@code false} if it lost leadership
   */
  void onLeaderChange(boolean isLeader);
}
