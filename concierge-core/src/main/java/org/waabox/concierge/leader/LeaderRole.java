package org.waabox.concierge.leader;

/**
 * The role of an instance for one channel scope.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum LeaderRole {

  /** The instance has not taken part in an election yet. */
  UNLEASED,

  /** The instance holds the lease and polls on behalf of the session. */
  LEADER,

  /** Another instance holds the lease; this one listens to the fanout. */
  FOLLOWER
}
