package org.waabox.concierge.backoff;

/**
 * The outcome of a poll cycle, as seen by the {@link BackoffPolicy}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum CycleOutcome {

  /** The server returned at least one event. */
  SUCCESS_WITH_EVENTS,

  /** The server returned no events (heartbeat or fast empty). */
  SUCCESS_EMPTY,

  /** The request failed. */
  ERROR
}
