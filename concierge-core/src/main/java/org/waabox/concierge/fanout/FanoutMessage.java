package org.waabox.concierge.fanout;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

import org.waabox.concierge.event.ChannelEvent;

/**
 * A message exchanged between the instances of a session.
 *
 * <p>{@link Kind#EVENTS} carries a batch polled by the leader together with
 * the cursor that batch advanced to. {@link Kind#HEARTBEAT} announces that
 * the sender holds the lease. {@link Kind#LOGOUT} tells every instance that
 * the session ended.
 *
 * @param kind   the message kind, never null
 * @param sender the instance id of the publisher, never null
 * @param at     the instant the message was published, never null
 * @param events the events, empty unless {@link Kind#EVENTS}, never null
 * @param cursor the cursor after the events, may be null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record FanoutMessage(Kind kind, String sender, Instant at,
    List<ChannelEvent> events, String cursor) {

  /** The message kinds. */
  public enum Kind {
    /** A batch of events polled by the leader. */
    EVENTS,
    /** A leadership announcement. */
    HEARTBEAT,
    /** The end of the session. */
    LOGOUT
  }

  /** Validates the message. */
  public FanoutMessage {
    Objects.requireNonNull(kind, "kind must not be null");
    Objects.requireNonNull(sender, "sender must not be null");
    Objects.requireNonNull(at, "at must not be null");
    events = events == null ? List.of() : List.copyOf(events);
  }

  /**
   * Creates an events message.
   *
   * @param sender the publisher, never null
   * @param at     the publication instant, never null
   * @param events the batch, never null
   * @param cursor the cursor after the batch, may be null
   * @return the message, never null
   */
  public static FanoutMessage events(final String sender, final Instant at,
      final List<ChannelEvent> events, final String cursor) {
    return new FanoutMessage(Kind.EVENTS, sender, at, events, cursor);
  }

  /**
   * Creates a heartbeat message.
   *
   * @param sender the publisher, never null
   * @param at     the heartbeat instant, never null
   * @return the message, never null
   */
  public static FanoutMessage heartbeat(final String sender,
      final Instant at) {
    return new FanoutMessage(Kind.HEARTBEAT, sender, at, List.of(), null);
  }

  /**
   * Creates a logout message.
   *
   * @param sender the publisher, never null
   * @param at     the publication instant, never null
   * @return the message, never null
   */
  public static FanoutMessage logout(final String sender, final Instant at) {
    return new FanoutMessage(Kind.LOGOUT, sender, at, List.of(), null);
  }
}
