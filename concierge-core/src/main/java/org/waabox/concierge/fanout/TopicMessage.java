package org.waabox.concierge.fanout;

import java.util.Objects;

/**
 * A fanout message together with the topic it was published on, as it
 * travels over a wire transport.
 *
 * @param topic   the topic name, never null
 * @param message the message, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record TopicMessage(String topic, FanoutMessage message) {

  /** Validates the envelope. */
  public TopicMessage {
    Objects.requireNonNull(topic, "topic must not be null");
    Objects.requireNonNull(message, "message must not be null");
  }
}
