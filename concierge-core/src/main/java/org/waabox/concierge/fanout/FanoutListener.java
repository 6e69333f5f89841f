package org.waabox.concierge.fanout;

/**
 * A listener for messages published on a fanout topic.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface FanoutListener {

  /**
   * Called for every message received on the subscribed topic.
   *
   * <p>Messages published by the receiving instance itself are delivered
   * too; listeners filter them on {@link FanoutMessage#sender()}.
   *
   * @param message the received message, never null
   */
  void onMessage(FanoutMessage message);
}
