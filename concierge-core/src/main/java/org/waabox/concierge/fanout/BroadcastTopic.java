package org.waabox.concierge.fanout;

/**
 * A best-effort publish/subscribe channel between the instances of a
 * session.
 *
 * <p>Messages are not persisted and may be lost or duplicated; the protocol
 * recovers through the lease store and the cursor. Implementations define
 * how messages travel (in memory, HTTP, Kafka) and manage the lifecycle of
 * the underlying transport.
 *
 * <p>Typical lifecycle:
 * <ol>
 *   <li>Register listeners via {@link #subscribe(String, FanoutListener)}</li>
 *   <li>Call {@link #start()} to begin receiving messages</li>
 *   <li>Publish messages via {@link #publish(String, FanoutMessage)}</li>
 *   <li>Call {@link #stop()} to shut down the transport</li>
 * </ol>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface BroadcastTopic {

  /**
   * Publishes a message on a topic.
   *
   * @param topic   the topic name, never null
   * @param message the message, never null
   */
  void publish(String topic, FanoutMessage message);

  /**
   * Registers a listener on a topic.
   *
   * @param topic    the topic name, never null
   * @param listener the listener, never null
   */
  void subscribe(String topic, FanoutListener listener);

  /**
   * Removes a listener from a topic.
   *
   * @param topic    the topic name, never null
   * @param listener the listener, never null
   */
  void unsubscribe(String topic, FanoutListener listener);

  /** Starts the transport, enabling message reception. */
  void start();

  /**
   * Stops the transport and releases associated resources.
   *
   * <p>After this method returns, no further messages are delivered.
   */
  void stop();
}
