package org.waabox.concierge.fanout;

import java.util.Objects;

/**
 * A {@link BroadcastTopic} that delivers messages synchronously inside the
 * current JVM.
 *
 * <p>It is the default topic of a {@code Concierge} and is useful when
 * every instance of a session runs in the same process, as in tests.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class InMemoryBroadcastTopic implements BroadcastTopic {

  /** The listeners per topic. */
  private final TopicListeners listeners = new TopicListeners();

  /** {@inheritDoc} */
  @Override
  public void publish(final String topic, final FanoutMessage message) {
    Objects.requireNonNull(topic, "topic must not be null");
    Objects.requireNonNull(message, "message must not be null");
    listeners.deliver(topic, message);
  }

  /** {@inheritDoc} */
  @Override
  public void subscribe(final String topic, final FanoutListener listener) {
    listeners.add(topic, listener);
  }

  /** {@inheritDoc} */
  @Override
  public void unsubscribe(final String topic, final FanoutListener listener) {
    listeners.remove(topic, listener);
  }

  /** {@inheritDoc} */
  @Override
  public void start() {
    // Nothing to open in memory.
  }

  /** {@inheritDoc} */
  @Override
  public void stop() {
    // Nothing to release in memory.
  }
}
