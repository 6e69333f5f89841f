package org.waabox.concierge.fanout;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The listeners of every topic of a {@link BroadcastTopic}.
 *
 * <p>Shared by the transport implementations. This class is thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class TopicListeners {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(TopicListeners.class);

  /** The listeners, keyed by topic. */
  private final Map<String, List<FanoutListener>> listeners =
      new ConcurrentHashMap<>();

  /**
   * Registers a listener.
   *
   * @param topic    the topic, never null
   * @param listener the listener, never null
   */
  public void add(final String topic, final FanoutListener listener) {
    Objects.requireNonNull(topic, "topic must not be null");
    Objects.requireNonNull(listener, "listener must not be null");
    listeners.computeIfAbsent(topic, t -> new CopyOnWriteArrayList<>())
        .add(listener);
  }

  /**
   * Removes a listener.
   *
   * @param topic    the topic, never null
   * @param listener the listener, never null
   */
  public void remove(final String topic, final FanoutListener listener) {
    Objects.requireNonNull(topic, "topic must not be null");
    final List<FanoutListener> list = listeners.get(topic);
    if (list != null) {
      list.remove(listener);
    }
  }

  /**
   * Delivers a message to the listeners of a topic.
   *
   * <p>A failing listener is logged and does not prevent delivery to the
   * others.
   *
   * @param topic   the topic, never null
   * @param message the message, never null
   * @return the number of listeners the message was handed to
   */
  public int deliver(final String topic, final FanoutMessage message) {
    final List<FanoutListener> list = listeners.get(topic);
    if (list == null) {
      return 0;
    }
    int count = 0;
    for (final FanoutListener listener : list) {
      count++;
      try {
        listener.onMessage(message);
      } catch (final Exception e) {
        log.error("Fanout listener threw exception for topic {}", topic, e);
      }
    }
    return count;
  }

  /**
   * Returns the number of listeners of a topic.
   *
   * @param topic the topic, never null
   * @return the listener count
   */
  public int count(final String topic) {
    final List<FanoutListener> list = listeners.get(topic);
    return list == null ? 0 : list.size();
  }
}
