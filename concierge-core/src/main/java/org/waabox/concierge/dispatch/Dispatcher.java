package org.waabox.concierge.dispatch;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.concierge.event.ChannelEvent;

/**
 * Delivers event batches to the local subscribers of a channel.
 *
 * <p>Batches are handed to every handler in the order they are dispatched.
 * The dispatcher performs no deduplication. A failing handler is logged and
 * does not prevent the others from receiving the batch.
 *
 * <p>This class is thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class Dispatcher {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);

  /** The handlers, keyed by channel name. */
  private final Map<String, List<EventHandler>> handlers =
      new ConcurrentHashMap<>();

  /**
   * Subscribes a handler to a channel.
   *
   * @param channel the channel name, never null
   * @param handler the handler, never null
   */
  public void subscribe(final String channel, final EventHandler handler) {
    Objects.requireNonNull(channel, "channel must not be null");
    Objects.requireNonNull(handler, "handler must not be null");
    handlers.computeIfAbsent(channel, name -> new CopyOnWriteArrayList<>())
        .add(handler);
  }

  /**
   * Unsubscribes a handler from a channel.
   *
   * @param channel the channel name, never null
   * @param handler the handler to remove, never null
   *
   * @return true if the handler was subscribed
   */
  public boolean unsubscribe(final String channel,
      final EventHandler handler) {
    Objects.requireNonNull(channel, "channel must not be null");
    Objects.requireNonNull(handler, "handler must not be null");
    final List<EventHandler> list = handlers.get(channel);
    return list != null && list.remove(handler);
  }

  /**
   * Delivers a batch to the handlers of a channel.
   *
   * <p>Empty batches are not delivered.
   *
   * @param channel the channel name, never null
   * @param events  the batch, in cursor order, never null
   */
  public void dispatch(final String channel,
      final List<ChannelEvent> events) {
    Objects.requireNonNull(channel, "channel must not be null");
    Objects.requireNonNull(events, "events must not be null");
    if (events.isEmpty()) {
      return;
    }
    final List<EventHandler> list = handlers.get(channel);
    if (list == null || list.isEmpty()) {
      log.debug("No handlers for channel '{}', dropping {} event(s)",
          channel, events.size());
      return;
    }
    final List<ChannelEvent> batch = List.copyOf(events);
    for (final EventHandler handler : list) {
      try {
        handler.onEvents(channel, batch);
      } catch (final Exception e) {
        log.error("Event handler threw exception for channel '{}'",
            channel, e);
      }
    }
  }

  /**
   * Returns the number of handlers subscribed to a channel.
   *
   * @param channel the channel name, never null
   *
   * @return the handler count
   */
  public int handlerCount(final String channel) {
    final List<EventHandler> list = handlers.get(channel);
    return list == null ? 0 : list.size();
  }
}
