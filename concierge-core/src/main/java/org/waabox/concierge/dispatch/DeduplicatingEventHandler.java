package org.waabox.concierge.dispatch;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.waabox.concierge.event.ChannelEvent;

/**
 * An {@link EventHandler} decorator that drops events whose id was already
 * delivered.
 *
 * <p>Remembers the most recent ids, up to a fixed capacity per channel.
 * Re-delivery after a takeover or a filter change usually overlaps only the
 * last few events, so a bounded window is enough.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class DeduplicatingEventHandler implements EventHandler {

  /** The default number of ids remembered per channel. */
  private static final int DEFAULT_CAPACITY = 1024;

  /** The decorated handler. */
  private final EventHandler delegate;

  /** The number of ids remembered per channel. */
  private final int capacity;

  /** The seen ids, per channel, in insertion order. */
  private final Map<String, Map<String, Boolean>> seen = new LinkedHashMap<>();

  /**
   * Creates a new handler remembering the default number of ids.
   *
   * @param theDelegate the handler to protect, never null
   */
  public DeduplicatingEventHandler(final EventHandler theDelegate) {
    this(theDelegate, DEFAULT_CAPACITY);
  }

  /**
   * Creates a new handler.
   *
   * @param theDelegate the handler to protect, never null
   * @param theCapacity the number of ids remembered per channel, positive
   */
  public DeduplicatingEventHandler(final EventHandler theDelegate,
      final int theCapacity) {
    delegate = Objects.requireNonNull(theDelegate,
        "delegate must not be null");
    if (theCapacity <= 0) {
      throw new IllegalArgumentException(
          "capacity must be greater than 0, got: " + theCapacity);
    }
    capacity = theCapacity;
  }

  /** {@inheritDoc} */
  @Override
  public void onEvents(final String channel,
      final List<ChannelEvent> events) {
    final List<ChannelEvent> fresh = new ArrayList<>(events.size());
    synchronized (seen) {
      final Map<String, Boolean> ids = seen.computeIfAbsent(channel,
          name -> new LinkedHashMap<>(16, 0.75f, false) {
            private static final long serialVersionUID = 1L;

            @Override
            protected boolean removeEldestEntry(
                final Map.Entry<String, Boolean> eldest) {
              return size() > capacity;
            }
          });
      for (final ChannelEvent event : events) {
        if (ids.putIfAbsent(event.id(), Boolean.TRUE) == null) {
          fresh.add(event);
        }
      }
    }
    if (!fresh.isEmpty()) {
      delegate.onEvents(channel, fresh);
    }
  }
}
