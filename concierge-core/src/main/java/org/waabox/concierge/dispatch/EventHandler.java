package org.waabox.concierge.dispatch;

import java.util.List;

import org.waabox.concierge.event.ChannelEvent;

/**
 * A domain consumer of realtime events.
 *
 * <p>Handlers decide what an event means for their data: invalidate a
 * cached query, patch a row, ignore it. Batches arrive in cursor order but
 * may repeat events already seen, so handlers must be idempotent on the
 * event id (see {@link DeduplicatingEventHandler}).
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface EventHandler {

  /**
   * Called with an ordered batch of events of a channel.
   *
   * @param channel the channel name, never null
   * @param events  the batch, never null or empty
   */
  void onEvents(String channel, List<ChannelEvent> events);
}
