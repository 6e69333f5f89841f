package org.waabox.concierge.transport;

import java.util.List;

import org.waabox.concierge.event.ChannelEvent;

/**
 * A parsed response of the subscribe endpoint.
 *
 * <p>An empty event list is a heartbeat. The cursor may be null when the
 * server did not send one, in which case the caller keeps its own.
 *
 * @param events the events, in server order, never null
 * @param cursor the new cursor, may be null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record SubscribeResponse(List<ChannelEvent> events, String cursor) {

  /** Copies the event list. */
  public SubscribeResponse {
    events = events == null ? List.of() : List.copyOf(events);
  }
}
