package org.waabox.concierge.event;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A server-side change notification delivered on a realtime channel.
 *
 * <p>The {@code id} is unique and ordered within a channel. Delivery is
 * at-least-once, so consumers must apply events idempotently on the id.
 *
 * @param id        the event identifier, unique within the channel, never
 *                  null
 * @param type      the event type (e.g. {@code transaction_created}),
 *                  never null
 * @param entityId  the identifier of the entity that changed, may be null
 * @param timestamp the instant the change happened on the server, never
 *                  null
 * @param metadata  free-form event attributes, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record ChannelEvent(
    String id,
    String type,
    String entityId,
    Instant timestamp,
    Map<String, Object> metadata
) {

  /** Validates the mandatory fields and freezes the metadata. */
  public ChannelEvent {
    Objects.requireNonNull(id, "id must not be null");
    Objects.requireNonNull(type, "type must not be null");
    Objects.requireNonNull(timestamp, "timestamp must not be null");
    metadata = metadata == null ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }
}
