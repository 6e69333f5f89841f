package org.waabox.concierge.transport;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.waabox.concierge.event.ChannelEvent;

/**
 * Parses the JSON body of the subscribe endpoint.
 *
 * <p>The expected shape is {@code {"events": [...], "cursor": "..."}}. Older
 * endpoints send the cursor as {@code lastEventId}, which is accepted when
 * {@code cursor} is absent. Events may name their fields {@code id} or
 * {@code eventId}, and {@code type} or {@code eventType}. A blank body is an
 * empty heartbeat.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class SubscribeResponseCodec {

  /** Shared ObjectMapper for tree model operations. */
  private static final ObjectMapper MAPPER = new ObjectMapper();

  /** Private constructor to prevent instantiation. */
  private SubscribeResponseCodec() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Parses a response body.
   *
   * @param body the raw body, never null
   * @return the parsed response, never null
   * @throws MalformedResponseException if the body is not a valid response
   */
  public static SubscribeResponse parse(final String body) {
    Objects.requireNonNull(body, "body must not be null");
    if (body.isBlank()) {
      return new SubscribeResponse(List.of(), null);
    }

    final JsonNode root;
    try {
      root = MAPPER.readTree(body);
    } catch (final JsonProcessingException e) {
      throw new MalformedResponseException(
          "Subscribe response is not valid JSON", e);
    }
    if (root == null || !root.isObject()) {
      throw new MalformedResponseException(
          "Subscribe response is not a JSON object");
    }

    final List<ChannelEvent> events = new ArrayList<>();
    final JsonNode eventsNode = root.get("events");
    if (eventsNode != null && !eventsNode.isNull()) {
      if (!eventsNode.isArray()) {
        throw new MalformedResponseException("events must be an array");
      }
      for (final JsonNode eventNode : eventsNode) {
        events.add(toEvent(eventNode));
      }
    }

    return new SubscribeResponse(events, cursorOf(root));
  }

  /**
   * Reads the cursor, falling back to the legacy field name.
   *
   * @param root the response object
   * @return the cursor, null if none was sent
   */
  private static String cursorOf(final JsonNode root) {
    JsonNode cursor = root.get("cursor");
    if (cursor == null || cursor.isNull()) {
      cursor = root.get("lastEventId");
    }
    if (cursor == null || cursor.isNull()) {
      return null;
    }
    if (!cursor.isValueNode()) {
      throw new MalformedResponseException("cursor must be a scalar value");
    }
    return cursor.asText();
  }

  /**
   * Converts one event node.
   *
   * @param node the event node
   * @return the event, never null
   */
  private static ChannelEvent toEvent(final JsonNode node) {
    if (!node.isObject()) {
      throw new MalformedResponseException("event must be a JSON object");
    }
    final String id = requireText(node, "id", "eventId");
    final String type = requireText(node, "type", "eventType");
    final JsonNode entity = node.get("entityId");
    final String entityId = entity == null || entity.isNull()
        ? null : entity.asText();

    final Instant timestamp;
    try {
      timestamp = Instant.parse(requireText(node, "timestamp", "timestamp"));
    } catch (final DateTimeParseException e) {
      throw new MalformedResponseException(
          "Invalid event timestamp for event " + id, e);
    }

    final Map<String, Object> metadata = new LinkedHashMap<>();
    final JsonNode metadataNode = node.get("metadata");
    if (metadataNode != null && metadataNode.isObject()) {
      final Iterator<Map.Entry<String, JsonNode>> fields =
          metadataNode.fields();
      while (fields.hasNext()) {
        final Map.Entry<String, JsonNode> field = fields.next();
        metadata.put(field.getKey(),
            MAPPER.convertValue(field.getValue(), Object.class));
      }
    }
    return new ChannelEvent(id, type, entityId, timestamp, metadata);
  }

  /**
   * Returns the text of the first present field or throws.
   *
   * @param node the parent node
   * @param field the preferred field name
   * @param fallback the legacy field name
   * @return the text value, never null
   */
  private static String requireText(final JsonNode node, final String field,
      final String fallback) {
    JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      value = node.get(fallback);
    }
    if (value == null || value.isNull() || !value.isValueNode()) {
      throw new MalformedResponseException(
          "Missing field: " + field + " in event: " + node);
    }
    return value.asText();
  }
}
