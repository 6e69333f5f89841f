package org.waabox.concierge.fanout;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.waabox.concierge.event.ChannelEvent;

/**
 * Static utility class for serializing and deserializing
 * {@link TopicMessage} instances to and from JSON strings.
 *
 * <p>Uses Jackson's tree model. {@link Instant} values are stored as
 * ISO-8601 strings.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class FanoutMessageCodec {

  /** Shared ObjectMapper for tree model operations. */
  private static final ObjectMapper MAPPER = new ObjectMapper();

  /** The metadata map type. */
  private static final TypeReference<LinkedHashMap<String, Object>>
      METADATA_TYPE = new TypeReference<>() { };

  /** Private constructor to prevent instantiation. */
  private FanoutMessageCodec() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Serializes a message published on a topic.
   *
   * @param topic   the topic name, never null
   * @param message the message, never null
   * @return the JSON representation, never null
   */
  public static String serialize(final String topic,
      final FanoutMessage message) {
    Objects.requireNonNull(topic, "topic must not be null");
    Objects.requireNonNull(message, "message must not be null");

    final ObjectNode node = MAPPER.createObjectNode();
    node.put("topic", topic);
    node.put("kind", message.kind().name());
    node.put("sender", message.sender());
    node.put("at", message.at().toString());
    if (message.cursor() != null) {
      node.put("cursor", message.cursor());
    }
    final ArrayNode events = node.putArray("events");
    for (final ChannelEvent event : message.events()) {
      final ObjectNode eventNode = events.addObject();
      eventNode.put("id", event.id());
      eventNode.put("type", event.type());
      if (event.entityId() != null) {
        eventNode.put("entityId", event.entityId());
      }
      eventNode.put("timestamp", event.timestamp().toString());
      eventNode.set("metadata", MAPPER.valueToTree(event.metadata()));
    }
    return node.toString();
  }

  /**
   * Deserializes a message.
   *
   * @param json the JSON string to parse, never null
   * @return the topic and message, never null
   * @throws IllegalArgumentException if the JSON is malformed or missing
   *     required fields
   */
  public static TopicMessage deserialize(final String json) {
    Objects.requireNonNull(json, "json must not be null");

    try {
      final JsonNode node = MAPPER.readTree(json);
      final String topic = requireField(node, "topic").asText();
      final FanoutMessage.Kind kind = FanoutMessage.Kind.valueOf(
          requireField(node, "kind").asText());
      final String sender = requireField(node, "sender").asText();
      final Instant at = Instant.parse(requireField(node, "at").asText());
      final JsonNode cursorNode = node.get("cursor");
      final String cursor = cursorNode == null || cursorNode.isNull()
          ? null : cursorNode.asText();

      final List<ChannelEvent> events = new ArrayList<>();
      final JsonNode eventsNode = node.get("events");
      if (eventsNode != null && eventsNode.isArray()) {
        for (final JsonNode eventNode : eventsNode) {
          events.add(toEvent(eventNode));
        }
      }
      return new TopicMessage(topic,
          new FanoutMessage(kind, sender, at, events, cursor));
    } catch (final IllegalArgumentException e) {
      throw e;
    } catch (final Exception e) {
      throw new IllegalArgumentException(
          "Failed to deserialize FanoutMessage from JSON: " + json, e);
    }
  }

  /**
   * Converts one event node.
   *
   * @param node the event node
   * @return the event, never null
   */
  private static ChannelEvent toEvent(final JsonNode node) {
    final JsonNode entity = node.get("entityId");
    final JsonNode metadataNode = node.get("metadata");
    final Map<String, Object> metadata = metadataNode == null
        || !metadataNode.isObject()
        ? Map.of() : MAPPER.convertValue(metadataNode, METADATA_TYPE);
    return new ChannelEvent(
        requireField(node, "id").asText(),
        requireField(node, "type").asText(),
        entity == null || entity.isNull() ? null : entity.asText(),
        Instant.parse(requireField(node, "timestamp").asText()),
        metadata);
  }

  /**
   * Returns the field node for the given key or throws if missing.
   *
   * @param node the parent JSON node.
   * @param field the field name to look up.
   * @return the field node, never null.
   * @throws IllegalArgumentException if the field is missing.
   */
  private static JsonNode requireField(final JsonNode node,
      final String field) {
    final JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      throw new IllegalArgumentException(
          "Missing field: " + field + " in JSON: " + node);
    }
    return value;
  }
}
