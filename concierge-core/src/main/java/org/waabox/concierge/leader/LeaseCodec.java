package org.waabox.concierge.leader;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts {@link Lease} instances to and from their stored JSON form,
 * {@code {"owner": "...", "expiresAt": <epoch millis>}}.
 *
 * <p>Stored values that cannot be read are reported as absent: a corrupt
 * lease is as good as no lease and may be taken over.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class LeaseCodec {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(LeaseCodec.class);

  /** Shared ObjectMapper for tree model operations. */
  private static final ObjectMapper MAPPER = new ObjectMapper();

  /** Private constructor to prevent instantiation. */
  private LeaseCodec() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Serializes a lease.
   *
   * @param lease the lease, never null
   * @return the JSON value, never null
   */
  public static String serialize(final Lease lease) {
    Objects.requireNonNull(lease, "lease must not be null");
    final ObjectNode node = MAPPER.createObjectNode();
    node.put("owner", lease.owner());
    node.put("expiresAt", lease.expiresAt().toEpochMilli());
    return node.toString();
  }

  /**
   * Parses a stored value.
   *
   * @param json the stored value, may be null
   * @return the lease, or empty if the value is null or corrupt
   */
  public static Optional<Lease> parse(final String json) {
    if (json == null) {
      return Optional.empty();
    }
    try {
      final JsonNode node = MAPPER.readTree(json);
      if (node == null || !node.isObject()) {
        log.debug("Ignoring corrupt lease value: {}", json);
        return Optional.empty();
      }
      final JsonNode owner = node.get("owner");
      final JsonNode expiresAt = node.get("expiresAt");
      if (owner == null || !owner.isTextual()
          || expiresAt == null || !expiresAt.canConvertToLong()) {
        log.debug("Ignoring corrupt lease value: {}", json);
        return Optional.empty();
      }
      return Optional.of(new Lease(owner.asText(),
          Instant.ofEpochMilli(expiresAt.asLong())));
    } catch (final Exception e) {
      log.debug("Ignoring unreadable lease value: {}", json, e);
      return Optional.empty();
    }
  }
}
