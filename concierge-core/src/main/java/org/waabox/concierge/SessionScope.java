package org.waabox.concierge;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Derives the shared lease keys and fanout topics of one session.
 *
 * <p>Every instance logged into the same session computes the same names,
 * so they meet on the same lease and topic without exchanging anything.
 * The session id never leaves the process in clear text: names carry its
 * SHA-256 hash.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class SessionScope {

  /** The hex encoded session hash, never null. */
  private final String sessionHash;

  /** Private constructor; use {@link #of(String)}. */
  private SessionScope(final String theSessionHash) {
    sessionHash = theSessionHash;
  }

  /**
   * Creates the scope of a session.
   *
   * @param sessionId the session identifier, never null
   * @return the scope, never null
   */
  public static SessionScope of(final String sessionId) {
    Objects.requireNonNull(sessionId, "sessionId must not be null");
    try {
      final MessageDigest digest = MessageDigest.getInstance("SHA-256");
      final byte[] hash = digest.digest(
          sessionId.getBytes(StandardCharsets.UTF_8));
      return new SessionScope(HexFormat.of().formatHex(hash));
    } catch (final NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 algorithm not available", e);
    }
  }

  /**
   * Combines a channel and its filter into a channel scope.
   *
   * @param channel the channel name, never null
   * @param filter  the filter, null or empty for none
   * @return the scope, {@code channel} or {@code channel#filter}
   */
  public static String channelScope(final String channel,
      final String filter) {
    Objects.requireNonNull(channel, "channel must not be null");
    if (filter == null || filter.isEmpty()) {
      return channel;
    }
    return channel + "#" + filter;
  }

  /**
   * Returns the lease key of a channel scope.
   *
   * @param channelScope the channel scope, never null
   * @return the key, never null
   */
  public String leaseKey(final String channelScope) {
    Objects.requireNonNull(channelScope, "channelScope must not be null");
    return "concierge.lease." + sessionHash + "." + channelScope;
  }

  /**
   * Returns the fanout topic of a channel scope.
   *
   * @param channelScope the channel scope, never null
   * @return the topic name, never null
   */
  public String topic(final String channelScope) {
    Objects.requireNonNull(channelScope, "channelScope must not be null");
    return "concierge.fanout." + sessionHash + "." + channelScope;
  }

  /**
   * Returns the topic carrying session-wide control messages such as
   * logout.
   *
   * @return the topic name, never null
   */
  public String controlTopic() {
    return "concierge.control." + sessionHash;
  }

  /**
   * Returns the session hash.
   *
   * @return the hex encoded SHA-256 of the session id, never null
   */
  public String sessionHash() {
    return sessionHash;
  }
}
