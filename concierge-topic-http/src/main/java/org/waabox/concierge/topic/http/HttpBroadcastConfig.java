package org.waabox.concierge.topic.http;

import java.util.List;
import java.util.Objects;

/**
 * Configuration holder for the {@link HttpBroadcastTopic}.
 *
 * <p>Holds the port to listen on, the base URLs of the peer instances and
 * the HTTP path where fanout messages are exchanged.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class HttpBroadcastConfig {

  /** The default HTTP path for fanout messages. */
  private static final String DEFAULT_PATH = "/concierge/fanout";

  /** The port to listen on for incoming messages. */
  private final int port;

  /** The URLs of the peers to publish messages to. */
  private final List<String> peerUrls;

  /** The HTTP path of the fanout endpoint. */
  private final String path;

  /**
   * Private constructor; use the static factory methods instead.
   *
   * @param thePort     the listening port
   * @param thePeerUrls the peer URLs
   * @param thePath     the endpoint path
   */
  private HttpBroadcastConfig(final int thePort,
      final List<String> thePeerUrls, final String thePath) {
    port = thePort;
    peerUrls = List.copyOf(thePeerUrls);
    path = thePath;
  }

  /**
   * Creates a configuration using the default path
   * ({@value #DEFAULT_PATH}).
   *
   * @param port     the port to listen on, between 1 and 65535
   * @param peerUrls the peer base URLs, never null
   * @return a new configuration, never null
   */
  public static HttpBroadcastConfig create(final int port,
      final List<String> peerUrls) {
    return create(port, peerUrls, DEFAULT_PATH);
  }

  /**
   * Creates a configuration with a custom path.
   *
   * @param port     the port to listen on, between 1 and 65535
   * @param peerUrls the peer base URLs, never null
   * @param path     the endpoint path, must start with a slash
   * @return a new configuration, never null
   */
  public static HttpBroadcastConfig create(final int port,
      final List<String> peerUrls, final String path) {
    Objects.requireNonNull(peerUrls, "peerUrls cannot be null");
    Objects.requireNonNull(path, "path cannot be null");
    if (port < 1 || port > 65535) {
      throw new IllegalArgumentException("port out of range: " + port);
    }
    if (!path.startsWith("/")) {
      throw new IllegalArgumentException(
          "path must start with '/': " + path);
    }
    return new HttpBroadcastConfig(port, peerUrls, path);
  }

  /**
   * Returns the port to listen on.
   *
   * @return the listening port
   */
  public int port() {
    return port;
  }

  /**
   * Returns an unmodifiable list of peer base URLs.
   *
   * @return the peer URLs, never null
   */
  public List<String> peerUrls() {
    return peerUrls;
  }

  /**
   * Returns the HTTP path of the fanout endpoint.
   *
   * @return the path, never null
   */
  public String path() {
    return path;
  }
}
