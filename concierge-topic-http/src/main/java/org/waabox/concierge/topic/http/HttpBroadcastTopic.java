package org.waabox.concierge.topic.http;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.waabox.concierge.fanout.BroadcastTopic;
import org.waabox.concierge.fanout.FanoutListener;
import org.waabox.concierge.fanout.FanoutMessage;
import org.waabox.concierge.fanout.FanoutMessageCodec;
import org.waabox.concierge.fanout.TopicListeners;
import org.waabox.concierge.fanout.TopicMessage;

/**
 * HTTP-based implementation of {@link BroadcastTopic}.
 *
 * <p>Uses Java's built-in {@code com.sun.net.httpserver.HttpServer} to
 * receive fanout messages and {@code java.net.http.HttpClient} to post them
 * to the peer instances in a fire-and-forget manner. Messages are also
 * delivered to the local listeners, so that several instances may share one
 * topic within a process.
 *
 * <p>Typical usage:
 * <pre>{@code
 * HttpBroadcastConfig config = HttpBroadcastConfig.create(8081,
 *     List.of("http://node2:8081", "http://node3:8081"));
 * Concierge concierge = Concierge.builder()
 *     .broadcastTopic(new HttpBroadcastTopic(config))
 *     ...
 *     .build();
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class HttpBroadcastTopic implements BroadcastTopic {

  /** Logger for this class. */
  private static final Logger log =
      LoggerFactory.getLogger(HttpBroadcastTopic.class);

  /** HTTP 200 OK status code. */
  private static final int HTTP_OK = 200;

  /** HTTP 400 Bad Request status code. */
  private static final int HTTP_BAD_REQUEST = 400;

  /** HTTP 405 Method Not Allowed status code. */
  private static final int HTTP_METHOD_NOT_ALLOWED = 405;

  /** The delay in seconds before stopping the HTTP server. */
  private static final int SERVER_STOP_DELAY_SECONDS = 1;

  /** The configuration of this topic. */
  private final HttpBroadcastConfig config;

  /** The local listeners per topic. */
  private final TopicListeners listeners = new TopicListeners();

  /** The HTTP server receiving messages from peers. */
  private HttpServer server;

  /** The HTTP client posting messages to peers. */
  private volatile HttpClient client;

  /**
   * Creates a new HTTP broadcast topic with the given configuration.
   *
   * @param theConfig the configuration, never null
   */
  public HttpBroadcastTopic(final HttpBroadcastConfig theConfig) {
    config = Objects.requireNonNull(theConfig, "config cannot be null");
  }

  /** {@inheritDoc} */
  @Override
  public void publish(final String topic, final FanoutMessage message) {
    Objects.requireNonNull(topic, "topic cannot be null");
    Objects.requireNonNull(message, "message cannot be null");

    listeners.deliver(topic, message);

    final HttpClient current = client;
    if (current == null) {
      log.debug("Topic not started, message on {} kept local", topic);
      return;
    }

    final String json = FanoutMessageCodec.serialize(topic, message);

    for (final String peerUrl : config.peerUrls()) {
      final String url = peerUrl + config.path();
      final HttpRequest request = HttpRequest.newBuilder()
          .uri(URI.create(url))
          .header("Content-Type", "application/json")
          .POST(HttpRequest.BodyPublishers.ofString(json))
          .build();

      current.sendAsync(request, HttpResponse.BodyHandlers.ofString())
          .thenAccept(response -> {
            if (response.statusCode() != HTTP_OK) {
              log.warn("Peer {} responded with status {}", url,
                  response.statusCode());
            }
          })
          .exceptionally(ex -> {
            log.warn("Failed to publish {} message to {}: {}",
                message.kind(), url, ex.getMessage());
            return null;
          });
    }
  }

  /** {@inheritDoc} */
  @Override
  public void subscribe(final String topic, final FanoutListener listener) {
    listeners.add(topic, listener);
  }

  /** {@inheritDoc} */
  @Override
  public void unsubscribe(final String topic, final FanoutListener listener) {
    listeners.remove(topic, listener);
  }

  /** {@inheritDoc} */
  @Override
  public synchronized void start() {
    if (server != null) {
      return;
    }
    try {
      server = HttpServer.create(new InetSocketAddress(config.port()), 0);
      server.createContext(config.path(), this::handleMessage);
      server.start();

      client = HttpClient.newHttpClient();

      log.info("HttpBroadcastTopic started on port {} at path {}",
          config.port(), config.path());
    } catch (final IOException e) {
      server = null;
      throw new IllegalStateException(
          "Failed to start HTTP server on port " + config.port(), e);
    }
  }

  /** {@inheritDoc} */
  @Override
  public synchronized void stop() {
    if (server != null) {
      server.stop(SERVER_STOP_DELAY_SECONDS);
      server = null;
      log.info("HTTP server stopped");
    }
    client = null;
  }

  /**
   * Handles an incoming HTTP request on the fanout endpoint.
   *
   * <p>Only POST requests are accepted. The body must be a message written
   * by {@link FanoutMessageCodec}; it is delivered to the local listeners
   * of its topic.
   *
   * @param exchange the HTTP exchange, never null
   * @throws IOException if reading the request body or sending the
   *     response fails
   */
  private void handleMessage(final HttpExchange exchange) throws IOException {
    if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
      sendResponse(exchange, HTTP_METHOD_NOT_ALLOWED, "Method Not Allowed");
      return;
    }

    final TopicMessage received;
    try (InputStream is = exchange.getRequestBody()) {
      final String body = new String(is.readAllBytes(),
          StandardCharsets.UTF_8);
      received = FanoutMessageCodec.deserialize(body);
    } catch (final IllegalArgumentException e) {
      log.warn("Rejected malformed fanout message: {}", e.getMessage());
      sendResponse(exchange, HTTP_BAD_REQUEST, "Bad Request");
      return;
    }

    listeners.deliver(received.topic(), received.message());
    sendResponse(exchange, HTTP_OK, "OK");
  }

  /**
   * Sends an HTTP response with the given status code and body.
   *
   * @param exchange   the HTTP exchange
   * @param statusCode the HTTP status code
   * @param body       the response body text
   * @throws IOException if writing the response fails
   */
  private void sendResponse(final HttpExchange exchange,
      final int statusCode, final String body) throws IOException {
    final byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
    exchange.sendResponseHeaders(statusCode, bytes.length);
    try (OutputStream os = exchange.getResponseBody()) {
      os.write(bytes);
    }
  }
}
