package org.waabox.concierge.transport;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link CancellableRequest} backed by {@code java.net.http.HttpClient}.
 *
 * <p>Sends {@code GET {baseUri}/{channel}/realtime/subscribe} with the
 * cursor and the filter as query parameters and the token as a bearer
 * {@code Authorization} header. Cancelling the request token cancels the
 * exchange.
 *
 * <p>The exchange timeout is the configured request timeout, stretched
 * when needed so the server always has the whole long-poll window plus
 * {@link #LONG_POLL_MARGIN} to answer.
 *
 * <p>Typical usage:
 * <pre>{@code
 * HttpCancellableRequest request = new HttpCancellableRequest(
 *     HttpTransportConfig.create(URI.create("https://api.example.com")));
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class HttpCancellableRequest implements CancellableRequest {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(HttpCancellableRequest.class);

  /** HTTP 401 Unauthorized status code. */
  private static final int HTTP_UNAUTHORIZED = 401;

  /** HTTP 403 Forbidden status code. */
  private static final int HTTP_FORBIDDEN = 403;

  /** Time allowed on top of the long-poll window for the answer. */
  static final Duration LONG_POLL_MARGIN = Duration.ofSeconds(5);

  /** The configuration, never null. */
  private final HttpTransportConfig config;

  /** The HTTP client, never null. */
  private final HttpClient client;

  /**
   * Creates a new request with a default HTTP client.
   *
   * @param theConfig the configuration, never null
   */
  public HttpCancellableRequest(final HttpTransportConfig theConfig) {
    this(theConfig, HttpClient.newHttpClient());
  }

  /**
   * Creates a new request.
   *
   * @param theConfig the configuration, never null
   * @param theClient the HTTP client, never null
   */
  public HttpCancellableRequest(final HttpTransportConfig theConfig,
      final HttpClient theClient) {
    config = Objects.requireNonNull(theConfig, "config must not be null");
    client = Objects.requireNonNull(theClient, "client must not be null");
  }

  /** {@inheritDoc} */
  @Override
  public CompletableFuture<String> send(final SubscribeRequest request) {
    Objects.requireNonNull(request, "request must not be null");

    final HttpRequest httpRequest = HttpRequest.newBuilder()
        .uri(uriFor(request))
        .timeout(timeoutFor(request))
        .header("Authorization", "Bearer " + request.accessToken())
        .header("Accept", "application/json")
        .GET()
        .build();

    final CompletableFuture<HttpResponse<String>> exchange =
        client.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofString());
    request.cancelToken().onCancel(() -> exchange.cancel(true));

    return exchange.thenApply(response -> {
      final int status = response.statusCode();
      if (status == HTTP_UNAUTHORIZED || status == HTTP_FORBIDDEN) {
        throw new AuthMissingException("Subscribe rejected with status "
            + status + " for channel " + request.channel());
      }
      if (status < 200 || status >= 300) {
        throw new TransportException("Subscribe failed with status "
            + status + " for channel " + request.channel(), status);
      }
      log.debug("Subscribe for channel {} answered {}", request.channel(),
          status);
      return response.body();
    });
  }

  /**
   * Computes the exchange timeout of a request.
   *
   * @param request the request, never null
   * @return the larger of the configured timeout and the long-poll window
   *         plus the margin, never null
   */
  Duration timeoutFor(final SubscribeRequest request) {
    final Duration window = request.longPollWindow().plus(LONG_POLL_MARGIN);
    final Duration configured = config.requestTimeout();
    return configured.compareTo(window) >= 0 ? configured : window;
  }

  /**
   * Builds the subscribe URI for a request.
   *
   * @param request the request, never null
   * @return the URI, never null
   */
  URI uriFor(final SubscribeRequest request) {
    String base = config.baseUri().toString();
    if (base.endsWith("/")) {
      base = base.substring(0, base.length() - 1);
    }
    final StringBuilder uri = new StringBuilder(base)
        .append('/').append(encode(request.channel()))
        .append("/realtime/subscribe");
    char separator = '?';
    if (request.cursor() != null && !request.cursor().isEmpty()) {
      uri.append(separator).append(config.cursorParam()).append('=')
          .append(encode(request.cursor()));
      separator = '&';
    }
    if (request.filter() != null && !request.filter().isEmpty()) {
      uri.append(separator).append(config.filterParam()).append('=')
          .append(encode(request.filter()));
    }
    return URI.create(uri.toString());
  }

  /**
   * URL-encodes a value.
   *
   * @param value the value
   * @return the encoded value
   */
  private static String encode(final String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }
}
