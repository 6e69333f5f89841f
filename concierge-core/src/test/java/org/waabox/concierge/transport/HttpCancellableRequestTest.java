package org.waabox.concierge.transport;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link HttpCancellableRequest}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class HttpCancellableRequestTest {

  private static final int PORT = 19181;

  private HttpServer server;

  private final AtomicReference<String> query = new AtomicReference<>();

  private final AtomicReference<String> path = new AtomicReference<>();

  private final AtomicReference<String> authorization =
      new AtomicReference<>();

  private final AtomicInteger status = new AtomicInteger(200);

  private final AtomicReference<String> body = new AtomicReference<>(
      "{\"events\":[],\"cursor\":\"c-1\"}");

  @BeforeEach
  void setUp() throws IOException {
    server = HttpServer.create(new InetSocketAddress("localhost", PORT), 0);
    server.createContext("/api", this::answer);
    server.start();
  }

  @AfterEach
  void tearDown() {
    server.stop(0);
  }

  private void answer(final HttpExchange exchange) throws IOException {
    path.set(exchange.getRequestURI().getPath());
    query.set(exchange.getRequestURI().getRawQuery());
    authorization.set(exchange.getRequestHeaders().getFirst("Authorization"));
    final byte[] bytes = body.get().getBytes(StandardCharsets.UTF_8);
    exchange.sendResponseHeaders(status.get(), bytes.length);
    try (OutputStream out = exchange.getResponseBody()) {
      out.write(bytes);
    }
  }

  private HttpCancellableRequest request() {
    return new HttpCancellableRequest(HttpTransportConfig.create(
        URI.create("http://localhost:" + PORT + "/api/"),
        Duration.ofSeconds(5)));
  }

  private static SubscribeRequest subscribe(final String cursor,
      final String filter) {
    return new SubscribeRequest("finance", cursor, filter, "secret",
        new CancelToken(), Duration.ofSeconds(25));
  }

  @Test
  void whenSending_givenCursorAndFilter_shouldSendThemWithBearer() {
    final String response = request()
        .send(subscribe("2026-03-01T10:00:00Z", "42")).join();

    assertEquals("{\"events\":[],\"cursor\":\"c-1\"}", response);
    assertEquals("/api/finance/realtime/subscribe", path.get());
    assertEquals("lastEventId=2026-03-01T10%3A00%3A00Z&propertyId=42",
        query.get());
    assertEquals("Bearer secret", authorization.get());
  }

  @Test
  void whenSending_givenNoCursor_shouldOmitTheParameter() {
    request().send(subscribe(null, "42")).join();
    assertEquals("propertyId=42", query.get());
  }

  @Test
  void whenSending_givenUnauthorized_shouldFailWithAuthMissing() {
    status.set(401);
    final CompletionException error = assertThrows(CompletionException.class,
        () -> request().send(subscribe(null, null)).join());
    assertInstanceOf(AuthMissingException.class, error.getCause());
  }

  @Test
  void whenSending_givenServerError_shouldCarryTheStatus() {
    status.set(503);
    final CompletionException error = assertThrows(CompletionException.class,
        () -> request().send(subscribe(null, null)).join());
    final TransportException cause = assertInstanceOf(
        TransportException.class, error.getCause());
    assertEquals(503, cause.statusCode());
  }

  @Test
  void whenBuildingUri_givenCustomParams_shouldUseThem() {
    final HttpCancellableRequest custom = new HttpCancellableRequest(
        HttpTransportConfig.create(URI.create("https://api.example.com"),
            Duration.ofSeconds(1), "since", "scope"));

    final URI uri = custom.uriFor(new SubscribeRequest("front desk", "7",
        "a&b", "t", new CancelToken(), Duration.ofSeconds(25)));

    assertEquals("https://api.example.com/front+desk/realtime/subscribe"
        + "?since=7&scope=a%26b", uri.toString());
  }

  @Test
  void whenComputingTimeout_givenLongerWindow_shouldOutlastTheWindow() {
    final HttpCancellableRequest shortTimeout = request();

    assertEquals(Duration.ofSeconds(30),
        shortTimeout.timeoutFor(subscribe(null, null)));
  }

  @Test
  void whenComputingTimeout_givenShorterWindow_shouldKeepTheConfigured() {
    final HttpCancellableRequest longTimeout = new HttpCancellableRequest(
        HttpTransportConfig.create(URI.create("https://api.example.com"),
            Duration.ofSeconds(60)));

    assertEquals(Duration.ofSeconds(60),
        longTimeout.timeoutFor(subscribe(null, null)));
  }
}
