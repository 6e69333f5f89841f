package org.waabox.concierge.topic.http;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.Test;

import org.waabox.concierge.event.ChannelEvent;
import org.waabox.concierge.fanout.FanoutMessage;

/**
 * Integration tests for {@link HttpBroadcastTopic}.
 *
 * <p>These tests start real HTTP servers on fixed localhost ports.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class HttpBroadcastTopicTest {

  private static final Instant AT = Instant.parse("2026-03-01T10:00:00Z");

  @Test
  void whenPublishing_givenPeer_shouldDeliverOnTheSameTopic()
      throws Exception {
    final int port1 = 19191;
    final int port2 = 19192;
    final HttpBroadcastTopic node1 = new HttpBroadcastTopic(
        HttpBroadcastConfig.create(port1, List.of("http://localhost:"
            + port2)));
    final HttpBroadcastTopic node2 = new HttpBroadcastTopic(
        HttpBroadcastConfig.create(port2, List.of("http://localhost:"
            + port1)));

    final CountDownLatch latch = new CountDownLatch(1);
    final AtomicReference<FanoutMessage> received = new AtomicReference<>();
    final List<FanoutMessage> otherTopic = new CopyOnWriteArrayList<>();
    node2.subscribe("concierge.fanout.ab.finance", message -> {
      received.set(message);
      latch.countDown();
    });
    node2.subscribe("concierge.fanout.ab.ops", otherTopic::add);

    node1.start();
    node2.start();

    try {
      final ChannelEvent event = new ChannelEvent("e-1",
          "transaction_created", "tx-1", AT, Map.of("amount", 10));
      node1.publish("concierge.fanout.ab.finance",
          FanoutMessage.events("tab-1", AT, List.of(event), "c-1"));

      assertTrue(latch.await(5, TimeUnit.SECONDS),
          "Listener on node2 should have been notified");
      final FanoutMessage message = received.get();
      assertEquals(FanoutMessage.Kind.EVENTS, message.kind());
      assertEquals("tab-1", message.sender());
      assertEquals("c-1", message.cursor());
      assertEquals(List.of(event), message.events());
      assertTrue(otherTopic.isEmpty());
    } finally {
      node1.stop();
      node2.stop();
    }
  }

  @Test
  void whenPublishing_givenLocalListener_shouldDeliverLocallyToo() {
    final HttpBroadcastTopic topic = new HttpBroadcastTopic(
        HttpBroadcastConfig.create(19193, List.of()));
    final List<FanoutMessage> received = new CopyOnWriteArrayList<>();
    topic.subscribe("t", received::add);

    topic.publish("t", FanoutMessage.heartbeat("tab-1", AT));

    assertEquals(1, received.size());
  }

  @Test
  void whenReceivingPost_givenGarbage_shouldAnswerBadRequest()
      throws Exception {
    final int port = 19194;
    final HttpBroadcastTopic topic = new HttpBroadcastTopic(
        HttpBroadcastConfig.create(port, List.of()));
    topic.start();
    try {
      final HttpResponse<String> response = post(port, "not json");
      assertEquals(400, response.statusCode());
    } finally {
      topic.stop();
    }
  }

  @Test
  void whenReceivingGet_shouldAnswerMethodNotAllowed() throws Exception {
    final int port = 19195;
    final HttpBroadcastTopic topic = new HttpBroadcastTopic(
        HttpBroadcastConfig.create(port, List.of()));
    topic.start();
    try {
      final HttpResponse<String> response = HttpClient.newHttpClient().send(
          HttpRequest.newBuilder()
              .uri(URI.create("http://localhost:" + port
                  + "/concierge/fanout"))
              .GET()
              .build(),
          HttpResponse.BodyHandlers.ofString());
      assertEquals(405, response.statusCode());
    } finally {
      topic.stop();
    }
  }

  @Test
  void whenCreatingConfig_givenInvalidValues_shouldThrow() {
    assertThrows(IllegalArgumentException.class,
        () -> HttpBroadcastConfig.create(0, List.of()));
    assertThrows(IllegalArgumentException.class,
        () -> HttpBroadcastConfig.create(8080, List.of(), "fanout"));
  }

  private static HttpResponse<String> post(final int port,
      final String body) throws Exception {
    return HttpClient.newHttpClient().send(
        HttpRequest.newBuilder()
            .uri(URI.create("http://localhost:" + port
                + "/concierge/fanout"))
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body))
            .build(),
        HttpResponse.BodyHandlers.ofString());
  }
}
