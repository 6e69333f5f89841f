package org.waabox.concierge.topic.kafka;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.MockConsumer;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.serialization.StringSerializer;
import org.junit.jupiter.api.Test;

import org.waabox.concierge.event.ChannelEvent;
import org.waabox.concierge.fanout.FanoutMessage;
import org.waabox.concierge.fanout.FanoutMessageCodec;

/**
 * Unit tests for {@link KafkaBroadcastTopic} and
 * {@link KafkaBroadcastConfig}, running against the Kafka client mocks.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class KafkaBroadcastTopicTest {

  private static final Instant AT = Instant.parse("2026-03-01T10:00:00Z");

  private static final String FANOUT = "concierge.fanout.ab.finance";

  private final KafkaBroadcastConfig config = KafkaBroadcastConfig.create(
      "localhost:9092");

  private final MockProducer<String, String> producer = new MockProducer<>(
      true, new StringSerializer(), new StringSerializer());

  private final MockConsumer<String, String> consumer = new MockConsumer<>(
      OffsetResetStrategy.EARLIEST);

  private KafkaBroadcastTopic topic() {
    return new KafkaBroadcastTopic(config, () -> producer, () -> consumer);
  }

  @Test
  void whenCreatingConfig_givenDefaults_shouldHaveCorrectValues() {
    assertEquals("localhost:9092", config.bootstrapServers());
    assertEquals("concierge-fanout", config.topic());
    assertEquals("concierge-", config.consumerGroupPrefix());
  }

  @Test
  void whenCreatingConfig_givenBlankTopic_shouldThrow() {
    assertThrows(IllegalArgumentException.class,
        () -> KafkaBroadcastConfig.create("localhost:9092", " ", "p-"));
  }

  @Test
  void whenPublishing_givenStartedTopic_shouldKeyByFanoutTopic() {
    final KafkaBroadcastTopic topic = topic();
    topic.start();
    try {
      topic.publish(FANOUT, FanoutMessage.heartbeat("tab-1", AT));

      final List<ProducerRecord<String, String>> sent = producer.history();
      assertEquals(1, sent.size());
      assertEquals("concierge-fanout", sent.get(0).topic());
      assertEquals(FANOUT, sent.get(0).key());
      assertEquals(FanoutMessage.Kind.HEARTBEAT,
          FanoutMessageCodec.deserialize(sent.get(0).value()).message()
              .kind());
    } finally {
      topic.stop();
    }
  }

  @Test
  void whenPublishing_givenTopicNotStarted_shouldDropTheMessage() {
    final KafkaBroadcastTopic topic = topic();
    topic.publish(FANOUT, FanoutMessage.heartbeat("tab-1", AT));
    assertTrue(producer.history().isEmpty());
  }

  @Test
  void whenReceiving_givenRecord_shouldDeliverToTheFanoutTopic() {
    final KafkaBroadcastTopic topic = topic();
    final List<FanoutMessage> finance = new CopyOnWriteArrayList<>();
    final List<FanoutMessage> ops = new CopyOnWriteArrayList<>();
    topic.subscribe(FANOUT, finance::add);
    topic.subscribe("concierge.fanout.ab.ops", ops::add);

    final int reached = topic.receive(FanoutMessageCodec.serialize(FANOUT,
        FanoutMessage.logout("tab-2", AT)));

    assertEquals(1, reached);
    assertEquals(FanoutMessage.Kind.LOGOUT, finance.get(0).kind());
    assertTrue(ops.isEmpty());
  }

  @Test
  void whenReceiving_givenMalformedRecord_shouldSkipIt() {
    final KafkaBroadcastTopic topic = topic();
    final List<FanoutMessage> finance = new CopyOnWriteArrayList<>();
    topic.subscribe(FANOUT, finance::add);

    assertEquals(0, topic.receive("{broken"));
    assertTrue(finance.isEmpty());
  }

  @Test
  void whenPolling_givenConsumedRecord_shouldNotifyListeners()
      throws Exception {
    final TopicPartition partition = new TopicPartition("concierge-fanout",
        0);
    consumer.updateBeginningOffsets(Map.of(partition, 0L));
    final ChannelEvent event = new ChannelEvent("e-1", "checkin_completed",
        "g-1", AT, Map.of());
    consumer.schedulePollTask(() -> {
      consumer.rebalance(List.of(partition));
      consumer.addRecord(new ConsumerRecord<>("concierge-fanout", 0, 0L,
          FANOUT, FanoutMessageCodec.serialize(FANOUT,
              FanoutMessage.events("tab-1", AT, List.of(event), "c-1"))));
    });

    final KafkaBroadcastTopic topic = topic();
    final CountDownLatch latch = new CountDownLatch(1);
    final List<FanoutMessage> received = new CopyOnWriteArrayList<>();
    topic.subscribe(FANOUT, message -> {
      received.add(message);
      latch.countDown();
    });

    topic.start();
    try {
      assertTrue(latch.await(5, TimeUnit.SECONDS));
      assertEquals(List.of(event), received.get(0).events());
      assertEquals("c-1", received.get(0).cursor());
    } finally {
      topic.stop();
    }
    assertFalse(topic.isRunning());
    assertTrue(consumer.closed());
  }
}
