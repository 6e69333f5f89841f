package org.waabox.concierge.topic.kafka;

import java.time.Duration;
import java.util.Collections;
import java.util.Objects;
import java.util.Properties;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.errors.WakeupException;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.waabox.concierge.fanout.BroadcastTopic;
import org.waabox.concierge.fanout.FanoutListener;
import org.waabox.concierge.fanout.FanoutMessage;
import org.waabox.concierge.fanout.FanoutMessageCodec;
import org.waabox.concierge.fanout.TopicListeners;
import org.waabox.concierge.fanout.TopicMessage;

/**
 * Kafka-based implementation of {@link BroadcastTopic}.
 *
 * <p>All fanout topics share one Kafka topic; the record key is the fanout
 * topic name and the value is the JSON written by
 * {@link FanoutMessageCodec}. Each instance consumes with a unique consumer
 * group starting at the latest offset, so messages published while an
 * instance was down are never replayed to it.
 *
 * <p>Messages published before {@link #start()} are dropped: the protocol
 * recovers from lost messages through the lease store and the cursor.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class KafkaBroadcastTopic implements BroadcastTopic {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      KafkaBroadcastTopic.class);

  /** Poll timeout for the Kafka consumer loop. */
  private static final Duration POLL_TIMEOUT = Duration.ofMillis(500);

  /** The Kafka configuration, never null. */
  private final KafkaBroadcastConfig config;

  /** Creates the producer on start. */
  private final Supplier<Producer<String, String>> producerFactory;

  /** Creates the consumer on start. */
  private final Supplier<Consumer<String, String>> consumerFactory;

  /** The local listeners per fanout topic. */
  private final TopicListeners listeners = new TopicListeners();

  /** Flag indicating whether the poll loop is running. */
  private final AtomicBoolean running = new AtomicBoolean(false);

  /** The Kafka producer, created on {@link #start()}. */
  private volatile Producer<String, String> producer;

  /** The Kafka consumer, created on {@link #start()}. */
  private volatile Consumer<String, String> consumer;

  /** The daemon thread running the consumer poll loop. */
  private volatile Thread pollThread;

  /**
   * Creates a new KafkaBroadcastTopic with the given configuration.
   *
   * @param theConfig the Kafka configuration, never null
   */
  public KafkaBroadcastTopic(final KafkaBroadcastConfig theConfig) {
    this(theConfig, () -> createProducer(theConfig),
        () -> createConsumer(theConfig));
  }

  /**
   * Creates a new KafkaBroadcastTopic with custom clients.
   *
   * @param theConfig          the Kafka configuration, never null
   * @param theProducerFactory creates the producer, never null
   * @param theConsumerFactory creates the consumer, never null
   */
  KafkaBroadcastTopic(final KafkaBroadcastConfig theConfig,
      final Supplier<Producer<String, String>> theProducerFactory,
      final Supplier<Consumer<String, String>> theConsumerFactory) {
    config = Objects.requireNonNull(theConfig, "config must not be null");
    producerFactory = Objects.requireNonNull(theProducerFactory,
        "producerFactory must not be null");
    consumerFactory = Objects.requireNonNull(theConsumerFactory,
        "consumerFactory must not be null");
  }

  /** {@inheritDoc} */
  @Override
  public void publish(final String topic, final FanoutMessage message) {
    Objects.requireNonNull(topic, "topic must not be null");
    Objects.requireNonNull(message, "message must not be null");

    final Producer<String, String> current = producer;
    if (current == null) {
      log.debug("Topic not started, dropping {} message on {}",
          message.kind(), topic);
      return;
    }

    final String json = FanoutMessageCodec.serialize(topic, message);
    final ProducerRecord<String, String> record = new ProducerRecord<>(
        config.topic(), topic, json);

    current.send(record, (metadata, exception) -> {
      if (exception != null) {
        log.warn("Failed to publish {} message on '{}': {}", message.kind(),
            topic, exception.getMessage());
      } else {
        log.debug("Published {} message on '{}' to partition {} offset {}",
            message.kind(), topic, metadata.partition(), metadata.offset());
      }
    });
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
  public void start() {
    if (running.getAndSet(true)) {
      log.warn("KafkaBroadcastTopic is already running");
      return;
    }

    producer = producerFactory.get();
    consumer = consumerFactory.get();

    consumer.subscribe(Collections.singletonList(config.topic()));

    pollThread = new Thread(this::pollLoop, "concierge-kafka-fanout-poll");
    pollThread.setDaemon(true);
    pollThread.start();

    log.info("KafkaBroadcastTopic started on topic '{}' with bootstrap "
        + "servers '{}'", config.topic(), config.bootstrapServers());
  }

  /** {@inheritDoc} */
  @Override
  public void stop() {
    if (!running.getAndSet(false)) {
      return;
    }

    log.info("Stopping KafkaBroadcastTopic...");

    final Consumer<String, String> currentConsumer = consumer;
    if (currentConsumer != null) {
      currentConsumer.wakeup();
    }

    if (pollThread != null) {
      try {
        pollThread.join(5_000);
      } catch (final InterruptedException e) {
        Thread.currentThread().interrupt();
        log.warn("Interrupted while waiting for poll thread to stop");
      }
    }

    closeQuietly(producer, "producer");
    closeQuietly(consumer, "consumer");

    producer = null;
    consumer = null;
    pollThread = null;

    log.info("KafkaBroadcastTopic stopped");
  }

  /**
   * Returns whether the poll loop is running.
   *
   * @return true between {@link #start()} and {@link #stop()}
   */
  public boolean isRunning() {
    return running.get();
  }

  /**
   * Delivers one consumed record value to the local listeners.
   *
   * <p>Package-private for testability.
   *
   * @param value the record value, never null
   * @return the number of listeners reached
   */
  int receive(final String value) {
    final TopicMessage received;
    try {
      received = FanoutMessageCodec.deserialize(value);
    } catch (final IllegalArgumentException e) {
      log.warn("Skipping malformed fanout record: {}", e.getMessage());
      return 0;
    }
    return listeners.deliver(received.topic(), received.message());
  }

  /** The consumer poll loop, run in a daemon thread until stopped. */
  private void pollLoop() {
    try {
      while (running.get()) {
        final ConsumerRecords<String, String> records =
            consumer.poll(POLL_TIMEOUT);
        for (final ConsumerRecord<String, String> record : records) {
          if (record.value() != null) {
            receive(record.value());
          }
        }
      }
    } catch (final WakeupException e) {
      if (running.get()) {
        throw e;
      }
      log.debug("Poll loop woken up for shutdown");
    }
  }

  /**
   * Creates a Kafka producer configured with string serializers.
   *
   * @param config the Kafka configuration
   * @return the Kafka producer, never null
   */
  private static Producer<String, String> createProducer(
      final KafkaBroadcastConfig config) {
    final Properties props = new Properties();
    props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG,
        config.bootstrapServers());
    props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG,
        StringSerializer.class.getName());
    props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG,
        StringSerializer.class.getName());
    props.put(ProducerConfig.ACKS_CONFIG, "1");
    props.put(ProducerConfig.LINGER_MS_CONFIG, "0");
    return new KafkaProducer<>(props);
  }

  /**
   * Creates a Kafka consumer with a unique consumer group, so that every
   * instance receives every message.
   *
   * @param config the Kafka configuration
   * @return the Kafka consumer, never null
   */
  private static Consumer<String, String> createConsumer(
      final KafkaBroadcastConfig config) {
    final String groupId = config.consumerGroupPrefix() + UUID.randomUUID();

    final Properties props = new Properties();
    props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG,
        config.bootstrapServers());
    props.put(ConsumerConfig.GROUP_ID_CONFIG, groupId);
    props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG,
        StringDeserializer.class.getName());
    props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG,
        StringDeserializer.class.getName());
    props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "latest");
    props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "true");
    return new KafkaConsumer<>(props);
  }

  /**
   * Closes a resource, logging any error.
   *
   * @param closeable the resource to close, may be null
   * @param name      the name for logging purposes, never null
   */
  private static void closeQuietly(final AutoCloseable closeable,
      final String name) {
    if (closeable != null) {
      try {
        closeable.close();
      } catch (final Exception e) {
        log.warn("Error closing {}: {}", name, e.getMessage(), e);
      }
    }
  }
}
