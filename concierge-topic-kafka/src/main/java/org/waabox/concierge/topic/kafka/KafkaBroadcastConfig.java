package org.waabox.concierge.topic.kafka;

import java.util.Objects;

/**
 * Configuration holder for the {@link KafkaBroadcastTopic}.
 *
 * <p>Every fanout topic of every session travels on a single Kafka topic,
 * keyed by the fanout topic name. Each instance consumes with its own
 * consumer group (formed by {@code consumerGroupPrefix + UUID}), so every
 * instance receives every message.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class KafkaBroadcastConfig {

  /** Default Kafka topic for fanout messages. */
  private static final String DEFAULT_TOPIC = "concierge-fanout";

  /** Default consumer group prefix. */
  private static final String DEFAULT_CONSUMER_GROUP_PREFIX = "concierge-";

  /** The Kafka bootstrap servers connection string, never null. */
  private final String bootstrapServers;

  /** The Kafka topic carrying the fanout messages, never null. */
  private final String topic;

  /** The prefix for generating unique consumer groups, never null. */
  private final String consumerGroupPrefix;

  /**
   * Creates a new KafkaBroadcastConfig.
   *
   * @param theBootstrapServers    the Kafka bootstrap servers
   * @param theTopic               the Kafka topic name
   * @param theConsumerGroupPrefix the consumer group prefix
   */
  private KafkaBroadcastConfig(final String theBootstrapServers,
      final String theTopic, final String theConsumerGroupPrefix) {
    bootstrapServers = Objects.requireNonNull(theBootstrapServers,
        "bootstrapServers must not be null");
    topic = Objects.requireNonNull(theTopic, "topic must not be null");
    consumerGroupPrefix = Objects.requireNonNull(theConsumerGroupPrefix,
        "consumerGroupPrefix must not be null");
    if (bootstrapServers.isBlank()) {
      throw new IllegalArgumentException(
          "bootstrapServers must not be blank");
    }
    if (topic.isBlank()) {
      throw new IllegalArgumentException("topic must not be blank");
    }
  }

  /**
   * Creates a configuration with the default topic and consumer group
   * prefix.
   *
   * @param bootstrapServers the Kafka bootstrap servers (e.g.
   *        "localhost:9092"), never null
   *
   * @return a new configuration, never null
   */
  public static KafkaBroadcastConfig create(final String bootstrapServers) {
    return new KafkaBroadcastConfig(bootstrapServers, DEFAULT_TOPIC,
        DEFAULT_CONSUMER_GROUP_PREFIX);
  }

  /**
   * Creates a configuration with a custom topic and consumer group prefix.
   *
   * @param bootstrapServers    the Kafka bootstrap servers, never null
   * @param topic               the Kafka topic name, never null
   * @param consumerGroupPrefix the consumer group prefix, never null
   *
   * @return a new configuration, never null
   */
  public static KafkaBroadcastConfig create(final String bootstrapServers,
      final String topic, final String consumerGroupPrefix) {
    return new KafkaBroadcastConfig(bootstrapServers, topic,
        consumerGroupPrefix);
  }

  /**
   * Returns the Kafka bootstrap servers connection string.
   *
   * @return the bootstrap servers, never null
   */
  public String bootstrapServers() {
    return bootstrapServers;
  }

  /**
   * Returns the Kafka topic carrying the fanout messages.
   *
   * @return the topic name, never null
   */
  public String topic() {
    return topic;
  }

  /**
   * Returns the prefix used to generate unique consumer group ids.
   *
   * @return the consumer group prefix, never null
   */
  public String consumerGroupPrefix() {
    return consumerGroupPrefix;
  }
}
