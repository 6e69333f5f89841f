package org.waabox.concierge.spring;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.annotation.Bean;

import org.waabox.concierge.ChannelOptions;
import org.waabox.concierge.Concierge;
import org.waabox.concierge.fanout.BroadcastTopic;
import org.waabox.concierge.leader.LeaseStore;
import org.waabox.concierge.metrics.LoggingRealtimeMetrics;
import org.waabox.concierge.metrics.RealtimeMetrics;
import org.waabox.concierge.transport.CancellableRequest;
import org.waabox.concierge.transport.CredentialsProvider;
import org.waabox.concierge.transport.HttpCancellableRequest;
import org.waabox.concierge.transport.HttpTransportConfig;

/**
 * Spring Boot auto-configuration for the Concierge realtime client.
 *
 * <p>Creates and manages a singleton {@link Concierge} instance. The
 * application must provide a {@link CredentialsProvider} bean; lease store,
 * broadcast topic, metrics and the request implementation are optional
 * beans. Without a {@link CancellableRequest} bean, requests go through an
 * {@link HttpCancellableRequest} pointed at {@code concierge.base-url}.
 *
 * <p>Channels come from the {@code concierge.channels.*} properties and
 * from every {@link ChannelRegistrar} bean, all registered before the
 * lifecycle starts.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@AutoConfiguration
@EnableConfigurationProperties(ConciergeProperties.class)
public class ConciergeAutoConfiguration {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      ConciergeAutoConfiguration.class);

  /**
   * Creates the metrics sink used when the application defines none.
   *
   * @return metrics writing to the telemetry logger, never null
   */
  @Bean
  @ConditionalOnMissingBean(RealtimeMetrics.class)
  public RealtimeMetrics conciergeRealtimeMetrics() {
    return new LoggingRealtimeMetrics();
  }

  /**
   * Creates the singleton {@link Concierge} bean.
   *
   * @param properties           the configuration properties, never null
   * @param credentialsProvider  provider for the required
   *                             CredentialsProvider bean
   * @param requestProvider      provider for an optional CancellableRequest
   * @param leaseStoreProvider   provider for an optional LeaseStore
   * @param topicProvider        provider for an optional BroadcastTopic
   * @param metricsProvider      provider for the RealtimeMetrics bean
   * @param channelRegistrars    the channel registrars, may be empty
   *
   * @return the configured Concierge instance, never null
   */
  @Bean
  public Concierge concierge(
      final ConciergeProperties properties,
      final ObjectProvider<CredentialsProvider> credentialsProvider,
      final ObjectProvider<CancellableRequest> requestProvider,
      final ObjectProvider<LeaseStore> leaseStoreProvider,
      final ObjectProvider<BroadcastTopic> topicProvider,
      final ObjectProvider<RealtimeMetrics> metricsProvider,
      final List<ChannelRegistrar> channelRegistrars) {

    requireAtMostOne(leaseStoreProvider, LeaseStore.class);
    requireAtMostOne(topicProvider, BroadcastTopic.class);

    final CredentialsProvider credentials =
        credentialsProvider.getIfAvailable();
    if (credentials == null) {
      throw new IllegalStateException(
          "Concierge requires a CredentialsProvider bean");
    }

    final ChannelOptions options = properties.getOptions()
        .toChannelOptions();

    final Concierge.Builder builder = Concierge.builder()
        .credentials(credentials)
        .request(request(properties, requestProvider))
        .defaultOptions(options);

    final String instanceId = properties.getInstanceId();
    if (instanceId != null && !instanceId.isBlank()) {
      builder.instanceId(instanceId);
    }
    final String sessionId = properties.getSessionId();
    if (sessionId != null && !sessionId.isBlank()) {
      builder.sessionId(sessionId);
    }
    if (properties.getResumeDebounce() != null) {
      builder.resumeDebounce(properties.getResumeDebounce());
    }

    leaseStoreProvider.ifAvailable(store -> {
      builder.leaseStore(store);
      log.info("Concierge using LeaseStore: {}",
          store.getClass().getSimpleName());
    });

    topicProvider.ifAvailable(topic -> {
      builder.broadcastTopic(topic);
      log.info("Concierge using BroadcastTopic: {}",
          topic.getClass().getSimpleName());
    });

    metricsProvider.ifAvailable(builder::metrics);

    final Concierge concierge = builder.build();

    for (final Map.Entry<String, ConciergeProperties.Channel> channel
        : properties.getChannels().entrySet()) {
      final String filter = channel.getValue().getFilter();
      concierge.register(channel.getKey(),
          filter == null || filter.isBlank() ? null : filter, options);
      log.debug("Registered channel '{}' from properties", channel.getKey());
    }

    for (final ChannelRegistrar registrar : channelRegistrars) {
      registrar.register(concierge);
      log.debug("Invoked ChannelRegistrar: {}",
          registrar.getClass().getSimpleName());
    }

    log.info("Concierge created with {} channel(s) and instance ID: {}",
        concierge.channels().size(), concierge.instanceId());

    return concierge;
  }

  /**
   * Creates a {@link SmartLifecycle} bean that starts and stops the
   * Concierge instance.
   *
   * <p>The lifecycle starts late (phase {@code Integer.MAX_VALUE - 1}) so
   * that event handlers are ready, and stops early for the same reason.
   *
   * @param concierge the Concierge instance to manage, never null
   *
   * @return the lifecycle bean, never null
   */
  @Bean
  public SmartLifecycle conciergeLifecycle(final Concierge concierge) {
    return new SmartLifecycle() {

      /** Whether the lifecycle is currently running. */
      private volatile boolean running = false;

      @Override
      public void start() {
        log.info("Starting Concierge lifecycle...");
        concierge.start();
        running = true;
      }

      @Override
      public void stop() {
        log.info("Stopping Concierge lifecycle...");
        concierge.stop();
        running = false;
      }

      @Override
      public boolean isRunning() {
        return running;
      }

      @Override
      public int getPhase() {
        return Integer.MAX_VALUE - 1;
      }
    };
  }

  /**
   * Resolves the request implementation.
   *
   * @param properties the configuration properties
   * @param provider   provider for an optional CancellableRequest bean
   * @return the request implementation, never null
   *
   * @throws IllegalStateException if neither a bean nor a base URL is set
   */
  private CancellableRequest request(final ConciergeProperties properties,
      final ObjectProvider<CancellableRequest> provider) {
    final CancellableRequest custom = provider.getIfAvailable();
    if (custom != null) {
      log.info("Concierge using CancellableRequest: {}",
          custom.getClass().getSimpleName());
      return custom;
    }
    if (properties.getBaseUrl() == null) {
      throw new IllegalStateException("Concierge requires either the "
          + "concierge.base-url property or a CancellableRequest bean");
    }
    final HttpTransportConfig config = properties.getRequestTimeout() == null
        ? HttpTransportConfig.create(properties.getBaseUrl())
        : HttpTransportConfig.create(properties.getBaseUrl(),
            properties.getRequestTimeout());
    return new HttpCancellableRequest(config);
  }

  /**
   * Validates that at most one bean of the given type is present in the
   * application context.
   *
   * @param provider the object provider to validate, never null
   * @param type     the bean type for error reporting, never null
   * @param <T>      the bean type
   *
   * @throws IllegalStateException if more than one bean is present
   */
  private <T> void requireAtMostOne(final ObjectProvider<T> provider,
      final Class<T> type) {
    final List<String> beanNames = provider.orderedStream()
        .map(bean -> bean.getClass().getSimpleName())
        .collect(Collectors.toList());

    if (beanNames.size() > 1) {
      throw new IllegalStateException(
          "Concierge requires at most one " + type.getSimpleName()
              + " bean, but found " + beanNames.size() + ": "
              + String.join(", ", beanNames));
    }
  }
}
