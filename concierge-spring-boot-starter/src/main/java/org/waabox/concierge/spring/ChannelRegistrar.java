package org.waabox.concierge.spring;

import org.waabox.concierge.Concierge;

/**
 * A callback interface for registering channels and event handlers with a
 * {@link Concierge} instance during Spring Boot auto-configuration.
 *
 * <p>Implement this interface as a Spring bean. All discovered
 * {@code ChannelRegistrar} beans are invoked during the Concierge bean
 * creation, before the lifecycle starts.
 *
 * <p>Example usage:
 * <pre>{@code
 * @Bean
 * ChannelRegistrar financeChannel(FinanceCache cache) {
 *     return concierge -> {
 *         concierge.register("finance");
 *         concierge.subscribe("finance",
 *             (channel, events) -> cache.invalidate(events));
 *     };
 * }
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface ChannelRegistrar {

  /**
   * Registers channels and handlers with the given Concierge instance.
   *
   * @param concierge the Concierge instance, never null
   */
  void register(Concierge concierge);
}
