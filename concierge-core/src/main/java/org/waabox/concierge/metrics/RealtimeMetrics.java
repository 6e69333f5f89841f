package org.waabox.concierge.metrics;

/**
 * An abstraction for recording operational telemetry of realtime channels.
 *
 * <p>Implementations can forward to a monitoring system or to a client
 * telemetry endpoint. Use {@link NoopRealtimeMetrics} when telemetry is not
 * required and {@link SampledRealtimeMetrics} to report only a fraction of
 * the events.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface RealtimeMetrics {

  /**
   * Records that this instance became the leader of a channel scope.
   *
   * @param channel  the channel name, never null
   * @param takeover {@code true} if an expired or corrupt lease of another
   *                 instance was replaced, {@code false} if no lease existed
   */
  void leaderAcquired(String channel, boolean takeover);

  /**
   * Records that this instance stopped being the leader of a channel scope.
   *
   * @param channel the channel name, never null
   */
  void leaderDemoted(String channel);

  /**
   * Records an empty response that came back faster than the long-poll
   * window allows, meaning the server did not hold the request open.
   *
   * @param channel   the channel name, never null
   * @param elapsedMs the observed latency in milliseconds
   * @param backoffMs the delay chosen for the next cycle in milliseconds
   * @param isLeader  whether this instance polled as leader
   */
  void fastEmpty(String channel, long elapsedMs, long backoffMs,
      boolean isLeader);

  /**
   * Records a batch of events delivered to the local dispatcher.
   *
   * @param channel the channel name, never null
   * @param count   the number of events in the batch
   * @param fanout  {@code true} if the batch came from the leader through
   *                the fanout topic
   */
  void eventsDelivered(String channel, int count, boolean fanout);

  /**
   * Records a failed poll cycle.
   *
   * @param channel the channel name, never null
   * @param cause   the failure, never null
   */
  void cycleFailed(String channel, Throwable cause);
}
