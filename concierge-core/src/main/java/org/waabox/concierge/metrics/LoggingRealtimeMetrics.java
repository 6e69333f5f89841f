package org.waabox.concierge.metrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link RealtimeMetrics} that writes every telemetry event to the
 * {@code org.waabox.concierge.telemetry} logger.
 *
 * <p>Leadership changes are logged at info level, everything else at debug.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class LoggingRealtimeMetrics implements RealtimeMetrics {

  /** The telemetry logger. */
  private static final Logger log =
      LoggerFactory.getLogger("org.waabox.concierge.telemetry");

  /** {@inheritDoc} */
  @Override
  public void leaderAcquired(final String channel, final boolean takeover) {
    log.info("type={} channel={}",
        takeover ? "leader_takeover" : "leader_acquired", channel);
  }

  /** {@inheritDoc} */
  @Override
  public void leaderDemoted(final String channel) {
    log.info("type=leader_demoted channel={}", channel);
  }

  /** {@inheritDoc} */
  @Override
  public void fastEmpty(final String channel, final long elapsedMs,
      final long backoffMs, final boolean isLeader) {
    log.debug("type=fast_empty channel={} elapsedMs={} backoffMs={}"
        + " isLeader={}", channel, elapsedMs, backoffMs, isLeader);
  }

  /** {@inheritDoc} */
  @Override
  public void eventsDelivered(final String channel, final int count,
      final boolean fanout) {
    log.debug("type=events_delivered channel={} count={} fanout={}",
        channel, count, fanout);
  }

  /** {@inheritDoc} */
  @Override
  public void cycleFailed(final String channel, final Throwable cause) {
    log.debug("type=cycle_failed channel={} error={}", channel,
        cause.getMessage());
  }
}
