package org.waabox.concierge.metrics;

/**
 * A no-operation implementation of {@link RealtimeMetrics}.
 *
 * <p>All methods in this class are intentionally empty.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class NoopRealtimeMetrics implements RealtimeMetrics {

  /** {@inheritDoc} */
  @Override
  public void leaderAcquired(final String channel, final boolean takeover) {
  }

  /** {@inheritDoc} */
  @Override
  public void leaderDemoted(final String channel) {
  }

  /** {@inheritDoc} */
  @Override
  public void fastEmpty(final String channel, final long elapsedMs,
      final long backoffMs, final boolean isLeader) {
  }

  /** {@inheritDoc} */
  @Override
  public void eventsDelivered(final String channel, final int count,
      final boolean fanout) {
  }

  /** {@inheritDoc} */
  @Override
  public void cycleFailed(final String channel, final Throwable cause) {
  }
}
