package org.waabox.concierge.metrics;

import java.util.Objects;
import java.util.Random;

/**
 * A {@link RealtimeMetrics} decorator that forwards only a random fraction
 * of the telemetry events.
 *
 * <p>Client telemetry is sent by every instance of every session, so it is
 * sampled. The rate is configurable; a rate of 1 forwards everything and a
 * rate of 0 nothing.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class SampledRealtimeMetrics implements RealtimeMetrics {

  /** The decorated metrics. */
  private final RealtimeMetrics delegate;

  /** The fraction of events to forward. */
  private final double sampleRate;

  /** The random source. */
  private final Random random;

  /**
   * Creates a new sampled decorator.
   *
   * @param theDelegate   the metrics to forward to, never null
   * @param theSampleRate the fraction of events to forward, within [0, 1]
   * @param theRandom     the random source, never null
   */
  public SampledRealtimeMetrics(final RealtimeMetrics theDelegate,
      final double theSampleRate, final Random theRandom) {
    delegate = Objects.requireNonNull(theDelegate,
        "delegate must not be null");
    random = Objects.requireNonNull(theRandom, "random must not be null");
    if (theSampleRate < 0 || theSampleRate > 1) {
      throw new IllegalArgumentException(
          "sampleRate must be within [0, 1], got: " + theSampleRate);
    }
    sampleRate = theSampleRate;
  }

  /**
   * Returns the sample rate.
   *
   * @return the fraction of forwarded events
   */
  public double sampleRate() {
    return sampleRate;
  }

  /** {@inheritDoc} */
  @Override
  public void leaderAcquired(final String channel, final boolean takeover) {
    if (sampled()) {
      delegate.leaderAcquired(channel, takeover);
    }
  }

  /** {@inheritDoc} */
  @Override
  public void leaderDemoted(final String channel) {
    if (sampled()) {
      delegate.leaderDemoted(channel);
    }
  }

  /** {@inheritDoc} */
  @Override
  public void fastEmpty(final String channel, final long elapsedMs,
      final long backoffMs, final boolean isLeader) {
    if (sampled()) {
      delegate.fastEmpty(channel, elapsedMs, backoffMs, isLeader);
    }
  }

  /** {@inheritDoc} */
  @Override
  public void eventsDelivered(final String channel, final int count,
      final boolean fanout) {
    if (sampled()) {
      delegate.eventsDelivered(channel, count, fanout);
    }
  }

  /** {@inheritDoc} */
  @Override
  public void cycleFailed(final String channel, final Throwable cause) {
    if (sampled()) {
      delegate.cycleFailed(channel, cause);
    }
  }

  /**
   * Draws whether the current event is forwarded.
   *
   * @return true if the event must be forwarded
   */
  private boolean sampled() {
    return sampleRate >= 1 || random.nextDouble() < sampleRate;
  }
}
