package org.waabox.concierge;

import java.time.Duration;
import java.util.Objects;

/**
 * Timing and behavior options of a realtime channel.
 *
 * <p>Every channel (finance, guest check-in, audit logs...) runs the same
 * protocol; only these values change between them. Instances are immutable
 * and created through {@link #defaults()} or {@link #builder()}.
 *
 * <p>Defaults:
 * <ul>
 *   <li>leader election: enabled</li>
 *   <li>lease TTL: 18 seconds, plus up to 500 ms of jitter</li>
 *   <li>renew interval: 10 seconds</li>
 *   <li>follower tick: randomized between 3 and 5 seconds</li>
 *   <li>initial delay: 1 second</li>
 *   <li>fast floor: 500 ms, ceiling: 5 seconds</li>
 *   <li>fast-empty threshold: 1500 ms, band: 2 to 5 seconds</li>
 *   <li>heartbeat delay: 1200 ms</li>
 *   <li>long-poll window: 25 seconds</li>
 *   <li>resume debounce: 500 ms</li>
 *   <li>telemetry sample rate: 0.02</li>
 * </ul>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ChannelOptions {

  /** Whether instances elect a single poller per channel scope. */
  private final boolean leaderElectionEnabled;

  /** How long a written lease stays valid, before jitter. */
  private final Duration leaseTtl;

  /** The maximum random extension added to every lease. */
  private final Duration leaseJitter;

  /** How often the leader rewrites its lease and emits a heartbeat. */
  private final Duration renewInterval;

  /** The lower bound of the follower freshness check interval. */
  private final Duration followerTickMin;

  /** The upper bound of the follower freshness check interval. */
  private final Duration followerTickMax;

  /** The delay a fresh channel starts with. */
  private final Duration initialDelay;

  /** The fast floor used after a cycle that delivered events. */
  private final Duration minDelay;

  /** The latency under which an empty response counts as fast. */
  private final Duration fastEmptyThreshold;

  /** The lower bound of the fast-empty band. */
  private final Duration fastEmptyMin;

  /** The upper bound of the fast-empty band. */
  private final Duration fastEmptyMax;

  /** The delay after a genuine long-poll heartbeat timeout. */
  private final Duration heartbeatDelay;

  /** The ceiling no delay may exceed. */
  private final Duration maxDelay;

  /** How long the server holds a subscribe request open. */
  private final Duration longPollWindow;

  /** The fraction of telemetry events that are reported. */
  private final double telemetrySampleRate;

  /**
   * Creates the options from a validated builder.
   *
   * @param b the builder holding the values, never null
   */
  private ChannelOptions(final Builder b) {
    leaderElectionEnabled = b.leaderElectionEnabled;
    leaseTtl = b.leaseTtl;
    leaseJitter = b.leaseJitter;
    renewInterval = b.renewInterval;
    followerTickMin = b.followerTickMin;
    followerTickMax = b.followerTickMax;
    initialDelay = b.initialDelay;
    minDelay = b.minDelay;
    fastEmptyThreshold = b.fastEmptyThreshold;
    fastEmptyMin = b.fastEmptyMin;
    fastEmptyMax = b.fastEmptyMax;
    heartbeatDelay = b.heartbeatDelay;
    maxDelay = b.maxDelay;
    longPollWindow = b.longPollWindow;
    telemetrySampleRate = b.telemetrySampleRate;
  }

  /**
   * Returns the default options.
   *
   * @return the default options, never null
   */
  public static ChannelOptions defaults() {
    return builder().build();
  }

  /**
   * Creates a new builder initialized with the default values.
   *
   * @return a new builder, never null
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates a new builder initialized with the values of these options.
   *
   * @return a new builder, never null
   */
  public Builder toBuilder() {
    return new Builder()
        .leaderElectionEnabled(leaderElectionEnabled)
        .leaseTtl(leaseTtl)
        .leaseJitter(leaseJitter)
        .renewInterval(renewInterval)
        .followerTick(followerTickMin, followerTickMax)
        .initialDelay(initialDelay)
        .minDelay(minDelay)
        .fastEmptyThreshold(fastEmptyThreshold)
        .fastEmptyBand(fastEmptyMin, fastEmptyMax)
        .heartbeatDelay(heartbeatDelay)
        .maxDelay(maxDelay)
        .longPollWindow(longPollWindow)
        .telemetrySampleRate(telemetrySampleRate);
  }

  /**
   * Returns whether leader election is enabled.
   *
   * <p>When disabled every instance polls for itself.
   *
   * @return true if a single instance polls per channel scope
   */
  public boolean leaderElectionEnabled() {
    return leaderElectionEnabled;
  }

  /**
   * Returns the lease time-to-live, also the takeover threshold.
   *
   * @return the lease TTL, never null
   */
  public Duration leaseTtl() {
    return leaseTtl;
  }

  /**
   * Returns the maximum random extension added to a lease.
   *
   * @return the lease jitter, never null
   */
  public Duration leaseJitter() {
    return leaseJitter;
  }

  /**
   * Returns the interval between two lease renewals of the leader.
   *
   * @return the renew interval, always shorter than the TTL
   */
  public Duration renewInterval() {
    return renewInterval;
  }

  /**
   * Returns the lower bound of the follower tick interval.
   *
   * @return the minimum follower tick, never null
   */
  public Duration followerTickMin() {
    return followerTickMin;
  }

  /**
   * Returns the upper bound of the follower tick interval.
   *
   * @return the maximum follower tick, never null
   */
  public Duration followerTickMax() {
    return followerTickMax;
  }

  /**
   * Returns the delay a channel starts with.
   *
   * @return the initial delay, never null
   */
  public Duration initialDelay() {
    return initialDelay;
  }

  /**
   * Returns the fast floor used after a cycle with events.
   *
   * @return the minimum delay, never null
   */
  public Duration minDelay() {
    return minDelay;
  }

  /**
   * Returns the latency under which an empty response is considered fast.
   *
   * @return the fast-empty threshold, never null
   */
  public Duration fastEmptyThreshold() {
    return fastEmptyThreshold;
  }

  /**
   * Returns the lower bound of the fast-empty band.
   *
   * @return the minimum fast-empty delay, never null
   */
  public Duration fastEmptyMin() {
    return fastEmptyMin;
  }

  /**
   * Returns the upper bound of the fast-empty band.
   *
   * @return the maximum fast-empty delay, never null
   */
  public Duration fastEmptyMax() {
    return fastEmptyMax;
  }

  /**
   * Returns the delay applied after a genuine heartbeat timeout.
   *
   * @return the heartbeat delay, never null
   */
  public Duration heartbeatDelay() {
    return heartbeatDelay;
  }

  /**
   * Returns the delay ceiling.
   *
   * @return the maximum delay, never null
   */
  public Duration maxDelay() {
    return maxDelay;
  }

  /**
   * Returns how long the server holds a subscribe request open.
   *
   * @return the long-poll window, never null
   */
  public Duration longPollWindow() {
    return longPollWindow;
  }

  /**
   * Returns the fraction of telemetry events that are reported.
   *
   * @return a value between 0 and 1, inclusive
   */
  public double telemetrySampleRate() {
    return telemetrySampleRate;
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return "ChannelOptions{leaderElection=" + leaderElectionEnabled
        + ", leaseTtl=" + leaseTtl
        + ", renewInterval=" + renewInterval
        + ", delay=[" + minDelay + ".." + maxDelay + "]"
        + ", longPollWindow=" + longPollWindow + "}";
  }

  /**
   * A fluent builder for {@link ChannelOptions}.
   *
   * <p>All values start at their defaults. {@link #build()} validates the
   * relationships between them.
   */
  public static final class Builder {

    /** See {@link ChannelOptions#leaderElectionEnabled()}. */
    private boolean leaderElectionEnabled = true;

    /** See {@link ChannelOptions#leaseTtl()}. */
    private Duration leaseTtl = Duration.ofSeconds(18);

    /** See {@link ChannelOptions#leaseJitter()}. */
    private Duration leaseJitter = Duration.ofMillis(500);

    /** See {@link ChannelOptions#renewInterval()}. */
    private Duration renewInterval = Duration.ofSeconds(10);

    /** See {@link ChannelOptions#followerTickMin()}. */
    private Duration followerTickMin = Duration.ofSeconds(3);

    /** See {@link ChannelOptions#followerTickMax()}. */
    private Duration followerTickMax = Duration.ofSeconds(5);

    /** See {@link ChannelOptions#initialDelay()}. */
    private Duration initialDelay = Duration.ofSeconds(1);

    /** See {@link ChannelOptions#minDelay()}. */
    private Duration minDelay = Duration.ofMillis(500);

    /** See {@link ChannelOptions#fastEmptyThreshold()}. */
    private Duration fastEmptyThreshold = Duration.ofMillis(1500);

    /** See {@link ChannelOptions#fastEmptyMin()}. */
    private Duration fastEmptyMin = Duration.ofSeconds(2);

    /** See {@link ChannelOptions#fastEmptyMax()}. */
    private Duration fastEmptyMax = Duration.ofSeconds(5);

    /** See {@link ChannelOptions#heartbeatDelay()}. */
    private Duration heartbeatDelay = Duration.ofMillis(1200);

    /** See {@link ChannelOptions#maxDelay()}. */
    private Duration maxDelay = Duration.ofSeconds(5);

    /** See {@link ChannelOptions#longPollWindow()}. */
    private Duration longPollWindow = Duration.ofSeconds(25);

    /** See {@link ChannelOptions#telemetrySampleRate()}. */
    private double telemetrySampleRate = 0.02;

    /** Creates a builder with default values. */
    private Builder() {
    }

    /**
     * Enables or disables leader election.
     *
     * @param enabled false to make every instance poll for itself
     *
     * @return this builder, never null
     */
    public Builder leaderElectionEnabled(final boolean enabled) {
      leaderElectionEnabled = enabled;
      return this;
    }

    /**
     * Sets the lease time-to-live.
     *
     * @param theTtl the TTL, never null
     *
     * @return this builder, never null
     */
    public Builder leaseTtl(final Duration theTtl) {
      leaseTtl = positive(theTtl, "leaseTtl");
      return this;
    }

    /**
     * Sets the maximum lease jitter.
     *
     * @param theJitter the jitter, never null, may be zero
     *
     * @return this builder, never null
     */
    public Builder leaseJitter(final Duration theJitter) {
      leaseJitter = notNegative(theJitter, "leaseJitter");
      return this;
    }

    /**
     * Sets the lease renew interval.
     *
     * @param theInterval the interval, never null
     *
     * @return this builder, never null
     */
    public Builder renewInterval(final Duration theInterval) {
      renewInterval = positive(theInterval, "renewInterval");
      return this;
    }

    /**
     * Sets the follower tick band.
     *
     * @param theMin the lower bound, never null
     * @param theMax the upper bound, never null
     *
     * @return this builder, never null
     */
    public Builder followerTick(final Duration theMin,
        final Duration theMax) {
      followerTickMin = positive(theMin, "followerTickMin");
      followerTickMax = positive(theMax, "followerTickMax");
      return this;
    }

    /**
     * Sets the initial delay.
     *
     * @param theDelay the delay, never null
     *
     * @return this builder, never null
     */
    public Builder initialDelay(final Duration theDelay) {
      initialDelay = notNegative(theDelay, "initialDelay");
      return this;
    }

    /**
     * Sets the fast floor.
     *
     * @param theDelay the delay, never null
     *
     * @return this builder, never null
     */
    public Builder minDelay(final Duration theDelay) {
      minDelay = notNegative(theDelay, "minDelay");
      return this;
    }

    /**
     * Sets the fast-empty latency threshold.
     *
     * @param theThreshold the threshold, never null
     *
     * @return this builder, never null
     */
    public Builder fastEmptyThreshold(final Duration theThreshold) {
      fastEmptyThreshold = notNegative(theThreshold, "fastEmptyThreshold");
      return this;
    }

    /**
     * Sets the fast-empty band.
     *
     * @param theMin the lower bound, never null
     * @param theMax the upper bound, never null
     *
     * @return this builder, never null
     */
    public Builder fastEmptyBand(final Duration theMin,
        final Duration theMax) {
      fastEmptyMin = notNegative(theMin, "fastEmptyMin");
      fastEmptyMax = notNegative(theMax, "fastEmptyMax");
      return this;
    }

    /**
     * Sets the heartbeat delay.
     *
     * @param theDelay the delay, never null
     *
     * @return this builder, never null
     */
    public Builder heartbeatDelay(final Duration theDelay) {
      heartbeatDelay = notNegative(theDelay, "heartbeatDelay");
      return this;
    }

    /**
     * Sets the delay ceiling.
     *
     * @param theDelay the ceiling, never null
     *
     * @return this builder, never null
     */
    public Builder maxDelay(final Duration theDelay) {
      maxDelay = positive(theDelay, "maxDelay");
      return this;
    }

    /**
     * Sets the long-poll window.
     *
     * @param theWindow the window, never null
     *
     * @return this builder, never null
     */
    public Builder longPollWindow(final Duration theWindow) {
      longPollWindow = positive(theWindow, "longPollWindow");
      return this;
    }

    /**
     * Sets the telemetry sample rate.
     *
     * @param theRate a value between 0 and 1, inclusive
     *
     * @return this builder, never null
     */
    public Builder telemetrySampleRate(final double theRate) {
      if (theRate < 0 || theRate > 1 || Double.isNaN(theRate)) {
        throw new IllegalArgumentException(
            "telemetrySampleRate must be within [0, 1], got: " + theRate);
      }
      telemetrySampleRate = theRate;
      return this;
    }

    /**
     * Builds the options.
     *
     * @return the options, never null
     *
     * @throws IllegalArgumentException if the values are inconsistent
     */
    public ChannelOptions build() {
      check(renewInterval.compareTo(leaseTtl) < 0,
          "renewInterval must be shorter than leaseTtl");
      check(followerTickMin.compareTo(followerTickMax) <= 0,
          "followerTickMin must not exceed followerTickMax");
      check(fastEmptyMin.compareTo(fastEmptyMax) <= 0,
          "fastEmptyMin must not exceed fastEmptyMax");
      check(minDelay.compareTo(maxDelay) <= 0,
          "minDelay must not exceed maxDelay");
      check(fastEmptyMax.compareTo(maxDelay) <= 0,
          "fastEmptyMax must not exceed maxDelay");
      check(heartbeatDelay.compareTo(maxDelay) <= 0,
          "heartbeatDelay must not exceed maxDelay");
      check(initialDelay.compareTo(maxDelay) <= 0,
          "initialDelay must not exceed maxDelay");
      return new ChannelOptions(this);
    }

    /**
     * Throws if the condition does not hold.
     *
     * @param condition the condition to check
     * @param message the error message
     */
    private static void check(final boolean condition,
        final String message) {
      if (!condition) {
        throw new IllegalArgumentException(message);
      }
    }

    /**
     * Validates a strictly positive duration.
     *
     * @param value the value to check
     * @param name the option name for error messages
     * @return the value, never null
     */
    private static Duration positive(final Duration value,
        final String name) {
      Objects.requireNonNull(value, name + " must not be null");
      if (value.isNegative() || value.isZero()) {
        throw new IllegalArgumentException(
            name + " must be positive, got: " + value);
      }
      return value;
    }

    /**
     * Validates a non-negative duration.
     *
     * @param value the value to check
     * @param name the option name for error messages
     * @return the value, never null
     */
    private static Duration notNegative(final Duration value,
        final String name) {
      Objects.requireNonNull(value, name + " must not be null");
      if (value.isNegative()) {
        throw new IllegalArgumentException(
            name + " must not be negative, got: " + value);
      }
      return value;
    }
  }
}
