package org.waabox.concierge.leader;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.waabox.concierge.ChannelOptions;
import org.waabox.concierge.metrics.RealtimeMetrics;

/**
 * Elects one leader per channel scope among the instances of a session.
 *
 * <p>The coordinator runs a small state machine over a shared
 * {@link LeaseStore}:
 * <ul>
 *   <li>{@link #tryAcquire()} claims the lease if it is absent, expired or
 *       corrupt, and confirms the claim with a second read.</li>
 *   <li>{@link #renew()} extends the lease of the leader and publishes a
 *       heartbeat; a leader that finds another valid owner steps down.</li>
 *   <li>{@link #followerTick()} lets a follower take over a stale lease.</li>
 *   <li>{@link #onHeartbeat(String, Instant)} makes a leader step down when
 *       another instance announces a newer leadership.</li>
 * </ul>
 *
 * <p>If the store cannot be reached the instance acts as its own leader
 * (single-instance mode) and keeps retrying the store on later calls. When
 * leader election is disabled the coordinator is always leader and never
 * touches the store.
 *
 * <p>Stopping the coordinator does not delete the lease; it expires on its
 * own.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class LeaderCoordinator {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(LeaderCoordinator.class);

  /** The channel name, used for logging and metrics. */
  private final String channel;

  /** The id of this instance. */
  private final String instanceId;

  /** The shared lease store. */
  private final LeaseStore store;

  /** The timing options. */
  private final ChannelOptions options;

  /** The clock. */
  private final Clock clock;

  /** The random source for the lease jitter. */
  private final Random random;

  /** The telemetry sink. */
  private final RealtimeMetrics metrics;

  /** The heartbeat sink. */
  private final HeartbeatPublisher heartbeats;

  /** The registered listeners. */
  private final List<LeaderChangeListener> listeners =
      new CopyOnWriteArrayList<>();

  /** The key of the lease of the current channel scope. */
  private String leaseKey;

  /** The current role. */
  private LeaderRole role = LeaderRole.UNLEASED;

  /** Whether leadership is held because the store is unavailable. */
  private boolean singleInstance;

  /** The instant of the last heartbeat this instance published. */
  private Instant lastOwnHeartbeat;

  /**
   * Creates a new coordinator.
   *
   * @param theChannel    the channel name, never null
   * @param theInstanceId the id of this instance, never null
   * @param theLeaseKey   the lease key of the channel scope, never null
   * @param theStore      the shared lease store, never null
   * @param theOptions    the timing options, never null
   * @param theClock      the clock, never null
   * @param theRandom     the random source, never null
   * @param theMetrics    the telemetry sink, never null
   * @param theHeartbeats the heartbeat sink, never null
   */
  public LeaderCoordinator(final String theChannel, final String theInstanceId,
      final String theLeaseKey, final LeaseStore theStore,
      final ChannelOptions theOptions, final Clock theClock,
      final Random theRandom, final RealtimeMetrics theMetrics,
      final HeartbeatPublisher theHeartbeats) {
    channel = Objects.requireNonNull(theChannel, "channel must not be null");
    instanceId = Objects.requireNonNull(theInstanceId,
        "instanceId must not be null");
    leaseKey = Objects.requireNonNull(theLeaseKey,
        "leaseKey must not be null");
    store = Objects.requireNonNull(theStore, "store must not be null");
    options = Objects.requireNonNull(theOptions, "options must not be null");
    clock = Objects.requireNonNull(theClock, "clock must not be null");
    random = Objects.requireNonNull(theRandom, "random must not be null");
    metrics = Objects.requireNonNull(theMetrics, "metrics must not be null");
    heartbeats = Objects.requireNonNull(theHeartbeats,
        "heartbeats must not be null");
  }

  /**
   * Tries to become the leader of the channel scope.
   *
   * <p>A valid lease held by another instance leaves this one as follower.
   * A valid lease held by this instance is adopted again.
   *
   * @return the resulting role, never null
   */
  public synchronized LeaderRole tryAcquire() {
    if (!options.leaderElectionEnabled()) {
      becomeLeader(false);
      return role;
    }
    final Instant now = clock.instant();
    try {
      final Optional<String> raw = store.read(leaseKey);
      final Optional<Lease> current = raw.flatMap(LeaseCodec::parse);

      if (current.isPresent() && !current.get().isExpired(now)) {
        singleInstance = false;
        if (current.get().isOwnedBy(instanceId)) {
          becomeLeader(false);
        } else {
          becomeFollower();
        }
        return role;
      }

      final boolean takeover = raw.isPresent()
          && !current.map(lease -> lease.isOwnedBy(instanceId)).orElse(false);
      final Lease claim = new Lease(instanceId, expiry(now));
      final boolean written = store.writeIfFresh(leaseKey, raw.orElse(null),
          LeaseCodec.serialize(claim));
      singleInstance = false;
      if (written && ownsStoredLease()) {
        log.debug("Lease {} claimed by {}", leaseKey, instanceId);
        becomeLeader(takeover);
      } else {
        log.debug("Lost the race for lease {}", leaseKey);
        becomeFollower();
      }
    } catch (final LeaseStoreUnavailableException e) {
      enterSingleInstance(e);
    }
    return role;
  }

  /**
   * Extends the lease of the leader and publishes a heartbeat.
   *
   * <p>Does nothing unless this instance is the leader. A leader whose lease
   * now belongs to another valid owner becomes a follower.
   *
   * @return true if the lease was renewed, false otherwise
   */
  public synchronized boolean renew() {
    if (role != LeaderRole.LEADER) {
      return false;
    }
    final Instant now = clock.instant();
    if (!options.leaderElectionEnabled()) {
      heartbeat(now);
      return true;
    }
    try {
      final Optional<String> raw = store.read(leaseKey);
      final Optional<Lease> current = raw.flatMap(LeaseCodec::parse);
      if (isHeldByOther(current, now)) {
        log.info("Lease {} now held by {}, stepping down", leaseKey,
            current.get().owner());
        demote();
        return false;
      }
      final boolean written = store.writeIfFresh(leaseKey, raw.orElse(null),
          LeaseCodec.serialize(new Lease(instanceId, expiry(now))));
      if (!written && !ownsStoredLease()) {
        log.info("Lease {} renewal lost to another instance", leaseKey);
        demote();
        return false;
      }
      if (singleInstance) {
        log.info("Lease store reachable again for channel {}", channel);
        singleInstance = false;
      }
    } catch (final LeaseStoreUnavailableException e) {
      enterSingleInstance(e);
    }
    heartbeat(now);
    return true;
  }

  /**
   * Checks the lease as a follower and takes it over if it went stale.
   *
   * @return the resulting role, never null
   */
  public synchronized LeaderRole followerTick() {
    if (role == LeaderRole.LEADER && !singleInstance) {
      return role;
    }
    return tryAcquire();
  }

  /**
   * Handles a heartbeat published by a leader.
   *
   * <p>A leader that receives a heartbeat from another instance, stamped no
   * earlier than its own last heartbeat, becomes a follower.
   *
   * @param sender the instance that published the heartbeat, never null
   * @param at     the heartbeat instant, never null
   */
  public synchronized void onHeartbeat(final String sender, final Instant at) {
    Objects.requireNonNull(sender, "sender must not be null");
    Objects.requireNonNull(at, "at must not be null");
    if (sender.equals(instanceId) || role != LeaderRole.LEADER
        || !options.leaderElectionEnabled()) {
      return;
    }
    if (lastOwnHeartbeat == null || !at.isBefore(lastOwnHeartbeat)) {
      log.info("Heartbeat from {} on channel {}, stepping down", sender,
          channel);
      demote();
    }
  }

  /**
   * Moves the coordinator to another channel scope.
   *
   * <p>Leadership of the previous scope is dropped without touching its
   * lease, which expires on its own.
   *
   * @param theLeaseKey the lease key of the new scope, never null
   */
  public synchronized void rescope(final String theLeaseKey) {
    Objects.requireNonNull(theLeaseKey, "leaseKey must not be null");
    if (theLeaseKey.equals(leaseKey)) {
      return;
    }
    final boolean wasLeader = role == LeaderRole.LEADER;
    leaseKey = theLeaseKey;
    role = LeaderRole.UNLEASED;
    singleInstance = false;
    lastOwnHeartbeat = null;
    if (wasLeader) {
      notifyListeners(false);
    }
  }

  /** Leaves the election without touching the lease. */
  public synchronized void stop() {
    final boolean wasLeader = role == LeaderRole.LEADER;
    role = LeaderRole.UNLEASED;
    singleInstance = false;
    lastOwnHeartbeat = null;
    if (wasLeader) {
      log.info("Channel {} stopped, lease {} left to expire", channel,
          leaseKey);
      notifyListeners(false);
    }
  }

  /**
   * Returns the current role.
   *
   * @return the role, never null
   */
  public synchronized LeaderRole role() {
    return role;
  }

  /**
   * Returns whether this instance is the leader.
   *
   * @return true while in {@link LeaderRole#LEADER}
   */
  public synchronized boolean isLeader() {
    return role == LeaderRole.LEADER;
  }

  /**
   * Returns whether leadership is held only because the store is down.
   *
   * @return true in single-instance mode
   */
  public synchronized boolean isSingleInstance() {
    return singleInstance;
  }

  /**
   * Returns the key of the current lease.
   *
   * @return the lease key, never null
   */
  public synchronized String leaseKey() {
    return leaseKey;
  }

  /**
   * Registers a listener.
   *
   * @param listener the listener, never null
   */
  public void onLeaderChange(final LeaderChangeListener listener) {
    Objects.requireNonNull(listener, "listener must not be null");
    listeners.add(listener);
  }

  /**
   * Re-reads the lease and checks this instance holds it.
   *
   * @return true if the stored lease is owned by this instance
   */
  private boolean ownsStoredLease() {
    return store.read(leaseKey).flatMap(LeaseCodec::parse)
        .map(lease -> lease.isOwnedBy(instanceId))
        .orElse(false);
  }

  /**
   * Checks whether a lease is valid and owned by another instance.
   *
   * @param lease the stored lease
   * @param now the current instant
   * @return true if another instance holds a valid lease
   */
  private boolean isHeldByOther(final Optional<Lease> lease,
      final Instant now) {
    return lease.isPresent() && !lease.get().isExpired(now)
        && !lease.get().isOwnedBy(instanceId);
  }

  /**
   * Computes the expiry of a new claim.
   *
   * @param now the current instant
   * @return now plus the TTL plus a random jitter
   */
  private Instant expiry(final Instant now) {
    final long jitterMs = options.leaseJitter().toMillis();
    final long jitter = jitterMs == 0
        ? 0 : (long) (random.nextDouble() * (jitterMs + 1));
    return now.plus(options.leaseTtl()).plus(Duration.ofMillis(jitter));
  }

  /**
   * Acts as leader because the store cannot be reached.
   *
   * @param cause the store failure
   */
  private void enterSingleInstance(final LeaseStoreUnavailableException cause) {
    if (!singleInstance) {
      log.warn("Lease store unavailable for channel {}, acting as single"
          + " instance: {}", channel, cause.getMessage());
    }
    singleInstance = true;
    becomeLeader(false);
  }

  /**
   * Transitions into the leader role.
   *
   * @param takeover whether a stale lease of another instance was replaced
   */
  private void becomeLeader(final boolean takeover) {
    if (role == LeaderRole.LEADER) {
      return;
    }
    role = LeaderRole.LEADER;
    log.info("Instance {} is now leader of channel {}", instanceId, channel);
    metrics.leaderAcquired(channel, takeover);
    heartbeat(clock.instant());
    notifyListeners(true);
  }

  /** Transitions into the follower role, demoting a current leader. */
  private void becomeFollower() {
    if (role == LeaderRole.LEADER) {
      demote();
      return;
    }
    role = LeaderRole.FOLLOWER;
  }

  /** Steps down from leadership. */
  private void demote() {
    role = LeaderRole.FOLLOWER;
    singleInstance = false;
    log.info("Instance {} is no longer leader of channel {}", instanceId,
        channel);
    metrics.leaderDemoted(channel);
    notifyListeners(false);
  }

  /**
   * Publishes a heartbeat and remembers its instant.
   *
   * @param now the heartbeat instant
   */
  private void heartbeat(final Instant now) {
    lastOwnHeartbeat = now;
    try {
      heartbeats.publishHeartbeat(now);
    } catch (final RuntimeException e) {
      log.warn("Failed to publish heartbeat for channel {}: {}", channel,
          e.getMessage());
    }
  }

  /**
   * Notifies the listeners of a leadership change.
   *
   * @param isLeader the new leadership status
   */
  private void notifyListeners(final boolean isLeader) {
    for (final LeaderChangeListener listener : listeners) {
      try {
        listener.onLeaderChange(isLeader);
      } catch (final Exception e) {
        log.error("Error notifying leader change listener", e);
      }
    }
  }
}
