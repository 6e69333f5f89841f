package org.waabox.concierge;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.waabox.concierge.backoff.BackoffPolicy;
import org.waabox.concierge.backoff.BackoffState;
import org.waabox.concierge.backoff.CycleOutcome;
import org.waabox.concierge.cursor.CursorPosition;
import org.waabox.concierge.cursor.CursorStore;
import org.waabox.concierge.dispatch.Dispatcher;
import org.waabox.concierge.fanout.BroadcastTopic;
import org.waabox.concierge.fanout.FanoutListener;
import org.waabox.concierge.fanout.FanoutMessage;
import org.waabox.concierge.health.HealthMonitor;
import org.waabox.concierge.health.HealthSnapshot;
import org.waabox.concierge.leader.LeaderCoordinator;
import org.waabox.concierge.leader.LeaderRole;
import org.waabox.concierge.metrics.RealtimeMetrics;
import org.waabox.concierge.metrics.SampledRealtimeMetrics;
import org.waabox.concierge.transport.CancelToken;
import org.waabox.concierge.transport.PollResult;
import org.waabox.concierge.transport.TransportClient;
import org.waabox.concierge.visibility.VisibilityGate;
import org.waabox.concierge.visibility.VisibilityListener;

/**
 * One realtime subscription of a {@link Concierge}.
 *
 * <p>A channel owns its cursor scope, its backoff state, the cancel token
 * of the request in flight and the pending timers. Its control loop is:
 * <ol>
 *   <li>The {@link VisibilityGate} decides whether cycles may run at
 *       all.</li>
 *   <li>The {@link LeaderCoordinator} decides the role of this
 *       instance.</li>
 *   <li>The leader polls, adopts the returned cursor, publishes the events
 *       on the fanout topic and dispatches them locally, updates the health
 *       snapshot and schedules the next cycle after the backoff delay. It
 *       renews the lease at a fixed interval.</li>
 *   <li>A follower never touches the network. It dispatches the events the
 *       leader fans out and checks the lease at a randomized interval,
 *       taking it over once it goes stale.</li>
 * </ol>
 *
 * <p>Every state transition runs on the single scheduler thread of the
 * owning {@link Concierge}; transport completions, fanout messages and
 * visibility changes hop onto it. There is at most one pending cycle and
 * one request in flight per channel.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class RealtimeChannel {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(RealtimeChannel.class);

  /** The channel name. */
  private final String name;

  /** The timing options. */
  private final ChannelOptions options;

  /** The id of this instance. */
  private final String instanceId;

  /** The naming of shared keys and topics. */
  private final SessionScope scope;

  /** The scheduler all transitions run on. */
  private final ScheduledExecutorService scheduler;

  /** The clock. */
  private final Clock clock;

  /** The random source for the follower tick. */
  private final Random random;

  /** The long-poll client of this channel. */
  private final TransportClient transport;

  /** The backoff computation. */
  private final BackoffPolicy backoffPolicy;

  /** The shared cursor store. */
  private final CursorStore cursors;

  /** The shared dispatcher. */
  private final Dispatcher dispatcher;

  /** The health of this channel. */
  private final HealthMonitor health;

  /** The broadcast topic shared by the session. */
  private final BroadcastTopic broadcast;

  /** The visibility of the process. */
  private final VisibilityGate visibility;

  /** The telemetry sink. */
  private final RealtimeMetrics metrics;

  /** The sampled telemetry sink for per-cycle events. */
  private final RealtimeMetrics sampledMetrics;

  /** The lease state machine. */
  private final LeaderCoordinator coordinator;

  /** The fanout listener of this channel. */
  private final FanoutListener fanoutListener = this::receive;

  /** The visibility listener of this channel. */
  private final VisibilityListener visibilityListener =
      this::visibilityChanged;

  /** Whether the channel is running. */
  private volatile boolean running;

  /** The current filter, null for none. */
  private volatile String filter;

  /** The current backoff state. */
  private volatile BackoffState backoff;

  /** The fanout topic of the current channel scope. */
  private String fanoutTopic;

  /** The token of the request in flight, null if none. */
  private CancelToken inFlight;

  /** The pending cycle, null if none. */
  private ScheduledFuture<?> cycleTimer;

  /** The pending follower tick, null if none. */
  private ScheduledFuture<?> followerTimer;

  /** The lease renewal task, null if not leader. */
  private ScheduledFuture<?> renewTimer;

  /**
   * Creates a new channel owned by a concierge.
   *
   * @param theName    the channel name, never null
   * @param theFilter  the initial filter, null for none
   * @param theOptions the timing options, never null
   * @param hub        the owning concierge, never null
   */
  RealtimeChannel(final String theName, final String theFilter,
      final ChannelOptions theOptions, final Concierge hub) {
    name = Objects.requireNonNull(theName, "name must not be null");
    options = Objects.requireNonNull(theOptions, "options must not be null");
    Objects.requireNonNull(hub, "hub must not be null");

    filter = theFilter;
    instanceId = hub.instanceId();
    scope = hub.scope();
    scheduler = hub.scheduler();
    clock = hub.clock();
    random = hub.random();
    cursors = hub.cursors();
    dispatcher = hub.dispatcher();
    broadcast = hub.broadcastTopic();
    visibility = hub.visibility();
    metrics = hub.metrics();
    sampledMetrics = new SampledRealtimeMetrics(metrics,
        options.telemetrySampleRate(), random);

    transport = new TransportClient(hub.request(), hub.credentials(), clock,
        options.longPollWindow());
    backoffPolicy = new BackoffPolicy(options, random);
    backoff = backoffPolicy.initial();
    health = new HealthMonitor(name, clock);

    final String channelScope = SessionScope.channelScope(name, filter);
    fanoutTopic = scope.topic(channelScope);
    coordinator = new LeaderCoordinator(name, instanceId,
        scope.leaseKey(channelScope), hub.leaseStore(), options, clock,
        random, metrics, this::publishHeartbeat);
    coordinator.onLeaderChange(this::leadershipChanged);
  }

  /**
   * Starts the channel.
   *
   * <p>Subscribes to the fanout topic and to visibility changes, and takes
   * part in the election. Starting a running channel has no effect.
   *
   * @return a future completed once the channel has started, never null
   */
  public CompletableFuture<Void> start() {
    return CompletableFuture.runAsync(this::doStart, scheduler);
  }

  /**
   * Stops the channel.
   *
   * <p>Cancels the request in flight and every timer, leaves the election
   * and marks the health snapshot idle. The lease is left to expire.
   *
   * @return a future completed once the channel has stopped, never null
   */
  public CompletableFuture<Void> stop() {
    return CompletableFuture.runAsync(this::doStop, scheduler);
  }

  /**
   * Stops the channel on the calling thread, which must be the scheduler.
   */
  void stopNow() {
    doStop();
  }

  /**
   * Changes the server-side filter of the channel.
   *
   * <p>The request in flight is cancelled and its late result discarded,
   * the cursor and the backoff are reset, and the channel moves to the
   * lease and topic of the new scope. A leader polls immediately. Setting
   * the current filter again has no effect.
   *
   * @param theFilter the new filter, null for none
   * @return a future completed once the filter has changed, never null
   */
  public CompletableFuture<Void> changeFilter(final String theFilter) {
    return CompletableFuture.runAsync(() -> doChangeFilter(theFilter),
        scheduler);
  }

  /**
   * Returns the channel name.
   *
   * @return the name, never null
   */
  public String name() {
    return name;
  }

  /**
   * Returns the current filter.
   *
   * @return the filter, null for none
   */
  public String filter() {
    return filter;
  }

  /**
   * Returns the timing options.
   *
   * @return the options, never null
   */
  public ChannelOptions options() {
    return options;
  }

  /**
   * Returns whether the channel is running.
   *
   * @return true between start and stop
   */
  public boolean isRunning() {
    return running;
  }

  /**
   * Returns the role of this instance for the channel.
   *
   * @return the role, never null
   */
  public LeaderRole role() {
    return coordinator.role();
  }

  /**
   * Returns whether this instance is the leader of the channel.
   *
   * @return true while leader
   */
  public boolean isLeader() {
    return coordinator.isLeader();
  }

  /**
   * Returns the current health snapshot.
   *
   * @return the snapshot, never null
   */
  public HealthSnapshot health() {
    return health.snapshot();
  }

  /**
   * Returns the health monitor, to register listeners.
   *
   * @return the monitor, never null
   */
  public HealthMonitor healthMonitor() {
    return health;
  }

  /**
   * Returns the current cursor position.
   *
   * @return the position, never null
   */
  public CursorPosition cursor() {
    return cursors.position(name);
  }

  /**
   * Returns the current backoff state.
   *
   * @return the state, never null
   */
  public BackoffState backoff() {
    return backoff;
  }

  /** Starts the channel on the scheduler thread. */
  private void doStart() {
    if (running) {
      return;
    }
    running = true;
    backoff = backoffPolicy.initial();
    cursors.changeFilter(name, filter);
    broadcast.subscribe(fanoutTopic, fanoutListener);
    visibility.onVisibilityChange(visibilityListener);
    log.info("Channel {} started with filter {}", name, filter);
    elect();
  }

  /** Stops the channel on the scheduler thread. */
  private void doStop() {
    if (!running) {
      return;
    }
    running = false;
    cancelInFlight();
    cancelCycle();
    cancelFollowerTick();
    stopRenewing();
    visibility.removeListener(visibilityListener);
    broadcast.unsubscribe(fanoutTopic, fanoutListener);
    coordinator.stop();
    health.markIdle();
    log.info("Channel {} stopped", name);
  }

  /**
   * Changes the filter on the scheduler thread.
   *
   * @param theFilter the new filter
   */
  private void doChangeFilter(final String theFilter) {
    if (Objects.equals(filter, theFilter)) {
      return;
    }
    log.info("Channel {} filter changed from {} to {}", name, filter,
        theFilter);
    filter = theFilter;
    if (!running) {
      rescope();
      return;
    }
    cancelInFlight();
    cancelCycle();
    cancelFollowerTick();
    stopRenewing();
    cursors.changeFilter(name, filter);
    backoff = backoffPolicy.initial();
    broadcast.unsubscribe(fanoutTopic, fanoutListener);
    rescope();
    broadcast.subscribe(fanoutTopic, fanoutListener);
    elect();
    if (coordinator.isLeader()) {
      scheduleCycle(Duration.ZERO);
    }
  }

  /** Points the coordinator and the topic at the current channel scope. */
  private void rescope() {
    final String channelScope = SessionScope.channelScope(name, filter);
    fanoutTopic = scope.topic(channelScope);
    coordinator.rescope(scope.leaseKey(channelScope));
  }

  /** Takes part in the election and arms the timers of the outcome. */
  private void elect() {
    coordinator.tryAcquire();
    if (!coordinator.isLeader()) {
      scheduleFollowerTick();
    }
  }

  /** Runs one poll cycle. */
  private void cycle() {
    cycleTimer = null;
    if (!running || !coordinator.isLeader()) {
      return;
    }
    if (!visibility.isForeground()) {
      park();
      return;
    }
    final CursorPosition position = cursors.position(name);
    final CancelToken token = new CancelToken();
    inFlight = token;
    transport.poll(name, position.cursor(), position.filter(), token)
        .thenAcceptAsync(result -> complete(position.generation(), token,
            result), scheduler)
        .exceptionally(error -> {
          log.warn("Channel {} could not handle a poll result: {}", name,
              error.getMessage());
          return null;
        });
  }

  /**
   * Handles a poll result on the scheduler thread.
   *
   * @param generation the cursor generation the poll was sent with
   * @param token the token of the poll
   * @param result the result
   */
  private void complete(final long generation, final CancelToken token,
      final PollResult result) {
    if (inFlight == token) {
      inFlight = null;
    }
    if (!running) {
      return;
    }
    if (generation != cursors.position(name).generation()) {
      log.debug("Channel {} discarding result of a superseded filter", name);
      return;
    }
    final long latency = result.latencyMs();
    switch (result.outcome()) {
      case CANCELLED -> {
        return;
      }
      case EVENTS -> {
        cursors.adopt(name, generation, result.cursor());
        if (coordinator.isLeader()) {
          broadcast.publish(fanoutTopic, FanoutMessage.events(instanceId,
              clock.instant(), result.events(),
              cursors.position(name).cursor()));
        }
        metrics.eventsDelivered(name, result.events().size(), false);
        health.recordEvents();
        backoff = backoffPolicy.next(backoff, CycleOutcome.SUCCESS_WITH_EVENTS,
            latency);
        // Handlers may stop the channel, so they run last.
        dispatcher.dispatch(name, result.events());
      }
      case EMPTY, MALFORMED -> {
        cursors.adopt(name, generation, result.cursor());
        health.recordEmpty();
        backoff = backoffPolicy.next(backoff, CycleOutcome.SUCCESS_EMPTY,
            latency);
        if (backoffPolicy.isFastEmpty(latency)) {
          sampledMetrics.fastEmpty(name, latency, backoff.currentDelayMs(),
              coordinator.isLeader());
        }
      }
      case FAILED -> {
        health.recordFailure();
        metrics.cycleFailed(name, result.error());
        backoff = backoffPolicy.next(backoff, CycleOutcome.ERROR, latency);
      }
      case AUTH_MISSING, DROPPED -> log.debug("Channel {} skipped a cycle: {}",
          name, result.outcome());
      default -> throw new IllegalStateException(
          "Unknown outcome: " + result.outcome());
    }
    if (running) {
      scheduleCycle(backoff.currentDelay());
    }
  }

  /** Waits for the process to come back to the foreground. */
  private void park() {
    scheduleCycle(followerTickDelay());
  }

  /** Checks the lease as a follower. */
  private void followerTick() {
    followerTimer = null;
    if (!running || coordinator.isLeader()) {
      return;
    }
    if (visibility.isForeground()) {
      coordinator.followerTick();
    }
    if (!coordinator.isLeader()) {
      scheduleFollowerTick();
    }
  }

  /** Renews the lease of the leader. */
  private void renewTick() {
    if (!running) {
      return;
    }
    final Duration backgrounded = visibility.backgroundedFor();
    if (backgrounded.compareTo(options.leaseTtl()) >= 0) {
      log.debug("Channel {} backgrounded for {}, not renewing", name,
          backgrounded);
      return;
    }
    coordinator.renew();
  }

  /**
   * Reacts to a leadership change.
   *
   * @param isLeader the new leadership status
   */
  private void leadershipChanged(final boolean isLeader) {
    if (!running) {
      return;
    }
    if (isLeader) {
      cancelFollowerTick();
      startRenewing();
      scheduleCycle(backoff.currentDelay());
    } else {
      cancelInFlight();
      cancelCycle();
      stopRenewing();
      scheduleFollowerTick();
    }
  }

  /**
   * Hops a fanout message onto the scheduler.
   *
   * @param message the message
   */
  private void receive(final FanoutMessage message) {
    if (instanceId.equals(message.sender())) {
      return;
    }
    Concierge.submit(scheduler, () -> handle(message));
  }

  /**
   * Handles a fanout message on the scheduler thread.
   *
   * @param message the message
   */
  private void handle(final FanoutMessage message) {
    if (!running) {
      return;
    }
    switch (message.kind()) {
      case HEARTBEAT -> coordinator.onHeartbeat(message.sender(),
          message.at());
      case EVENTS -> {
        if (coordinator.isLeader()) {
          log.debug("Leader of channel {} ignoring events from {}", name,
              message.sender());
          return;
        }
        final long generation = cursors.position(name).generation();
        cursors.adopt(name, generation, message.cursor());
        metrics.eventsDelivered(name, message.events().size(), true);
        health.recordEvents();
        dispatcher.dispatch(name, message.events());
      }
      default -> log.debug("Channel {} ignoring {} message", name,
          message.kind());
    }
  }

  /**
   * Hops a visibility change onto the scheduler.
   *
   * @param foreground the new visibility
   */
  private void visibilityChanged(final boolean foreground) {
    Concierge.submit(scheduler, () -> applyVisibility(foreground));
  }

  /**
   * Applies a visibility change on the scheduler thread.
   *
   * @param foreground the new visibility
   */
  private void applyVisibility(final boolean foreground) {
    if (!running) {
      return;
    }
    if (!foreground) {
      cancelInFlight();
      cancelCycle();
      if (coordinator.isLeader()) {
        park();
      }
      return;
    }
    if (coordinator.isLeader()) {
      scheduleCycle(Duration.ZERO);
    } else {
      cancelFollowerTick();
      followerTick();
    }
  }

  /**
   * Publishes a heartbeat of this instance.
   *
   * @param at the heartbeat instant
   */
  private void publishHeartbeat(final Instant at) {
    broadcast.publish(fanoutTopic, FanoutMessage.heartbeat(instanceId, at));
  }

  /**
   * Schedules the next cycle, replacing a pending one.
   *
   * @param delay the delay
   */
  private void scheduleCycle(final Duration delay) {
    cancelCycle();
    cycleTimer = scheduler.schedule(this::cycle, delay.toMillis(),
        TimeUnit.MILLISECONDS);
  }

  /** Schedules the next follower tick, replacing a pending one. */
  private void scheduleFollowerTick() {
    cancelFollowerTick();
    followerTimer = scheduler.schedule(this::followerTick,
        followerTickDelay().toMillis(), TimeUnit.MILLISECONDS);
  }

  /** Starts renewing the lease at a fixed interval. */
  private void startRenewing() {
    stopRenewing();
    if (!options.leaderElectionEnabled()) {
      return;
    }
    final long interval = options.renewInterval().toMillis();
    renewTimer = scheduler.scheduleAtFixedRate(this::renewTick, interval,
        interval, TimeUnit.MILLISECONDS);
  }

  /**
   * Draws a delay within the follower tick band.
   *
   * @return the delay, never null
   */
  private Duration followerTickDelay() {
    final long min = options.followerTickMin().toMillis();
    final long span = options.followerTickMax().toMillis() - min;
    return Duration.ofMillis(min + (long) (random.nextDouble() * (span + 1)));
  }

  /** Cancels the request in flight. */
  private void cancelInFlight() {
    final CancelToken token = inFlight;
    inFlight = null;
    if (token != null) {
      token.cancel();
    }
  }

  /** Cancels the pending cycle. */
  private void cancelCycle() {
    if (cycleTimer != null) {
      cycleTimer.cancel(false);
      cycleTimer = null;
    }
  }

  /** Cancels the pending follower tick. */
  private void cancelFollowerTick() {
    if (followerTimer != null) {
      followerTimer.cancel(false);
      followerTimer = null;
    }
  }

  /** Stops renewing the lease. */
  private void stopRenewing() {
    if (renewTimer != null) {
      renewTimer.cancel(false);
      renewTimer = null;
    }
  }
}
