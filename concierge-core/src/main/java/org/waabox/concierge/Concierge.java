package org.waabox.concierge;

import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.waabox.concierge.cursor.CursorStore;
import org.waabox.concierge.dispatch.Dispatcher;
import org.waabox.concierge.dispatch.EventHandler;
import org.waabox.concierge.fanout.BroadcastTopic;
import org.waabox.concierge.fanout.FanoutListener;
import org.waabox.concierge.fanout.FanoutMessage;
import org.waabox.concierge.fanout.InMemoryBroadcastTopic;
import org.waabox.concierge.health.HealthSnapshot;
import org.waabox.concierge.leader.InMemoryLeaseStore;
import org.waabox.concierge.leader.LeaseStore;
import org.waabox.concierge.metrics.NoopRealtimeMetrics;
import org.waabox.concierge.metrics.RealtimeMetrics;
import org.waabox.concierge.transport.CancellableRequest;
import org.waabox.concierge.transport.CredentialsProvider;
import org.waabox.concierge.visibility.VisibilityGate;

/**
 * The realtime hub of one process.
 *
 * <p>Concierge keeps the instances of an authenticated session synchronized
 * with server-side changes while only one instance per channel actually
 * long-polls the server. It owns the scheduler thread every channel runs
 * on, the {@link VisibilityGate}, the {@link Dispatcher}, the
 * {@link LeaseStore} and the {@link BroadcastTopic}.
 *
 * <p>Typical usage:
 * <pre>{@code
 * Concierge concierge = Concierge.builder()
 *     .sessionId(session.id())
 *     .credentials(() -> Optional.ofNullable(session.token()))
 *     .request(new HttpCancellableRequest(
 *         HttpTransportConfig.create(URI.create("https://api.example.com"))))
 *     .leaseStore(new JdbcLeaseStore(dataSource))
 *     .broadcastTopic(new HttpBroadcastTopic(config))
 *     .build();
 *
 * concierge.register("finance", "property=42", ChannelOptions.defaults());
 * concierge.subscribe("finance", (channel, events) -> apply(events));
 * concierge.start();
 * // ... on shutdown
 * concierge.stop();
 * }</pre>
 *
 * <p>When the session ends, {@link #logout()} stops every channel of every
 * instance of the session.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class Concierge {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(Concierge.class);

  /** The default foreground debounce of the visibility gate. */
  private static final Duration DEFAULT_RESUME_DEBOUNCE =
      Duration.ofMillis(500);

  /** How long stop waits for each channel to wind down. */
  private static final long STOP_TIMEOUT_SECONDS = 5;

  /** The unique identifier of this instance. */
  private final String instanceId;

  /** The naming of the session's shared keys and topics. */
  private final SessionScope scope;

  /** The bearer token source. */
  private final CredentialsProvider credentials;

  /** The network call of a poll cycle. */
  private final CancellableRequest request;

  /** The shared lease store. */
  private final LeaseStore leaseStore;

  /** The session broadcast topic. */
  private final BroadcastTopic broadcastTopic;

  /** The clock. */
  private final Clock clock;

  /** The random source. */
  private final Random random;

  /** The telemetry sink. */
  private final RealtimeMetrics metrics;

  /** The options of channels registered without their own. */
  private final ChannelOptions defaultOptions;

  /** The visibility of this process. */
  private final VisibilityGate visibility;

  /** The local event dispatcher. */
  private final Dispatcher dispatcher = new Dispatcher();

  /** The cursors of every channel. */
  private final CursorStore cursors = new CursorStore();

  /** The registered channels, keyed by name. */
  private final Map<String, RealtimeChannel> channels =
      new ConcurrentHashMap<>();

  /** The callbacks run when the session ends. */
  private final List<Runnable> logoutListeners = new CopyOnWriteArrayList<>();

  /** The listener of the session control topic. */
  private final FanoutListener controlListener = this::onControlMessage;

  /** Whether this instance has been started. */
  private final AtomicBoolean started = new AtomicBoolean(false);

  /** Whether this instance has been stopped. */
  private final AtomicBoolean stopped = new AtomicBoolean(false);

  /** The single thread every channel transition runs on. */
  private final ScheduledExecutorService scheduler;

  /** The thread of the scheduler, null until it first runs a task. */
  private volatile Thread schedulerThread;

  /** Private constructor; use {@link #builder()}. */
  private Concierge(final Builder builder) {
    instanceId = builder.instanceId != null
        ? builder.instanceId : UUID.randomUUID().toString();
    scope = SessionScope.of(builder.sessionId);
    credentials = Objects.requireNonNull(builder.credentials,
        "credentials must not be null");
    request = Objects.requireNonNull(builder.request,
        "request must not be null");
    leaseStore = builder.leaseStore != null
        ? builder.leaseStore : new InMemoryLeaseStore();
    broadcastTopic = builder.broadcastTopic != null
        ? builder.broadcastTopic : new InMemoryBroadcastTopic();
    clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    random = builder.random != null ? builder.random : new Random();
    metrics = builder.metrics != null
        ? builder.metrics : new NoopRealtimeMetrics();
    defaultOptions = builder.defaultOptions != null
        ? builder.defaultOptions : ChannelOptions.defaults();
    visibility = builder.visibility != null
        ? builder.visibility
        : new VisibilityGate(clock, builder.resumeDebounce);
    scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
      final Thread thread = new Thread(r, "concierge-realtime");
      thread.setDaemon(true);
      schedulerThread = thread;
      return thread;
    });
  }

  /**
   * Creates a new builder.
   *
   * @return a new builder, never null
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Registers a channel with the default options and no filter.
   *
   * @param channel the channel name, never null
   * @return the registered channel, never null
   */
  public RealtimeChannel register(final String channel) {
    return register(channel, null, defaultOptions);
  }

  /**
   * Registers a channel.
   *
   * <p>Channels must be registered before {@link #start()}. Once started,
   * a channel can be stopped and started again on its own.
   *
   * @param channel the channel name, never null
   * @param filter  the initial filter, null for none
   * @param options the timing options, never null
   * @return the registered channel, never null
   *
   * @throws IllegalStateException    if this instance has been started
   * @throws IllegalArgumentException if the channel is already registered
   */
  public RealtimeChannel register(final String channel, final String filter,
      final ChannelOptions options) {
    Objects.requireNonNull(channel, "channel must not be null");
    Objects.requireNonNull(options, "options must not be null");
    if (channel.isEmpty()) {
      throw new IllegalArgumentException("channel must not be empty");
    }
    if (started.get()) {
      throw new IllegalStateException(
          "Cannot register channels after start() has been called");
    }
    final RealtimeChannel created = new RealtimeChannel(channel, filter,
        options, this);
    final RealtimeChannel existing = channels.putIfAbsent(channel, created);
    if (existing != null) {
      throw new IllegalArgumentException(
          "A channel with name '" + channel + "' is already registered");
    }
    return created;
  }

  /**
   * Subscribes a handler to the events of a channel.
   *
   * @param channel the channel name, never null
   * @param handler the handler, never null
   */
  public void subscribe(final String channel, final EventHandler handler) {
    dispatcher.subscribe(channel, handler);
  }

  /**
   * Removes a handler from a channel.
   *
   * @param channel the channel name, never null
   * @param handler the handler, never null
   * @return true if the handler was subscribed
   */
  public boolean unsubscribe(final String channel,
      final EventHandler handler) {
    return dispatcher.unsubscribe(channel, handler);
  }

  /**
   * Starts the broadcast topic and every registered channel.
   *
   * @throws IllegalStateException if this instance was already started
   */
  public void start() {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("Concierge has already been started");
    }
    broadcastTopic.subscribe(scope.controlTopic(), controlListener);
    broadcastTopic.start();
    for (final RealtimeChannel channel : channels.values()) {
      channel.start();
    }
    log.info("Concierge {} started with {} channel(s)", instanceId,
        channels.size());
  }

  /**
   * Stops every channel, the broadcast topic and the scheduler.
   *
   * <p>Leases are not deleted; they expire on their own so that another
   * instance takes over. Calling this method more than once has no effect.
   */
  public void stop() {
    if (!stopped.compareAndSet(false, true)) {
      return;
    }
    stopChannels();
    broadcastTopic.unsubscribe(scope.controlTopic(), controlListener);
    broadcastTopic.stop();
    scheduler.shutdownNow();
    log.info("Concierge {} stopped", instanceId);
  }

  /**
   * Ends the session on every instance.
   *
   * <p>Publishes a logout message to the other instances of the session,
   * stops every local channel and runs the logout listeners.
   */
  public void logout() {
    log.info("Concierge {} logging out", instanceId);
    broadcastTopic.publish(scope.controlTopic(),
        FanoutMessage.logout(instanceId, clock.instant()));
    endSession();
  }

  /**
   * Registers a callback run when the session ends, locally or on another
   * instance.
   *
   * @param listener the callback, never null
   */
  public void onLogout(final Runnable listener) {
    Objects.requireNonNull(listener, "listener must not be null");
    logoutListeners.add(listener);
  }

  /**
   * Returns a registered channel.
   *
   * @param name the channel name, never null
   * @return the channel, never null
   *
   * @throws IllegalArgumentException if no such channel is registered
   */
  public RealtimeChannel channel(final String name) {
    Objects.requireNonNull(name, "name must not be null");
    final RealtimeChannel channel = channels.get(name);
    if (channel == null) {
      throw new IllegalArgumentException(
          "No channel registered with name: " + name);
    }
    return channel;
  }

  /**
   * Returns the health snapshot of a channel.
   *
   * @param name the channel name, never null
   * @return the snapshot, never null
   *
   * @throws IllegalArgumentException if no such channel is registered
   */
  public HealthSnapshot health(final String name) {
    return channel(name).health();
  }

  /**
   * Returns an unmodifiable view of the registered channels.
   *
   * @return the channels, never null
   */
  public Collection<RealtimeChannel> channels() {
    return Collections.unmodifiableCollection(channels.values());
  }

  /**
   * Returns the identifier of this instance.
   *
   * @return the instance id, never null
   */
  public String instanceId() {
    return instanceId;
  }

  /**
   * Returns the local dispatcher.
   *
   * @return the dispatcher, never null
   */
  public Dispatcher dispatcher() {
    return dispatcher;
  }

  /**
   * Returns the visibility gate of this process.
   *
   * @return the gate, never null
   */
  public VisibilityGate visibility() {
    return visibility;
  }

  /**
   * Submits a task to a scheduler, logging instead of failing once the
   * scheduler has been shut down.
   *
   * @param scheduler the scheduler, never null
   * @param task      the task, never null
   */
  static void submit(final ScheduledExecutorService scheduler,
      final Runnable task) {
    try {
      scheduler.execute(task);
    } catch (final RejectedExecutionException e) {
      log.debug("Scheduler shut down, task discarded: {}", e.getMessage());
    }
  }

  /**
   * Handles a message of the session control topic.
   *
   * @param message the message
   */
  private void onControlMessage(final FanoutMessage message) {
    if (message.kind() != FanoutMessage.Kind.LOGOUT
        || instanceId.equals(message.sender())) {
      return;
    }
    log.info("Session ended by instance {}", message.sender());
    endSession();
  }

  /** Stops every channel and runs the logout listeners. */
  private void endSession() {
    stopChannels();
    for (final RealtimeChannel channel : channels.values()) {
      cursors.clear(channel.name());
    }
    for (final Runnable listener : logoutListeners) {
      try {
        listener.run();
      } catch (final Exception e) {
        log.error("Error running logout listener", e);
      }
    }
  }

  /**
   * Stops every channel and waits for them to wind down.
   *
   * <p>Called from the scheduler thread, for instance by an event handler,
   * the channels are stopped inline since the thread cannot wait on itself.
   */
  private void stopChannels() {
    if (Thread.currentThread() == schedulerThread) {
      channels.values().forEach(RealtimeChannel::stopNow);
      return;
    }
    for (final RealtimeChannel channel : channels.values()) {
      final CompletableFuture<Void> stopping;
      try {
        stopping = channel.stop();
      } catch (final RejectedExecutionException e) {
        log.debug("Channel {} not stopped, scheduler already shut down",
            channel.name());
        continue;
      }
      try {
        stopping.get(STOP_TIMEOUT_SECONDS, TimeUnit.SECONDS);
      } catch (final InterruptedException e) {
        Thread.currentThread().interrupt();
        return;
      } catch (final ExecutionException | TimeoutException e) {
        log.warn("Channel {} did not stop cleanly: {}", channel.name(),
            e.getMessage());
      }
    }
  }

  /** Returns the session scope. */
  SessionScope scope() {
    return scope;
  }

  /** Returns the scheduler. */
  ScheduledExecutorService scheduler() {
    return scheduler;
  }

  /** Returns the clock. */
  Clock clock() {
    return clock;
  }

  /** Returns the random source. */
  Random random() {
    return random;
  }

  /** Returns the cursor store. */
  CursorStore cursors() {
    return cursors;
  }

  /** Returns the broadcast topic. */
  BroadcastTopic broadcastTopic() {
    return broadcastTopic;
  }

  /** Returns the lease store. */
  LeaseStore leaseStore() {
    return leaseStore;
  }

  /** Returns the metrics. */
  RealtimeMetrics metrics() {
    return metrics;
  }

  /** Returns the request implementation. */
  CancellableRequest request() {
    return request;
  }

  /** Returns the credentials provider. */
  CredentialsProvider credentials() {
    return credentials;
  }

  /**
   * Builder for {@link Concierge} instances.
   *
   * <p>Default values:
   * <ul>
   *   <li>instanceId: a random UUID</li>
   *   <li>sessionId: {@code "default"}</li>
   *   <li>leaseStore: {@link InMemoryLeaseStore}</li>
   *   <li>broadcastTopic: {@link InMemoryBroadcastTopic}</li>
   *   <li>clock: {@link Clock#systemUTC()}</li>
   *   <li>metrics: {@link NoopRealtimeMetrics}</li>
   *   <li>defaultOptions: {@link ChannelOptions#defaults()}</li>
   *   <li>visibility: a gate debounced by the default options</li>
   * </ul>
   *
   * <p>{@code credentials} and {@code request} are required.
   */
  public static final class Builder {

    /** The optional instance id. */
    private String instanceId;

    /** The session id. */
    private String sessionId = "default";

    /** The token source. */
    private CredentialsProvider credentials;

    /** The request implementation. */
    private CancellableRequest request;

    /** The optional lease store. */
    private LeaseStore leaseStore;

    /** The optional broadcast topic. */
    private BroadcastTopic broadcastTopic;

    /** The optional clock. */
    private Clock clock;

    /** The optional random source. */
    private Random random;

    /** The optional metrics. */
    private RealtimeMetrics metrics;

    /** The optional default channel options. */
    private ChannelOptions defaultOptions;

    /** The optional visibility gate. */
    private VisibilityGate visibility;

    /** The foreground debounce of the default visibility gate. */
    private Duration resumeDebounce = DEFAULT_RESUME_DEBOUNCE;

    /** Creates a new builder with default settings. */
    private Builder() {
    }

    /**
     * Sets the identifier of this instance.
     *
     * @param theInstanceId the instance id, never null or empty
     * @return this builder for chaining, never null
     */
    public Builder instanceId(final String theInstanceId) {
      Objects.requireNonNull(theInstanceId, "instanceId must not be null");
      if (theInstanceId.isEmpty()) {
        throw new IllegalArgumentException("instanceId must not be empty");
      }
      instanceId = theInstanceId;
      return this;
    }

    /**
     * Sets the session shared by the instances to coordinate.
     *
     * @param theSessionId the session id, never null or empty
     * @return this builder for chaining, never null
     */
    public Builder sessionId(final String theSessionId) {
      Objects.requireNonNull(theSessionId, "sessionId must not be null");
      if (theSessionId.isEmpty()) {
        throw new IllegalArgumentException("sessionId must not be empty");
      }
      sessionId = theSessionId;
      return this;
    }

    /**
     * Sets the bearer token source.
     *
     * @param theCredentials the provider, never null
     * @return this builder for chaining, never null
     */
    public Builder credentials(final CredentialsProvider theCredentials) {
      credentials = Objects.requireNonNull(theCredentials,
          "credentials must not be null");
      return this;
    }

    /**
     * Sets the network call of a poll cycle.
     *
     * @param theRequest the request implementation, never null
     * @return this builder for chaining, never null
     */
    public Builder request(final CancellableRequest theRequest) {
      request = Objects.requireNonNull(theRequest,
          "request must not be null");
      return this;
    }

    /**
     * Sets the lease store shared by the instances of the session.
     *
     * @param theLeaseStore the store, never null
     * @return this builder for chaining, never null
     */
    public Builder leaseStore(final LeaseStore theLeaseStore) {
      leaseStore = Objects.requireNonNull(theLeaseStore,
          "leaseStore must not be null");
      return this;
    }

    /**
     * Sets the broadcast topic shared by the instances of the session.
     *
     * @param theBroadcastTopic the topic, never null
     * @return this builder for chaining, never null
     */
    public Builder broadcastTopic(final BroadcastTopic theBroadcastTopic) {
      broadcastTopic = Objects.requireNonNull(theBroadcastTopic,
          "broadcastTopic must not be null");
      return this;
    }

    /**
     * Sets the clock.
     *
     * @param theClock the clock, never null
     * @return this builder for chaining, never null
     */
    public Builder clock(final Clock theClock) {
      clock = Objects.requireNonNull(theClock, "clock must not be null");
      return this;
    }

    /**
     * Sets the random source used for jitter and sampling.
     *
     * @param theRandom the random source, never null
     * @return this builder for chaining, never null
     */
    public Builder random(final Random theRandom) {
      random = Objects.requireNonNull(theRandom, "random must not be null");
      return this;
    }

    /**
     * Sets the telemetry sink.
     *
     * @param theMetrics the metrics, never null
     * @return this builder for chaining, never null
     */
    public Builder metrics(final RealtimeMetrics theMetrics) {
      metrics = Objects.requireNonNull(theMetrics,
          "metrics must not be null");
      return this;
    }

    /**
     * Sets the options of channels registered without their own.
     *
     * @param theOptions the options, never null
     * @return this builder for chaining, never null
     */
    public Builder defaultOptions(final ChannelOptions theOptions) {
      defaultOptions = Objects.requireNonNull(theOptions,
          "defaultOptions must not be null");
      return this;
    }

    /**
     * Sets the foreground debounce of the visibility gate.
     *
     * <p>The gate is shared by every channel of the process, so the
     * debounce is a process setting. Ignored when a gate is given through
     * {@link #visibility(VisibilityGate)}.
     *
     * @param theDebounce the debounce window, never null nor negative
     * @return this builder for chaining, never null
     */
    public Builder resumeDebounce(final Duration theDebounce) {
      Objects.requireNonNull(theDebounce, "resumeDebounce must not be null");
      if (theDebounce.isNegative()) {
        throw new IllegalArgumentException(
            "resumeDebounce must not be negative, got: " + theDebounce);
      }
      resumeDebounce = theDebounce;
      return this;
    }

    /**
     * Sets the visibility gate, to share one between several hubs.
     *
     * @param theVisibility the gate, never null
     * @return this builder for chaining, never null
     */
    public Builder visibility(final VisibilityGate theVisibility) {
      visibility = Objects.requireNonNull(theVisibility,
          "visibility must not be null");
      return this;
    }

    /**
     * Builds the Concierge instance with the configured settings.
     *
     * @return a new instance, never null
     *
     * @throws NullPointerException if credentials or request are not set
     */
    public Concierge build() {
      return new Concierge(this);
    }
  }
}
