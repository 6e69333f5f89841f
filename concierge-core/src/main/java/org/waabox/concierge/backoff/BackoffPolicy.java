package org.waabox.concierge.backoff;

import java.util.Objects;
import java.util.Random;

import org.waabox.concierge.ChannelOptions;

/**
 * Computes the delay before the next poll cycle from the outcome of the
 * previous one.
 *
 * <p>Rules:
 * <ul>
 *   <li>events: reset to the fast floor</li>
 *   <li>empty and faster than the fast threshold: the server is not holding
 *       the long-poll open, move into the randomized fast-empty band</li>
 *   <li>empty at or above the threshold: a genuine heartbeat timeout, use
 *       the short heartbeat delay</li>
 *   <li>error: double, capped at the ceiling</li>
 * </ul>
 *
 * <p>Only a cycle that delivered events may lower the delay. Every other
 * outcome keeps at least the previous delay, and no outcome goes above the
 * ceiling.
 *
 * <p>Apart from the injected random source this class holds no state and is
 * thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class BackoffPolicy {

  /** The fast floor, in milliseconds. */
  private final long minDelayMs;

  /** The ceiling, in milliseconds. */
  private final long maxDelayMs;

  /** The fast-empty latency threshold, in milliseconds. */
  private final long fastEmptyThresholdMs;

  /** The fast-empty band lower bound, in milliseconds. */
  private final long fastEmptyMinMs;

  /** The fast-empty band upper bound, in milliseconds. */
  private final long fastEmptyMaxMs;

  /** The delay after a heartbeat timeout, in milliseconds. */
  private final long heartbeatDelayMs;

  /** The initial delay, in milliseconds. */
  private final long initialDelayMs;

  /** The random source for the fast-empty band. */
  private final Random random;

  /**
   * Creates a new policy.
   *
   * @param options the channel options, never null
   * @param theRandom the random source, never null
   */
  public BackoffPolicy(final ChannelOptions options, final Random theRandom) {
    Objects.requireNonNull(options, "options must not be null");
    random = Objects.requireNonNull(theRandom, "random must not be null");
    minDelayMs = options.minDelay().toMillis();
    maxDelayMs = options.maxDelay().toMillis();
    fastEmptyThresholdMs = options.fastEmptyThreshold().toMillis();
    fastEmptyMinMs = options.fastEmptyMin().toMillis();
    fastEmptyMaxMs = options.fastEmptyMax().toMillis();
    heartbeatDelayMs = options.heartbeatDelay().toMillis();
    initialDelayMs = options.initialDelay().toMillis();
  }

  /**
   * Returns the state a freshly enabled channel starts with.
   *
   * @return the initial state, never null
   */
  public BackoffState initial() {
    return new BackoffState(Math.max(initialDelayMs, minDelayMs));
  }

  /**
   * Computes the next state.
   *
   * @param previous  the state after the previous cycle, never null
   * @param outcome   the outcome of the cycle that just finished, never null
   * @param latencyMs the observed round-trip latency in milliseconds
   *
   * @return the next state, never null
   */
  public BackoffState next(final BackoffState previous,
      final CycleOutcome outcome, final long latencyMs) {
    Objects.requireNonNull(previous, "previous must not be null");
    Objects.requireNonNull(outcome, "outcome must not be null");

    final long current = previous.currentDelayMs();

    final long next = switch (outcome) {
      case SUCCESS_WITH_EVENTS -> minDelayMs;
      case SUCCESS_EMPTY -> Math.max(current, latencyMs < fastEmptyThresholdMs
          ? fastEmptyDelay() : heartbeatDelayMs);
      case ERROR -> Math.max(current, minDelayMs) * 2;
    };

    return new BackoffState(Math.min(next, maxDelayMs));
  }

  /**
   * Tells whether an empty response with the given latency is fast.
   *
   * @param latencyMs the observed latency in milliseconds
   *
   * @return true if the server answered without holding the request open
   */
  public boolean isFastEmpty(final long latencyMs) {
    return latencyMs < fastEmptyThresholdMs;
  }

  /**
   * Picks a delay inside the fast-empty band.
   *
   * @return a delay between the band bounds, inclusive
   */
  private long fastEmptyDelay() {
    final long span = fastEmptyMaxMs - fastEmptyMinMs;
    if (span <= 0) {
      return fastEmptyMinMs;
    }
    return fastEmptyMinMs + (long) (random.nextDouble() * (span + 1));
  }
}
