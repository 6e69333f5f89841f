package org.waabox.concierge.transport;

import java.util.List;
import java.util.Objects;

import org.waabox.concierge.event.ChannelEvent;

/**
 * The outcome of one long-poll cycle.
 *
 * <p>A poll never fails with an exception; every failure mode is one of the
 * {@link Outcome} values. {@code events} is empty unless the outcome is
 * {@link Outcome#EVENTS}, and {@code cursor} is only meaningful for
 * {@link Outcome#EVENTS} and {@link Outcome#EMPTY}.
 *
 * @param outcome   the outcome, never null
 * @param events    the delivered events, never null
 * @param cursor    the cursor returned by the server, may be null
 * @param latencyMs the observed round trip in milliseconds, zero when no
 *                  request was sent
 * @param error     the failure cause for {@link Outcome#FAILED} and
 *                  {@link Outcome#MALFORMED}, null otherwise
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record PollResult(Outcome outcome, List<ChannelEvent> events,
    String cursor, long latencyMs, Throwable error) {

  /** The possible outcomes of a poll. */
  public enum Outcome {
    /** The server returned at least one event. */
    EVENTS,
    /** The server returned no events; a heartbeat. */
    EMPTY,
    /** The server answered with a body that could not be parsed. */
    MALFORMED,
    /** The request failed at network or HTTP level. */
    FAILED,
    /** The request was cancelled by its token. */
    CANCELLED,
    /** No access token was available, or the server rejected it. */
    AUTH_MISSING,
    /** Another poll of the same client was still in flight. */
    DROPPED
  }

  /** Validates the result. */
  public PollResult {
    Objects.requireNonNull(outcome, "outcome must not be null");
    events = events == null ? List.of() : List.copyOf(events);
  }

  /**
   * Creates a result for a successful response.
   *
   * <p>The outcome is {@link Outcome#EMPTY} if the list is empty.
   *
   * @param events    the events, never null
   * @param cursor    the new cursor, may be null
   * @param latencyMs the round trip in milliseconds
   * @return the result, never null
   */
  public static PollResult success(final List<ChannelEvent> events,
      final String cursor, final long latencyMs) {
    Objects.requireNonNull(events, "events must not be null");
    final Outcome outcome = events.isEmpty() ? Outcome.EMPTY : Outcome.EVENTS;
    return new PollResult(outcome, events, cursor, latencyMs, null);
  }

  /**
   * Creates a result for an unparseable response.
   *
   * @param latencyMs the round trip in milliseconds
   * @param error     the parse failure, never null
   * @return the result, never null
   */
  public static PollResult malformed(final long latencyMs,
      final Throwable error) {
    return new PollResult(Outcome.MALFORMED, List.of(), null, latencyMs,
        error);
  }

  /**
   * Creates a result for a failed request.
   *
   * @param latencyMs the round trip in milliseconds
   * @param error     the failure, never null
   * @return the result, never null
   */
  public static PollResult failed(final long latencyMs,
      final Throwable error) {
    return new PollResult(Outcome.FAILED, List.of(), null, latencyMs, error);
  }

  /**
   * Creates a result for a cancelled request.
   *
   * @param latencyMs the time until cancellation in milliseconds
   * @return the result, never null
   */
  public static PollResult cancelled(final long latencyMs) {
    return new PollResult(Outcome.CANCELLED, List.of(), null, latencyMs,
        null);
  }

  /**
   * Creates a result for a missing or rejected access token.
   *
   * @param latencyMs the round trip in milliseconds, zero if nothing was
   *                  sent
   * @return the result, never null
   */
  public static PollResult authMissing(final long latencyMs) {
    return new PollResult(Outcome.AUTH_MISSING, List.of(), null, latencyMs,
        null);
  }

  /**
   * Creates a result for an overlapping call.
   *
   * @return the result, never null
   */
  public static PollResult dropped() {
    return new PollResult(Outcome.DROPPED, List.of(), null, 0, null);
  }

  /**
   * Returns whether the server answered, with or without events.
   *
   * @return true for {@link Outcome#EVENTS} and {@link Outcome#EMPTY}
   */
  public boolean isSuccess() {
    return outcome == Outcome.EVENTS || outcome == Outcome.EMPTY;
  }
}
