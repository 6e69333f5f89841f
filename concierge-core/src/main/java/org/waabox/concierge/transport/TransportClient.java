package org.waabox.concierge.transport;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Executes long-poll cycles against the subscribe endpoint.
 *
 * <p>Each call to {@link #poll} performs at most one network call, and a
 * client allows only one call in flight: an overlapping call returns
 * {@link PollResult.Outcome#DROPPED} without touching the network. The
 * returned future never completes exceptionally.
 *
 * <p>One client is used per channel.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class TransportClient {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(TransportClient.class);

  /** The request implementation, never null. */
  private final CancellableRequest request;

  /** The token source, never null. */
  private final CredentialsProvider credentials;

  /** The clock used to measure latency, never null. */
  private final Clock clock;

  /** How long the server may hold a request open, never null. */
  private final Duration longPollWindow;

  /** Whether a call is in flight. */
  private final AtomicBoolean inFlight = new AtomicBoolean(false);

  /**
   * Creates a new client.
   *
   * @param theRequest     the request implementation, never null
   * @param theCredentials the token source, never null
   * @param theClock       the clock for latency measurement, never null
   * @param theLongPollWindow how long the server may hold a request open,
   *                       never null
   */
  public TransportClient(final CancellableRequest theRequest,
      final CredentialsProvider theCredentials, final Clock theClock,
      final Duration theLongPollWindow) {
    request = Objects.requireNonNull(theRequest, "request must not be null");
    credentials = Objects.requireNonNull(theCredentials,
        "credentials must not be null");
    clock = Objects.requireNonNull(theClock, "clock must not be null");
    longPollWindow = Objects.requireNonNull(theLongPollWindow,
        "longPollWindow must not be null");
  }

  /**
   * Runs one long-poll cycle.
   *
   * @param channel     the channel, never null
   * @param cursor      the last cursor for the filter, null if none
   * @param filter      the filter, null for none
   * @param cancelToken the token that aborts the call, never null
   * @return a future with the result, never completing exceptionally
   */
  public CompletableFuture<PollResult> poll(final String channel,
      final String cursor, final String filter,
      final CancelToken cancelToken) {
    Objects.requireNonNull(channel, "channel must not be null");
    Objects.requireNonNull(cancelToken, "cancelToken must not be null");

    if (!inFlight.compareAndSet(false, true)) {
      log.debug("Poll for channel {} dropped, another one is in flight",
          channel);
      return CompletableFuture.completedFuture(PollResult.dropped());
    }
    if (cancelToken.isCancelled()) {
      inFlight.set(false);
      return CompletableFuture.completedFuture(PollResult.cancelled(0));
    }

    final Optional<String> token;
    try {
      token = credentials.accessToken();
    } catch (final RuntimeException e) {
      inFlight.set(false);
      log.warn("Credentials provider failed for channel {}", channel, e);
      return CompletableFuture.completedFuture(PollResult.failed(0, e));
    }
    if (token.isEmpty() || token.get().isBlank()) {
      inFlight.set(false);
      log.debug("No access token, skipping poll for channel {}", channel);
      return CompletableFuture.completedFuture(PollResult.authMissing(0));
    }

    final long startedAt = clock.millis();
    CompletableFuture<String> response;
    try {
      response = request.send(new SubscribeRequest(channel, cursor, filter,
          token.get(), cancelToken, longPollWindow));
    } catch (final RuntimeException e) {
      response = CompletableFuture.failedFuture(e);
    }

    return response.handle((body, error) -> {
      final long latency = Math.max(0, clock.millis() - startedAt);
      inFlight.set(false);
      return toResult(channel, body, error, latency, cancelToken);
    });
  }

  /**
   * Returns whether a call is in flight.
   *
   * @return true while a request has not completed
   */
  public boolean isInFlight() {
    return inFlight.get();
  }

  /**
   * Maps a completed request to its result.
   *
   * @param channel the channel
   * @param body the response body, null on error
   * @param error the failure, null on success
   * @param latency the round trip in milliseconds
   * @param cancelToken the request token
   * @return the result, never null
   */
  private PollResult toResult(final String channel, final String body,
      final Throwable error, final long latency,
      final CancelToken cancelToken) {
    final Throwable cause = unwrap(error);
    if (cause instanceof CancellationException || cancelToken.isCancelled()) {
      log.debug("Poll for channel {} cancelled after {}ms", channel, latency);
      return PollResult.cancelled(latency);
    }
    if (cause instanceof AuthMissingException) {
      log.debug("Access token rejected for channel {}", channel);
      return PollResult.authMissing(latency);
    }
    if (cause != null) {
      log.warn("Poll for channel {} failed after {}ms: {}", channel, latency,
          cause.getMessage());
      return PollResult.failed(latency, cause);
    }
    try {
      final SubscribeResponse response = SubscribeResponseCodec.parse(
          body == null ? "" : body);
      return PollResult.success(response.events(), response.cursor(),
          latency);
    } catch (final MalformedResponseException e) {
      log.warn("Malformed response for channel {}: {}", channel,
          e.getMessage());
      return PollResult.malformed(latency, e);
    }
  }

  /**
   * Unwraps completion wrappers.
   *
   * @param error the error, may be null
   * @return the root cause, null if error was null
   */
  private static Throwable unwrap(final Throwable error) {
    Throwable cause = error;
    while (cause instanceof CompletionException && cause.getCause() != null) {
      cause = cause.getCause();
    }
    return cause;
  }
}
