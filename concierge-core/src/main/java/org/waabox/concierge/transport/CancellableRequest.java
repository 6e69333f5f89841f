package org.waabox.concierge.transport;

import java.util.concurrent.CompletableFuture;

/**
 * Performs the network call of a long-poll cycle.
 *
 * <p>Implementations must abort the call when the request's
 * {@link CancelToken} is cancelled, completing the returned future with a
 * {@link java.util.concurrent.CancellationException}. HTTP level failures
 * complete it with a {@link TransportException}, and a rejected token with
 * an {@link AuthMissingException}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface CancellableRequest {

  /**
   * Sends a subscribe request.
   *
   * @param request the request, never null
   * @return a future with the raw response body, never null
   */
  CompletableFuture<String> send(SubscribeRequest request);
}
