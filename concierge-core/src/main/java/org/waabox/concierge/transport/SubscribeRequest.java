package org.waabox.concierge.transport;

import java.time.Duration;
import java.util.Objects;

/**
 * One long-poll request to the subscribe endpoint.
 *
 * @param channel     the channel to subscribe to, never null
 * @param cursor      the last cursor seen for this filter, null on the first
 *                    poll of a scope
 * @param filter      the server-side filter, null for none
 * @param accessToken the bearer token, never null
 * @param cancelToken the token that aborts this request, never null
 * @param longPollWindow how long the server may hold the request open,
 *                    never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record SubscribeRequest(String channel, String cursor, String filter,
    String accessToken, CancelToken cancelToken, Duration longPollWindow) {

  /** Validates the request. */
  public SubscribeRequest {
    Objects.requireNonNull(channel, "channel must not be null");
    Objects.requireNonNull(accessToken, "accessToken must not be null");
    Objects.requireNonNull(cancelToken, "cancelToken must not be null");
    Objects.requireNonNull(longPollWindow,
        "longPollWindow must not be null");
  }
}
