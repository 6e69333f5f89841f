package org.waabox.concierge.transport;

import java.util.Optional;

/**
 * Supplies the bearer token for the subscribe endpoint.
 *
 * <p>The token lifecycle (login, refresh, expiry) belongs to the caller;
 * this library only reads the current value before every poll.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface CredentialsProvider {

  /**
   * Returns the current access token.
   *
   * @return the token, or empty when the user is not authenticated
   */
  Optional<String> accessToken();
}
