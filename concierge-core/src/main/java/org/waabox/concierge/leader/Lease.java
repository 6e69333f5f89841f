package org.waabox.concierge.leader;

import java.time.Instant;
import java.util.Objects;

/**
 * A leadership claim over one channel scope of a session.
 *
 * @param owner     the instance id of the holder, never null
 * @param expiresAt the instant after which the claim is void, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record Lease(String owner, Instant expiresAt) {

  /** Validates the lease. */
  public Lease {
    Objects.requireNonNull(owner, "owner must not be null");
    Objects.requireNonNull(expiresAt, "expiresAt must not be null");
  }

  /**
   * Returns whether the lease is no longer valid at the given instant.
   *
   * @param now the instant to check, never null
   * @return true if {@code now} is strictly after the expiry
   */
  public boolean isExpired(final Instant now) {
    return now.isAfter(expiresAt);
  }

  /**
   * Returns whether the lease is held by the given instance.
   *
   * @param instanceId the instance id, never null
   * @return true if the instance owns this lease
   */
  public boolean isOwnedBy(final String instanceId) {
    return owner.equals(instanceId);
  }
}
