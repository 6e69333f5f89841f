package org.waabox.concierge.leader;

import org.waabox.concierge.ConciergeException;

/**
 * Thrown by a {@link LeaseStore} that cannot be reached.
 *
 * <p>The {@link LeaderCoordinator} reacts by acting as its own leader
 * (single-instance mode) until the store answers again.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class LeaseStoreUnavailableException extends ConciergeException {

  private static final long serialVersionUID = 1L;

  /**
   * Creates a new exception with the given message and cause.
   *
   * @param message the detail message, never null
   * @param cause the underlying store failure, never null
   */
  public LeaseStoreUnavailableException(final String message,
      final Throwable cause) {
    super(message, cause);
  }
}
