package org.waabox.concierge.transport;

import org.waabox.concierge.ConciergeException;

/**
 * Thrown when no credentials are available for a subscribe request, or the
 * server rejected the ones that were sent.
 *
 * <p>The cycle is skipped silently and retried on the next scheduled tick.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class AuthMissingException extends ConciergeException {

  private static final long serialVersionUID = 1L;

  /**
   * Creates a new exception with the given message.
   *
   * @param message the detail message, never null
   */
  public AuthMissingException(final String message) {
    super(message);
  }
}
