package org.waabox.concierge;

/**
 * Base exception for all Concierge realtime errors.
 *
 * <p>This is an unchecked exception. Failures raised while running a poll
 * cycle never escape the cycle: they are absorbed into the channel health
 * and its backoff. Only misconfiguration surfaces to the caller.</p>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class ConciergeException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /**
   * Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public ConciergeException(final String message) {
    super(message);
  }

  /**
   * Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   */
  public ConciergeException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
