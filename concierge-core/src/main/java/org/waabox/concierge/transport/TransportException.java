package org.waabox.concierge.transport;

import org.waabox.concierge.ConciergeException;

/**
 * Thrown when a subscribe request fails at the network or HTTP level.
 *
 * <p>Never fatal: the channel records a failure and backs off.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class TransportException extends ConciergeException {

  private static final long serialVersionUID = 1L;

  /** The HTTP status code, or -1 when the failure is not an HTTP one. */
  private final int statusCode;

  /**
   * Creates a new exception for a network failure.
   *
   * @param message the detail message, never null
   * @param cause   the underlying cause, never null
   */
  public TransportException(final String message, final Throwable cause) {
    super(message, cause);
    statusCode = -1;
  }

  /**
   * Creates a new exception for an unexpected HTTP status.
   *
   * @param message    the detail message, never null
   * @param statusCode the HTTP status code returned by the server
   */
  public TransportException(final String message, final int statusCode) {
    super(message);
    this.statusCode = statusCode;
  }

  /**
   * Returns the HTTP status code of the failed response.
   *
   * @return the status code, or -1 if the failure happened before a
   *         response was received
   */
  public int statusCode() {
    return statusCode;
  }
}
