package org.waabox.concierge.transport;

import org.waabox.concierge.ConciergeException;

/**
 * Thrown when the subscribe endpoint answers with a body that cannot be
 * parsed.
 *
 * <p>A malformed response is treated as an empty heartbeat and is never
 * surfaced to consumers.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class MalformedResponseException extends ConciergeException {

  private static final long serialVersionUID = 1L;

  /**
   * Creates a new exception with the given message.
   *
   * @param message the detail message, never null
   */
  public MalformedResponseException(final String message) {
    super(message);
  }

  /**
   * Creates a new exception with the given message and cause.
   *
   * @param message the detail message, never null
   * @param cause the parsing failure, never null
   */
  public MalformedResponseException(final String message,
      final Throwable cause) {
    super(message, cause);
  }
}
