package org.waabox.concierge.cursor;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds the last acknowledged cursor of every channel.
 *
 * <p>A cursor is only meaningful for the filter it was obtained with.
 * Changing the filter clears the cursor, so the first poll under the new
 * scope starts from the server's default position instead of silently
 * skipping events that only matched the new filter.
 *
 * <p>This class is thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class CursorStore {

  /** The positions, keyed by channel name. */
  private final Map<String, CursorPosition> positions =
      new ConcurrentHashMap<>();

  /**
   * Returns the current position of a channel.
   *
   * @param channel the channel name, never null
   *
   * @return the position, never null; an empty unfiltered position if the
   *         channel was never seen
   */
  public CursorPosition position(final String channel) {
    Objects.requireNonNull(channel, "channel must not be null");
    return positions.getOrDefault(channel, new CursorPosition(null, null, 0));
  }

  /**
   * Moves a channel to a new filter scope.
   *
   * <p>If the filter differs from the current one, the cursor is cleared
   * and the generation incremented. Setting the same filter again is a
   * no-op.
   *
   * @param channel the channel name, never null
   * @param filter  the new filter, null for none
   *
   * @return the resulting position, never null
   */
  public CursorPosition changeFilter(final String channel,
      final String filter) {
    Objects.requireNonNull(channel, "channel must not be null");
    return positions.compute(channel, (name, current) -> {
      if (current == null) {
        return new CursorPosition(filter, null, 0);
      }
      if (Objects.equals(current.filter(), filter)) {
        return current;
      }
      return new CursorPosition(filter, null, current.generation() + 1);
    });
  }

  /**
   * Adopts a cursor returned by the server.
   *
   * <p>The cursor is only adopted if the channel is still in the generation
   * the poll was issued under. A null or empty cursor leaves the position
   * untouched.
   *
   * @param channel    the channel name, never null
   * @param generation the generation the poll was issued under
   * @param cursor     the cursor to adopt, may be null
   *
   * @return true if the response belongs to the live scope, false if it is
   *         stale and must be discarded
   */
  public boolean adopt(final String channel, final long generation,
      final String cursor) {
    Objects.requireNonNull(channel, "channel must not be null");
    final boolean[] live = new boolean[1];
    positions.compute(channel, (name, current) -> {
      final CursorPosition base = current == null
          ? new CursorPosition(null, null, 0) : current;
      if (base.generation() != generation) {
        return current;
      }
      live[0] = true;
      if (cursor == null || cursor.isEmpty()) {
        return base;
      }
      return new CursorPosition(base.filter(), cursor, base.generation());
    });
    return live[0];
  }

  /**
   * Forgets a channel.
   *
   * @param channel the channel name, never null
   */
  public void clear(final String channel) {
    Objects.requireNonNull(channel, "channel must not be null");
    positions.remove(channel);
  }
}
