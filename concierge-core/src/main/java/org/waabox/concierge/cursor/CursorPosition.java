package org.waabox.concierge.cursor;

/**
 * The cursor of a channel together with the filter scope it belongs to.
 *
 * <p>The generation grows every time the filter changes. A poll records the
 * generation it was issued under, so a response arriving after a filter
 * change can be recognised as stale and discarded.
 *
 * @param filter     the filter the cursor is scoped to, null when unfiltered
 * @param cursor     the last acknowledged cursor, null when none was seen
 * @param generation the scope generation, starts at zero
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record CursorPosition(String filter, String cursor, long generation) {

  /**
   * Tells whether a cursor has been acknowledged in this scope.
   *
   * @return true if the next poll resumes from a cursor
   */
  public boolean hasCursor() {
    return cursor != null && !cursor.isEmpty();
  }
}
