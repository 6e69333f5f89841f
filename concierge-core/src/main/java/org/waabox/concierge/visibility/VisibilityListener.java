package org.waabox.concierge.visibility;

/**
 * A listener notified when the process moves between foreground and
 * background.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface VisibilityListener {

  /**
   * Called on every accepted visibility transition.
   *
   * @param foreground {@code true} if the process is now in the
   *                   foreground, {@code false} if it went to background
   */
  void onVisibilityChange(boolean foreground);
}
