package org.waabox.concierge.leader;

import java.util.Optional;

/**
 * A shared key-value store holding leases.
 *
 * <p>The store is not transactional. Its only coordination primitive is
 * {@link #writeIfFresh}, which replaces a value only if it still holds what
 * the caller read. Implementations that cannot offer even that may write
 * unconditionally; the coordinator confirms ownership with a second read
 * and tolerates a brief dual leadership.
 *
 * <p>Both operations throw {@link LeaseStoreUnavailableException} when the
 * store cannot be reached.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface LeaseStore {

  /**
   * Reads the value stored under a key.
   *
   * @param key the key, never null
   * @return the value, or empty if none is stored
   */
  Optional<String> read(String key);

  /**
   * Writes a value if the key still holds the observed one.
   *
   * @param key      the key, never null
   * @param observed the value the caller read, null if it read nothing
   * @param value    the value to write, never null
   * @return true if the value was written
   */
  boolean writeIfFresh(String key, String observed, String value);
}
