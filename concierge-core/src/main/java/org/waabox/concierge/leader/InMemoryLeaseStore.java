package org.waabox.concierge.leader;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * A {@link LeaseStore} kept in memory.
 *
 * <p>Shares leases between the channels of one process, for example in
 * tests or when every instance of a session lives in the same JVM.
 * Conditional writes are atomic.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class InMemoryLeaseStore implements LeaseStore {

  /** The stored values. */
  private final ConcurrentMap<String, String> values =
      new ConcurrentHashMap<>();

  /** {@inheritDoc} */
  @Override
  public Optional<String> read(final String key) {
    Objects.requireNonNull(key, "key must not be null");
    return Optional.ofNullable(values.get(key));
  }

  /** {@inheritDoc} */
  @Override
  public boolean writeIfFresh(final String key, final String observed,
      final String value) {
    Objects.requireNonNull(key, "key must not be null");
    Objects.requireNonNull(value, "value must not be null");
    if (observed == null) {
      return values.putIfAbsent(key, value) == null;
    }
    return values.replace(key, observed, value);
  }

  /**
   * Overwrites a value unconditionally.
   *
   * @param key   the key, never null
   * @param value the value, never null
   */
  public void put(final String key, final String value) {
    values.put(key, value);
  }
}
