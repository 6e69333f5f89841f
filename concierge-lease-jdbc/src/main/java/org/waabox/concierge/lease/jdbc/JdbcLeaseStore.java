package org.waabox.concierge.lease.jdbc;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.Timestamp;
import java.time.Clock;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.waabox.concierge.leader.LeaseStore;
import org.waabox.concierge.leader.LeaseStoreUnavailableException;

/**
 * A {@link LeaseStore} that keeps the leases of every instance in a shared
 * database table, so that instances running in different processes elect
 * one leader per channel.
 *
 * <p>Conditional writes map to SQL: a claim of an absent key is a plain
 * {@code INSERT} that loses against the primary key when another instance
 * inserted first, and a claim over an observed value is an {@code UPDATE}
 * guarded by that value.
 *
 * <p>The table is created on first use if it does not already exist. Any
 * {@link SQLException} is reported as a
 * {@link LeaseStoreUnavailableException}.
 *
 * <p>Thread safety: this class is thread-safe; every call uses its own
 * connection.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class JdbcLeaseStore implements LeaseStore {

  /** Class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(JdbcLeaseStore.class);

  /** The SQL state class of integrity constraint violations. */
  private static final String INTEGRITY_VIOLATION = "23";

  /** The configuration, never null. */
  private final JdbcLeaseStoreConfig config;

  /** The clock stamping the rows, never null. */
  private final Clock clock;

  /** Whether the table is known to exist. */
  private volatile boolean tableReady;

  /**
   * Creates a new JDBC lease store.
   *
   * @param theConfig the configuration, never null
   */
  public JdbcLeaseStore(final JdbcLeaseStoreConfig theConfig) {
    this(theConfig, Clock.systemUTC());
  }

  /**
   * Creates a new JDBC lease store with a custom clock.
   *
   * @param theConfig the configuration, never null
   * @param theClock  the clock stamping the rows, never null
   */
  public JdbcLeaseStore(final JdbcLeaseStoreConfig theConfig,
      final Clock theClock) {
    config = Objects.requireNonNull(theConfig, "config cannot be null");
    clock = Objects.requireNonNull(theClock, "clock cannot be null");
  }

  /** {@inheritDoc} */
  @Override
  public Optional<String> read(final String key) {
    Objects.requireNonNull(key, "key cannot be null");
    ensureTable();

    final String sql = "SELECT lease_value FROM " + config.tableName()
        + " WHERE lease_key = ?";

    try (final Connection conn = config.dataSource().getConnection();
         final PreparedStatement ps = conn.prepareStatement(sql)) {
      ps.setString(1, key);
      try (final ResultSet rs = ps.executeQuery()) {
        if (rs.next()) {
          return Optional.ofNullable(rs.getString("lease_value"));
        }
        return Optional.empty();
      }
    } catch (final SQLException e) {
      throw new LeaseStoreUnavailableException(
          "Failed to read lease '" + key + "'", e);
    }
  }

  /** {@inheritDoc} */
  @Override
  public boolean writeIfFresh(final String key, final String observed,
      final String value) {
    Objects.requireNonNull(key, "key cannot be null");
    Objects.requireNonNull(value, "value cannot be null");
    ensureTable();

    if (observed == null) {
      return insert(key, value);
    }
    return update(key, observed, value);
  }

  /**
   * Inserts the lease of an absent key.
   *
   * @param key   the lease key
   * @param value the new value
   * @return true if inserted, false if another instance inserted first
   */
  private boolean insert(final String key, final String value) {
    final String sql = "INSERT INTO " + config.tableName()
        + " (lease_key, lease_value, updated_at) VALUES (?, ?, ?)";

    try (final Connection conn = config.dataSource().getConnection();
         final PreparedStatement ps = conn.prepareStatement(sql)) {
      ps.setString(1, key);
      ps.setString(2, value);
      ps.setTimestamp(3, Timestamp.from(clock.instant()));
      return ps.executeUpdate() == 1;
    } catch (final SQLException e) {
      if (isIntegrityViolation(e)) {
        log.debug("Lease '{}' inserted concurrently by another instance",
            key);
        return false;
      }
      throw new LeaseStoreUnavailableException(
          "Failed to insert lease '" + key + "'", e);
    }
  }

  /**
   * Replaces the lease of a key if it still holds the observed value.
   *
   * @param key      the lease key
   * @param observed the value read before
   * @param value    the new value
   * @return true if replaced
   */
  private boolean update(final String key, final String observed,
      final String value) {
    final String sql = "UPDATE " + config.tableName()
        + " SET lease_value = ?, updated_at = ?"
        + " WHERE lease_key = ? AND lease_value = ?";

    try (final Connection conn = config.dataSource().getConnection();
         final PreparedStatement ps = conn.prepareStatement(sql)) {
      ps.setString(1, value);
      ps.setTimestamp(2, Timestamp.from(clock.instant()));
      ps.setString(3, key);
      ps.setString(4, observed);
      return ps.executeUpdate() == 1;
    } catch (final SQLException e) {
      throw new LeaseStoreUnavailableException(
          "Failed to update lease '" + key + "'", e);
    }
  }

  /**
   * Creates the lease table if it does not already exist.
   *
   * <p>Uses {@code CREATE TABLE IF NOT EXISTS} for idempotent DDL.
   */
  private void ensureTable() {
    if (tableReady) {
      return;
    }
    final String ddl = "CREATE TABLE IF NOT EXISTS " + config.tableName()
        + " ("
        + "lease_key VARCHAR(512) NOT NULL, "
        + "lease_value VARCHAR(1024) NOT NULL, "
        + "updated_at TIMESTAMP NOT NULL, "
        + "PRIMARY KEY (lease_key)"
        + ")";

    try (final Connection conn = config.dataSource().getConnection();
         final PreparedStatement ps = conn.prepareStatement(ddl)) {
      ps.execute();
      tableReady = true;
      log.debug("Ensured lease table '{}' exists", config.tableName());
    } catch (final SQLException e) {
      throw new LeaseStoreUnavailableException(
          "Failed to create lease table '" + config.tableName() + "'", e);
    }
  }

  /**
   * Checks whether a failure is a primary key violation.
   *
   * @param e the failure
   * @return true for integrity constraint violations
   */
  private static boolean isIntegrityViolation(final SQLException e) {
    return e instanceof SQLIntegrityConstraintViolationException
        || (e.getSQLState() != null
            && e.getSQLState().startsWith(INTEGRITY_VIOLATION));
  }
}
