package org.waabox.concierge.lease.jdbc;

import java.util.Objects;

import javax.sql.DataSource;

/**
 * Configuration for the {@link JdbcLeaseStore}.
 *
 * <p>Holds the {@link DataSource} and the name of the table that keeps one
 * row per lease key.
 *
 * <p>Instances are created via the static factory methods
 * {@link #create(DataSource)} and {@link #create(DataSource, String)}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class JdbcLeaseStoreConfig {

  /** Default table name for the leases. */
  private static final String DEFAULT_TABLE_NAME = "concierge_lease";

  /** The JDBC data source, never null. */
  private final DataSource dataSource;

  /** The lease table name, never null. */
  private final String tableName;

  /**
   * Private constructor; use static factories.
   *
   * @param theDataSource the JDBC data source
   * @param theTableName  the lease table name
   */
  private JdbcLeaseStoreConfig(final DataSource theDataSource,
      final String theTableName) {
    dataSource = theDataSource;
    tableName = theTableName;
  }

  /**
   * Creates a configuration with a custom table name.
   *
   * @param dataSource the JDBC data source, never null
   * @param tableName  the lease table name, never null or blank
   *
   * @return a new configuration instance, never null
   */
  public static JdbcLeaseStoreConfig create(final DataSource dataSource,
      final String tableName) {
    Objects.requireNonNull(dataSource, "dataSource cannot be null");
    Objects.requireNonNull(tableName, "tableName cannot be null");

    if (tableName.isBlank()) {
      throw new IllegalArgumentException("tableName cannot be blank");
    }
    if (!tableName.matches("[A-Za-z_][A-Za-z0-9_.]*")) {
      throw new IllegalArgumentException(
          "tableName is not a valid identifier: " + tableName);
    }
    return new JdbcLeaseStoreConfig(dataSource, tableName);
  }

  /**
   * Creates a configuration using the {@code concierge_lease} table.
   *
   * @param dataSource the JDBC data source, never null
   *
   * @return a new configuration instance, never null
   */
  public static JdbcLeaseStoreConfig create(final DataSource dataSource) {
    return create(dataSource, DEFAULT_TABLE_NAME);
  }

  /**
   * Returns the JDBC data source.
   *
   * @return the data source, never null
   */
  public DataSource dataSource() {
    return dataSource;
  }

  /**
   * Returns the lease table name.
   *
   * @return the table name, never null
   */
  public String tableName() {
    return tableName;
  }
}
