package org.waabox.concierge.lease.jdbc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Random;

import javax.sql.DataSource;

import org.easymock.EasyMock;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import org.waabox.concierge.ChannelOptions;
import org.waabox.concierge.leader.LeaderCoordinator;
import org.waabox.concierge.leader.LeaderRole;
import org.waabox.concierge.leader.LeaseStoreUnavailableException;
import org.waabox.concierge.metrics.NoopRealtimeMetrics;

/**
 * Tests for {@link JdbcLeaseStore}.
 *
 * <p>Uses an H2 in-memory database per test.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class JdbcLeaseStoreTest {

  /** The H2 in-memory data source. */
  private DataSource dataSource;

  @BeforeEach
  void setUp() {
    final JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:leases_" + System.nanoTime()
        + ";DB_CLOSE_DELAY=-1");
    ds.setUser("sa");
    ds.setPassword("");
    dataSource = ds;
  }

  @Test
  void whenReading_givenFreshDatabase_shouldCreateTable() throws Exception {
    final JdbcLeaseStore store = new JdbcLeaseStore(
        JdbcLeaseStoreConfig.create(dataSource));

    assertTrue(store.read("k").isEmpty());

    try (final Connection conn = dataSource.getConnection()) {
      final ResultSet rs = conn.getMetaData().getTables(
          null, null, "CONCIERGE_LEASE", null);
      assertTrue(rs.next(), "Table concierge_lease should exist");
    }
  }

  @Test
  void whenInserting_givenAbsentKey_shouldWinOnlyOnce() {
    final JdbcLeaseStore store = new JdbcLeaseStore(
        JdbcLeaseStoreConfig.create(dataSource));

    assertTrue(store.writeIfFresh("k", null, "a"));
    assertFalse(store.writeIfFresh("k", null, "b"));
    assertEquals("a", store.read("k").orElseThrow());
  }

  @Test
  void whenUpdating_givenObservedValue_shouldCompareAndSwap() {
    final JdbcLeaseStore store = new JdbcLeaseStore(
        JdbcLeaseStoreConfig.create(dataSource, "tenant_leases"));
    store.writeIfFresh("k", null, "a");

    assertFalse(store.writeIfFresh("k", "stale", "b"));
    assertTrue(store.writeIfFresh("k", "a", "b"));
    assertFalse(store.writeIfFresh("k", "a", "c"));
    assertEquals("b", store.read("k").orElseThrow());
  }

  @Test
  void whenConnecting_givenDatabaseDown_shouldReportUnavailable()
      throws Exception {
    final DataSource broken = EasyMock.createMock(DataSource.class);
    EasyMock.expect(broken.getConnection())
        .andThrow(new SQLException("connection refused")).anyTimes();
    EasyMock.replay(broken);

    final JdbcLeaseStore store = new JdbcLeaseStore(
        JdbcLeaseStoreConfig.create(broken));

    assertThrows(LeaseStoreUnavailableException.class,
        () -> store.read("k"));
    assertThrows(LeaseStoreUnavailableException.class,
        () -> store.writeIfFresh("k", null, "a"));
  }

  @Test
  void whenCreatingConfig_givenInvalidTable_shouldThrow() {
    assertThrows(IllegalArgumentException.class,
        () -> JdbcLeaseStoreConfig.create(dataSource, " "));
    assertThrows(IllegalArgumentException.class,
        () -> JdbcLeaseStoreConfig.create(dataSource, "x; DROP TABLE y"));
  }

  @Test
  void whenElecting_givenTwoProcessesSharingTheTable_shouldElectOne() {
    final Clock clock = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"),
        ZoneOffset.UTC);
    final ChannelOptions options = ChannelOptions.builder()
        .leaseTtl(Duration.ofSeconds(2))
        .renewInterval(Duration.ofSeconds(1))
        .build();
    final LeaderCoordinator a = coordinator("a", options, clock);
    final LeaderCoordinator b = coordinator("b", options, clock);

    assertEquals(LeaderRole.LEADER, a.tryAcquire());
    assertEquals(LeaderRole.FOLLOWER, b.tryAcquire());
    assertTrue(a.renew());
  }

  private LeaderCoordinator coordinator(final String id,
      final ChannelOptions options, final Clock clock) {
    return new LeaderCoordinator("finance", id, "concierge.lease.x.finance",
        new JdbcLeaseStore(JdbcLeaseStoreConfig.create(dataSource), clock),
        options, clock, new Random(1), new NoopRealtimeMetrics(),
        at -> { });
  }
}
