package org.waabox.concierge.lease.fs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Random;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.IntStream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import org.waabox.concierge.ChannelOptions;
import org.waabox.concierge.leader.LeaderCoordinator;
import org.waabox.concierge.leader.LeaderRole;
import org.waabox.concierge.leader.LeaseStoreUnavailableException;
import org.waabox.concierge.metrics.NoopRealtimeMetrics;

/**
 * Tests for {@link FileSystemLeaseStore}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class FileSystemLeaseStoreTest {

  @Test
  void whenWriting_givenAbsentKey_shouldCreateTheLeaseFile(
      @TempDir final Path tempDir) {
    final FileSystemLeaseStore store = new FileSystemLeaseStore(
        tempDir.resolve("leases"));

    assertTrue(store.read("concierge.lease.ab.finance#7").isEmpty());
    assertTrue(store.writeIfFresh("concierge.lease.ab.finance#7", null,
        "{\"owner\":\"a\"}"));

    assertEquals("{\"owner\":\"a\"}",
        store.read("concierge.lease.ab.finance#7").orElseThrow());
    assertTrue(Files.exists(tempDir.resolve("leases")
        .resolve("concierge.lease.ab.finance%237.lease")));
  }

  @Test
  void whenWriting_givenStaleObservation_shouldRefuse(
      @TempDir final Path tempDir) {
    final FileSystemLeaseStore store = new FileSystemLeaseStore(tempDir);
    store.writeIfFresh("k", null, "a");

    assertFalse(store.writeIfFresh("k", null, "b"));
    assertFalse(store.writeIfFresh("k", "old", "b"));
    assertTrue(store.writeIfFresh("k", "a", "b"));
    assertEquals("b", store.read("k").orElseThrow());
  }

  @Test
  void whenRacing_givenManyWriters_shouldLetExactlyOneWin(
      @TempDir final Path tempDir) throws Exception {
    final ExecutorService pool = Executors.newFixedThreadPool(8);
    try {
      final List<Callable<Boolean>> claims = IntStream.range(0, 16)
          .mapToObj(i -> (Callable<Boolean>) () ->
              new FileSystemLeaseStore(tempDir).writeIfFresh("k", null,
                  "owner-" + i))
          .toList();

      long winners = 0;
      for (final Future<Boolean> claim : pool.invokeAll(claims)) {
        if (claim.get()) {
          winners++;
        }
      }
      assertEquals(1, winners);
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void whenReading_givenKeyIsADirectory_shouldReportUnavailable(
      @TempDir final Path tempDir) throws Exception {
    final FileSystemLeaseStore store = new FileSystemLeaseStore(tempDir);
    Files.createDirectories(tempDir.resolve("k.lease"));

    assertThrows(LeaseStoreUnavailableException.class,
        () -> store.read("k"));
  }

  @Test
  void whenElecting_givenSharedDirectory_shouldElectOneLeader(
      @TempDir final Path tempDir) {
    final Clock clock = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"),
        ZoneOffset.UTC);
    final ChannelOptions options = ChannelOptions.builder()
        .leaseTtl(Duration.ofSeconds(2))
        .renewInterval(Duration.ofSeconds(1))
        .build();

    final LeaderCoordinator a = coordinator("a", tempDir, options, clock);
    final LeaderCoordinator b = coordinator("b", tempDir, options, clock);

    assertEquals(LeaderRole.LEADER, a.tryAcquire());
    assertEquals(LeaderRole.FOLLOWER, b.tryAcquire());
    assertTrue(a.renew());
    assertFalse(b.renew());
  }

  @Test
  void whenElecting_givenUndecodableLeaseFile_shouldTakeItOver(
      @TempDir final Path tempDir) throws Exception {
    Files.write(tempDir.resolve("concierge.lease.x.finance.lease"),
        new byte[] {(byte) 0xFF, (byte) 0xFE, (byte) 0x7B});
    final Clock clock = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"),
        ZoneOffset.UTC);
    final ChannelOptions options = ChannelOptions.builder()
        .leaseTtl(Duration.ofSeconds(2))
        .renewInterval(Duration.ofSeconds(1))
        .build();

    final LeaderCoordinator a = coordinator("a", tempDir, options, clock);
    final LeaderCoordinator b = coordinator("b", tempDir, options, clock);

    assertEquals(LeaderRole.LEADER, a.tryAcquire());
    assertFalse(a.isSingleInstance());
    assertEquals(LeaderRole.FOLLOWER, b.tryAcquire());
    assertFalse(b.isSingleInstance());
    assertTrue(new FileSystemLeaseStore(tempDir)
        .read("concierge.lease.x.finance").orElseThrow()
        .contains("\"owner\":\"a\""));
  }

  private static LeaderCoordinator coordinator(final String id,
      final Path dir, final ChannelOptions options, final Clock clock) {
    return new LeaderCoordinator("finance", id, "concierge.lease.x.finance",
        new FileSystemLeaseStore(dir), options, clock, new Random(1),
        new NoopRealtimeMetrics(), at -> { });
  }
}
