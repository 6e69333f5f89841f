package org.waabox.concierge.leader;

import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.expectLastCall;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;

import org.junit.jupiter.api.Test;

import org.waabox.concierge.ChannelOptions;
import org.waabox.concierge.MutableClock;
import org.waabox.concierge.metrics.NoopRealtimeMetrics;
import org.waabox.concierge.metrics.RealtimeMetrics;

/**
 * Tests for {@link LeaderCoordinator}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class LeaderCoordinatorTest {

  private static final String KEY = "concierge.lease.abc.finance";

  private final MutableClock clock = new MutableClock(
      Instant.parse("2026-03-01T10:00:00Z"));

  private final InMemoryLeaseStore store = new InMemoryLeaseStore();

  private final ChannelOptions options = ChannelOptions.builder()
      .leaseTtl(Duration.ofMillis(200))
      .leaseJitter(Duration.ofMillis(20))
      .renewInterval(Duration.ofMillis(100))
      .followerTick(Duration.ofMillis(30), Duration.ofMillis(50))
      .build();

  private final List<Instant> heartbeats = new ArrayList<>();

  private LeaderCoordinator coordinator(final String instanceId,
      final LeaseStore theStore, final ChannelOptions theOptions,
      final RealtimeMetrics metrics) {
    return new LeaderCoordinator("finance", instanceId, KEY, theStore,
        theOptions, clock, new Random(7), metrics, heartbeats::add);
  }

  private LeaderCoordinator coordinator(final String instanceId) {
    return coordinator(instanceId, store, options, new NoopRealtimeMetrics());
  }

  private void putLease(final String owner, final Instant expiresAt) {
    store.put(KEY, LeaseCodec.serialize(new Lease(owner, expiresAt)));
  }

  @Test
  void whenAcquiring_givenNoLease_shouldLeadAndAnnounce() {
    final LeaderCoordinator a = coordinator("a");
    final List<Boolean> changes = new ArrayList<>();
    a.onLeaderChange(changes::add);

    assertEquals(LeaderRole.LEADER, a.tryAcquire());

    assertTrue(a.isLeader());
    assertEquals(List.of(true), changes);
    assertEquals(List.of(clock.instant()), heartbeats);
    final Lease lease = LeaseCodec.parse(store.read(KEY).orElseThrow())
        .orElseThrow();
    assertEquals("a", lease.owner());
    assertFalse(lease.expiresAt().isBefore(clock.instant().plusMillis(200)));
    assertFalse(lease.expiresAt().isAfter(clock.instant().plusMillis(220)));
  }

  @Test
  void whenAcquiring_givenValidLeaseOfOther_shouldFollow() {
    putLease("b", clock.instant().plusMillis(150));
    final LeaderCoordinator a = coordinator("a");

    assertEquals(LeaderRole.FOLLOWER, a.tryAcquire());
    assertTrue(heartbeats.isEmpty());
  }

  @Test
  void whenAcquiring_givenOwnValidLease_shouldLeadAgain() {
    putLease("a", clock.instant().plusMillis(150));
    assertEquals(LeaderRole.LEADER, coordinator("a").tryAcquire());
  }

  @Test
  void whenAcquiring_givenExpiredLeaseOfOther_shouldTakeOver() {
    putLease("b", clock.instant().minusMillis(1));
    final RealtimeMetrics metrics = createMock(RealtimeMetrics.class);
    metrics.leaderAcquired("finance", true);
    expectLastCall().once();
    replay(metrics);

    final LeaderCoordinator a = coordinator("a", store, options, metrics);

    assertEquals(LeaderRole.LEADER, a.tryAcquire());
    verify(metrics);
  }

  @Test
  void whenAcquiring_givenCorruptLease_shouldTakeOver() {
    store.put(KEY, "garbage");
    assertEquals(LeaderRole.LEADER, coordinator("a").tryAcquire());
  }

  @Test
  void whenRenewing_givenLeaseTakenByOther_shouldStepDown() {
    final LeaderCoordinator a = coordinator("a");
    a.tryAcquire();
    final List<Boolean> changes = new ArrayList<>();
    a.onLeaderChange(changes::add);
    putLease("b", clock.instant().plusMillis(200));

    assertFalse(a.renew());

    assertEquals(LeaderRole.FOLLOWER, a.role());
    assertEquals(List.of(false), changes);
  }

  @Test
  void whenRenewing_givenOwnLease_shouldExtendIt() {
    final LeaderCoordinator a = coordinator("a");
    a.tryAcquire();
    clock.advanceMillis(100);

    assertTrue(a.renew());

    final Lease lease = LeaseCodec.parse(store.read(KEY).orElseThrow())
        .orElseThrow();
    assertFalse(lease.expiresAt().isBefore(clock.instant().plusMillis(200)));
    assertEquals(2, heartbeats.size());
  }

  @Test
  void whenRenewing_givenFollower_shouldDoNothing() {
    putLease("b", clock.instant().plusMillis(150));
    final LeaderCoordinator a = coordinator("a");
    a.tryAcquire();

    assertFalse(a.renew());
  }

  @Test
  void whenReceivingHeartbeat_givenNewerFromOther_shouldStepDown() {
    final LeaderCoordinator a = coordinator("a");
    a.tryAcquire();

    a.onHeartbeat("a", clock.instant());
    assertTrue(a.isLeader());

    a.onHeartbeat("b", clock.instant().minusSeconds(1));
    assertTrue(a.isLeader());

    a.onHeartbeat("b", clock.instant());
    assertEquals(LeaderRole.FOLLOWER, a.role());
  }

  @Test
  void whenAcquiring_givenStoreDown_shouldActAsSingleInstance() {
    final LeaseStore down = createMock(LeaseStore.class);
    expect(down.read(KEY)).andThrow(new LeaseStoreUnavailableException(
        "down", new IllegalStateException("io"))).anyTimes();
    replay(down);

    final LeaderCoordinator a = coordinator("a", down, options,
        new NoopRealtimeMetrics());

    assertEquals(LeaderRole.LEADER, a.tryAcquire());
    assertTrue(a.isSingleInstance());
    assertTrue(a.renew());
    assertEquals(LeaderRole.LEADER, a.followerTick());
  }

  @Test
  void whenStoreRecovers_givenSingleInstance_shouldFollowValidOwner() {
    final LeaseStore flaky = createMock(LeaseStore.class);
    expect(flaky.read(KEY)).andThrow(new LeaseStoreUnavailableException(
        "down", new IllegalStateException("io")));
    expect(flaky.read(KEY)).andReturn(Optional.of(
        LeaseCodec.serialize(new Lease("b", clock.instant().plusSeconds(1)))));
    replay(flaky);

    final LeaderCoordinator a = coordinator("a", flaky, options,
        new NoopRealtimeMetrics());
    a.tryAcquire();

    assertEquals(LeaderRole.FOLLOWER, a.followerTick());
    assertFalse(a.isSingleInstance());
    verify(flaky);
  }

  @Test
  void whenAcquiring_givenElectionDisabled_shouldLeadWithoutStore() {
    final LeaseStore untouched = createMock(LeaseStore.class);
    replay(untouched);
    final ChannelOptions noElection = options.toBuilder()
        .leaderElectionEnabled(false).build();

    final LeaderCoordinator a = coordinator("a", untouched, noElection,
        new NoopRealtimeMetrics());

    assertEquals(LeaderRole.LEADER, a.tryAcquire());
    assertTrue(a.renew());
    a.onHeartbeat("b", clock.instant().plusSeconds(1));
    assertTrue(a.isLeader());
    verify(untouched);
  }

  @Test
  void whenRescoping_givenLeader_shouldDropLeadership() {
    final LeaderCoordinator a = coordinator("a");
    a.tryAcquire();
    final List<Boolean> changes = new ArrayList<>();
    a.onLeaderChange(changes::add);

    a.rescope(KEY + "#42");

    assertEquals(LeaderRole.UNLEASED, a.role());
    assertEquals(KEY + "#42", a.leaseKey());
    assertEquals(List.of(false), changes);
    assertEquals(LeaderRole.LEADER, a.tryAcquire());
  }

  @Test
  void whenStopping_givenLeader_shouldLeaveLeaseToExpire() {
    final LeaderCoordinator a = coordinator("a");
    a.tryAcquire();

    a.stop();

    assertEquals(LeaderRole.UNLEASED, a.role());
    assertTrue(store.read(KEY).isPresent());
    assertEquals(LeaderRole.FOLLOWER, coordinator("b").tryAcquire());
  }

  @Test
  void whenListenerFails_givenLeadershipChange_shouldStillLead() {
    final LeaderCoordinator a = coordinator("a");
    final LeaderChangeListener failing = isLeader -> {
      throw new IllegalStateException("boom");
    };
    a.onLeaderChange(failing);
    assertEquals(LeaderRole.LEADER, a.tryAcquire());
  }

  @Test
  void whenLeaderVanishes_givenThreeInstances_shouldElectExactlyOneNew() {
    final List<LeaderCoordinator> all = new ArrayList<>();
    for (final String id : List.of("a", "b", "c")) {
      final LeaderCoordinator[] self = new LeaderCoordinator[1];
      self[0] = new LeaderCoordinator("finance", id, KEY, store, options,
          clock, new Random(id.hashCode()), new NoopRealtimeMetrics(),
          at -> all.stream().filter(other -> other != self[0])
              .forEach(other -> other.onHeartbeat(id, at)));
      all.add(self[0]);
    }
    all.forEach(LeaderCoordinator::tryAcquire);
    assertEquals(1, leaders(all));
    assertTrue(all.get(0).isLeader());

    // The leader keeps renewing for a while.
    for (int i = 0; i < 20; i++) {
      clock.advanceMillis(50);
      if (i % 2 == 1) {
        all.get(0).renew();
      }
      all.get(1).followerTick();
      all.get(2).followerTick();
      assertEquals(1, leaders(all));
      assertTrue(all.get(0).isLeader());
    }

    // The leader vanishes without releasing its lease.
    final LeaderCoordinator gone = all.remove(0);
    long elapsed = 0;
    while (leaders(all) == 0) {
      clock.advanceMillis(40);
      elapsed += 40;
      all.forEach(LeaderCoordinator::followerTick);
      assertTrue(leaders(all) <= 1);
    }
    assertEquals(1, leaders(all));
    assertTrue(elapsed <= 220 + 50 + 100,
        "takeover took " + elapsed + "ms");
    assertTrue(gone.isLeader());

    // The stale leader finds the new lease on its next renewal.
    final LeaderCoordinator newLeader = all.stream()
        .filter(LeaderCoordinator::isLeader).findFirst().orElseThrow();
    assertFalse(gone.renew());
    assertFalse(gone.isLeader());
    assertTrue(newLeader.isLeader());
  }

  private static long leaders(final List<LeaderCoordinator> coordinators) {
    return coordinators.stream().filter(LeaderCoordinator::isLeader).count();
  }
}
