package org.waabox.concierge.health;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import org.waabox.concierge.MutableClock;

/**
 * Tests for {@link HealthMonitor}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class HealthMonitorTest {

  private final MutableClock clock = new MutableClock(
      Instant.parse("2026-03-01T10:00:00Z"));

  @Test
  void whenCreated_givenNoCycles_shouldNotBeLive() {
    final HealthMonitor monitor = new HealthMonitor("finance", clock);
    assertEquals(HealthSnapshot.initial(), monitor.snapshot());
  }

  @Test
  void whenFailuresThenEvents_givenMonitor_shouldResetFailureCount() {
    final HealthMonitor monitor = new HealthMonitor("finance", clock);

    monitor.recordFailure();
    monitor.recordFailure();
    assertEquals(2, monitor.snapshot().consecutiveFailures());
    assertFalse(monitor.snapshot().isLive());

    clock.advanceMillis(1000);
    monitor.recordEvents();

    final HealthSnapshot snapshot = monitor.snapshot();
    assertTrue(snapshot.isLive());
    assertEquals(0, snapshot.consecutiveFailures());
    assertEquals(clock.instant(), snapshot.lastEventAt());
    assertEquals(clock.instant(), snapshot.lastSuccessAt());
  }

  @Test
  void whenEmpty_givenPreviousEvents_shouldKeepLastEventAt() {
    final HealthMonitor monitor = new HealthMonitor("finance", clock);
    monitor.recordEvents();
    final Instant eventsAt = clock.instant();

    clock.advanceMillis(3000);
    monitor.recordEmpty();

    assertEquals(eventsAt, monitor.snapshot().lastEventAt());
    assertEquals(clock.instant(), monitor.snapshot().lastSuccessAt());
  }

  @Test
  void whenEmpty_givenNoPreviousEvents_shouldLeaveLastEventAtNull() {
    final HealthMonitor monitor = new HealthMonitor("audit", clock);
    monitor.recordEmpty();

    assertTrue(monitor.snapshot().isLive());
    assertNull(monitor.snapshot().lastEventAt());
  }

  @Test
  void whenRecording_givenListeners_shouldPublishEverySnapshot() {
    final HealthMonitor monitor = new HealthMonitor("finance", clock);
    final List<HealthSnapshot> received = new ArrayList<>();
    monitor.onHealth((channel, snapshot) -> {
      throw new IllegalStateException("boom");
    });
    monitor.onHealth((channel, snapshot) -> received.add(snapshot));

    monitor.recordEvents();
    monitor.recordFailure();
    monitor.markIdle();

    assertEquals(2, received.size());
    assertSame(monitor.snapshot(), received.get(1));
  }
}
