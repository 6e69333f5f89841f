package org.waabox.concierge.metrics;

import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expectLastCall;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link SampledRealtimeMetrics}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class SampledRealtimeMetricsTest {

  @Test
  void whenSampling_givenRateOne_shouldForwardEverything() {
    final RealtimeMetrics delegate = createMock(RealtimeMetrics.class);
    delegate.fastEmpty("finance", 40, 2500, true);
    expectLastCall().times(3);
    replay(delegate);

    final SampledRealtimeMetrics metrics = new SampledRealtimeMetrics(
        delegate, 1.0, new Random(1));
    for (int i = 0; i < 3; i++) {
      metrics.fastEmpty("finance", 40, 2500, true);
    }

    verify(delegate);
  }

  @Test
  void whenSampling_givenRateZero_shouldForwardNothing() {
    final RealtimeMetrics delegate = createMock(RealtimeMetrics.class);
    replay(delegate);

    final SampledRealtimeMetrics metrics = new SampledRealtimeMetrics(
        delegate, 0.0, new Random(1));
    for (int i = 0; i < 100; i++) {
      metrics.fastEmpty("finance", 40, 2500, false);
    }

    verify(delegate);
  }

  @Test
  void whenSampling_givenTwoPercent_shouldForwardAFewOfMany() {
    final AtomicInteger forwarded = new AtomicInteger();
    final RealtimeMetrics counter = new NoopRealtimeMetrics() {
      @Override
      public void fastEmpty(final String channel, final long elapsedMs,
          final long backoffMs, final boolean isLeader) {
        forwarded.incrementAndGet();
      }
    };
    final SampledRealtimeMetrics metrics = new SampledRealtimeMetrics(
        counter, 0.02, new Random(42));

    for (int i = 0; i < 10_000; i++) {
      metrics.fastEmpty("finance", 40, 2500, true);
    }

    assertTrue(forwarded.get() > 100 && forwarded.get() < 300,
        "forwarded " + forwarded.get());
  }

  @Test
  void whenCreating_givenRateOutOfRange_shouldThrow() {
    assertThrows(IllegalArgumentException.class,
        () -> new SampledRealtimeMetrics(new NoopRealtimeMetrics(), 1.2,
            new Random()));
    assertThrows(IllegalArgumentException.class,
        () -> new SampledRealtimeMetrics(new NoopRealtimeMetrics(), -0.1,
            new Random()));
  }
}
