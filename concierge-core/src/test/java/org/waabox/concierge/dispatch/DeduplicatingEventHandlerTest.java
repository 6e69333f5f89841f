package org.waabox.concierge.dispatch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import org.waabox.concierge.event.ChannelEvent;

/**
 * Tests for {@link DeduplicatingEventHandler}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class DeduplicatingEventHandlerTest {

  private static ChannelEvent event(final String id, final String amount) {
    return new ChannelEvent(id, "transaction_updated", "tx-1",
        Instant.parse("2026-03-01T10:00:00Z"), Map.of("amount", amount));
  }

  @Test
  void whenBatchDeliveredTwice_givenIdempotentState_shouldApplyOnce() {
    final Map<String, String> state = new HashMap<>();
    final List<String> applied = new ArrayList<>();
    final EventHandler handler = new DeduplicatingEventHandler(
        (channel, events) -> events.forEach(e -> {
          applied.add(e.id());
          state.put(e.entityId(), (String) e.metadata().get("amount"));
        }));

    final List<ChannelEvent> batch = List.of(event("1", "10"),
        event("2", "20"));
    handler.onEvents("finance", batch);
    final Map<String, String> once = new HashMap<>(state);
    handler.onEvents("finance", batch);

    assertEquals(once, state);
    assertEquals(List.of("1", "2"), applied);
  }

  @Test
  void whenBatchOverlaps_givenSeenIds_shouldForwardOnlyNewOnes() {
    final List<String> applied = new ArrayList<>();
    final EventHandler handler = new DeduplicatingEventHandler(
        (channel, events) -> events.forEach(e -> applied.add(e.id())));

    handler.onEvents("finance", List.of(event("1", "a"), event("2", "b")));
    handler.onEvents("finance", List.of(event("2", "b"), event("3", "c")));

    assertEquals(List.of("1", "2", "3"), applied);
  }

  @Test
  void whenSameIdOnOtherChannel_givenSeenId_shouldForwardIt() {
    final List<String> applied = new ArrayList<>();
    final EventHandler handler = new DeduplicatingEventHandler(
        (channel, events) -> events.forEach(e ->
            applied.add(channel + ":" + e.id())));

    handler.onEvents("finance", List.of(event("1", "a")));
    handler.onEvents("audit", List.of(event("1", "a")));

    assertEquals(List.of("finance:1", "audit:1"), applied);
  }

  @Test
  void whenCapacityExceeded_givenOldId_shouldForwardItAgain() {
    final List<String> applied = new ArrayList<>();
    final EventHandler handler = new DeduplicatingEventHandler(
        (channel, events) -> events.forEach(e -> applied.add(e.id())), 2);

    handler.onEvents("finance", List.of(event("1", "a"), event("2", "b"),
        event("3", "c")));
    handler.onEvents("finance", List.of(event("1", "a")));

    assertEquals(List.of("1", "2", "3", "1"), applied);
  }

  @Test
  void whenCreating_givenZeroCapacity_shouldThrow() {
    assertThrows(IllegalArgumentException.class,
        () -> new DeduplicatingEventHandler((channel, events) -> { }, 0));
  }
}
