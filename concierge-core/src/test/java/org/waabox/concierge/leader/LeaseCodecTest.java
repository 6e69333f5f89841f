package org.waabox.concierge.leader;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link LeaseCodec}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class LeaseCodecTest {

  @Test
  void whenSerializing_shouldWriteOwnerAndEpochMillis() {
    final String json = LeaseCodec.serialize(new Lease("tab-1",
        Instant.ofEpochMilli(1_700_000_000_000L)));
    assertEquals("{\"owner\":\"tab-1\",\"expiresAt\":1700000000000}", json);
  }

  @Test
  void whenParsing_givenStoredLease_shouldReadIt() {
    final Lease lease = LeaseCodec.parse(
        "{\"owner\":\"tab-2\",\"expiresAt\":1700000000000}").orElseThrow();
    assertEquals("tab-2", lease.owner());
    assertEquals(Instant.ofEpochMilli(1_700_000_000_000L), lease.expiresAt());
  }

  @Test
  void whenParsing_givenCorruptValues_shouldReturnEmpty() {
    assertTrue(LeaseCodec.parse(null).isEmpty());
    assertTrue(LeaseCodec.parse("").isEmpty());
    assertTrue(LeaseCodec.parse("{not json").isEmpty());
    assertTrue(LeaseCodec.parse("[1,2]").isEmpty());
    assertTrue(LeaseCodec.parse("{\"owner\":\"x\"}").isEmpty());
    assertTrue(LeaseCodec.parse(
        "{\"owner\":3,\"expiresAt\":1700000000000}").isEmpty());
  }

  @Test
  void whenCheckingExpiry_givenExactExpiry_shouldStillBeValid() {
    final Instant at = Instant.parse("2026-03-01T10:00:00Z");
    final Lease lease = new Lease("tab-1", at);
    assertFalse(lease.isExpired(at));
    assertTrue(lease.isExpired(at.plusMillis(1)));
  }
}
