package org.waabox.concierge;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link SessionScope}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class SessionScopeTest {

  @Test
  void whenDerivingNames_givenSameSession_shouldBeDeterministic() {
    final SessionScope a = SessionScope.of("session-token-1");
    final SessionScope b = SessionScope.of("session-token-1");

    assertEquals(a.leaseKey("finance"), b.leaseKey("finance"));
    assertEquals(a.topic("finance"), b.topic("finance"));
    assertEquals(a.controlTopic(), b.controlTopic());
  }

  @Test
  void whenDerivingNames_givenOtherSession_shouldDiffer() {
    final SessionScope a = SessionScope.of("session-token-1");
    final SessionScope b = SessionScope.of("session-token-2");

    assertNotEquals(a.leaseKey("finance"), b.leaseKey("finance"));
  }

  @Test
  void whenDerivingNames_givenSessionId_shouldNotExposeIt() {
    final SessionScope scope = SessionScope.of("secret-token");

    assertFalse(scope.leaseKey("finance").contains("secret-token"));
    assertEquals(64, scope.sessionHash().length());
  }

  @Test
  void whenBuildingChannelScope_givenFilter_shouldAppendIt() {
    assertEquals("finance", SessionScope.channelScope("finance", null));
    assertEquals("finance", SessionScope.channelScope("finance", ""));
    assertEquals("finance#property=42",
        SessionScope.channelScope("finance", "property=42"));
  }
}
