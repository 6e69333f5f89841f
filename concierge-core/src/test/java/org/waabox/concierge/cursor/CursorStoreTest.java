package org.waabox.concierge.cursor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link CursorStore}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class CursorStoreTest {

  @Test
  void whenReadingPosition_givenUnknownChannel_shouldReturnEmptyPosition() {
    final CursorStore store = new CursorStore();
    final CursorPosition position = store.position("finance");

    assertNull(position.cursor());
    assertNull(position.filter());
    assertEquals(0, position.generation());
    assertFalse(position.hasCursor());
  }

  @Test
  void whenChangingFilter_givenExistingCursor_shouldClearIt() {
    final CursorStore store = new CursorStore();
    store.changeFilter("finance", "property=1");
    assertTrue(store.adopt("finance", 0, "c-10"));

    final CursorPosition position = store.changeFilter("finance",
        "property=2");

    assertNull(position.cursor());
    assertEquals("property=2", position.filter());
    assertEquals(1, position.generation());
  }

  @Test
  void whenChangingFilter_givenSameFilter_shouldKeepCursor() {
    final CursorStore store = new CursorStore();
    store.changeFilter("finance", "property=1");
    store.adopt("finance", 0, "c-10");

    final CursorPosition position = store.changeFilter("finance",
        "property=1");

    assertEquals("c-10", position.cursor());
    assertEquals(0, position.generation());
  }

  @Test
  void whenAdopting_givenStaleGeneration_shouldRejectCursor() {
    final CursorStore store = new CursorStore();
    store.changeFilter("finance", "property=1");
    store.changeFilter("finance", "property=2");

    assertFalse(store.adopt("finance", 0, "late"));
    assertNull(store.position("finance").cursor());
  }

  @Test
  void whenAdopting_givenNullCursor_shouldKeepPrevious() {
    final CursorStore store = new CursorStore();
    store.adopt("audit", 0, "c-1");
    store.adopt("audit", 0, null);

    assertEquals("c-1", store.position("audit").cursor());
  }

  @Test
  void whenClearing_givenChannel_shouldForgetPosition() {
    final CursorStore store = new CursorStore();
    store.adopt("audit", 0, "c-1");
    store.clear("audit");

    assertNull(store.position("audit").cursor());
  }
}
