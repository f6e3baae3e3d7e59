package ca.gc.cra.meshradar.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeAcceptsBounds() {
    assertEquals(1L, Numbers.requireRange("workers", 1, 1, 8));
    assertEquals(8L, Numbers.requireRange("workers", 8, 1, 8));
  }

  @Test
  void requireRangeNamesTheValue() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("workers", 9, 1, 8));
    assertTrue(ex.getMessage().startsWith("workers must be between 1 and 8"));
  }

  @Test
  void parsesNodeNumbersInAllNotations() {
    assertEquals(0xdeadbeefL, Numbers.parseNodeNumber("node", "!deadbeef"));
    assertEquals(0x10L, Numbers.parseNodeNumber("node", "0x10"));
    assertEquals(2_144_342_101L, Numbers.parseNodeNumber("node", " 2144342101 "));
  }

  @Test
  void rejectsInvalidNodeNumbers() {
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseNodeNumber("node", "!xyz"));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseNodeNumber("node", "-1"));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseNodeNumber("node", "4294967296"));
  }
}
