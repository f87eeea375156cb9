package ca.gc.cra.qsolog.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void parsesWithinRange() {
    assertEquals(8, Numbers.parseIntInRange("workers", " 8 ", 1, 1024));
    assertEquals(0L, Numbers.requireRange("limit", 0, 0, 10));
  }

  @Test
  void reportsNameAndValueOnFailure() {
    IllegalArgumentException range = assertThrows(IllegalArgumentException.class,
        () -> Numbers.parseIntInRange("workers", "0", 1, 1024));
    assertEquals("workers must be between 1 and 1024 (was 0)", range.getMessage());

    IllegalArgumentException format = assertThrows(IllegalArgumentException.class,
        () -> Numbers.parseIntInRange("limit", "ten", 0, 10));
    assertTrue(format.getMessage().contains("limit must be an integer"));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseIntInRange("", " ", 0, 10));
  }
}
