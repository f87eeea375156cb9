package ca.gc.cra.qsolog.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankTrims() {
    assertEquals("QSOLOG", Strings.requireNonBlank("programId", "  QSOLOG "));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("programId", "   "));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("programId", "a\u0007b"));
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("programId", null));
  }

  @Test
  void printableAsciiEnforcesLengthAndCharset() {
    assertEquals("Logger 1.0", Strings.requirePrintableAscii("programId", "Logger 1.0", 10));
    IllegalArgumentException tooLong = assertThrows(IllegalArgumentException.class,
        () -> Strings.requirePrintableAscii("programId", "Logger 1.01", 10));
    assertEquals("programId length must be <= 10", tooLong.getMessage());
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii(null, "Łódź", 10));
  }

  @Test
  void trimToNullTreatsBlankAsAbsent() {
    assertNull(Strings.trimToNull(" \t"));
    assertNull(Strings.trimToNull(null));
    assertEquals("20M", Strings.trimToNull(" 20M "));
  }
}
