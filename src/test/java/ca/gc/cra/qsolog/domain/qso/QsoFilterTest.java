package ca.gc.cra.qsolog.domain.qso;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class QsoFilterTest {
  private static final LocalDateTime START = LocalDateTime.of(2024, 5, 1, 12, 0);

  private static Qso qso(String call, String band, String mode) {
    return Qso.builder(call, START).band(band).mode(mode).build();
  }

  private static List<String> calls(Iterable<Qso> qsos) {
    List<String> out = new ArrayList<>();
    qsos.forEach(q -> out.add(q.call()));
    return out;
  }

  @Test
  void bandAndModeMatchAfterNormalization() {
    QsoFilter filter = QsoFilter.of(" 20m", "cw", null, 0);

    assertTrue(filter.matches(qso("W1AW", "20M", "CW")));
    assertTrue(filter.matches(qso("W1AW", "20m ", "Cw")));
    assertFalse(filter.matches(qso("W1AW", "40M", "CW")));
    assertFalse(filter.matches(qso("W1AW", null, "CW")));
  }

  @Test
  void callIsCaseInsensitiveSubstring() {
    QsoFilter filter = QsoFilter.of(null, null, "1a", 0);

    assertTrue(filter.matches(qso("W1AW", null, null)));
    assertTrue(filter.matches(qso("k1abc", null, null)));
    assertFalse(filter.matches(qso("G4XYZ", null, null)));
  }

  @Test
  void blankCriteriaAreIgnored() {
    QsoFilter filter = QsoFilter.of("", " ", null, 0);

    assertEquals(QsoFilter.all(), filter);
    assertTrue(filter.matches(qso("W1AW", null, null)));
  }

  @Test
  void selectAppliesLimitAfterMatching() {
    List<Qso> source = List.of(
        qso("A1", "20M", "CW"), qso("B1", "40M", "CW"), qso("C1", "20M", "CW"), qso("D1", "20M", "CW"));

    assertEquals(List.of("A1", "C1"), calls(QsoFilter.of("20M", null, null, 2).select(source)));
    assertEquals(List.of("A1", "C1", "D1"), calls(QsoFilter.of("20M", null, null, 0).select(source)));
  }

  @Test
  void negativeLimitIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> QsoFilter.of(null, null, null, -1));
  }
}
