package ca.gc.cra.qsolog.domain.adif;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.qsolog.domain.qso.Qso;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class RecordNormalizerTest {

  @Test
  void mapsAllSupportedFields() {
    Optional<Qso> qso = RecordNormalizer.decode(
        "<CALL:5>K1ABC<QSO_DATE:8>20240115<TIME_ON:4>1430<BAND:3>20M<MODE:2>CW<FREQ:6>14.025"
            + "<RST_SENT:3>599<RST_RCVD:3>579<NAME:3>Ann<QTH:6>Boston<GRIDSQUARE:4>FN42"
            + "<COUNTRY:13>United States<COMMENT:5>hello<APP_X:1>z");

    assertTrue(qso.isPresent());
    Qso q = qso.get();
    assertEquals("K1ABC", q.call());
    assertEquals(LocalDateTime.of(2024, 1, 15, 14, 30, 0), q.startAt());
    assertEquals("20M", q.band());
    assertEquals("CW", q.mode());
    assertEquals(14.025, q.freqMhz());
    assertEquals("599", q.rstSent());
    assertEquals("579", q.rstRcvd());
    assertEquals("Ann", q.name());
    assertEquals("Boston", q.qth());
    assertEquals("FN42", q.grid());
    assertEquals("United States", q.country());
    assertEquals("hello", q.comment());
  }

  @Test
  void sixDigitTimeKeepsSeconds() {
    Qso q = RecordNormalizer.decode("<CALL:4>W1AW<QSO_DATE:8>20231231<TIME_ON:6>235959").orElseThrow();

    assertEquals(LocalDateTime.of(2023, 12, 31, 23, 59, 59), q.startAt());
  }

  @Test
  void rejectsMissingRequiredFields() {
    assertTrue(RecordNormalizer.decode("<QSO_DATE:8>20240115<TIME_ON:4>1430").isEmpty());
    assertTrue(RecordNormalizer.decode("<CALL:4>W1AW<TIME_ON:4>1430").isEmpty());
    assertTrue(RecordNormalizer.decode("<CALL:4>W1AW<QSO_DATE:8>20240115").isEmpty());
    assertTrue(RecordNormalizer.decode("<CALL:3>   <QSO_DATE:8>20240115<TIME_ON:4>1430").isEmpty());
  }

  @Test
  void rejectsInvalidDatesAndTimes() {
    assertTrue(RecordNormalizer.parseDate("20241301").isEmpty());
    assertTrue(RecordNormalizer.parseDate("20230229").isEmpty());
    assertTrue(RecordNormalizer.parseDate("2024011").isEmpty());
    assertTrue(RecordNormalizer.parseDate("2024-1-1").isEmpty());
    assertTrue(RecordNormalizer.parseTime("2460").isEmpty());
    assertTrue(RecordNormalizer.parseTime("12345").isEmpty());
    assertTrue(RecordNormalizer.parseTime("1a30").isEmpty());
    assertTrue(RecordNormalizer.parseTime("120060").isEmpty());
    assertEquals(2024, RecordNormalizer.parseDate("20240229").orElseThrow().getYear());
  }

  @Test
  void unparsableFrequencyIsDroppedNotRejected() {
    Qso q = RecordNormalizer.normalize(Map.of(
        "CALL", "W1AW", "QSO_DATE", "20240115", "TIME_ON", "1430", "FREQ", "fourteen")).orElseThrow();

    assertNull(q.freqMhz());
    assertNull(RecordNormalizer.parseFrequency("NaN"));
    assertNull(RecordNormalizer.parseFrequency(""));
    assertEquals(7.0, RecordNormalizer.parseFrequency(" 7 "));
  }

  @Test
  void emptyOptionalValuesBecomeAbsent() {
    Qso q = RecordNormalizer.decode("<CALL:4>W1AW<QSO_DATE:8>20240115<TIME_ON:4>1430<BAND:0><NAME:0>")
        .orElseThrow();

    assertNull(q.band());
    assertNull(q.name());
  }
}
