package ca.gc.cra.qsolog.domain.adif;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TagScannerTest {

  @Test
  void readsValuesByDeclaredLengthAndUppercasesNames() {
    Map<String, String> fields = TagScanner.fields("<call:5>K1ABC <Band:3>20M\n<mode:2>CW");

    assertEquals(Map.of("CALL", "K1ABC", "BAND", "20M", "MODE", "CW"), fields);
  }

  @Test
  void valueMayContainAngleBracketsAndNewlines() {
    Map<String, String> fields = TagScanner.fields("<COMMENT:9>a <b>\nc>d<CALL:4>W1AW");

    assertEquals("a <b>\nc>d", fields.get("COMMENT"));
    assertEquals("W1AW", fields.get("CALL"));
  }

  @Test
  void typeSegmentIsIgnored() {
    assertEquals("20240115", TagScanner.fields("<QSO_DATE:8:D>20240115").get("QSO_DATE"));
  }

  @Test
  void lastDuplicateWins() {
    assertEquals("N0CALL", TagScanner.fields("<CALL:4>W1AW <CALL:6>N0CALL").get("CALL"));
  }

  @Test
  void malformedLengthSkipsTagAndContinues() {
    List<AdifTag> tags = TagScanner.tags("<CALL:x>W1AW <BAND:3>20M <MODE:-2>CW <NAME>Bob");

    assertEquals(4, tags.size());
    assertFalse(tags.get(0).hasValue());
    assertEquals("20M", tags.get(1).value());
    assertFalse(tags.get(2).hasValue());
    assertFalse(tags.get(3).hasValue());
    assertEquals(Map.of("BAND", "20M"), TagScanner.fields("<CALL:x>W1AW <BAND:3>20M <MODE:-2>CW"));
  }

  @Test
  void lengthBeyondEndOfTextSkipsTag() {
    Map<String, String> fields = TagScanner.fields("<BAND:3>20M <CALL:40>K1ABC");

    assertEquals(Map.of("BAND", "20M"), fields);
  }

  @Test
  void zeroLengthYieldsEmptyValue() {
    List<AdifTag> tags = TagScanner.tags("<NAME:0><CALL:4>W1AW");

    assertTrue(tags.get(0).hasValue());
    assertEquals("", tags.get(0).value());
    assertEquals("W1AW", TagScanner.fields("<NAME:0><CALL:4>W1AW").get("CALL"));
  }

  @Test
  void lengthCountsUtf8Bytes() {
    // "Zoë" is 4 bytes; "東京" is 6 bytes.
    Map<String, String> fields = TagScanner.fields("<NAME:4>Zoë<QTH:6>東京<CALL:4>JA1X");

    assertEquals("Zoë", fields.get("NAME"));
    assertEquals("東京", fields.get("QTH"));
    assertEquals("JA1X", fields.get("CALL"));
  }

  @Test
  void lengthEndingInsideMultiByteCharacterSkipsTag() {
    Map<String, String> fields = TagScanner.fields("<NAME:3>Zoë<CALL:4>W1AW");

    assertFalse(fields.containsKey("NAME"));
    assertEquals("W1AW", fields.get("CALL"));
  }

  @Test
  void textWithoutTagsYieldsNothing() {
    assertTrue(TagScanner.fields("just some words > here").isEmpty());
    assertTrue(TagScanner.fields("").isEmpty());
    assertTrue(TagScanner.fields("<unterminated").isEmpty());
  }

  @Test
  void utf8LengthMatchesEncoder() {
    assertEquals(1, TagScanner.utf8Length('A'));
    assertEquals(2, TagScanner.utf8Length('ë'));
    assertEquals(3, TagScanner.utf8Length('東'));
    assertEquals(4, TagScanner.utf8Length(0x1F4FB));
  }
}
