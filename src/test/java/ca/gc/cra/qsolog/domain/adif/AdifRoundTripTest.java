package ca.gc.cra.qsolog.domain.adif;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.qsolog.domain.qso.Qso;
import java.io.IOException;
import java.io.StringWriter;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class AdifRoundTripTest {

  private static List<Qso> decodeAll(String document) {
    List<Qso> out = new ArrayList<>();
    for (String chunk : ChunkSplitter.chunks(document)) {
      RecordNormalizer.decode(chunk).ifPresent(out::add);
    }
    return out;
  }

  @Test
  void encodedLogDecodesToEqualContacts() throws IOException {
    List<Qso> original = List.of(
        Qso.builder("K1ABC", LocalDateTime.of(2024, 1, 15, 14, 30))
            .band("20M").mode("CW").freqMhz(14.025).rstSent("599").rstRcvd("579")
            .grid("FN42").country("United States").build(),
        Qso.builder("G4XYZ", LocalDateTime.of(2024, 1, 15, 15, 5, 12))
            .band("40M").mode("SSB").freqMhz(7.15).name("Nigel").qth("London, UK")
            .comment("multi\nline <tag-like> text ").build(),
        Qso.builder("JA1AA", LocalDateTime.of(2024, 1, 16, 2, 10))
            .name("Tarō").qth("東京").build());
    StringWriter sink = new StringWriter();

    new AdifEncoder().writeTo(original, sink);

    assertEquals(original, decodeAll(sink.toString()));
  }

  @Test
  void reEncodingIsStable() throws IOException {
    AdifEncoder encoder = new AdifEncoder();
    StringWriter first = new StringWriter();
    encoder.writeTo(List.of(Qso.builder("W1AW", LocalDateTime.of(2024, 3, 1, 0, 0))
        .freqMhz(3.5).mode("CW").build()), first);

    StringWriter second = new StringWriter();
    encoder.writeTo(decodeAll(first.toString()), second);

    assertEquals(first.toString(), second.toString());
  }

  @Test
  void twoRecordLogKeepsOnlyTheCompleteContact() throws IOException {
    String document = "<ADIF_VER:3>3.1\n<EOH>\n"
        + "<CALL:5>K1ABC<QSO_DATE:8>20240115<TIME_ON:4>1430<BAND:3>20m<MODE:2>CW<FREQ:9>14.250000<EOR>\n"
        + "<QSO_DATE:8>20240115<TIME_ON:4>1500<BAND:3>40m<EOR>\n";

    List<Qso> decoded = decodeAll(document);

    assertEquals(1, decoded.size());
    assertEquals("K1ABC", decoded.get(0).call());
    assertEquals(14.25, decoded.get(0).freqMhz());

    StringWriter sink = new StringWriter();
    new AdifEncoder().writeTo(decoded, sink);
    String encoded = sink.toString();
    assertEquals(1, encoded.split("<EOR>", -1).length - 1);
    assertTrue(encoded.contains("<FREQ:5>14.25"), encoded);
    assertEquals(decoded, decodeAll(encoded));
  }

  @Test
  void yearZeroSurvivesReEncoding() throws IOException {
    List<Qso> decoded = decodeAll("<CALL:4>W1AW<QSO_DATE:8>00000101<TIME_ON:4>1200<EOR>");
    assertEquals(LocalDateTime.of(0, 1, 1, 12, 0), decoded.get(0).startAt());

    StringWriter sink = new StringWriter();
    new AdifEncoder().writeTo(decoded, sink);

    assertTrue(sink.toString().contains("<QSO_DATE:8>00000101"), sink.toString());
    assertEquals(decoded, decodeAll(sink.toString()));
  }

  @Test
  void lastFourDigitYearRoundTrips() throws IOException {
    List<Qso> original = List.of(Qso.builder("W1AW", LocalDateTime.of(9999, 12, 31, 23, 59, 59)).build());
    StringWriter sink = new StringWriter();

    new AdifEncoder().writeTo(original, sink);

    assertTrue(sink.toString().contains("<QSO_DATE:8>99991231<TIME_ON:6>235959"), sink.toString());
    assertEquals(original, decodeAll(sink.toString()));
  }
}
