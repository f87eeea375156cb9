package ca.gc.cra.qsolog.infrastructure.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ca.gc.cra.qsolog.application.port.ImportEngine;
import ca.gc.cra.qsolog.application.port.ImportEngine.ImportResult;
import ca.gc.cra.qsolog.domain.qso.Qso;
import ca.gc.cra.qsolog.testutil.AdifSamples;
import ca.gc.cra.qsolog.testutil.RecordingMetrics;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

/** Both engines must accept the same multiset of contacts for any worker count. */
class ImportEngineConformanceTest {

  static Stream<Arguments> engines() {
    return Stream.of(
        Arguments.of("serial", new SerialImportEngine()),
        Arguments.of("parallel-1", new ExecutorImportEngine(1, 100, new RecordingMetrics())),
        Arguments.of("parallel-4", new ExecutorImportEngine(4, 100, new RecordingMetrics())),
        Arguments.of("parallel-16", new ExecutorImportEngine(16, 100, new RecordingMetrics())),
        Arguments.of("parallel-always", new ExecutorImportEngine(8, 0, new RecordingMetrics())));
  }

  static Map<Qso, Long> multiset(List<Qso> qsos) {
    return qsos.stream().collect(Collectors.groupingBy(Function.identity(), Collectors.counting()));
  }

  @ParameterizedTest(name = "{0}")
  @MethodSource("engines")
  void largeDocumentMatchesSerialDecode(String label, ImportEngine engine) {
    String document = AdifSamples.generatedDocument(1_000, 7);
    ImportResult expected = new SerialImportEngine().decode(document);

    ImportResult actual = engine.decode(document);

    assertEquals(1_000, actual.chunks());
    assertEquals(142, actual.rejected());
    assertEquals(858, actual.accepted().size());
    assertEquals(multiset(expected.accepted()), multiset(actual.accepted()));
  }

  @ParameterizedTest(name = "{0}")
  @MethodSource("engines")
  void sampleFixtureAcceptsThreeOfFive(String label, ImportEngine engine) {
    ImportResult result = engine.decode(AdifSamples.sampleDocument());

    assertEquals(5, result.chunks());
    assertEquals(2, result.rejected());
    assertEquals(
        List.of("G4XYZ", "JA1AA", "K1ABC"),
        result.accepted().stream().map(Qso::call).sorted().collect(Collectors.toList()));
  }

  @ParameterizedTest(name = "{0}")
  @MethodSource("engines")
  void emptyDocumentYieldsNothing(String label, ImportEngine engine) {
    ImportResult result = engine.decode("<ADIF_VER:3>3.1<EOH>\n");

    assertEquals(0, result.chunks());
    assertEquals(List.of(), result.accepted());
  }
}
