package ca.gc.cra.qsolog.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.qsolog.application.pipeline.ImportUseCase.ImportSummary;
import ca.gc.cra.qsolog.domain.qso.Qso;
import ca.gc.cra.qsolog.infrastructure.engine.ExecutorImportEngine;
import ca.gc.cra.qsolog.infrastructure.engine.SerialImportEngine;
import ca.gc.cra.qsolog.infrastructure.persistence.InMemoryQsoStore;
import ca.gc.cra.qsolog.testutil.AdifSamples;
import ca.gc.cra.qsolog.testutil.RecordingMetrics;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.MDC;

class ImportUseCaseTest {
  @TempDir Path dir;

  @Test
  void importsAcceptedRecordsAndRecordsMetrics() throws IOException {
    Path input = dir.resolve("in.adi");
    Files.writeString(input, AdifSamples.sampleDocument(), StandardCharsets.UTF_8);
    InMemoryQsoStore store = new InMemoryQsoStore();
    RecordingMetrics metrics = new RecordingMetrics();

    ImportSummary summary = new ImportUseCase(input, new SerialImportEngine(), store, metrics).run();

    assertEquals(new ImportSummary(5, 3, 2, 3), summary);
    assertEquals(3, store.size());
    assertEquals(5, metrics.last("import.chunks"));
    assertEquals(3, metrics.last("import.records.accepted"));
    assertEquals(2, metrics.last("import.records.rejected"));
    assertEquals(3, metrics.last("store.records.inserted"));
    assertTrue(metrics.last("import.latencyNanos") >= 0);
    assertNull(MDC.get("qsolog.in"));
  }

  @Test
  void largeImportsAreInsertedInBatches() throws IOException {
    Path input = dir.resolve("big.adi");
    Files.writeString(input, AdifSamples.generatedDocument(2_500, 0), StandardCharsets.UTF_8);
    CountingStore store = new CountingStore();

    ImportSummary summary = new ImportUseCase(
        input, new ExecutorImportEngine(4, 100, new RecordingMetrics()), store, new RecordingMetrics()).run();

    assertEquals(2_500, summary.stored());
    assertEquals(3, store.batches);
  }

  @Test
  void missingInputPropagatesIoFailure() {
    ImportUseCase useCase = new ImportUseCase(
        dir.resolve("absent.adi"), new SerialImportEngine(), new InMemoryQsoStore(), new RecordingMetrics());

    assertThrows(IOException.class, useCase::run);
    assertNull(MDC.get("qsolog.in"));
  }

  private static final class CountingStore implements ca.gc.cra.qsolog.application.port.QsoStorePort {
    private final InMemoryQsoStore delegate = new InMemoryQsoStore();
    private int batches;

    @Override
    public int insertBatch(java.util.List<Qso> records) {
      batches++;
      return delegate.insertBatch(records);
    }

    @Override
    public Iterable<Qso> iterate(ca.gc.cra.qsolog.domain.qso.QsoFilter filter) {
      return delegate.iterate(filter);
    }
  }
}
