package ca.gc.cra.qsolog.infrastructure.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.qsolog.application.port.ImportEngine.ImportResult;
import ca.gc.cra.qsolog.testutil.AdifSamples;
import ca.gc.cra.qsolog.testutil.RecordingMetrics;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class ExecutorImportEngineTest {

  @Test
  void rejectedDispatchFallsBackToSerial() {
    RecordingMetrics metrics = new RecordingMetrics();
    ExecutorImportEngine engine = new ExecutorImportEngine(4, 10, metrics, capacity -> {
      ExecutorService pool = Executors.newSingleThreadExecutor();
      pool.shutdown();
      return pool;
    });
    String document = AdifSamples.generatedDocument(200, 0);

    ImportResult result = engine.decode(document);

    assertEquals(200, result.accepted().size());
    assertEquals(1, metrics.count("import.fallback.serial"));
  }

  @Test
  void failingTasksFallBackToSerial() {
    RecordingMetrics metrics = new RecordingMetrics();
    ExecutorImportEngine engine = new ExecutorImportEngine(2, 10, metrics, capacity -> new FailingTaskPool(2));

    ImportResult result = engine.decode(AdifSamples.generatedDocument(120, 4));

    assertEquals(90, result.accepted().size());
    assertEquals(30, result.rejected());
    assertEquals(120, result.chunks());
    assertEquals(1, metrics.count("import.fallback.serial"));
  }

  @Test
  void interruptFallsBackAndRestoresFlag() {
    RecordingMetrics metrics = new RecordingMetrics();
    ExecutorImportEngine engine = new ExecutorImportEngine(2, 10, metrics);
    String document = AdifSamples.generatedDocument(150, 0);

    Thread.currentThread().interrupt();
    ImportResult result;
    try {
      result = engine.decode(document);
    } finally {
      assertTrue(Thread.interrupted(), "interrupt flag should be restored");
    }

    assertEquals(150, result.accepted().size());
    assertEquals(1, metrics.count("import.fallback.serial"));
  }

  @Test
  void smallDocumentsNeverCreateAPool() {
    AtomicInteger pools = new AtomicInteger();
    ExecutorImportEngine engine = new ExecutorImportEngine(4, 100, new RecordingMetrics(), capacity -> {
      pools.incrementAndGet();
      return Executors.newFixedThreadPool(1);
    });

    engine.decode(AdifSamples.generatedDocument(99, 0));

    assertEquals(0, pools.get());
  }

  @Test
  void queueIsSizedToChunkCount() {
    AtomicInteger requested = new AtomicInteger();
    ExecutorImportEngine engine = new ExecutorImportEngine(3, 1, new RecordingMetrics(), capacity -> {
      requested.set(capacity);
      return Executors.newFixedThreadPool(3);
    });

    ImportResult result = engine.decode(AdifSamples.generatedDocument(250, 5));

    assertEquals(250, requested.get());
    assertEquals(50, result.rejected());
  }

  @Test
  void rejectsInvalidSizing() {
    RecordingMetrics metrics = new RecordingMetrics();
    assertThrows(IllegalArgumentException.class, () -> new ExecutorImportEngine(0, 100, metrics));
    assertThrows(IllegalArgumentException.class, () -> new ExecutorImportEngine(2, -1, metrics));
  }
}
