package ca.gc.cra.qsolog.infrastructure.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ca.gc.cra.qsolog.domain.awards.AwardsAggregator;
import ca.gc.cra.qsolog.domain.qso.Qso;
import ca.gc.cra.qsolog.testutil.AdifSamples;
import ca.gc.cra.qsolog.testutil.RecordingMetrics;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.Test;

class ExecutorSummaryEngineTest {

  @Test
  void countsMergedChunks() {
    RecordingMetrics metrics = new RecordingMetrics();
    ExecutorSummaryEngine engine = new ExecutorSummaryEngine(4, 100, metrics);

    engine.summarize(AdifSamples.contacts(1_050));

    assertEquals(11, metrics.count("awards.chunks"));
  }

  @Test
  void belowChunkSizeStaysSerial() {
    RecordingMetrics metrics = new RecordingMetrics();
    ExecutorSummaryEngine engine = new ExecutorSummaryEngine(4, 100, metrics);

    engine.summarize(AdifSamples.contacts(99));

    assertEquals(0, metrics.count("awards.chunks"));
  }

  @Test
  void rejectedDispatchFallsBackToSerial() {
    RecordingMetrics metrics = new RecordingMetrics();
    ExecutorSummaryEngine engine = new ExecutorSummaryEngine(2, 10, metrics, capacity -> {
      ExecutorService pool = Executors.newFixedThreadPool(1);
      pool.shutdownNow();
      return pool;
    });
    List<Qso> qsos = AdifSamples.contacts(300);

    assertEquals(AwardsAggregator.summarize(qsos), engine.summarize(qsos));
    assertEquals(1, metrics.count("awards.fallback.serial"));
  }

  @Test
  void failingTasksFallBackToSerial() {
    RecordingMetrics metrics = new RecordingMetrics();
    ExecutorSummaryEngine engine = new ExecutorSummaryEngine(2, 10, metrics, capacity -> new FailingTaskPool(2));
    List<Qso> qsos = AdifSamples.contacts(300);

    assertEquals(AwardsAggregator.summarize(qsos), engine.summarize(qsos));
    assertEquals(1, metrics.count("awards.fallback.serial"));
    assertEquals(0, metrics.count("awards.chunks"));
  }
}
