package ca.gc.cra.qsolog.infrastructure.engine;

import ca.gc.cra.qsolog.application.port.MetricsPort;
import ca.gc.cra.qsolog.application.port.SummaryEngine;
import ca.gc.cra.qsolog.domain.awards.AwardsAggregator;
import ca.gc.cra.qsolog.domain.awards.AwardsSummary;
import ca.gc.cra.qsolog.domain.qso.Qso;
import ca.gc.cra.qsolog.infrastructure.exec.ExecutorFactories;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.IntFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Summarizes fixed-size slices of a contact list on a worker pool and folds the results.
 * <p><strong>Why:</strong> Chunk summaries keep per-band grid <em>sets</em>, so folding them with
 * {@link AwardsSummary#merge(AwardsSummary)} gives exactly the serial answer in any completion order.</p>
 * <p><strong>Role:</strong> Parallel {@link SummaryEngine} selected by {@code engine=PARALLEL}.</p>
 * <p><strong>Thread-safety:</strong> A pool is created per call and shut down before returning.</p>
 * <p><strong>Observability:</strong> Emits {@code awards.chunks} and {@code awards.fallback.serial}.</p>
 *
 * @since 0.1.0
 */
public final class ExecutorSummaryEngine implements SummaryEngine {
  private static final Logger log = LoggerFactory.getLogger(ExecutorSummaryEngine.class);
  /** Contacts per slice when none is configured. */
  public static final int DEFAULT_CHUNK_SIZE = 5000;
  static final String THREAD_PREFIX = "qsolog-awards";

  private final int workers;
  private final int chunkSize;
  private final MetricsPort metrics;
  private final IntFunction<ExecutorService> poolFactory;

  /**
   * Creates a parallel summary engine.
   *
   * @param workers worker threads per call; must be positive
   * @param chunkSize contacts per slice; must be positive
   * @param metrics metrics sink; must not be {@code null}
   */
  public ExecutorSummaryEngine(int workers, int chunkSize, MetricsPort metrics) {
    this(workers, chunkSize, metrics, queueCapacity -> ExecutorFactories.newWorkerPool(
        workers,
        queueCapacity,
        THREAD_PREFIX,
        (thread, ex) -> log.error("Uncaught failure on {}", thread.getName(), ex)));
  }

  ExecutorSummaryEngine(int workers, int chunkSize, MetricsPort metrics, IntFunction<ExecutorService> poolFactory) {
    if (workers <= 0) {
      throw new IllegalArgumentException("workers must be positive (was " + workers + ")");
    }
    if (chunkSize <= 0) {
      throw new IllegalArgumentException("chunkSize must be positive (was " + chunkSize + ")");
    }
    this.workers = workers;
    this.chunkSize = chunkSize;
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.poolFactory = Objects.requireNonNull(poolFactory, "poolFactory");
  }

  @Override
  public AwardsSummary summarize(List<Qso> qsos) {
    Objects.requireNonNull(qsos, "qsos");
    if (qsos.size() < chunkSize) {
      return AwardsAggregator.summarize(qsos);
    }
    List<List<Qso>> slices = new ArrayList<>();
    for (int from = 0; from < qsos.size(); from += chunkSize) {
      slices.add(List.copyOf(qsos.subList(from, Math.min(qsos.size(), from + chunkSize))));
    }
    try {
      return summarizeParallel(slices);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return fallback(qsos, ex);
    } catch (RejectedExecutionException | ExecutionException | OutOfMemoryError ex) {
      return fallback(qsos, ex);
    }
  }

  private AwardsSummary summarizeParallel(List<List<Qso>> slices)
      throws InterruptedException, ExecutionException {
    ExecutorService pool = poolFactory.apply(slices.size());
    try {
      CompletionService<AwardsSummary> completion = new ExecutorCompletionService<>(pool);
      for (List<Qso> slice : slices) {
        completion.submit(() -> AwardsAggregator.summarize(slice));
      }
      AwardsSummary merged = AwardsSummary.empty();
      for (int i = 0; i < slices.size(); i++) {
        merged = merged.merge(completion.take().get());
        metrics.increment("awards.chunks");
      }
      log.debug("Merged {} awards chunks of up to {} contacts on {} workers", slices.size(), chunkSize, workers);
      return merged;
    } finally {
      ExecutorFactories.shutdownQuietly(pool);
    }
  }

  private AwardsSummary fallback(List<Qso> qsos, Throwable cause) {
    log.warn("Parallel awards summary failed; aggregating {} contacts serially", qsos.size(), cause);
    metrics.increment("awards.fallback.serial");
    return AwardsAggregator.summarize(qsos);
  }
}
