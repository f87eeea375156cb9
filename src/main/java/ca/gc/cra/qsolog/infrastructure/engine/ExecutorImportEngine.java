package ca.gc.cra.qsolog.infrastructure.engine;

import ca.gc.cra.qsolog.application.port.ImportEngine;
import ca.gc.cra.qsolog.application.port.MetricsPort;
import ca.gc.cra.qsolog.domain.adif.ChunkSplitter;
import ca.gc.cra.qsolog.domain.qso.Qso;
import ca.gc.cra.qsolog.infrastructure.exec.ExecutorFactories;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.IntFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Decodes record spans on a fixed worker pool and collects them in completion order.
 * <p><strong>Why:</strong> Large logs decode faster in parallel; each span is a pure function of its text, so the
 * accepted multiset does not depend on worker count or scheduling.</p>
 * <p><strong>Role:</strong> Parallel {@link ImportEngine} selected by {@code engine=PARALLEL}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Decode serially below {@code parallelThreshold} spans.</li>
 *   <li>Submit one task per span and fan in through an {@link ExecutorCompletionService}.</li>
 *   <li>Fall back to {@link SerialImportEngine} when dispatch or a task fails, counting
 *   {@code import.fallback.serial}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> A pool is created per {@link #decode(String)} call and shut down before it
 * returns; concurrent calls do not share workers.</p>
 *
 * @since 0.1.0
 */
public final class ExecutorImportEngine implements ImportEngine {
  private static final Logger log = LoggerFactory.getLogger(ExecutorImportEngine.class);
  /** Span count below which decoding stays on the calling thread. */
  public static final int DEFAULT_PARALLEL_THRESHOLD = 100;
  static final String THREAD_PREFIX = "qsolog-import";

  private final int workers;
  private final int parallelThreshold;
  private final MetricsPort metrics;
  private final IntFunction<ExecutorService> poolFactory;
  private final SerialImportEngine serial = new SerialImportEngine();

  /**
   * Creates a parallel engine.
   *
   * @param workers worker threads per decode; must be positive
   * @param parallelThreshold minimum span count for parallel dispatch; must be non-negative
   * @param metrics metrics sink for fallback counts; must not be {@code null}
   */
  public ExecutorImportEngine(int workers, int parallelThreshold, MetricsPort metrics) {
    this(workers, parallelThreshold, metrics, queueCapacity -> ExecutorFactories.newWorkerPool(
        workers,
        queueCapacity,
        THREAD_PREFIX,
        (thread, ex) -> log.error("Uncaught failure on {}", thread.getName(), ex)));
  }

  ExecutorImportEngine(
      int workers, int parallelThreshold, MetricsPort metrics, IntFunction<ExecutorService> poolFactory) {
    if (workers <= 0) {
      throw new IllegalArgumentException("workers must be positive (was " + workers + ")");
    }
    if (parallelThreshold < 0) {
      throw new IllegalArgumentException("parallelThreshold must be >= 0 (was " + parallelThreshold + ")");
    }
    this.workers = workers;
    this.parallelThreshold = parallelThreshold;
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.poolFactory = Objects.requireNonNull(poolFactory, "poolFactory");
  }

  @Override
  public ImportResult decode(String document) {
    Objects.requireNonNull(document, "document");
    List<String> chunks = new ArrayList<>();
    ChunkSplitter.chunks(document).forEach(chunks::add);
    if (chunks.size() < parallelThreshold) {
      log.debug("Decoding {} records serially (threshold {})", chunks.size(), parallelThreshold);
      return serial.decodeChunks(chunks);
    }
    try {
      return decodeParallel(chunks);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return fallback(chunks, ex);
    } catch (RejectedExecutionException | ExecutionException | OutOfMemoryError ex) {
      return fallback(chunks, ex);
    }
  }

  private ImportResult decodeParallel(List<String> chunks) throws InterruptedException, ExecutionException {
    ExecutorService pool = poolFactory.apply(Math.max(1, chunks.size()));
    try {
      CompletionService<Optional<Qso>> completion = new ExecutorCompletionService<>(pool);
      for (String chunk : chunks) {
        completion.submit(() -> SerialImportEngine.decodeChunk(chunk));
      }
      List<Qso> accepted = new ArrayList<>(chunks.size());
      long rejected = 0;
      for (int i = 0; i < chunks.size(); i++) {
        Optional<Qso> qso = completion.take().get();
        if (qso.isPresent()) {
          accepted.add(qso.get());
        } else {
          rejected++;
        }
      }
      log.debug("Decoded {} records on {} workers", chunks.size(), workers);
      return new ImportResult(accepted, rejected, chunks.size());
    } finally {
      ExecutorFactories.shutdownQuietly(pool);
    }
  }

  private ImportResult fallback(List<String> chunks, Throwable cause) {
    log.warn("Parallel import failed; decoding {} records serially", chunks.size(), cause);
    metrics.increment("import.fallback.serial");
    return serial.decodeChunks(chunks);
  }

  public int workers() {
    return workers;
  }
}
