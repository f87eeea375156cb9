package ca.gc.cra.qsolog.config;

import ca.gc.cra.qsolog.infrastructure.engine.ExecutorImportEngine;
import ca.gc.cra.qsolog.infrastructure.engine.ExecutorSummaryEngine;
import java.util.Map;
import java.util.Objects;

/**
 * Engine selection and sizing shared by the import and awards commands.
 *
 * @param engine serial or parallel engines
 * @param workers worker threads for parallel engines; at least one
 * @param parallelThreshold record count below which the parallel import runs serially
 * @param summaryChunkSize contacts per parallel summary slice
 * @since 0.1.0
 */
public record EngineConfig(EngineMode engine, int workers, int parallelThreshold, int summaryChunkSize) {
  static final int MAX_WORKERS = 1024;

  public EngineConfig {
    engine = Objects.requireNonNullElse(engine, EngineMode.PARALLEL);
    if (workers < 1 || workers > MAX_WORKERS) {
      throw new IllegalArgumentException("workers must be in [1, " + MAX_WORKERS + "]");
    }
    if (parallelThreshold < 0) {
      throw new IllegalArgumentException("parallelThreshold must be >= 0");
    }
    if (summaryChunkSize < 1) {
      throw new IllegalArgumentException("summaryChunkSize must be >= 1");
    }
  }

  /**
   * Returns defaults: parallel engines sized to the available processors.
   *
   * @return default engine configuration
   */
  public static EngineConfig defaults() {
    return new EngineConfig(
        EngineMode.PARALLEL,
        Math.max(1, Math.min(MAX_WORKERS, Runtime.getRuntime().availableProcessors())),
        ExecutorImportEngine.DEFAULT_PARALLEL_THRESHOLD,
        ExecutorSummaryEngine.DEFAULT_CHUNK_SIZE);
  }

  /**
   * Builds an engine configuration from flattened key/value options.
   *
   * @param options keys {@code engine}, {@code workers}, {@code parallelThreshold}, {@code summaryChunkSize}
   * @return parsed configuration
   * @throws IllegalArgumentException if a value is malformed or out of range
   */
  public static EngineConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    EngineConfig defaults = defaults();
    String rawEngine = options.get("engine");
    EngineMode engine = rawEngine == null || rawEngine.isBlank()
        ? defaults.engine()
        : EngineMode.fromString(rawEngine);
    return new EngineConfig(
        engine,
        ConfigValues.parseInt(options, "workers", defaults.workers(), 1, MAX_WORKERS),
        ConfigValues.parseInt(options, "parallelThreshold", defaults.parallelThreshold(), 0, Integer.MAX_VALUE),
        ConfigValues.parseInt(options, "summaryChunkSize", defaults.summaryChunkSize(), 1, Integer.MAX_VALUE));
  }

  public boolean parallel() {
    return engine == EngineMode.PARALLEL;
  }
}
