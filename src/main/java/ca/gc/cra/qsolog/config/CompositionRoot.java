package ca.gc.cra.qsolog.config;

import ca.gc.cra.qsolog.application.pipeline.AwardsUseCase;
import ca.gc.cra.qsolog.application.pipeline.ExportUseCase;
import ca.gc.cra.qsolog.application.pipeline.ImportUseCase;
import ca.gc.cra.qsolog.application.port.ImportEngine;
import ca.gc.cra.qsolog.application.port.MetricsPort;
import ca.gc.cra.qsolog.application.port.QsoStorePort;
import ca.gc.cra.qsolog.application.port.SummaryEngine;
import ca.gc.cra.qsolog.domain.adif.AdifEncoder;
import ca.gc.cra.qsolog.infrastructure.engine.ExecutorImportEngine;
import ca.gc.cra.qsolog.infrastructure.engine.ExecutorSummaryEngine;
import ca.gc.cra.qsolog.infrastructure.engine.SerialImportEngine;
import ca.gc.cra.qsolog.infrastructure.engine.SerialSummaryEngine;
import ca.gc.cra.qsolog.infrastructure.persistence.AdifFileQsoStore;
import ca.gc.cra.qsolog.infrastructure.persistence.InMemoryQsoStore;
import java.nio.file.Path;
import java.util.Objects;

/**
 * <strong>What:</strong> Wires use cases to engines, stores, and the metrics adapter.
 * <p><strong>Why:</strong> Keeps the engine choice a construction-time decision instead of a global flag.</p>
 * <p><strong>Role:</strong> Composition root for the {@code import}, {@code export}, and {@code awards} commands.</p>
 * <p><strong>Thread-safety:</strong> Holds immutable references; factory methods allocate new instances.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot {
  private final EngineConfig engineConfig;
  private final MetricsPort metrics;

  /**
   * Creates a composition root.
   *
   * @param engineConfig engine choice and sizing; must not be {@code null}
   * @param metrics metrics adapter shared by every constructed component; must not be {@code null}
   */
  public CompositionRoot(EngineConfig engineConfig, MetricsPort metrics) {
    this.engineConfig = Objects.requireNonNull(engineConfig, "engineConfig");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Builds the import engine selected by {@link EngineConfig#engine()}.
   *
   * @return serial or executor-backed engine
   */
  public ImportEngine importEngine() {
    if (!engineConfig.parallel()) {
      return new SerialImportEngine();
    }
    return new ExecutorImportEngine(engineConfig.workers(), engineConfig.parallelThreshold(), metrics);
  }

  /**
   * Builds the summary engine selected by {@link EngineConfig#engine()}.
   *
   * @return serial or executor-backed engine
   */
  public SummaryEngine summaryEngine() {
    if (!engineConfig.parallel()) {
      return new SerialSummaryEngine();
    }
    return new ExecutorSummaryEngine(engineConfig.workers(), engineConfig.summaryChunkSize(), metrics);
  }

  public QsoStorePort fileStore(Path file) {
    return new AdifFileQsoStore(file, new AdifEncoder());
  }

  /**
   * Builds the import use case; dry runs write to a throwaway in-memory store.
   *
   * @param config import settings
   * @return runnable use case
   */
  public ImportUseCase importUseCase(ImportConfig config) {
    Objects.requireNonNull(config, "config");
    QsoStorePort store = config.dryRun() ? new InMemoryQsoStore() : fileStore(config.store());
    return new ImportUseCase(config.input(), importEngine(), store, metrics);
  }

  public ExportUseCase exportUseCase(ExportConfig config) {
    Objects.requireNonNull(config, "config");
    return new ExportUseCase(
        config.output(), fileStore(config.store()), config.filter(), new AdifEncoder(config.programId()), metrics);
  }

  /**
   * Builds the awards use case over the input file when given, otherwise over the store.
   *
   * @param config awards settings
   * @return runnable use case
   */
  public AwardsUseCase awardsUseCase(AwardsConfig config) {
    Objects.requireNonNull(config, "config");
    return new AwardsUseCase(fileStore(config.source()), config.filter(), summaryEngine(), config.thresholds());
  }
}
