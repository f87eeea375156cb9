package ca.gc.cra.qsolog.application.pipeline;

import ca.gc.cra.qsolog.application.port.ImportEngine;
import ca.gc.cra.qsolog.application.port.ImportEngine.ImportResult;
import ca.gc.cra.qsolog.application.port.MetricsPort;
import ca.gc.cra.qsolog.application.port.QsoStorePort;
import ca.gc.cra.qsolog.domain.adif.ChunkSplitter;
import ca.gc.cra.qsolog.domain.qso.Qso;
import ca.gc.cra.qsolog.logging.Logs;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Reads an ADIF file, decodes it with the configured engine, and stores accepted contacts.
 * <p><strong>Why:</strong> Keeps file IO, decoding, and persistence in one auditable run with a single summary.</p>
 * <p><strong>Role:</strong> Application use case behind the {@code import} command.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Decode the whole document through {@link ImportEngine}.</li>
 *   <li>Insert accepted contacts into the {@link QsoStorePort} in batches.</li>
 *   <li>Record {@code import.*} and {@code store.records.inserted} metrics.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; call {@link #run()} once per instance.</p>
 * <p><strong>Observability:</strong> Sets MDC {@code qsolog.in} to the input path for the duration of the run.</p>
 *
 * @since 0.1.0
 */
public final class ImportUseCase {
  private static final Logger log = LoggerFactory.getLogger(ImportUseCase.class);
  /** Contacts per {@link QsoStorePort#insertBatch(List)} call. */
  public static final int INSERT_BATCH_SIZE = 1000;

  private final Path input;
  private final ImportEngine engine;
  private final QsoStorePort store;
  private final MetricsPort metrics;

  /**
   * Creates an import use case.
   *
   * @param input ADIF file to read; must not be {@code null}
   * @param engine decoding engine; must not be {@code null}
   * @param store destination store; must not be {@code null}
   * @param metrics metrics sink; must not be {@code null}
   */
  public ImportUseCase(Path input, ImportEngine engine, QsoStorePort store, MetricsPort metrics) {
    this.input = Objects.requireNonNull(input, "input");
    this.engine = Objects.requireNonNull(engine, "engine");
    this.store = Objects.requireNonNull(store, "store");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Runs the import.
   *
   * @return counts describing what was decoded and stored
   * @throws IOException if the input cannot be read or the store rejects a write
   */
  public ImportSummary run() throws IOException {
    MDC.put("qsolog.in", input.toString());
    try {
      long started = System.nanoTime();
      String document = Files.readString(input, StandardCharsets.UTF_8);
      String header = ChunkSplitter.header(document);
      if (!header.isBlank()) {
        log.debug("ADIF header: {}", Logs.preview(header));
      }
      ImportResult result = engine.decode(document);
      int stored = insertAll(result.accepted());
      long elapsed = System.nanoTime() - started;

      metrics.observe("import.chunks", result.chunks());
      metrics.observe("import.records.accepted", result.accepted().size());
      metrics.observe("import.records.rejected", result.rejected());
      metrics.observe("import.latencyNanos", elapsed);
      metrics.observe("store.records.inserted", stored);

      log.info("Imported {} of {} records from {} ({} rejected)",
          stored, result.chunks(), input, result.rejected());
      return new ImportSummary(result.chunks(), result.accepted().size(), result.rejected(), stored);
    } catch (IOException ex) {
      log.error("Import from {} failed", input, ex);
      throw ex;
    } finally {
      MDC.remove("qsolog.in");
    }
  }

  private int insertAll(List<Qso> accepted) throws IOException {
    int stored = 0;
    for (int from = 0; from < accepted.size(); from += INSERT_BATCH_SIZE) {
      List<Qso> batch = accepted.subList(from, Math.min(accepted.size(), from + INSERT_BATCH_SIZE));
      stored += store.insertBatch(batch);
    }
    return stored;
  }

  /**
   * Outcome of one import run.
   *
   * @param chunks non-blank record spans in the document
   * @param accepted contacts that passed normalization
   * @param rejected record spans that were skipped
   * @param stored contacts written to the store
   */
  public record ImportSummary(long chunks, long accepted, long rejected, long stored) {}
}
