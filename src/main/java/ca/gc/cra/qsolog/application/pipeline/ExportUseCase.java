package ca.gc.cra.qsolog.application.pipeline;

import ca.gc.cra.qsolog.application.port.MetricsPort;
import ca.gc.cra.qsolog.application.port.QsoStorePort;
import ca.gc.cra.qsolog.domain.adif.AdifEncoder;
import ca.gc.cra.qsolog.domain.qso.QsoFilter;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Streams stored contacts into an ADIF file.
 * <p><strong>Role:</strong> Application use case behind the {@code export} command.</p>
 * <p><strong>Performance:</strong> Contacts flow from the store iterator through the encoder to a buffered writer
 * one record at a time.</p>
 * <p><strong>Observability:</strong> Records {@code export.records}.</p>
 *
 * @since 0.1.0
 */
public final class ExportUseCase {
  private static final Logger log = LoggerFactory.getLogger(ExportUseCase.class);

  private final Path output;
  private final QsoStorePort store;
  private final QsoFilter filter;
  private final AdifEncoder encoder;
  private final MetricsPort metrics;

  public ExportUseCase(Path output, QsoStorePort store, QsoFilter filter, AdifEncoder encoder, MetricsPort metrics) {
    this.output = Objects.requireNonNull(output, "output");
    this.store = Objects.requireNonNull(store, "store");
    this.filter = Objects.requireNonNull(filter, "filter");
    this.encoder = Objects.requireNonNull(encoder, "encoder");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Writes the filtered contacts to the output file, replacing any existing content.
   *
   * @return number of records written
   * @throws IOException if the store cannot be read or the file cannot be written
   */
  public long run() throws IOException {
    long written;
    try (BufferedWriter writer = Files.newBufferedWriter(output, StandardCharsets.UTF_8)) {
      written = encoder.writeTo(store.iterate(filter), writer);
    }
    metrics.observe("export.records", written);
    log.info("Exported {} records to {}", written, output);
    return written;
  }
}
