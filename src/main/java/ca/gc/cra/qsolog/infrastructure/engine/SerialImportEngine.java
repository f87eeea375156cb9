package ca.gc.cra.qsolog.infrastructure.engine;

import ca.gc.cra.qsolog.application.port.ImportEngine;
import ca.gc.cra.qsolog.domain.adif.ChunkSplitter;
import ca.gc.cra.qsolog.domain.adif.RecordNormalizer;
import ca.gc.cra.qsolog.domain.qso.Qso;
import ca.gc.cra.qsolog.logging.Logs;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Decodes a document on the calling thread, one record span at a time.
 * <p><strong>Role:</strong> Reference {@link ImportEngine}; also the fallback path of {@link ExecutorImportEngine}.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 * <p><strong>Observability:</strong> Logs each rejected record at DEBUG with a truncated preview.</p>
 *
 * @since 0.1.0
 */
public final class SerialImportEngine implements ImportEngine {
  private static final Logger log = LoggerFactory.getLogger(SerialImportEngine.class);

  @Override
  public ImportResult decode(String document) {
    Objects.requireNonNull(document, "document");
    return decodeChunks(ChunkSplitter.chunks(document));
  }

  ImportResult decodeChunks(Iterable<String> chunks) {
    List<Qso> accepted = new ArrayList<>();
    long rejected = 0;
    long seen = 0;
    for (String chunk : chunks) {
      seen++;
      Optional<Qso> qso = decodeChunk(chunk);
      if (qso.isPresent()) {
        accepted.add(qso.get());
      } else {
        rejected++;
      }
    }
    return new ImportResult(accepted, rejected, seen);
  }

  static Optional<Qso> decodeChunk(String chunk) {
    Optional<Qso> qso = RecordNormalizer.decode(chunk);
    if (qso.isEmpty() && log.isDebugEnabled()) {
      log.debug("Rejected record {}", Logs.preview(chunk));
    }
    return qso;
  }
}
