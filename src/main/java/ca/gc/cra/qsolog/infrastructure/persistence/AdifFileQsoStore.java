package ca.gc.cra.qsolog.infrastructure.persistence;

import ca.gc.cra.qsolog.application.port.QsoStorePort;
import ca.gc.cra.qsolog.domain.adif.AdifEncoder;
import ca.gc.cra.qsolog.domain.adif.ChunkSplitter;
import ca.gc.cra.qsolog.domain.adif.RecordNormalizer;
import ca.gc.cra.qsolog.domain.qso.Qso;
import ca.gc.cra.qsolog.domain.qso.QsoFilter;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link QsoStorePort} backed by a single ADIF log file.
 * <p><strong>Why:</strong> An ADIF file is the interchange format operators already keep, so the store needs no
 * database and its contents can be opened by any logging program.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Append encoded records, writing the header once when the file is new or empty.</li>
 *   <li>Decode the file on {@link #iterate(QsoFilter)}, yielding contacts one at a time.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Writes are synchronized; iteration reads the file content present at call time.</p>
 * <p><strong>Observability:</strong> Logs appends at DEBUG; unreadable records are skipped as on import.</p>
 *
 * @since 0.1.0
 */
public final class AdifFileQsoStore implements QsoStorePort {
  private static final Logger log = LoggerFactory.getLogger(AdifFileQsoStore.class);

  private final Path file;
  private final AdifEncoder encoder;
  private volatile boolean closed;

  /**
   * Creates a store over {@code file}; the file is created on the first insert.
   *
   * @param file ADIF log path; must not be {@code null}
   * @param encoder encoder used for appended records; must not be {@code null}
   */
  public AdifFileQsoStore(Path file, AdifEncoder encoder) {
    this.file = Objects.requireNonNull(file, "file");
    this.encoder = Objects.requireNonNull(encoder, "encoder");
  }

  @Override
  public synchronized int insertBatch(List<Qso> records) throws IOException {
    Objects.requireNonNull(records, "records");
    ensureOpen();
    if (records.isEmpty()) {
      return 0;
    }
    boolean fresh = !Files.exists(file) || Files.size(file) == 0;
    try (BufferedWriter writer = Files.newBufferedWriter(
        file, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
      if (fresh) {
        writer.write(encoder.header());
      }
      encoder.writeRecords(records, writer);
    }
    log.debug("Appended {} records to {}", records.size(), file);
    return records.size();
  }

  @Override
  public Iterable<Qso> iterate(QsoFilter filter) throws IOException {
    Objects.requireNonNull(filter, "filter");
    ensureOpen();
    if (!Files.exists(file)) {
      return List.of();
    }
    String document = Files.readString(file, StandardCharsets.UTF_8);
    Iterable<String> chunks = ChunkSplitter.chunks(document);
    return filter.select(() -> new DecodingIterator(chunks.iterator()));
  }

  @Override
  public void close() {
    closed = true;
  }

  private void ensureOpen() {
    if (closed) {
      throw new IllegalStateException("store is closed: " + file);
    }
  }

  private static final class DecodingIterator implements Iterator<Qso> {
    private final Iterator<String> chunks;
    private Qso next;

    private DecodingIterator(Iterator<String> chunks) {
      this.chunks = chunks;
    }

    @Override
    public boolean hasNext() {
      while (next == null && chunks.hasNext()) {
        Optional<Qso> decoded = RecordNormalizer.decode(chunks.next());
        next = decoded.orElse(null);
      }
      return next != null;
    }

    @Override
    public Qso next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      Qso out = next;
      next = null;
      return out;
    }
  }
}
