package ca.gc.cra.qsolog.infrastructure.persistence;

import ca.gc.cra.qsolog.application.port.QsoStorePort;
import ca.gc.cra.qsolog.domain.qso.Qso;
import ca.gc.cra.qsolog.domain.qso.QsoFilter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@link QsoStorePort} held in memory; used for dry runs and tests.
 * <p>Thread-safe; {@link #iterate(QsoFilter)} reads a snapshot taken at call time.</p>
 *
 * @since 0.1.0
 */
public final class InMemoryQsoStore implements QsoStorePort {
  private final List<Qso> records = new ArrayList<>();

  @Override
  public synchronized int insertBatch(List<Qso> batch) {
    Objects.requireNonNull(batch, "records");
    for (Qso qso : batch) {
      records.add(Objects.requireNonNull(qso, "record"));
    }
    return batch.size();
  }

  @Override
  public Iterable<Qso> iterate(QsoFilter filter) {
    Objects.requireNonNull(filter, "filter");
    return filter.select(snapshot());
  }

  /**
   * Returns every stored contact in insertion order.
   *
   * @return immutable copy of the stored contacts
   */
  public synchronized List<Qso> snapshot() {
    return List.copyOf(records);
  }

  public synchronized int size() {
    return records.size();
  }
}
