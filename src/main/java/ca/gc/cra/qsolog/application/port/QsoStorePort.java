package ca.gc.cra.qsolog.application.port;

import ca.gc.cra.qsolog.domain.qso.Qso;
import ca.gc.cra.qsolog.domain.qso.QsoFilter;
import java.io.IOException;
import java.util.List;

/**
 * <strong>What:</strong> Port for persisting contacts and reading them back.
 * <p><strong>Why:</strong> Keeps import, export, and awards use cases free of any storage handle.</p>
 * <p><strong>Role:</strong> Output port implemented by {@code InMemoryQsoStore} and {@code AdifFileQsoStore}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Store batches of contacts, reporting how many were stored.</li>
 *   <li>Yield stored contacts lazily, applying a {@link QsoFilter}.</li>
 *   <li>Release underlying resources on {@link #close()}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations document their guarantees; use cases call from one thread.</p>
 * <p><strong>Observability:</strong> Implementations log store operations; callers emit {@code store.*} metrics.</p>
 *
 * @since 0.1.0
 */
public interface QsoStorePort extends AutoCloseable {
  /**
   * Stores a batch of contacts.
   *
   * @param records contacts to store; must not be {@code null}
   * @return number of contacts stored
   * @throws IOException if the underlying store cannot be written
   */
  int insertBatch(List<Qso> records) throws IOException;

  /**
   * Returns a lazy sequence of stored contacts matching {@code filter}.
   *
   * @param filter selection criteria; must not be {@code null}
   * @return contacts in storage order, capped by the filter's limit
   * @throws IOException if the underlying store cannot be read
   */
  Iterable<Qso> iterate(QsoFilter filter) throws IOException;

  /**
   * Closes the store.
   *
   * @throws IOException if pending writes cannot complete
   */
  @Override
  default void close() throws IOException {}
}
