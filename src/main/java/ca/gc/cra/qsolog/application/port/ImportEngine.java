package ca.gc.cra.qsolog.application.port;

import ca.gc.cra.qsolog.domain.qso.Qso;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Decodes a whole ADIF document into accepted contacts.
 * <p><strong>Why:</strong> Serial and parallel decoding sit behind one contract so both pass the same
 * conformance tests and the choice is a configuration value.</p>
 * <p><strong>Role:</strong> Port implemented by {@code SerialImportEngine} and {@code ExecutorImportEngine}.</p>
 * <p><strong>Thread-safety:</strong> Implementations are safe to call from one thread at a time per instance.</p>
 *
 * @since 0.1.0
 */
public interface ImportEngine {
  /**
   * Decodes every record of {@code document}.
   *
   * <p>The accepted contacts equal, as a multiset, what serial decoding of the same document produces;
   * their order is unspecified.</p>
   *
   * @param document full ADIF document; must not be {@code null}
   * @return accepted contacts with rejection and chunk counts
   * @throws NullPointerException if {@code document} is {@code null}
   */
  ImportResult decode(String document);

  /**
   * Outcome of decoding one document.
   *
   * @param accepted contacts that passed normalization, in unspecified order
   * @param rejected non-blank record spans that failed normalization
   * @param chunks non-blank record spans examined
   */
  record ImportResult(List<Qso> accepted, long rejected, long chunks) {
    /**
     * Copies the accepted list and validates counts.
     *
     * @throws IllegalArgumentException if counts are negative or inconsistent
     */
    public ImportResult {
      accepted = List.copyOf(Objects.requireNonNull(accepted, "accepted"));
      if (rejected < 0 || chunks < 0) {
        throw new IllegalArgumentException("counts must be >= 0");
      }
      if (accepted.size() + rejected != chunks) {
        throw new IllegalArgumentException(
            "accepted + rejected must equal chunks (" + accepted.size() + " + " + rejected + " != " + chunks + ")");
      }
    }
  }
}
