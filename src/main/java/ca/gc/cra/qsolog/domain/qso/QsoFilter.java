package ca.gc.cra.qsolog.domain.qso;

import java.util.Iterator;
import java.util.Locale;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Selection criteria applied when iterating stored contacts.
 * <p><strong>Why:</strong> Lets awards and export runs focus on one band, mode, or station without loading
 * the full log into the caller.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param band band to match after normalization; empty matches every band
 * @param mode mode to match after normalization; empty matches every mode
 * @param callContains case-insensitive callsign substring; empty matches every call
 * @param limit maximum number of contacts to yield; {@code 0} means unlimited
 * @since 0.1.0
 */
public record QsoFilter(
    Optional<String> band,
    Optional<String> mode,
    Optional<String> callContains,
    int limit) {

  private static final QsoFilter ALL = new QsoFilter(Optional.empty(), Optional.empty(), Optional.empty(), 0);

  /**
   * Normalizes criteria so matching never re-normalizes per record.
   *
   * @throws IllegalArgumentException if {@code limit} is negative
   */
  public QsoFilter {
    band = band == null ? Optional.empty() : band.flatMap(QsoValues::norm);
    mode = mode == null ? Optional.empty() : mode.flatMap(QsoValues::norm);
    callContains = callContains == null
        ? Optional.empty()
        : callContains.flatMap(QsoValues::norm);
    if (limit < 0) {
      throw new IllegalArgumentException("limit must be >= 0 (was " + limit + ")");
    }
  }

  /**
   * Returns a filter that accepts every contact.
   *
   * @return unrestricted filter
   */
  public static QsoFilter all() {
    return ALL;
  }

  /**
   * Builds a filter from nullable criteria, as read from configuration.
   *
   * @param band band or {@code null}
   * @param mode mode or {@code null}
   * @param callContains callsign substring or {@code null}
   * @param limit maximum contacts, {@code 0} for unlimited
   * @return filter with blank criteria treated as absent
   */
  public static QsoFilter of(String band, String mode, String callContains, int limit) {
    return new QsoFilter(
        Optional.ofNullable(band), Optional.ofNullable(mode), Optional.ofNullable(callContains), limit);
  }

  /**
   * Tests a contact against band, mode, and call criteria; the limit is enforced by the iterating store.
   *
   * @param qso contact to test; must not be {@code null}
   * @return {@code true} when the contact satisfies every present criterion
   */
  public boolean matches(Qso qso) {
    if (band.isPresent() && !band.equals(QsoValues.norm(qso.band()))) {
      return false;
    }
    if (mode.isPresent() && !mode.equals(QsoValues.norm(qso.mode()))) {
      return false;
    }
    return callContains.isEmpty()
        || qso.call().toUpperCase(Locale.ROOT).contains(callContains.get());
  }

  /**
   * Indicates whether a limit caps the number of yielded contacts.
   *
   * @return {@code true} when {@link #limit()} is positive
   */
  public boolean limited() {
    return limit > 0;
  }

  /**
   * Lazily applies this filter, including the limit, to a contact sequence.
   *
   * @param source contacts to filter; each {@code iterator()} call restarts the source
   * @return restartable view yielding matching contacts only
   */
  public Iterable<Qso> select(Iterable<Qso> source) {
    Objects.requireNonNull(source, "source");
    return () -> new SelectingIterator(source.iterator());
  }

  private final class SelectingIterator implements Iterator<Qso> {
    private final Iterator<Qso> source;
    private Qso next;
    private int yielded;

    private SelectingIterator(Iterator<Qso> source) {
      this.source = source;
    }

    @Override
    public boolean hasNext() {
      if (limited() && yielded >= limit) {
        return false;
      }
      while (next == null && source.hasNext()) {
        Qso candidate = source.next();
        if (matches(candidate)) {
          next = candidate;
        }
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
      yielded++;
      return out;
    }
  }
}
