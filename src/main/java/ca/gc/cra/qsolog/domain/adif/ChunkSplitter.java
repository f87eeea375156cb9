package ca.gc.cra.qsolog.domain.adif;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * <strong>What:</strong> Divides an ADIF document into per-record text spans on the {@code <EOR>} marker.
 * <p><strong>Why:</strong> Record spans are the independent work units fanned out by import engines.</p>
 * <p><strong>Role:</strong> Domain helper between raw document text and {@link TagScanner}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Drop the header region that ends at the first {@code <EOH>} marker when it precedes every
 *       {@code <EOR>}.</li>
 *   <li>Split on the case-sensitive literal {@code <EOR>}; it is a standalone marker, not a tag.</li>
 *   <li>Discard blank spans so they never count as rejected records.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Each {@link Iterable} is immutable; iterators are single-threaded.</p>
 * <p><strong>Performance:</strong> Lazy; spans are cut one at a time as the iterator advances.</p>
 *
 * @since 0.1.0
 */
public final class ChunkSplitter {
  /** Marker terminating each record. */
  public static final String EOR = "<EOR>";
  /** Marker terminating the document header. */
  public static final String EOH = "<EOH>";

  private ChunkSplitter() {}

  /**
   * Returns a restartable sequence of non-blank record spans.
   *
   * <p>Spans are not trimmed: a value ending in whitespace right before {@code <EOR>} must keep its
   * declared length.</p>
   *
   * @param document full ADIF document; must not be {@code null}
   * @return iterable whose every {@code iterator()} call restarts from the first record
   * @throws NullPointerException if {@code document} is {@code null}
   */
  public static Iterable<String> chunks(String document) {
    Objects.requireNonNull(document, "document");
    int bodyStart = bodyStart(document);
    return () -> new ChunkIterator(document, bodyStart);
  }

  /**
   * Returns the header region preceding the first {@code <EOH>} marker.
   *
   * @param document full ADIF document; must not be {@code null}
   * @return header text without the marker, or an empty string when the document has no header or its first
   *     {@code <EOH>} follows an {@code <EOR>}
   */
  public static String header(String document) {
    Objects.requireNonNull(document, "document");
    int eoh = headerEnd(document);
    return eoh < 0 ? "" : document.substring(0, eoh);
  }

  private static int bodyStart(String document) {
    int eoh = headerEnd(document);
    return eoh < 0 ? 0 : eoh + EOH.length();
  }

  // An <EOH> after the first <EOR> is record data, not a header marker.
  private static int headerEnd(String document) {
    int eoh = document.indexOf(EOH);
    if (eoh < 0) {
      return -1;
    }
    int eor = document.indexOf(EOR);
    return eor >= 0 && eor < eoh ? -1 : eoh;
  }

  private static final class ChunkIterator implements Iterator<String> {
    private final String document;
    private int cursor;
    private String next;

    private ChunkIterator(String document, int start) {
      this.document = document;
      this.cursor = start;
    }

    @Override
    public boolean hasNext() {
      while (next == null && cursor <= document.length()) {
        int eor = document.indexOf(EOR, cursor);
        int spanEnd = eor < 0 ? document.length() : eor;
        String span = document.substring(cursor, spanEnd);
        cursor = eor < 0 ? document.length() + 1 : eor + EOR.length();
        if (!span.isBlank()) {
          next = span;
        }
      }
      return next != null;
    }

    @Override
    public String next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      String span = next;
      next = null;
      return span;
    }
  }
}
