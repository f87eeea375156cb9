package ca.gc.cra.qsolog.domain.adif;

import ca.gc.cra.qsolog.domain.qso.Qso;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.time.format.DateTimeFormatter;
import java.util.Iterator;
import java.util.Locale;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * <strong>What:</strong> Serializes contacts into ADIF text, one fragment at a time.
 * <p><strong>Why:</strong> Exports must stream from the store to the sink without holding the document in memory.</p>
 * <p><strong>Role:</strong> Domain codec used by the export use case and by {@code AdifFileQsoStore} appends.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Emit the fixed header once, then one fragment per contact ending in {@code <EOR>}.</li>
 *   <li>Declare every value length in UTF-8 bytes so {@link TagScanner} reads back the same value.</li>
 *   <li>Omit absent fields; never emit an empty tag.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; each iterator is single-threaded.</p>
 * <p><strong>Performance:</strong> One contact is rendered per {@code next()} call.</p>
 *
 * @since 0.1.0
 */
public final class AdifEncoder {
  /** Program identifier written when none is configured. */
  public static final String DEFAULT_PROGRAM_ID = "QSOLOG";
  /** ADIF version declared in the header. */
  public static final String ADIF_VERSION = "3.1";

  private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("uuuuMMdd", Locale.ROOT);
  private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HHmmss", Locale.ROOT);

  private final String programId;

  /** Creates an encoder that identifies itself as {@value #DEFAULT_PROGRAM_ID}. */
  public AdifEncoder() {
    this(DEFAULT_PROGRAM_ID);
  }

  /**
   * Creates an encoder with a custom program identifier.
   *
   * @param programId value of the {@code PROGRAMID} header tag; must not be blank
   */
  public AdifEncoder(String programId) {
    Objects.requireNonNull(programId, "programId");
    if (programId.isBlank()) {
      throw new IllegalArgumentException("programId must not be blank");
    }
    this.programId = programId;
  }

  /**
   * Returns a lazy sequence of fragments: the header followed by one fragment per contact.
   *
   * @param qsos contacts to encode; iterated once per {@code iterator()} call
   * @return fragments whose concatenation is a complete ADIF document
   */
  public Iterable<String> encode(Iterable<Qso> qsos) {
    Objects.requireNonNull(qsos, "qsos");
    return () -> new FragmentIterator(header(), qsos.iterator());
  }

  /**
   * Writes the document to {@code sink} fragment by fragment.
   *
   * @param qsos contacts to encode
   * @param sink destination; flushed but not closed
   * @return number of records written
   * @throws IOException if the sink fails
   */
  public long writeTo(Iterable<Qso> qsos, Writer sink) throws IOException {
    Objects.requireNonNull(sink, "sink");
    sink.write(header());
    long count = writeRecords(qsos, sink);
    sink.flush();
    return count;
  }

  /**
   * Writes record fragments only, without the header. Used when appending to an existing log.
   *
   * @param qsos contacts to encode
   * @param sink destination; not flushed or closed
   * @return number of records written
   * @throws IOException if the sink fails
   */
  public long writeRecords(Iterable<Qso> qsos, Writer sink) throws IOException {
    Objects.requireNonNull(qsos, "qsos");
    Objects.requireNonNull(sink, "sink");
    long count = 0;
    for (Qso qso : qsos) {
      sink.write(record(qso));
      count++;
    }
    return count;
  }

  /**
   * Renders the document header.
   *
   * @return header text ending with {@code <EOH>} and a newline
   */
  public String header() {
    StringBuilder sb = new StringBuilder(64);
    appendTag(sb, "ADIF_VER", ADIF_VERSION);
    sb.append('\n');
    appendTag(sb, "PROGRAMID", programId);
    sb.append('\n').append(ChunkSplitter.EOH).append('\n');
    return sb.toString();
  }

  /**
   * Renders one contact as a record fragment.
   *
   * @param qso contact to render
   * @return fragment ending with {@code <EOR>} and a newline
   */
  public String record(Qso qso) {
    Objects.requireNonNull(qso, "qso");
    StringBuilder sb = new StringBuilder(160);
    for (AdifField field : AdifField.values()) {
      appendTag(sb, field.name(), render(field, qso));
    }
    return sb.append(ChunkSplitter.EOR).append('\n').toString();
  }

  private static String render(AdifField field, Qso qso) {
    switch (field) {
      case QSO_DATE:
        return DATE.format(qso.startAt());
      case TIME_ON:
        return TIME.format(qso.startAt());
      case FREQ:
        return qso.freqMhz() == null ? null : formatFrequency(qso.freqMhz());
      default:
        return field.text(qso);
    }
  }

  /**
   * Formats a frequency with six decimals, then strips trailing zeros and a dangling decimal point.
   *
   * @param mhz frequency in MHz
   * @return compact decimal text, e.g. {@code 14.25} for {@code 14.250000}
   */
  static String formatFrequency(double mhz) {
    String text = String.format(Locale.ROOT, "%.6f", mhz);
    int end = text.length();
    while (end > 0 && text.charAt(end - 1) == '0') {
      end--;
    }
    if (end > 0 && text.charAt(end - 1) == '.') {
      end--;
    }
    return text.substring(0, end);
  }

  private static void appendTag(StringBuilder sb, String name, String value) {
    if (value == null || value.isEmpty()) {
      return;
    }
    sb.append('<').append(name).append(':')
        .append(value.getBytes(StandardCharsets.UTF_8).length)
        .append('>').append(value);
  }

  private final class FragmentIterator implements Iterator<String> {
    private final Iterator<Qso> source;
    private String header;

    private FragmentIterator(String header, Iterator<Qso> source) {
      this.header = header;
      this.source = source;
    }

    @Override
    public boolean hasNext() {
      return header != null || source.hasNext();
    }

    @Override
    public String next() {
      if (header != null) {
        String out = header;
        header = null;
        return out;
      }
      if (!source.hasNext()) {
        throw new NoSuchElementException();
      }
      return record(source.next());
    }
  }
}
