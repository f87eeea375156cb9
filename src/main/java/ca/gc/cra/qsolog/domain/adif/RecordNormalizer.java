package ca.gc.cra.qsolog.domain.adif;

import ca.gc.cra.qsolog.domain.qso.Qso;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Maps the raw field map of one record to a {@link Qso}, or rejects it.
 * <p><strong>Why:</strong> Keeps partially decoded data from ever existing as a contact with a missing
 * required field.</p>
 * <p><strong>Role:</strong> Second stage of the decode path, composed with {@link TagScanner} per chunk.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Require {@code CALL}, {@code QSO_DATE} ({@code YYYYMMDD}) and {@code TIME_ON} ({@code HHMM[SS]}).</li>
 *   <li>Treat an unparsable {@code FREQ} as absent instead of rejecting the record.</li>
 *   <li>Ignore tags outside the supported subset.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 * <p><strong>Observability:</strong> Rejection is a normal outcome reported as {@link Optional#empty()};
 * callers count it.</p>
 *
 * @since 0.1.0
 */
public final class RecordNormalizer {
  private RecordNormalizer() {}

  /**
   * Decodes a single record span with {@link TagScanner} and normalizes it.
   *
   * @param recordText text of one record; must not be {@code null}
   * @return normalized contact, or empty when the record is rejected
   */
  public static Optional<Qso> decode(String recordText) {
    return normalize(TagScanner.fields(recordText));
  }

  /**
   * Builds a contact from a raw field map.
   *
   * @param fields uppercase tag name to raw value; must not be {@code null}
   * @return normalized contact, or empty when a required field is missing or invalid
   */
  public static Optional<Qso> normalize(Map<String, String> fields) {
    Objects.requireNonNull(fields, "fields");
    String call = fields.get(AdifField.CALL.name());
    if (call == null || call.isBlank()) {
      return Optional.empty();
    }
    Optional<LocalDate> date = parseDate(fields.get(AdifField.QSO_DATE.name()));
    Optional<LocalTime> time = parseTime(fields.get(AdifField.TIME_ON.name()));
    if (date.isEmpty() || time.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(Qso.builder(call, LocalDateTime.of(date.get(), time.get()))
        .band(fields.get(AdifField.BAND.name()))
        .mode(fields.get(AdifField.MODE.name()))
        .freqMhz(parseFrequency(fields.get(AdifField.FREQ.name())))
        .rstSent(fields.get(AdifField.RST_SENT.name()))
        .rstRcvd(fields.get(AdifField.RST_RCVD.name()))
        .name(fields.get(AdifField.NAME.name()))
        .qth(fields.get(AdifField.QTH.name()))
        .grid(fields.get(AdifField.GRIDSQUARE.name()))
        .country(fields.get(AdifField.COUNTRY.name()))
        .comment(fields.get(AdifField.COMMENT.name()))
        .build());
  }

  static Optional<LocalDate> parseDate(String raw) {
    if (raw == null || raw.length() != 8 || !allDigits(raw)) {
      return Optional.empty();
    }
    try {
      return Optional.of(LocalDate.of(
          Integer.parseInt(raw, 0, 4, 10),
          Integer.parseInt(raw, 4, 6, 10),
          Integer.parseInt(raw, 6, 8, 10)));
    } catch (DateTimeException ex) {
      return Optional.empty();
    }
  }

  static Optional<LocalTime> parseTime(String raw) {
    if (raw == null || (raw.length() != 4 && raw.length() != 6) || !allDigits(raw)) {
      return Optional.empty();
    }
    int seconds = raw.length() == 6 ? Integer.parseInt(raw, 4, 6, 10) : 0;
    try {
      return Optional.of(LocalTime.of(
          Integer.parseInt(raw, 0, 2, 10),
          Integer.parseInt(raw, 2, 4, 10),
          seconds));
    } catch (DateTimeException ex) {
      return Optional.empty();
    }
  }

  static Double parseFrequency(String raw) {
    if (raw == null || raw.isBlank()) {
      return null;
    }
    try {
      double value = Double.parseDouble(raw.strip());
      return Double.isFinite(value) ? value : null;
    } catch (NumberFormatException ex) {
      return null;
    }
  }

  private static boolean allDigits(String value) {
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (c < '0' || c > '9') {
        return false;
      }
    }
    return true;
  }
}
