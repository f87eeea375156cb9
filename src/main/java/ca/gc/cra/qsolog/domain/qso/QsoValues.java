package ca.gc.cra.qsolog.domain.qso;

import java.util.Locale;
import java.util.Optional;

/**
 * Normalization rule shared by awards aggregation and record filtering.
 *
 * @since 0.1.0
 */
public final class QsoValues {
  private QsoValues() {}

  /**
   * Trims and uppercases a value; blank or {@code null} input has no normalized form.
   *
   * <p>Idempotent: normalizing an already normalized value returns it unchanged.</p>
   *
   * @param value raw attribute value; may be {@code null}
   * @return normalized value, or empty when nothing remains after trimming
   */
  public static Optional<String> norm(String value) {
    if (value == null) {
      return Optional.empty();
    }
    String trimmed = value.strip();
    if (trimmed.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(trimmed.toUpperCase(Locale.ROOT));
  }
}
