package ca.gc.cra.qsolog.domain.adif;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * Transient decode unit produced by {@link TagScanner} for a single {@code <NAME:LENGTH>} header.
 *
 * <p>A tag whose length is missing, malformed, or longer than the remaining record text is reported
 * with an empty {@link #declaredLength()} and a {@code null} value; such tags never reach the field map.</p>
 *
 * @param name uppercase tag name
 * @param declaredLength declared value length in UTF-8 bytes, or empty when unusable
 * @param value exactly {@code declaredLength} bytes of text, or {@code null} when skipped
 * @since 0.1.0
 */
public record AdifTag(String name, OptionalInt declaredLength, String value) {

  /**
   * Validates that length and value are either both present or both absent.
   *
   * @throws NullPointerException if {@code name} or {@code declaredLength} is {@code null}
   * @throws IllegalArgumentException if only one of length and value is present
   */
  public AdifTag {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(declaredLength, "declaredLength");
    if (declaredLength.isPresent() != (value != null)) {
      throw new IllegalArgumentException("declaredLength and value must be present together");
    }
  }

  static AdifTag accepted(String name, int length, String value) {
    return new AdifTag(name, OptionalInt.of(length), value);
  }

  static AdifTag skipped(String name) {
    return new AdifTag(name, OptionalInt.empty(), null);
  }

  /**
   * Indicates whether the scanner captured a value for this tag.
   *
   * @return {@code true} when the tag carries a value
   */
  public boolean hasValue() {
    return value != null;
  }
}
