package ca.gc.cra.qsolog.domain.adif;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * <strong>What:</strong> Lexes the text of one ADIF record into {@code <NAME:LENGTH[:TYPE]>value} tags.
 * <p><strong>Why:</strong> Length-prefixed values may contain delimiters such as {@code <} or newlines, so the
 * declared length, not delimiter scanning, decides where a value ends.</p>
 * <p><strong>Role:</strong> First stage of the decode path, invoked per chunk by import engines and store adapters.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Canonicalize tag names to uppercase.</li>
 *   <li>Read exactly the declared number of UTF-8 bytes as the value.</li>
 *   <li>Skip tags with a missing, malformed, or overlong length and resume after their {@code >}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use from import workers.</p>
 * <p><strong>Performance:</strong> Single forward pass; values are substrings of the input, so no fixed-size
 * buffers bound field length.</p>
 *
 * @implNote Declared lengths count UTF-8 bytes because {@link AdifEncoder} declares byte lengths. A length
 * that ends inside a multi-byte character is treated as malformed and the tag is skipped.
 * @since 0.1.0
 */
public final class TagScanner {
  private TagScanner() {}

  /**
   * Builds the raw field map for one record; later duplicates of a tag overwrite earlier ones.
   *
   * @param recordText text between two {@code <EOR>} markers; must not be {@code null}
   * @return mutable map of uppercase tag name to value, in first-seen order
   */
  public static Map<String, String> fields(String recordText) {
    Map<String, String> fields = new LinkedHashMap<>();
    scan(recordText, tag -> {
      if (tag.hasValue()) {
        fields.put(tag.name(), tag.value());
      }
    });
    return fields;
  }

  /**
   * Returns every tag header found in the record, including skipped ones.
   *
   * @param recordText text between two {@code <EOR>} markers; must not be {@code null}
   * @return tags in scan order
   */
  public static List<AdifTag> tags(String recordText) {
    List<AdifTag> tags = new ArrayList<>();
    scan(recordText, tags::add);
    return tags;
  }

  private static void scan(String text, Consumer<AdifTag> sink) {
    Objects.requireNonNull(text, "recordText");
    int cursor = 0;
    int end = text.length();
    while (cursor < end) {
      int open = text.indexOf('<', cursor);
      if (open < 0) {
        return;
      }
      int close = text.indexOf('>', open + 1);
      if (close < 0) {
        return;
      }
      String header = text.substring(open + 1, close);
      int colon = header.indexOf(':');
      String name = (colon < 0 ? header : header.substring(0, colon)).strip().toUpperCase(Locale.ROOT);
      int valueStart = close + 1;
      cursor = valueStart;
      if (name.isEmpty()) {
        continue;
      }
      int length = colon < 0 ? -1 : parseLength(header, colon + 1);
      if (length < 0) {
        sink.accept(AdifTag.skipped(name));
        continue;
      }
      int valueEnd = advanceBytes(text, valueStart, length);
      if (valueEnd < 0) {
        sink.accept(AdifTag.skipped(name));
        continue;
      }
      sink.accept(AdifTag.accepted(name, length, text.substring(valueStart, valueEnd)));
      cursor = valueEnd;
    }
  }

  // Only the first colon-delimited segment is the length; a trailing :TYPE is ignored.
  private static int parseLength(String header, int from) {
    int to = header.indexOf(':', from);
    String digits = (to < 0 ? header.substring(from) : header.substring(from, to)).strip();
    if (digits.isEmpty()) {
      return -1;
    }
    for (int i = 0; i < digits.length(); i++) {
      char c = digits.charAt(i);
      if (c < '0' || c > '9') {
        return -1;
      }
    }
    try {
      return Integer.parseInt(digits);
    } catch (NumberFormatException ex) {
      return -1;
    }
  }

  private static int advanceBytes(String text, int start, int byteLength) {
    int bytes = 0;
    int index = start;
    while (bytes < byteLength) {
      if (index >= text.length()) {
        return -1;
      }
      int codePoint = text.codePointAt(index);
      bytes += utf8Length(codePoint);
      index += Character.charCount(codePoint);
    }
    return bytes == byteLength ? index : -1;
  }

  static int utf8Length(int codePoint) {
    if (codePoint < 0x80) {
      return 1;
    }
    if (codePoint < 0x800) {
      return 2;
    }
    if (codePoint <= 0xFFFF && Character.isSurrogate((char) codePoint)) {
      // Lone surrogates encode as a single replacement byte.
      return 1;
    }
    return codePoint < 0x10000 ? 3 : 4;
  }
}
