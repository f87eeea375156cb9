package ca.gc.cra.qsolog.logging;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * <strong>What:</strong> Helpers that keep logged record text short and on one line.
 * <p><strong>Why:</strong> Rejected records can carry long comments; previews keep DEBUG logs readable.</p>
 * <p><strong>Thread-safety:</strong> Stateless utilities safe for concurrent use by import workers.</p>
 *
 * @implNote Decoding uses {@link CodingErrorAction#IGNORE} so truncating mid-codepoint never throws.
 * @since 0.1.0
 */
public final class Logs {
  /** Byte budget applied by {@link #preview(String)}. */
  public static final int PREVIEW_BYTES = 120;

  private static final String NULL_PLACEHOLDER = "<null>";

  private Logs() {
    // Utility
  }

  /**
   * Truncates a string to the requested UTF-8 byte length, appending the original length metadata.
   *
   * @param value string to truncate; {@code null} results in {@code "<null>"}
   * @param maxBytes maximum number of bytes to retain; must be positive
   * @return truncated string when the input exceeds {@code maxBytes}; otherwise the original value
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    if (bytes.length <= maxBytes) {
      return value;
    }
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.IGNORE)
        .onUnmappableCharacter(CodingErrorAction.IGNORE);
    try {
      CharBuffer buffer = decoder.decode(ByteBuffer.wrap(bytes, 0, maxBytes));
      return buffer + "... (truncated, " + maxBytes + " of " + bytes.length + ")";
    } catch (CharacterCodingException ex) {
      String fallback = new String(bytes, 0, maxBytes, StandardCharsets.UTF_8);
      return fallback + "... (truncated)";
    }
  }

  /**
   * Collapses line breaks and truncates a record span for single-line log output.
   *
   * @param recordText raw record text; may be {@code null}
   * @return one-line preview of at most {@link #PREVIEW_BYTES} bytes plus the truncation suffix
   */
  public static String preview(String recordText) {
    if (recordText == null) {
      return NULL_PLACEHOLDER;
    }
    String oneLine = recordText.strip().replace('\r', ' ').replace('\n', ' ');
    return truncate(oneLine, PREVIEW_BYTES);
  }
}
