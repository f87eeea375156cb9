package ca.gc.cra.qsolog.config;

import java.util.Locale;

/**
 * <strong>What:</strong> Decode and summary strategies available to the CLI.
 * <p><strong>Role:</strong> Configuration enum consumed by {@link CompositionRoot} when choosing engines.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum EngineMode {
  /** Single-threaded engines. */
  SERIAL,
  /** Executor-backed engines with serial fallback. */
  PARALLEL;

  /**
   * Parses a string into an {@link EngineMode}, defaulting to {@link #PARALLEL} when blank.
   *
   * @param value textual representation such as {@code "serial"} or {@code "parallel"}
   * @return parsed mode
   * @throws IllegalArgumentException if the string does not match a known mode
   */
  public static EngineMode fromString(String value) {
    if (value == null || value.isBlank()) {
      return PARALLEL;
    }
    try {
      return EngineMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unknown engine: " + value, ex);
    }
  }
}
