package ca.gc.cra.qsolog.infrastructure.report;

import java.util.Locale;

/** Output formats for the awards report. */
public enum ReportFormat {
  TEXT,
  JSON;

  /**
   * Parses a format name, ignoring case.
   *
   * @param raw format name such as {@code text} or {@code json}
   * @return matching format
   * @throws IllegalArgumentException if the name is unknown
   */
  public static ReportFormat fromString(String raw) {
    if (raw == null || raw.isBlank()) {
      return TEXT;
    }
    String normalized = raw.trim().toUpperCase(Locale.ROOT);
    for (ReportFormat format : values()) {
      if (format.name().equals(normalized)) {
        return format;
      }
    }
    throw new IllegalArgumentException("format must be text or json (was " + raw + ")");
  }
}
