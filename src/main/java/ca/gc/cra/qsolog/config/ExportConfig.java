package ca.gc.cra.qsolog.config;

import ca.gc.cra.qsolog.domain.adif.AdifEncoder;
import ca.gc.cra.qsolog.domain.qso.QsoFilter;
import ca.gc.cra.qsolog.validation.Strings;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Validated settings for the {@code export} command.
 *
 * @param output ADIF file to write
 * @param store log file to read
 * @param filter contact selection
 * @param programId value written to the {@code PROGRAMID} header tag
 * @since 0.1.0
 */
public record ExportConfig(Path output, Path store, QsoFilter filter, String programId) {
  static final int MAX_PROGRAM_ID_LENGTH = 64;

  public ExportConfig {
    output = Objects.requireNonNull(output, "output").toAbsolutePath().normalize();
    store = Objects.requireNonNullElseGet(store, ConfigValues::defaultStore).toAbsolutePath().normalize();
    filter = Objects.requireNonNullElse(filter, QsoFilter.all());
    programId = Strings.requirePrintableAscii(
        "programId", Objects.requireNonNullElse(programId, AdifEncoder.DEFAULT_PROGRAM_ID), MAX_PROGRAM_ID_LENGTH);
    if (output.equals(store)) {
      throw new IllegalArgumentException("out and store must be different files");
    }
  }

  public static ExportConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    String out = ConfigValues.firstNonBlank(options, "out", "output");
    if (out == null) {
      throw new IllegalArgumentException("out is required for export");
    }
    return new ExportConfig(
        ConfigValues.parsePath("out", out),
        ConfigValues.optionalPath("store", options.get("store")).orElseGet(ConfigValues::defaultStore),
        ConfigValues.filter(options),
        ConfigValues.optionalString(options.get("programId")).orElse(AdifEncoder.DEFAULT_PROGRAM_ID));
  }
}
