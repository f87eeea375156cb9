package ca.gc.cra.qsolog.config;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Validated settings for the {@code import} command.
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param input ADIF file to import
 * @param store ADIF log file that receives accepted contacts
 * @param dryRun decode and count only; accepted contacts go to a throwaway in-memory store
 * @param engine engine settings
 * @since 0.1.0
 */
public record ImportConfig(Path input, Path store, boolean dryRun, EngineConfig engine) {

  public ImportConfig {
    Objects.requireNonNull(input, "input");
    store = Objects.requireNonNullElseGet(store, ConfigValues::defaultStore).toAbsolutePath().normalize();
    engine = Objects.requireNonNullElseGet(engine, EngineConfig::defaults);
    input = input.toAbsolutePath().normalize();
    if (input.equals(store)) {
      throw new IllegalArgumentException("in and store must be different files");
    }
  }

  /**
   * Builds the import configuration from flattened options.
   *
   * @param options merged options; {@code in} is required
   * @return parsed configuration
   * @throws IllegalArgumentException if {@code in} is missing or a value is invalid
   */
  public static ImportConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    String in = ConfigValues.firstNonBlank(options, "in", "input");
    if (in == null) {
      throw new IllegalArgumentException("in is required for import");
    }
    return new ImportConfig(
        ConfigValues.parsePath("in", in),
        ConfigValues.optionalPath("store", options.get("store")).orElseGet(ConfigValues::defaultStore),
        ConfigValues.parseBoolean(options.get("dryRun"), false),
        EngineConfig.fromMap(options));
  }
}
