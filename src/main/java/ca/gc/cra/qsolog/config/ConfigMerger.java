package ca.gc.cra.qsolog.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML, and CLI sources while enforcing precedence and invariants.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map using precedence CLI > YAML > defaults.
   *
   * @param mode active CLI mode
   * @param yaml optional YAML-derived settings for the mode
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults for the mode
   * @param warn consumer invoked when a CLI key overrides a YAML key
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when validation fails
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(yamlCopy);
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      String value = entry.getValue();
      if (key == null || value == null) {
        continue;
      }
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      merged.put(key, value);
    }

    validate(mode, merged);
    return Map.copyOf(merged);
  }

  private static void validate(String mode, Map<String, String> effective) {
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    if ("import".equals(normalized) && isBlank(effective.get("in"))) {
      throw new IllegalArgumentException("in is required for import");
    }
    if ("export".equals(normalized) && isBlank(effective.get("out"))) {
      throw new IllegalArgumentException("out is required for export");
    }
    if (EngineMode.fromString(effective.get("engine")) == EngineMode.PARALLEL) {
      String workers = effective.get("workers");
      if (!isBlank(workers) && parsesBelowOne(workers)) {
        throw new IllegalArgumentException("workers must be >= 1 when engine=PARALLEL");
      }
    }
  }

  private static boolean parsesBelowOne(String raw) {
    try {
      return Integer.parseInt(raw.trim()) < 1;
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("workers must be an integer (was " + raw + ")", ex);
    }
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
