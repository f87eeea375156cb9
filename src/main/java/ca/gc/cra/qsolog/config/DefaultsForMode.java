package ca.gc.cra.qsolog.config;

import ca.gc.cra.qsolog.domain.adif.AdifEncoder;
import ca.gc.cra.qsolog.domain.awards.AwardThresholds;
import ca.gc.cra.qsolog.infrastructure.report.ReportFormat;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each CLI mode.
 *
 * <p>The defaults are the lowest-precedence layer under YAML and CLI values.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns defaults for the requested mode merged with common defaults.
   *
   * @param mode target CLI mode (import, export, awards)
   * @return unmodifiable map of default key/value pairs as strings
   * @throws IllegalArgumentException if the mode is unknown
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "import" -> buildImportDefaults();
      case "export" -> buildExportDefaults();
      case "awards" -> buildAwardsDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    EngineConfig engine = EngineConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    map.put("store", ConfigValues.defaultStore().toString());
    map.put("engine", engine.engine().name());
    map.put("workers", Integer.toString(engine.workers()));
    map.put("parallelThreshold", Integer.toString(engine.parallelThreshold()));
    map.put("summaryChunkSize", Integer.toString(engine.summaryChunkSize()));
    return Map.copyOf(map);
  }

  private static Map<String, String> buildImportDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("dryRun", "false");
    return map;
  }

  private static Map<String, String> buildExportDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("programId", AdifEncoder.DEFAULT_PROGRAM_ID);
    map.put("limit", "0");
    return map;
  }

  private static Map<String, String> buildAwardsDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("format", ReportFormat.TEXT.name().toLowerCase(Locale.ROOT));
    map.put("awards.dxcc", Integer.toString(AwardThresholds.DEFAULT_THRESHOLD));
    map.put("awards.vucc", Integer.toString(AwardThresholds.DEFAULT_THRESHOLD));
    return map;
  }
}
