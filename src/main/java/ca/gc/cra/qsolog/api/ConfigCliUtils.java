package ca.gc.cra.qsolog.api;

import java.util.Map;

/** Helpers for CLI options that are not plain configuration keys. */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  /** Removes and returns {@code config=PATH}, or {@code null} when absent. */
  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    String value = args.remove("config");
    return value == null || value.isBlank() ? null : value.trim();
  }

  static boolean parseBoolean(Map<String, String> map, String key) {
    String value = map == null ? null : map.get(key);
    return value != null && Boolean.parseBoolean(value.trim());
  }
}
