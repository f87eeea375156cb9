package ca.gc.cra.qsolog.config;

import ca.gc.cra.qsolog.domain.qso.QsoFilter;
import ca.gc.cra.qsolog.validation.Numbers;
import ca.gc.cra.qsolog.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/** Parsing helpers shared by the typed configuration records. */
final class ConfigValues {
  private ConfigValues() {}

  static Path defaultStore() {
    String home = System.getProperty("user.home", ".");
    return Path.of(home, ".qsolog", "qsolog.adi").toAbsolutePath().normalize();
  }

  static boolean parseBoolean(String value, boolean defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return Boolean.parseBoolean(value.trim());
  }

  static Optional<String> optionalString(String value) {
    return Optional.ofNullable(Strings.trimToNull(value));
  }

  static Path parsePath(String name, String value) {
    try {
      return Path.of(Strings.requireNonBlank(name, value)).toAbsolutePath().normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + value, ex);
    }
  }

  static Optional<Path> optionalPath(String name, String value) {
    return optionalString(value).map(v -> parsePath(name, v));
  }

  static int parseInt(Map<String, String> options, String key, int defaultValue, int min, int max) {
    String raw = options.get(key);
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    return Numbers.parseIntInRange(key, raw, min, max);
  }

  static String firstNonBlank(Map<String, String> map, String... keys) {
    for (String key : keys) {
      String val = map.get(key);
      if (val != null && !val.isBlank()) {
        return val;
      }
    }
    return null;
  }

  /** Reads {@code band}, {@code mode}, {@code call} and {@code limit}; {@code limit=0} means unlimited. */
  static QsoFilter filter(Map<String, String> options) {
    int limit = parseInt(options, "limit", 0, 0, Integer.MAX_VALUE);
    return QsoFilter.of(options.get("band"), options.get("mode"), options.get("call"), limit);
  }
}
