package ca.gc.cra.qsolog.config;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads a YAML settings file and flattens its {@code common} section and the section named after the
 * CLI mode into dotted keys, mode entries winning.
 *
 * <pre>
 * common:
 *   store: /var/log/ham/main.adi
 * awards:
 *   awards:
 *     dxcc: 150      # becomes awards.dxcc=150
 * </pre>
 */
public final class YamlConfigLoader {

  private YamlConfigLoader() {}

  /**
   * Loads {@code path} and returns the flattened settings for {@code mode}.
   *
   * @param path YAML file
   * @param mode CLI mode (import, export, awards)
   * @return flattened settings, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the document is not a mapping or contains lists
   */
  public static Optional<Map<String, String>> load(Path path, String mode) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(mode, "mode");
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return Optional.of(parse(reader, mode, path.toString()));
    }
  }

  static Map<String, String> parse(String yaml, String mode) {
    return parse(new StringReader(yaml), mode, "<inline>");
  }

  private static Map<String, String> parse(Reader reader, String mode, String origin) {
    Object document;
    try {
      document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + origin, ex);
    }
    if (document == null) {
      return Map.of();
    }
    Map<String, Object> root = mapping(document, "root");
    String wanted = mode.trim().toLowerCase(Locale.ROOT);

    Map<String, String> flat = new LinkedHashMap<>();
    Object common = section(root, "common");
    if (common != null) {
      flattenInto(flat, "", mapping(common, "common"));
    }
    Object own = section(root, wanted);
    if (own != null) {
      flattenInto(flat, "", mapping(own, wanted));
    }
    return Map.copyOf(flat);
  }

  private static Object section(Map<String, Object> root, String name) {
    for (Map.Entry<String, Object> entry : root.entrySet()) {
      if (entry.getKey().trim().toLowerCase(Locale.ROOT).equals(name)) {
        return entry.getValue();
      }
    }
    return null;
  }

  private static Map<String, Object> mapping(Object node, String where) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(where + " must be a mapping");
    }
    Map<String, Object> out = new LinkedHashMap<>();
    raw.forEach((k, v) -> {
      if (!(k instanceof String key) || key.isBlank()) {
        throw new IllegalArgumentException(where + " has a blank or non-string key");
      }
      out.put(key, v);
    });
    return out;
  }

  private static void flattenInto(Map<String, String> target, String prefix, Map<String, Object> node) {
    node.forEach((key, value) -> {
      String dotted = prefix.isEmpty() ? key : prefix + '.' + key;
      if (value instanceof Map<?, ?>) {
        flattenInto(target, dotted, mapping(value, dotted));
      } else if (value instanceof Iterable<?>) {
        throw new IllegalArgumentException("YAML lists are not supported (key " + dotted + ")");
      } else {
        target.put(dotted, value == null ? "" : value.toString());
      }
    });
  }
}
