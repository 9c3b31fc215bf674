package ca.gc.cra.prism.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.StringJoiner;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads PRISM YAML configuration and flattens it into the {@code key=value} space used by the CLI.
 *
 * <p>The {@code common} section applies to every command; the section named after the command (for
 * example {@code analyze}) overrides it. Nested mappings become dotted keys ({@code queue.high}); lists
 * of scalars become comma-separated values ({@code files}).</p>
 */
public final class YamlConfigLoader {

  private YamlConfigLoader() {}

  /**
   * Loads the {@code common} and {@code mode} sections of a YAML file.
   *
   * @param path YAML file location
   * @param mode command name such as {@code analyze}
   * @return flattened settings, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML is malformed or structurally invalid
   */
  public static Optional<Map<String, String>> load(Path path, String mode) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(mode, "mode");
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    String section = mode.trim().toLowerCase(Locale.ROOT);
    Object document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
    if (document == null) {
      return Optional.of(Map.of());
    }
    Map<String, Object> root = asMap(document, "root");
    Map<String, String> flattened = new LinkedHashMap<>();
    Object common = section(root, "common");
    if (common != null) {
      flatten(asMap(common, "common"), "", flattened);
    }
    Object modeSection = section(root, section);
    if (modeSection != null) {
      flatten(asMap(modeSection, section), "", flattened);
    }
    return Optional.of(Map.copyOf(flattened));
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " section must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key) || key.isBlank()) {
        throw new IllegalArgumentException(context + " section contains a blank or non-string key");
      }
      map.put(key.trim(), entry.getValue());
    }
    return map;
  }

  private static Object section(Map<String, Object> root, String name) {
    for (Map.Entry<String, Object> entry : root.entrySet()) {
      if (entry.getKey().toLowerCase(Locale.ROOT).equals(name)) {
        return entry.getValue();
      }
    }
    return null;
  }

  private static void flatten(Map<String, Object> source, String prefix, Map<String, String> target) {
    for (Map.Entry<String, Object> entry : source.entrySet()) {
      String key = prefix.isEmpty() ? entry.getKey() : prefix + '.' + entry.getKey();
      Object value = entry.getValue();
      if (value == null) {
        target.put(key, "");
      } else if (value instanceof Map<?, ?> nested) {
        flatten(asMap(nested, key), key, target);
      } else if (value instanceof Iterable<?> items) {
        target.put(key, joinScalars(key, items));
      } else {
        target.put(key, value.toString());
      }
    }
  }

  private static String joinScalars(String key, Iterable<?> items) {
    StringJoiner joined = new StringJoiner(",");
    for (Object item : items) {
      if (item == null || item instanceof Map<?, ?> || item instanceof Iterable<?>) {
        throw new IllegalArgumentException("YAML list for key " + key + " must contain scalars only");
      }
      joined.add(item.toString());
    }
    return joined.toString();
  }
}
