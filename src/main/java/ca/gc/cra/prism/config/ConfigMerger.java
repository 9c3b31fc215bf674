package ca.gc.cra.prism.config;

import ca.gc.cra.prism.application.scheduler.BackpressureMode;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges defaults, YAML, and CLI settings with precedence CLI &gt; YAML &gt; defaults.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds the effective configuration for a command.
   *
   * @param mode active command
   * @param yaml optional YAML-derived settings
   * @param cli CLI {@code key=value} overrides; may be empty
   * @param defaults embedded defaults for the command
   * @param warn receives a message whenever a CLI key overrides a YAML key; may be {@code null}
   * @return immutable merged configuration
   * @throws IllegalArgumentException when a cross-key constraint is violated
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> yamlValues = yaml.orElse(Map.of());
    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(yamlValues);
    if (cli != null) {
      for (Map.Entry<String, String> entry : cli.entrySet()) {
        String key = entry.getKey();
        if (key == null || entry.getValue() == null) {
          continue;
        }
        if (yamlValues.containsKey(key) && warn != null) {
          warn.accept("CLI overrides YAML for key: " + key);
        }
        merged.put(key, entry.getValue());
      }
    }
    validate(merged);
    return Map.copyOf(merged);
  }

  private static void validate(Map<String, String> effective) {
    BackpressureMode backpressure = BackpressureMode.fromString(effective.get("backpressure"));
    String offerTimeout = trim(effective.get("offerTimeoutMs"));
    if (backpressure == BackpressureMode.BLOCK && !offerTimeout.isEmpty() && !"0".equals(offerTimeout)) {
      throw new IllegalArgumentException("offerTimeoutMs only applies when backpressure=REJECT");
    }
    String exporter = trim(effective.get("metricsExporter")).toLowerCase(Locale.ROOT);
    if (!exporter.isEmpty() && !exporter.equals("otlp") && !exporter.equals("none")) {
      throw new IllegalArgumentException("metricsExporter must be otlp or none (was " + exporter + ")");
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
