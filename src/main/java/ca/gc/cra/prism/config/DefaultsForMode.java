package ca.gc.cra.prism.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Flattened defaults per CLI command; the single source of truth for optional keys.
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = Map.of(
      "metricsExporter", "none",
      "otelEndpoint", "",
      "otelResourceAttributes", "",
      "verbose", "false");

  private DefaultsForMode() {}

  /**
   * Returns defaults for a command merged over the common defaults.
   *
   * @param mode command name; only {@code analyze} is defined
   * @return unmodifiable default map
   * @throws IllegalArgumentException if the mode is unknown
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "analyze" -> analyzeDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> analyzeDefaults() {
    Map<String, String> map = new LinkedHashMap<>(SchedulerConfig.defaults().asFlatMap());
    map.put("kind", "auto");
    map.put("priority", "normal");
    map.put("submitter", System.getProperty("user.name", "prism-cli"));
    map.put("waitSeconds", "300");
    return map;
  }
}
