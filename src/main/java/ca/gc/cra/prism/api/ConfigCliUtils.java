package ca.gc.cra.prism.api;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

final class ConfigCliUtils {

  private ConfigCliUtils() {}

  /**
   * Removes and returns the {@code config=} path from CLI arguments.
   *
   * @param args mutable CLI map
   * @return trimmed path, or {@code null} when absent
   */
  static String extractConfigPath(Map<String, String> args) {
    if (args == null) {
      return null;
    }
    String value = args.remove("config");
    return value == null || value.isBlank() ? null : value.trim();
  }

  /**
   * Splits a comma-separated value, dropping blanks.
   *
   * @param raw comma-separated text; may be {@code null}
   * @return trimmed entries in order
   */
  static List<String> splitList(String raw) {
    List<String> values = new ArrayList<>();
    if (raw == null) {
      return values;
    }
    for (String token : raw.split(",")) {
      String trimmed = token.trim();
      if (!trimmed.isEmpty()) {
        values.add(trimmed);
      }
    }
    return values;
  }
}
