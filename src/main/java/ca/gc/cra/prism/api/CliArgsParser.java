package ca.gc.cra.prism.api;

import ca.gc.cra.prism.validation.Strings;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Converts {@code key=value} arguments into an ordered map.
 *
 * @since 0.1.0
 */
public final class CliArgsParser {
  private static final Pattern KEY_PATTERN = Pattern.compile("^[A-Za-z][A-Za-z0-9._-]*$");

  private CliArgsParser() {}

  /**
   * Parses arguments; later duplicates win.
   *
   * @param args {@code key=value} tokens; {@code null} and blank tokens are skipped
   * @return mutable ordered map
   * @throws IllegalArgumentException if a token is not {@code key=value}, the key is malformed, or the
   *     value contains control characters
   */
  public static Map<String, String> toMap(String[] args) {
    Map<String, String> map = new LinkedHashMap<>();
    if (args == null) {
      return map;
    }
    for (String raw : args) {
      String arg = raw == null ? "" : raw.trim();
      if (arg.isEmpty()) {
        continue;
      }
      int idx = arg.indexOf('=');
      if (idx <= 0) {
        throw new IllegalArgumentException("argument must be key=value (was '" + raw + "')");
      }
      String key = arg.substring(0, idx).trim();
      String value = arg.substring(idx + 1).trim();
      if (!KEY_PATTERN.matcher(key).matches()) {
        throw new IllegalArgumentException("invalid argument name: " + key);
      }
      // Empty values clear a YAML or default setting; non-empty ones must be printable.
      if (!value.isEmpty()) {
        Strings.requireNonBlank(key, value);
      }
      map.put(key, value);
    }
    return map;
  }
}
