package ca.gc.cra.prism.validation;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> String validation helpers for CLI arguments and configuration values.
 * <p><strong>Why:</strong> Model names end up in file paths and submitter names in logs; both are
 * constrained before use.</p>
 * <p><strong>Thread-safety:</strong> Stateless utility.</p>
 *
 * @since 0.1.0
 * @see Numbers
 */
public final class Strings {
  private static final Pattern IDENTIFIER = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9._-]*$");

  private Strings() {
    // Utility
  }

  /**
   * Ensures a value is present, non-blank, and free of control characters.
   *
   * @param name parameter name used in diagnostics
   * @param value candidate value
   * @return trimmed value
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if blank or containing control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    if (containsControl(trimmed)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    return trimmed;
  }

  /**
   * Ensures a value is a simple identifier usable as a file name: letters, digits, dot, underscore,
   * hyphen, not starting with a separator.
   *
   * @param name parameter name used in diagnostics
   * @param value candidate value
   * @return trimmed value
   * @throws IllegalArgumentException if the value is not a plain identifier
   */
  public static String requireIdentifier(String name, String value) {
    String sanitized = requireNonBlank(name, value);
    if (!IDENTIFIER.matcher(sanitized).matches() || sanitized.contains("..")) {
      throw new IllegalArgumentException(message(name,
          "must only contain letters, digits, dot, underscore, or hyphen"));
    }
    return sanitized;
  }

  /**
   * Ensures a value is printable ASCII within a maximum length.
   *
   * @param name parameter name used in diagnostics
   * @param value candidate value
   * @param maxLength maximum number of characters
   * @return trimmed value
   * @throws IllegalArgumentException if too long or containing non-printable characters
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    String sanitized = requireNonBlank(name, value);
    if (sanitized.length() > maxLength) {
      throw new IllegalArgumentException(message(name, "length must be <= " + maxLength));
    }
    for (int i = 0; i < sanitized.length(); i++) {
      char c = sanitized.charAt(i);
      if (c < 0x20 || c > 0x7E) {
        throw new IllegalArgumentException(message(name, "must contain printable ASCII characters"));
      }
    }
    return sanitized;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
