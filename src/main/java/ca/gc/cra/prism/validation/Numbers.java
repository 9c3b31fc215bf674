package ca.gc.cra.prism.validation;

/**
 * Numeric validation for configuration keys such as queue capacities, worker counts, and timeouts.
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a value falls within an inclusive range.
   *
   * @param name parameter name included in diagnostics
   * @param value candidate value
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Parses a decimal value and validates its range.
   *
   * @param name parameter name included in diagnostics
   * @param raw text to parse; surrounding whitespace is ignored
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return parsed value
   * @throws IllegalArgumentException if {@code raw} is not an integer or is out of range
   */
  public static long parseRange(String name, String raw, long min, long max) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException(label(name) + " must be a number");
    }
    long value;
    try {
      value = Long.parseLong(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label(name) + " must be a number (was " + raw.trim() + ")", ex);
    }
    return requireRange(name, value, min, max);
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
