package ca.gc.cra.prism.domain.analysis;

import java.util.Locale;

/**
 * Priority tier of an analysis request.
 *
 * <p>Each tier owns a bounded queue and a dedicated set of workers. Tiers are isolated from each other;
 * a higher tier gets its own capacity rather than preempting lower tiers.</p>
 *
 * @since 0.1.0
 */
public enum Priority {
  /** Default tier for routine submissions. */
  NORMAL(1),
  /** Expedited submissions. */
  HIGH(2),
  /** Submissions that should rarely queue at all. */
  CRITICAL(3);

  private final int level;

  Priority(int level) {
    this.level = level;
  }

  /**
   * Returns the numeric level (1=normal, 2=high, 3=critical).
   *
   * @return numeric tier level
   */
  public int level() {
    return level;
  }

  /**
   * Resolves a numeric tier level.
   *
   * @param level numeric level
   * @return matching priority
   * @throws AnalysisValidationException if the level is not 1, 2, or 3
   */
  public static Priority fromLevel(int level) {
    for (Priority priority : values()) {
      if (priority.level == level) {
        return priority;
      }
    }
    throw new AnalysisValidationException("Unsupported priority tier: " + level);
  }

  /**
   * Parses a tier given either by name ({@code high}) or by numeric level ({@code 2}).
   *
   * @param raw tier name or level
   * @return matching priority
   * @throws AnalysisValidationException if the value is blank or unknown
   */
  public static Priority fromString(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new AnalysisValidationException("priority must not be blank");
    }
    String normalized = raw.trim();
    if (normalized.chars().allMatch(Character::isDigit)) {
      try {
        return fromLevel(Integer.parseInt(normalized));
      } catch (NumberFormatException ex) {
        throw new AnalysisValidationException("Unsupported priority tier: " + normalized, ex);
      }
    }
    try {
      return valueOf(normalized.toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new AnalysisValidationException("Unsupported priority tier: " + normalized, ex);
    }
  }

  /**
   * Returns the lowercase name used in metric keys and JSON output.
   *
   * @return wire name such as {@code critical}
   */
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
