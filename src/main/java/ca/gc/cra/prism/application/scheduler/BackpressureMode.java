package ca.gc.cra.prism.application.scheduler;

import java.util.Locale;

/** How submission behaves when the target tier queue is full. */
public enum BackpressureMode {
  /** Suspend the submitting thread until the tier has room. */
  BLOCK,
  /** Fail the submission with {@link QueueFullException} once the offer timeout elapses. */
  REJECT;

  /**
   * Parses a mode name, defaulting to {@link #BLOCK} when blank.
   *
   * @param raw mode name, case-insensitive
   * @return parsed mode
   * @throws IllegalArgumentException if the name is unknown
   */
  public static BackpressureMode fromString(String raw) {
    if (raw == null || raw.isBlank()) {
      return BLOCK;
    }
    try {
      return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("backpressure must be BLOCK or REJECT (was " + raw + ")", ex);
    }
  }
}
