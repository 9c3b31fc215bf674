package ca.gc.cra.prism.application.port;

/**
 * <strong>What:</strong> Domain port supplying wall-clock timestamps to the scheduler.
 * <p><strong>Why:</strong> Record timestamps, processing durations, and retention cleanup all read time;
 * tests inject a manual clock to age records deterministically.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe; dispatcher threads and callers read
 * the clock concurrently.</p>
 *
 * @implNote Default implementation delegates to {@link System#currentTimeMillis()}.
 * @since 0.1.0
 * @see ca.gc.cra.prism.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();

  /** Default {@link ClockPort} using {@link System#currentTimeMillis()}. */
  ClockPort SYSTEM = System::currentTimeMillis;
}
