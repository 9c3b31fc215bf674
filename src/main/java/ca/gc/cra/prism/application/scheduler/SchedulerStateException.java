package ca.gc.cra.prism.application.scheduler;

/**
 * Raised when an operation is invoked in the wrong lifecycle phase, such as submitting before
 * {@link AnalysisScheduler#start()} or after {@link AnalysisScheduler#shutdown()} began.
 *
 * @since 0.1.0
 */
public final class SchedulerStateException extends IllegalStateException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a descriptive message.
   *
   * @param message human-readable reason
   */
  public SchedulerStateException(String message) {
    super(message);
  }
}
