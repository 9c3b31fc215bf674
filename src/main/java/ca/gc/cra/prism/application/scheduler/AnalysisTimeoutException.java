package ca.gc.cra.prism.application.scheduler;

import java.time.Duration;

/**
 * Raised by {@link AnalysisScheduler#waitForCompletion(String, Duration)} when the deadline passes before
 * the job settles. The job itself keeps running and may still complete.
 *
 * @since 0.1.0
 */
public final class AnalysisTimeoutException extends Exception {
  private static final long serialVersionUID = 1L;

  private final String analysisId;

  /**
   * Creates a timeout for the given job.
   *
   * @param analysisId job that did not settle in time
   * @param timeout wait budget that elapsed
   */
  public AnalysisTimeoutException(String analysisId, Duration timeout) {
    super("Analysis " + analysisId + " did not complete within " + timeout.toMillis() + " ms");
    this.analysisId = analysisId;
  }

  /**
   * Returns the job that timed out.
   *
   * @return analysis id
   */
  public String analysisId() {
    return analysisId;
  }
}
