package ca.gc.cra.prism.application.scheduler;

/**
 * Raised when an analysis id was never submitted or its record has already been cleaned up.
 * Distinct from a job that exists and {@code FAILED}.
 *
 * @since 0.1.0
 */
public final class AnalysisNotFoundException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final String analysisId;

  /**
   * Creates a not-found signal for the given id.
   *
   * @param analysisId unknown id
   */
  public AnalysisNotFoundException(String analysisId) {
    super("Analysis not found: " + analysisId);
    this.analysisId = analysisId;
  }

  /**
   * Returns the unknown id.
   *
   * @return analysis id
   */
  public String analysisId() {
    return analysisId;
  }
}
