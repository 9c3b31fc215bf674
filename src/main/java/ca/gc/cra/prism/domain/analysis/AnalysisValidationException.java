package ca.gc.cra.prism.domain.analysis;

/**
 * Raised synchronously when a submission names an unknown file kind or priority tier, or omits a
 * required field. No job is created when this is thrown.
 *
 * @since 0.1.0
 */
public class AnalysisValidationException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a descriptive message.
   *
   * @param message human-readable reason
   */
  public AnalysisValidationException(String message) {
    super(message);
  }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param message human-readable reason
   * @param cause parsing failure that triggered the rejection
   */
  public AnalysisValidationException(String message, Throwable cause) {
    super(message, cause);
  }
}
