package ca.gc.cra.prism.domain.analysis;

/**
 * Checked exception thrown when a detector cannot analyze a file.
 *
 * @since 0.1.0
 */
public final class AnalysisException extends Exception {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a descriptive message.
   *
   * @param msg human-readable error
   */
  public AnalysisException(String msg) { super(msg); }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param msg human-readable error
   * @param cause root cause from file access or model evaluation
   */
  public AnalysisException(String msg, Throwable cause) { super(msg, cause); }
}
