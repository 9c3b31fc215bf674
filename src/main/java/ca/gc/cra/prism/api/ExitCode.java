package ca.gc.cra.prism.api;

/**
 * Process exit codes returned by PRISM commands.
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Every job completed. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** IO failure, such as a missing model directory or unreadable config file. */
  IO_ERROR(3),
  /** Configuration was valid syntactically but could not be applied, such as a detector that failed to load. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure. */
  RUNTIME_FAILURE(5),
  /** The run finished but at least one job failed or did not finish in time. */
  ANALYSIS_FAILED(6),
  /** Process was interrupted (e.g., SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Numeric process status.
   *
   * @return exit status
   */
  public int code() {
    return code;
  }
}
