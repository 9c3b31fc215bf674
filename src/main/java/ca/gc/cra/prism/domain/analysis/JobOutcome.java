package ca.gc.cra.prism.domain.analysis;

import java.util.Objects;

/**
 * Tagged outcome of a finished job: either a detector payload or a classified failure.
 *
 * <p>Workers convert every detector exception into a {@link Failure} before touching the result
 * store, so exceptions never cross the worker/store boundary.</p>
 *
 * @since 0.1.0
 */
public sealed interface JobOutcome permits JobOutcome.Success, JobOutcome.Failure {

  /**
   * Wraps a detector payload.
   *
   * @param result detector result
   * @return success outcome
   */
  static JobOutcome success(DetectionResult result) {
    return new Success(result);
  }

  /**
   * Builds a failure outcome.
   *
   * @param kind failure classification
   * @param detail human-readable detail
   * @return failure outcome
   */
  static JobOutcome failure(FailureKind kind, String detail) {
    return new Failure(kind, detail);
  }

  /**
   * Status a record takes when it settles on this outcome.
   *
   * @return {@link JobStatus#COMPLETED} or {@link JobStatus#FAILED}
   */
  JobStatus terminalStatus();

  /**
   * Successful detector run.
   *
   * @param result detector payload
   */
  record Success(DetectionResult result) implements JobOutcome {
    /** Validates the payload. */
    public Success {
      Objects.requireNonNull(result, "result");
    }

    @Override
    public JobStatus terminalStatus() {
      return JobStatus.COMPLETED;
    }
  }

  /**
   * Failed job.
   *
   * @param kind failure classification
   * @param detail error detail; never {@code null}
   */
  record Failure(FailureKind kind, String detail) implements JobOutcome {
    /** Validates the failure fields. */
    public Failure {
      Objects.requireNonNull(kind, "kind");
      detail = detail == null || detail.isBlank() ? kind.defaultDetail() : detail;
    }

    @Override
    public JobStatus terminalStatus() {
      return JobStatus.FAILED;
    }
  }

  /** Classification of job failures. */
  enum FailureKind {
    /** Detector raised {@link AnalysisException}. */
    DETECTOR_ERROR("detector reported an error"),
    /** Detector cannot handle the job's file kind. */
    UNSUPPORTED_FILE_KIND("file kind not supported by detector"),
    /** Detector threw an unexpected runtime exception or error. */
    DETECTOR_CRASH("detector crashed"),
    /** Job was abandoned because the scheduler was forced to stop. */
    INTERRUPTED("job interrupted by scheduler shutdown");

    private final String defaultDetail;

    FailureKind(String defaultDetail) {
      this.defaultDetail = defaultDetail;
    }

    String defaultDetail() {
      return defaultDetail;
    }
  }
}
