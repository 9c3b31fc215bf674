package ca.gc.cra.prism.domain.analysis;

import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Snapshot of one job's lifecycle as held by the result store.
 * <p><strong>Why:</strong> Records are immutable; every transition produces a new snapshot that the store
 * swaps in atomically, so readers never observe a half-written record.</p>
 * <p><strong>Invariants:</strong>
 * <ul>
 *   <li>{@code outcome} is present exactly when {@code status} is terminal and agrees with it.</li>
 *   <li>Transitions follow {@link JobStatus#canTransitionTo(JobStatus)}; terminal records never change.</li>
 *   <li>{@code updatedAtMillis} is the last transition time and drives retention cleanup.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param analysisId job identifier
 * @param fileRef media reference submitted
 * @param fileKind media kind
 * @param priority tier the job ran on
 * @param submitter submitting identity
 * @param status current lifecycle state
 * @param createdAtMillis submission time (epoch millis)
 * @param updatedAtMillis time of the latest transition (epoch millis)
 * @param startedAtMillis time the worker picked the job up, or {@link #NOT_STARTED}
 * @param processingMillis detector wall time once terminal; {@code 0} before that
 * @param outcome terminal outcome, {@code null} while queued or processing
 * @since 0.1.0
 */
public record JobRecord(
    String analysisId,
    String fileRef,
    FileKind fileKind,
    Priority priority,
    String submitter,
    JobStatus status,
    long createdAtMillis,
    long updatedAtMillis,
    long startedAtMillis,
    long processingMillis,
    JobOutcome outcome) {

  /** Sentinel for {@code startedAtMillis} when no worker has picked the job up. */
  public static final long NOT_STARTED = -1L;

  /**
   * Validates the snapshot invariants.
   *
   * @throws IllegalArgumentException if outcome and status disagree
   */
  public JobRecord {
    Objects.requireNonNull(analysisId, "analysisId");
    Objects.requireNonNull(fileRef, "fileRef");
    Objects.requireNonNull(fileKind, "fileKind");
    Objects.requireNonNull(priority, "priority");
    Objects.requireNonNull(submitter, "submitter");
    Objects.requireNonNull(status, "status");
    if (status.isTerminal()) {
      if (outcome == null || outcome.terminalStatus() != status) {
        throw new IllegalArgumentException("terminal status " + status + " requires a matching outcome");
      }
    } else if (outcome != null) {
      throw new IllegalArgumentException("non-terminal status " + status + " must not carry an outcome");
    }
    if (processingMillis < 0) {
      throw new IllegalArgumentException("processingMillis must be >= 0");
    }
  }

  /**
   * Creates the initial {@code QUEUED} record for a freshly accepted request.
   *
   * @param request accepted descriptor
   * @param nowMillis submission time
   * @return queued record
   */
  public static JobRecord queued(AnalysisRequest request, long nowMillis) {
    Objects.requireNonNull(request, "request");
    return new JobRecord(
        request.analysisId(),
        request.fileRef(),
        request.fileKind(),
        request.priority(),
        request.submitter(),
        JobStatus.QUEUED,
        nowMillis,
        nowMillis,
        NOT_STARTED,
        0L,
        null);
  }

  /**
   * Moves a queued record to {@code PROCESSING}.
   *
   * @param nowMillis time the worker dequeued the job
   * @return processing snapshot
   * @throws IllegalStateException if the record is not queued
   */
  public JobRecord startProcessing(long nowMillis) {
    requireTransition(JobStatus.PROCESSING);
    return new JobRecord(
        analysisId, fileRef, fileKind, priority, submitter,
        JobStatus.PROCESSING, createdAtMillis, nowMillis, nowMillis, 0L, null);
  }

  /**
   * Settles a processing record on its outcome.
   *
   * @param result tagged detector outcome
   * @param nowMillis completion time
   * @return terminal snapshot
   * @throws IllegalStateException if the record is not processing
   */
  public JobRecord finish(JobOutcome result, long nowMillis) {
    Objects.requireNonNull(result, "result");
    if (status != JobStatus.PROCESSING) {
      throw new IllegalStateException(
          "Job " + analysisId + " cannot finish from status " + status);
    }
    requireTransition(result.terminalStatus());
    long elapsed = Math.max(0L, nowMillis - startedAtMillis);
    return new JobRecord(
        analysisId, fileRef, fileKind, priority, submitter,
        result.terminalStatus(), createdAtMillis, nowMillis, startedAtMillis, elapsed, result);
  }

  /**
   * Fails a queued or processing record that will never be run to completion.
   *
   * @param failure failure to record
   * @param nowMillis abandonment time
   * @return failed snapshot
   * @throws IllegalStateException if the record is already terminal
   */
  public JobRecord abandon(JobOutcome.Failure failure, long nowMillis) {
    Objects.requireNonNull(failure, "failure");
    requireTransition(JobStatus.FAILED);
    long elapsed = startedAtMillis == NOT_STARTED ? 0L : Math.max(0L, nowMillis - startedAtMillis);
    return new JobRecord(
        analysisId, fileRef, fileKind, priority, submitter,
        JobStatus.FAILED, createdAtMillis, nowMillis, startedAtMillis, elapsed, failure);
  }

  /**
   * Returns the detector payload when the job completed.
   *
   * @return detection result, or empty unless {@link JobStatus#COMPLETED}
   */
  public Optional<DetectionResult> result() {
    return outcome instanceof JobOutcome.Success success
        ? Optional.of(success.result())
        : Optional.empty();
  }

  /**
   * Returns failure details when the job failed.
   *
   * @return failure, or empty unless {@link JobStatus#FAILED}
   */
  public Optional<JobOutcome.Failure> failure() {
    return outcome instanceof JobOutcome.Failure failure ? Optional.of(failure) : Optional.empty();
  }

  /**
   * Age of the record relative to its last update.
   *
   * @param nowMillis reference time
   * @return milliseconds since {@code updatedAtMillis}
   */
  public long ageMillis(long nowMillis) {
    return nowMillis - updatedAtMillis;
  }

  private void requireTransition(JobStatus next) {
    if (!status.canTransitionTo(next)) {
      throw new IllegalStateException(
          "Illegal transition " + status + " -> " + next + " for job " + analysisId);
    }
  }
}
