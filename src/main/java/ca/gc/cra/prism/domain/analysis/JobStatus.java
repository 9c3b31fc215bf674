package ca.gc.cra.prism.domain.analysis;

import java.util.Locale;

/**
 * Lifecycle states of an analysis job.
 *
 * <p>Transitions are monotonic: {@code QUEUED -> PROCESSING -> COMPLETED | FAILED}. A queued job may
 * also fail directly when it is abandoned during a forced shutdown. Terminal states never change.</p>
 *
 * @since 0.1.0
 */
public enum JobStatus {
  /** Accepted and waiting in its tier queue. */
  QUEUED,
  /** Dequeued by a worker; the detector is running. */
  PROCESSING,
  /** Detector returned a result. */
  COMPLETED,
  /** Detector raised an error or the job could not run. */
  FAILED;

  /**
   * Indicates whether no further transition can occur.
   *
   * @return {@code true} for {@link #COMPLETED} and {@link #FAILED}
   */
  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED;
  }

  /**
   * Checks whether moving from this state to {@code next} is permitted.
   *
   * @param next candidate state
   * @return {@code true} when the transition is legal
   */
  public boolean canTransitionTo(JobStatus next) {
    if (next == null) {
      return false;
    }
    return switch (this) {
      case QUEUED -> next == PROCESSING || next == FAILED;
      case PROCESSING -> next == COMPLETED || next == FAILED;
      case COMPLETED, FAILED -> false;
    };
  }

  /**
   * Returns the lowercase name used in JSON output.
   *
   * @return wire name such as {@code processing}
   */
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
