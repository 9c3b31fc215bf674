package ca.gc.cra.prism.application.scheduler;

import ca.gc.cra.prism.domain.analysis.Priority;

/**
 * Raised in {@link BackpressureMode#REJECT} mode when a tier queue stays full past the offer timeout.
 * The job is not created.
 *
 * @since 0.1.0
 */
public final class QueueFullException extends IllegalStateException {
  private static final long serialVersionUID = 1L;

  private final Priority priority;

  /**
   * Creates an exception for the saturated tier.
   *
   * @param priority tier whose queue was full
   * @param capacity configured capacity of that queue
   */
  public QueueFullException(Priority priority, int capacity) {
    super("Queue for " + priority.wireName() + " priority is full (capacity=" + capacity + ")");
    this.priority = priority;
  }

  /**
   * Returns the saturated tier.
   *
   * @return tier whose queue rejected the submission
   */
  public Priority priority() {
    return priority;
  }
}
