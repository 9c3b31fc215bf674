package ca.gc.cra.prism.application.scheduler;

import ca.gc.cra.prism.domain.analysis.Priority;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Point-in-time aggregate over the result store and tier queues.
 *
 * @param total number of records in the store
 * @param queued records in {@code QUEUED}
 * @param processing records in {@code PROCESSING}
 * @param completed records in {@code COMPLETED}
 * @param failed records in {@code FAILED}
 * @param queueDepths current depth per tier; all tiers present
 * @param avgProcessingMillis mean processing time over completed records, {@code 0} when none
 * @param successRate {@code completed / total} in {@code [0, 1]}, {@code 0} for an empty store
 * @since 0.1.0
 */
public record SchedulerMetrics(
    int total,
    int queued,
    int processing,
    int completed,
    int failed,
    Map<Priority, Integer> queueDepths,
    double avgProcessingMillis,
    double successRate) {

  /** Copies the depth map. */
  public SchedulerMetrics {
    Objects.requireNonNull(queueDepths, "queueDepths");
    Map<Priority, Integer> copy = new EnumMap<>(Priority.class);
    for (Priority priority : Priority.values()) {
      copy.put(priority, queueDepths.getOrDefault(priority, 0));
    }
    queueDepths = Collections.unmodifiableMap(copy);
  }

  /**
   * Success rate expressed as a percentage.
   *
   * @return {@code successRate * 100}
   */
  public double successPercent() {
    return successRate * 100.0;
  }
}
