package ca.gc.cra.prism.application.scheduler;

import ca.gc.cra.prism.domain.analysis.JobRecord;
import ca.gc.cra.prism.domain.analysis.Priority;
import java.util.Collection;
import java.util.Map;

/**
 * Derives {@link SchedulerMetrics} from a store snapshot. Stateless; computed on demand.
 *
 * @since 0.1.0
 */
final class MetricsAggregator {
  private MetricsAggregator() {}

  /**
   * Aggregates records and queue depths.
   *
   * @param records snapshot of the result store
   * @param queueDepths current tier depths
   * @return aggregate metrics
   */
  static SchedulerMetrics aggregate(Collection<JobRecord> records, Map<Priority, Integer> queueDepths) {
    int queued = 0;
    int processing = 0;
    int completed = 0;
    int failed = 0;
    long completedMillis = 0L;
    for (JobRecord record : records) {
      switch (record.status()) {
        case QUEUED -> queued++;
        case PROCESSING -> processing++;
        case COMPLETED -> {
          completed++;
          completedMillis += record.processingMillis();
        }
        case FAILED -> failed++;
        default -> throw new IllegalStateException("Unknown status " + record.status());
      }
    }
    int total = queued + processing + completed + failed;
    double avg = completed == 0 ? 0.0 : (double) completedMillis / completed;
    double successRate = total == 0 ? 0.0 : (double) completed / total;
    return new SchedulerMetrics(total, queued, processing, completed, failed, queueDepths, avg, successRate);
  }
}
