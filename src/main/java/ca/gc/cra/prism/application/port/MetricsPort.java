package ca.gc.cra.prism.application.port;

/**
 * <strong>What:</strong> Domain port abstracting PRISM metrics emission.
 * <p><strong>Why:</strong> Lets the scheduler record counters and latency observations without binding to a
 * vendor SDK.</p>
 * <p><strong>Role:</strong> Domain port implemented by adapters such as {@code OpenTelemetryMetricsAdapter}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Expose counter increments for events like accepted submissions or failed jobs.</li>
 *   <li>Record numeric observations for latency and queue depths.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent updates from submitter,
 * dispatcher, and detector threads.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code scheduler.job.latencyMillis}).</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys; adapters may normalize names.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key metric identifier using dotted naming (e.g., {@code scheduler.job.failed}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram/gauge style metric.
   *
   * @param key metric identifier using dotted naming; must not be {@code null}
   * @param value observed value (e.g., milliseconds, queue depth); semantics defined by the caller
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
