package ca.gc.cra.prism.infrastructure.metrics;

import ca.gc.cra.prism.application.port.MetricsPort;

/**
 * Metrics adapter that discards everything; selected with {@code --metrics} absent or
 * {@code metricsExporter=none}.
 *
 * @since 0.1.0
 */
public final class NoOpMetricsAdapter implements MetricsPort {
  @Override
  public void increment(String key) {}

  @Override
  public void observe(String key, long value) {}
}
