package ca.gc.cra.prism.config;

import ca.gc.cra.prism.application.port.ClockPort;
import ca.gc.cra.prism.application.port.DetectorPort;
import ca.gc.cra.prism.application.port.MetricsPort;
import ca.gc.cra.prism.application.port.ModelLocatorPort;
import ca.gc.cra.prism.application.port.ResultStore;
import ca.gc.cra.prism.application.scheduler.AnalysisScheduler;
import ca.gc.cra.prism.infrastructure.detect.FileSignatureDetector;
import ca.gc.cra.prism.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.prism.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.prism.infrastructure.model.FileSystemModelLocator;
import ca.gc.cra.prism.infrastructure.store.InMemoryResultStore;
import ca.gc.cra.prism.infrastructure.time.SystemClockAdapter;
import java.util.Locale;
import java.util.Objects;

/**
 * <strong>What:</strong> Wires the analysis scheduler to its production adapters.
 * <p><strong>Why:</strong> Keeps adapter selection in one place so the scheduler and CLI depend only on
 * ports.</p>
 * <p><strong>Thread-safety:</strong> Holds immutable references; each factory call builds a new graph.</p>
 *
 * @since 0.1.0
 * @see AnalysisScheduler
 */
public final class CompositionRoot {
  private final SchedulerConfig config;
  private final MetricsPort metrics;
  private final ClockPort clock;

  /**
   * Creates a composition root.
   *
   * @param config scheduler configuration
   * @param metrics metrics sink shared by everything this root builds
   */
  public CompositionRoot(SchedulerConfig config, MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.clock = new SystemClockAdapter();
  }

  /**
   * Selects the metrics adapter for an exporter name.
   *
   * @param exporter {@code otlp} or {@code none}; blank means {@code none}
   * @return metrics adapter
   */
  public static MetricsPort metricsFor(String exporter) {
    String normalized = exporter == null ? "" : exporter.trim().toLowerCase(Locale.ROOT);
    return normalized.equals("otlp") ? new OpenTelemetryMetricsAdapter() : new NoOpMetricsAdapter();
  }

  /**
   * Builds a scheduler backed by the in-memory store, the signature detector, and the file-system model
   * locator. The caller starts and shuts it down.
   *
   * @return new, unstarted scheduler
   */
  public AnalysisScheduler analysisScheduler() {
    return new AnalysisScheduler(
        config.settings(), detectorFactory(), modelLocator(), resultStore(), clock, metrics);
  }

  DetectorPort.Factory detectorFactory() {
    return FileSignatureDetector.factory();
  }

  ModelLocatorPort modelLocator() {
    return new FileSystemModelLocator(config.modelBase());
  }

  ResultStore resultStore() {
    return new InMemoryResultStore();
  }

  /**
   * Metrics sink used by built components.
   *
   * @return metrics port
   */
  public MetricsPort metrics() {
    return metrics;
  }

  /**
   * Configuration this root wires from.
   *
   * @return configuration
   */
  public SchedulerConfig config() {
    return config;
  }
}
