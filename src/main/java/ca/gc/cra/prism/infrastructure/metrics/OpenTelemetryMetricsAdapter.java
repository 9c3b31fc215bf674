package ca.gc.cra.prism.infrastructure.metrics;

import ca.gc.cra.prism.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forwards scheduler counters and observations to OpenTelemetry instruments.
 *
 * <p>Instruments are created lazily, one per metric key. The original key is attached as the
 * {@code prism.metric.key} attribute because instrument names are sanitized.</p>
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  private static final AttributeKey<String> METRIC_KEY = AttributeKey.stringKey("prism.metric.key");
  private static final String FALLBACK_NAME = "prism.metric";

  private final OpenTelemetryBootstrap.BootstrapResult bootstrap;
  private final Meter meter;
  private final ConcurrentMap<String, Instrument<LongCounter>> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Instrument<LongHistogram>> histograms = new ConcurrentHashMap<>();

  /** Creates an adapter wired to the environment-configured exporter. */
  public OpenTelemetryMetricsAdapter() {
    this(OpenTelemetryBootstrap.initialize());
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult bootstrap) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    this.meter = bootstrap.meter();
    if (bootstrap.isNoop()) {
      log.info("OpenTelemetry metrics adapter running in noop mode");
    }
  }

  @Override
  public void increment(String key) {
    Instrument<LongCounter> counter = counters.computeIfAbsent(Objects.requireNonNull(key, "key"), k ->
        new Instrument<>(meter.counterBuilder(sanitize(k)).setUnit("1")
            .setDescription("PRISM counter for " + k).build(), Attributes.of(METRIC_KEY, k)));
    counter.instrument().add(1, counter.attributes());
  }

  @Override
  public void observe(String key, long value) {
    Instrument<LongHistogram> histogram = histograms.computeIfAbsent(Objects.requireNonNull(key, "key"), k ->
        new Instrument<>(meter.histogramBuilder(sanitize(k)).ofLongs()
            .setDescription("PRISM observation for " + k).build(), Attributes.of(METRIC_KEY, k)));
    histogram.instrument().record(value, histogram.attributes());
  }

  /** Pushes pending data to the exporter. */
  public void forceFlush() {
    bootstrap.forceFlush();
  }

  /** Flushes and shuts down the meter provider. */
  @Override
  public void close() {
    bootstrap.close();
  }

  static String sanitize(String key) {
    String lower = key.trim().toLowerCase(Locale.ROOT);
    if (lower.isEmpty()) {
      return FALLBACK_NAME;
    }
    StringBuilder name = new StringBuilder(lower.length() + 1);
    if (!Character.isLetter(lower.charAt(0))) {
      name.append('m');
    }
    for (int i = 0; i < lower.length(); i++) {
      char c = lower.charAt(i);
      name.append(Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' ? c : '_');
    }
    return name.toString();
  }

  private record Instrument<T>(T instrument, Attributes attributes) {}
}
