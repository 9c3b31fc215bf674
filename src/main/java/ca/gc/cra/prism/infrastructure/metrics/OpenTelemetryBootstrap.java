package ca.gc.cra.prism.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.MeterProvider;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import java.lang.management.ManagementFactory;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the OpenTelemetry meter provider for PRISM from system properties and environment.
 *
 * <p>Recognized settings, system property first: {@code otel.metrics.exporter} /
 * {@code OTEL_METRICS_EXPORTER} ({@code otlp} or {@code none}), {@code otel.exporter.otlp.endpoint} /
 * {@code OTEL_EXPORTER_OTLP_ENDPOINT}, {@code otel.resource.attributes} /
 * {@code OTEL_RESOURCE_ATTRIBUTES}.</p>
 */
final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);
  static final String INSTRUMENTATION_SCOPE = "ca.gc.cra.prism";
  private static final String DEFAULT_ENDPOINT = "http://localhost:4317";
  private static final Duration EXPORT_INTERVAL = Duration.ofSeconds(30);
  private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
  private static final AttributeKey<String> SERVICE_NAMESPACE = AttributeKey.stringKey("service.namespace");
  private static final AttributeKey<String> SERVICE_VERSION = AttributeKey.stringKey("service.version");
  private static final AttributeKey<String> SERVICE_INSTANCE_ID = AttributeKey.stringKey("service.instance.id");

  private OpenTelemetryBootstrap() {
    // Utility class
  }

  static BootstrapResult initialize() {
    try {
      Settings settings = Settings.fromEnvironment();
      if (settings.exporter() == ExporterMode.NONE) {
        log.info("OpenTelemetry metrics exporter disabled (exporter=none)");
        return BootstrapResult.noop();
      }
      OtlpGrpcMetricExporter exporter =
          OtlpGrpcMetricExporter.builder().setEndpoint(settings.endpoint()).build();
      MetricReader reader = PeriodicMetricReader.builder(exporter).setInterval(EXPORT_INTERVAL).build();
      BootstrapResult result = build(reader, settings.resourceAttributes());
      log.info("OpenTelemetry metrics exporting to {} every {}s", settings.endpoint(), EXPORT_INTERVAL.toSeconds());
      return result;
    } catch (RuntimeException ex) {
      log.error("Failed to initialize OpenTelemetry metrics; metrics disabled", ex);
      return BootstrapResult.noop();
    }
  }

  static BootstrapResult forTesting(MetricReader reader) {
    return build(Objects.requireNonNull(reader, "reader"), Attributes.empty());
  }

  private static BootstrapResult build(MetricReader reader, Attributes extra) {
    String version = serviceVersion();
    SdkMeterProvider provider = SdkMeterProvider.builder()
        .setResource(resource(version, extra))
        .registerMetricReader(reader)
        .build();
    Meter meter = provider.meterBuilder(INSTRUMENTATION_SCOPE).setInstrumentationVersion(version).build();
    return new BootstrapResult(meter, provider);
  }

  private static Resource resource(String version, Attributes extra) {
    AttributesBuilder builder = Attributes.builder()
        .put(SERVICE_NAME, "prism")
        .put(SERVICE_NAMESPACE, "ca.gc.cra")
        .put(SERVICE_VERSION, version)
        .put(SERVICE_INSTANCE_ID, ManagementFactory.getRuntimeMXBean().getName());
    Resource merged = Resource.getDefault().merge(Resource.create(builder.build()));
    return extra.isEmpty() ? merged : merged.merge(Resource.create(extra));
  }

  static Attributes parseResourceAttributes(String raw) {
    if (raw == null || raw.isBlank()) {
      return Attributes.empty();
    }
    AttributesBuilder builder = Attributes.builder();
    for (String token : raw.split(",")) {
      String entry = token.trim();
      int idx = entry.indexOf('=');
      if (idx <= 0 || idx == entry.length() - 1) {
        if (!entry.isEmpty()) {
          log.warn("Ignoring malformed resource attribute: {}", entry);
        }
        continue;
      }
      builder.put(AttributeKey.stringKey(entry.substring(0, idx).trim()), entry.substring(idx + 1).trim());
    }
    return builder.build();
  }

  private static String serviceVersion() {
    Package pkg = OpenTelemetryBootstrap.class.getPackage();
    String version = pkg == null ? null : pkg.getImplementationVersion();
    return version == null || version.isBlank() ? "0.0.0-dev" : version;
  }

  private static String firstNonBlank(String... candidates) {
    for (String candidate : candidates) {
      if (candidate != null && !candidate.isBlank()) {
        return candidate.trim();
      }
    }
    return "";
  }

  enum ExporterMode {
    OTLP,
    NONE;

    static ExporterMode from(String raw) {
      String normalized = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
      return switch (normalized) {
        case "none" -> NONE;
        case "", "otlp" -> OTLP;
        default -> {
          log.warn("Unknown metrics exporter '{}'; using otlp", raw);
          yield OTLP;
        }
      };
    }
  }

  record Settings(ExporterMode exporter, String endpoint, Attributes resourceAttributes) {
    static Settings fromEnvironment() {
      ExporterMode exporter = ExporterMode.from(firstNonBlank(
          System.getProperty("otel.metrics.exporter"), System.getenv("OTEL_METRICS_EXPORTER")));
      String endpoint = firstNonBlank(
          System.getProperty("otel.exporter.otlp.endpoint"),
          System.getenv("OTEL_EXPORTER_OTLP_ENDPOINT"),
          DEFAULT_ENDPOINT);
      Attributes attributes = parseResourceAttributes(firstNonBlank(
          System.getProperty("otel.resource.attributes"), System.getenv("OTEL_RESOURCE_ATTRIBUTES")));
      return new Settings(exporter, endpoint, attributes);
    }
  }

  static final class BootstrapResult implements AutoCloseable {
    private final Meter meter;
    private final SdkMeterProvider provider;

    private BootstrapResult(Meter meter, SdkMeterProvider provider) {
      this.meter = meter;
      this.provider = provider;
    }

    static BootstrapResult noop() {
      return new BootstrapResult(MeterProvider.noop().get(INSTRUMENTATION_SCOPE), null);
    }

    Meter meter() {
      return meter;
    }

    boolean isNoop() {
      return provider == null;
    }

    void forceFlush() {
      if (provider != null && !provider.forceFlush().join(5, TimeUnit.SECONDS).isSuccess()) {
        log.warn("OpenTelemetry metrics flush did not complete within timeout");
      }
    }

    @Override
    public void close() {
      if (provider == null) {
        return;
      }
      try {
        CompletableResultCode shutdown = provider.shutdown().join(5, TimeUnit.SECONDS);
        if (!shutdown.isSuccess()) {
          log.warn("Timed out waiting for OpenTelemetry meter provider shutdown");
        }
      } catch (RuntimeException ex) {
        log.warn("Failed to close OpenTelemetry meter provider cleanly", ex);
      }
    }
  }
}
