package ca.gc.cra.prism.api;

import ca.gc.cra.prism.validation.Strings;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves telemetry keys from the CLI configuration into the system properties read by the
 * OpenTelemetry bootstrap.
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  private TelemetryConfigurator() {}

  /**
   * Applies and removes {@code metricsExporter}, {@code otelEndpoint}, and
   * {@code otelResourceAttributes} from {@code args}.
   *
   * @param args mutable configuration map
   * @return normalized exporter name, {@code none} when unset
   * @throws IllegalArgumentException if a value is invalid
   */
  static String configureMetrics(Map<String, String> args) {
    String exporter = trim(args.remove("metricsExporter")).toLowerCase(Locale.ROOT);
    if (exporter.isEmpty()) {
      exporter = "none";
    }
    if (!exporter.equals("otlp") && !exporter.equals("none")) {
      throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
    }
    System.setProperty("otel.metrics.exporter", exporter);

    String endpoint = trim(args.remove("otelEndpoint"));
    if (!endpoint.isEmpty()) {
      validateEndpoint(endpoint);
      log.debug("Configuring OTLP endpoint: {}", endpoint);
      System.setProperty("otel.exporter.otlp.endpoint", endpoint);
    }

    String resourceAttributes = trim(args.remove("otelResourceAttributes"));
    if (!resourceAttributes.isEmpty()) {
      Strings.requirePrintableAscii("otelResourceAttributes", resourceAttributes, MAX_RESOURCE_ATTRIBUTES_LENGTH);
      System.setProperty("otel.resource.attributes", resourceAttributes);
    }
    return exporter;
  }

  private static void validateEndpoint(String raw) {
    URI uri;
    try {
      uri = new URI(raw);
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
    String scheme = uri.getScheme();
    if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
      throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
    }
    if (uri.getHost() == null || uri.getHost().isBlank()) {
      throw new IllegalArgumentException("otelEndpoint must include a host");
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
