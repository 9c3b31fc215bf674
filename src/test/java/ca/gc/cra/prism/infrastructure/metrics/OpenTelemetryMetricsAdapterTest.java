package ca.gc.cra.prism.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Collection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private static final AttributeKey<String> METRIC_KEY = AttributeKey.stringKey("prism.metric.key");

  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forTesting(reader));
  }

  @AfterEach
  void tearDown() {
    if (adapter != null) {
      adapter.close();
    }
  }

  @Test
  void incrementExportsCounterWithServiceResource() {
    adapter.increment("scheduler.job.completed");
    adapter.increment("scheduler.job.completed");
    adapter.forceFlush();

    MetricData counter = find(reader.collectAllMetrics(), "scheduler.job.completed");
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(2L, point.getValue());
    assertEquals("scheduler.job.completed", point.getAttributes().get(METRIC_KEY));
    assertEquals("prism", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertEquals("ca.gc.cra", counter.getResource().getAttribute(AttributeKey.stringKey("service.namespace")));
  }

  @Test
  void observeRecordsHistogramUnderSanitizedName() {
    adapter.observe("scheduler.job.latencyMillis", 40L);
    adapter.observe("scheduler.job.latencyMillis", 60L);
    adapter.forceFlush();

    MetricData histogram = find(reader.collectAllMetrics(), "scheduler.job.latencymillis");
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(100d, point.getSum(), 1e-9);
    assertEquals("scheduler.job.latencyMillis", point.getAttributes().get(METRIC_KEY));
  }

  @Test
  void sanitizeProducesValidInstrumentNames() {
    assertEquals("scheduler.queue.depth.high", OpenTelemetryMetricsAdapter.sanitize("scheduler.queue.depth.high"));
    assertEquals("m9lives", OpenTelemetryMetricsAdapter.sanitize("9lives"));
    assertEquals("a_b", OpenTelemetryMetricsAdapter.sanitize("a b"));
    assertEquals("prism.metric", OpenTelemetryMetricsAdapter.sanitize("  "));
  }

  @Test
  void resourceAttributesIgnoreMalformedEntries() {
    Attributes attributes = OpenTelemetryBootstrap.parseResourceAttributes("env=prod, broken, team = media ");

    assertEquals("prod", attributes.get(AttributeKey.stringKey("env")));
    assertEquals("media", attributes.get(AttributeKey.stringKey("team")));
    assertEquals(2, attributes.size());
    assertTrue(OpenTelemetryBootstrap.parseResourceAttributes(null).isEmpty());
  }

  private static MetricData find(Collection<MetricData> metrics, String name) {
    return metrics.stream()
        .filter(metric -> metric.getName().equals(name))
        .findFirst()
        .orElseThrow(() -> new AssertionError("metric not exported: " + name));
  }
}
