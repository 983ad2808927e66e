package ca.gc.cra.funnel.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.funnel.application.port.MetricsPort;
import ca.gc.cra.funnel.config.AggregatorSettings;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forTesting(reader));
  }

  @AfterEach
  void tearDown() {
    adapter.close();
  }

  @Test
  void incrementRecordsCounterWithProcessAttributes() {
    adapter.increment("funnel.consumer.forwarded");
    adapter.increment("funnel.consumer.forwarded");
    adapter.increment("funnel.consumer.forwarded");
    adapter.forceFlush();

    MetricData counter = metric("funnel.consumer.forwarded");
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(3L, point.getValue());
    assertEquals(ProcessHandle.current().pid(), point.getAttributes().get(AttributeKey.longKey("funnel.pid")));

    assertEquals("funnel", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertEquals("ca.gc.cra", counter.getResource().getAttribute(AttributeKey.stringKey("service.namespace")));
  }

  @Test
  void observeRecordsHistogram() {
    adapter.observe("funnel.bridge.batch", 4L);
    adapter.observe("funnel.bridge.batch", 6L);
    adapter.forceFlush();

    MetricData histogram = metric("funnel.bridge.batch");
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(10.0, point.getSum());
  }

  @Test
  void disabledExporterYieldsNoOpPort() {
    assertSame(MetricsPort.NO_OP, OpenTelemetryMetricsAdapter.forSettings(AggregatorSettings.defaults()));
  }

  @Test
  void otlpSettingsBuildAnActiveAdapter() {
    MetricsPort port = OpenTelemetryMetricsAdapter.forSettings(
        AggregatorSettings.fromMap(Map.of("metrics.exporter", "otlp")));

    OpenTelemetryMetricsAdapter otlp = assertInstanceOf(OpenTelemetryMetricsAdapter.class, port);
    try {
      assertFalse(otlp.isNoop());
    } finally {
      otlp.close();
    }
  }

  @Test
  void unknownExporterFallsBackToNoop() {
    try (OpenTelemetryMetricsAdapter unknown = new OpenTelemetryMetricsAdapter("statsd")) {
      assertTrue(unknown.isNoop());
      unknown.increment("funnel.consumer.forwarded");
    }
  }

  private MetricData metric(String name) {
    return reader.collectAllMetrics().stream()
        .filter(metric -> metric.getName().equals(name))
        .findFirst()
        .orElseThrow(() -> new AssertionError("Expected metric " + name));
  }
}
