package ca.gc.cra.funnel.infrastructure.metrics;

import ca.gc.cra.funnel.application.port.MetricsPort;
import ca.gc.cra.funnel.config.AggregatorSettings;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Metrics adapter that forwards aggregation counters and observations to OpenTelemetry.
 *
 * <p>Instruments are created on first use and cached per key. The update methods never log: they run on
 * logging threads while an interceptor is installed.</p>
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final AttributeKey<Long> ORIGIN_PID = AttributeKey.longKey("funnel.pid");

  private final OpenTelemetryBootstrap.BootstrapResult bootstrap;
  private final Meter meter;
  private final Attributes attributes;
  private final ConcurrentMap<String, LongCounter> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, LongHistogram> histograms = new ConcurrentHashMap<>();

  /**
   * Creates an adapter for the given exporter name ({@code none} or {@code otlp}).
   *
   * @param exporter exporter name
   */
  public OpenTelemetryMetricsAdapter(String exporter) {
    this(OpenTelemetryBootstrap.initialize(exporter));
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult bootstrap) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    this.meter = bootstrap.meter();
    this.attributes = Attributes.of(ORIGIN_PID, ProcessHandle.current().pid());
  }

  /**
   * Chooses the metrics port for a set of settings.
   *
   * @param settings aggregation settings
   * @return {@link MetricsPort#NO_OP} when metrics are disabled, otherwise an OpenTelemetry adapter
   */
  public static MetricsPort forSettings(AggregatorSettings settings) {
    Objects.requireNonNull(settings, "settings");
    if (!settings.metricsEnabled()) {
      return MetricsPort.NO_OP;
    }
    return new OpenTelemetryMetricsAdapter(settings.metricsExporter());
  }

  @Override
  public void increment(String key) {
    Objects.requireNonNull(key, "key");
    counters.computeIfAbsent(key, this::createCounter).add(1, attributes);
  }

  @Override
  public void observe(String key, long value) {
    Objects.requireNonNull(key, "key");
    histograms.computeIfAbsent(key, this::createHistogram).record(value, attributes);
  }

  boolean isNoop() {
    return bootstrap.isNoop();
  }

  void forceFlush() {
    bootstrap.forceFlush();
  }

  /** Flushes and shuts down the meter provider. */
  @Override
  public void close() {
    bootstrap.close();
  }

  private LongCounter createCounter(String key) {
    return meter.counterBuilder(key)
        .setUnit("1")
        .setDescription("Log aggregation counter " + key)
        .build();
  }

  private LongHistogram createHistogram(String key) {
    return meter.histogramBuilder(key)
        .ofLongs()
        .setDescription("Log aggregation observation " + key)
        .build();
  }
}
