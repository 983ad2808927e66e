/**
 * OpenTelemetry adapter for the aggregation metrics port.
 * <p><strong>Concurrency:</strong> Instruments are cached in concurrent maps; updates are lock-free.</p>
 * <p><strong>Metrics:</strong> Publishes the {@code funnel.*} counters named by
 * {@link ca.gc.cra.funnel.application.port.MetricsPort}.</p>
 */
package ca.gc.cra.funnel.infrastructure.metrics;
