/**
 * Ports that isolate the aggregation core from Logback, sockets and process creation.
 * <p><strong>Role:</strong> Boundary of the hexagon; adapters live under {@code ca.gc.cra.funnel.infrastructure}.</p>
 * <p><strong>Concurrency:</strong> Each port documents its guarantees; producer-facing methods never block.</p>
 * <p><strong>Metrics:</strong> {@link ca.gc.cra.funnel.application.port.MetricsPort} defines the counter contract.</p>
 */
package ca.gc.cra.funnel.application.port;
