/**
 * Logback helpers for ready-made console and file sink loggers.
 * <p><strong>Concurrency:</strong> Builders are meant for startup; built loggers are thread-safe.</p>
 */
package ca.gc.cra.funnel.logging;
