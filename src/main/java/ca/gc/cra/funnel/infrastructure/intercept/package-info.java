/**
 * Logback adapters: the root-level interception appender, the backbone port over a {@code LoggerContext},
 * and the sink adapter that dispatches aggregated records.
 * <p><strong>Concurrency:</strong> Interception runs on every logging thread and never blocks.
 * <p><strong>Observability:</strong> Appender failures surface through Logback's status manager.
 */
package ca.gc.cra.funnel.infrastructure.intercept;
