/**
 * <strong>Purpose:</strong> Value types moved between interception points, channels and consumers.
 * <p><strong>Concurrency:</strong> {@link ca.gc.cra.funnel.domain.CapturedRecord} is handed off between
 * threads and never shared; the remaining types are immutable records.
 * <p><strong>Serialization:</strong> Every type here is reducible to plain strings and numbers so it can
 * cross a process boundary; see {@code ca.gc.cra.funnel.infrastructure.channel.RecordCodec}.
 *
 * @since FUNNEL 0.1
 */
package ca.gc.cra.funnel.domain;
