/**
 * <strong>Purpose:</strong> Handoff channels moving captured records from any producer thread or worker process
 * to a session's single consumer.
 * <p><strong>Concurrency:</strong> Producers never block; one consumer drains; close-then-drain is the only
 * termination path.
 * <p><strong>Transport:</strong> Worker processes reach the owning JVM through a loopback socket bridge carrying
 * newline-delimited JSON encoded with Jackson's streaming API.
 * <p><strong>Observability:</strong> Failures inside an interception window are reported once through
 * {@link ca.gc.cra.funnel.infrastructure.channel.TransportDiagnostics}, never through SLF4J.
 * <p><strong>Security:</strong> The bridge binds loopback only and requires the per-session token.
 *
 * @since FUNNEL 0.1
 */
package ca.gc.cra.funnel.infrastructure.channel;
