/**
 * Aggregation sessions and their consumer loop.
 * <p><strong>Role:</strong> Application layer; wires the channel, the root interceptor and the spawn-aware
 * launcher together for the lifetime of a session.</p>
 * <p><strong>Concurrency:</strong> One consumer thread per session; producers never block.</p>
 * <p><strong>Metrics:</strong> {@code funnel.consumer.*} counters.</p>
 */
package ca.gc.cra.funnel.application.aggregation;
