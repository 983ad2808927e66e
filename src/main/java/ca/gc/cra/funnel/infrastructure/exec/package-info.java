/**
 * Thread factories for session consumer, bridge acceptor, bridge reader and worker-side producer threads.
 * <p><strong>Role:</strong> Infrastructure utilities naming background threads so they are identifiable in dumps.</p>
 * <p><strong>Concurrency:</strong> Provides thread-safe factory methods.</p>
 * <p><strong>Security:</strong> Thread names carry sink names only; no tokens or payloads.</p>
 */
package ca.gc.cra.funnel.infrastructure.exec;
