/**
 * Worker process creation and spawn-time propagation of interception.
 * <p><strong>Role:</strong> Parent side ({@link ca.gc.cra.funnel.infrastructure.spawn.AggregatingWorkerLauncher})
 * snapshots interception points; child side ({@link ca.gc.cra.funnel.infrastructure.spawn.WorkerBootstrap})
 * reinstalls them around the worker's entry point.</p>
 * <p><strong>Security:</strong> Snapshots carry a per-session bridge token; bridges only bind loopback.</p>
 */
package ca.gc.cra.funnel.infrastructure.spawn;
