package ca.gc.cra.funnel.application.port;

import ca.gc.cra.funnel.domain.WorkerSpec;
import java.io.IOException;

/**
 * <strong>What:</strong> Strategy that creates operating-system worker processes.
 * <p><strong>Why:</strong> Aggregation sessions swap in a spawn-aware launcher for their lifetime; application
 * code that launches workers through {@code WorkerLauncherRegistry} picks up the swap without changes.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe to call from any thread.</p>
 *
 * @since FUNNEL 0.1
 */
@FunctionalInterface
public interface WorkerLauncher {
  /**
   * Starts a worker process.
   *
   * @param spec description of the worker's entry point and environment
   * @return the running process
   * @throws IOException if the process cannot be started
   */
  Process launch(WorkerSpec spec) throws IOException;
}
