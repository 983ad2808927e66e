package ca.gc.cra.funnel.infrastructure.spawn;

import ca.gc.cra.funnel.application.port.WorkerLauncher;
import ca.gc.cra.funnel.domain.WorkerSpec;
import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the launcher application code uses to start worker processes.
 *
 * <p>Code that starts workers through {@link #launch(WorkerSpec)} gets whatever launcher is current, so an
 * aggregation session can swap in a spawn-aware launcher for its lifetime and put the previous one back
 * afterwards.</p>
 *
 * @since FUNNEL 0.1
 */
public final class WorkerLauncherRegistry {
  private static final WorkerLauncherRegistry GLOBAL = new WorkerLauncherRegistry(new JvmWorkerLauncher());

  private final AtomicReference<WorkerLauncher> current;

  /**
   * Creates a registry with an initial launcher.
   *
   * @param initial launcher used until replaced
   */
  public WorkerLauncherRegistry(WorkerLauncher initial) {
    this.current = new AtomicReference<>(Objects.requireNonNull(initial, "initial"));
  }

  /**
   * Returns the process-wide registry, initially holding a {@link JvmWorkerLauncher}.
   *
   * @return global registry
   */
  public static WorkerLauncherRegistry global() {
    return GLOBAL;
  }

  public WorkerLauncher current() {
    return current.get();
  }

  /**
   * Installs a launcher.
   *
   * @param launcher new launcher
   * @return the launcher it replaced
   */
  public WorkerLauncher replace(WorkerLauncher launcher) {
    return current.getAndSet(Objects.requireNonNull(launcher, "launcher"));
  }

  /**
   * Puts back a launcher returned by {@link #replace(WorkerLauncher)}.
   *
   * @param previous launcher to reinstall
   */
  public void restore(WorkerLauncher previous) {
    current.set(Objects.requireNonNull(previous, "previous"));
  }

  /**
   * Starts a worker with the current launcher.
   *
   * @param spec worker description
   * @return running process
   * @throws IOException if the process cannot be started
   */
  public Process launch(WorkerSpec spec) throws IOException {
    return current.get().launch(Objects.requireNonNull(spec, "spec"));
  }
}
