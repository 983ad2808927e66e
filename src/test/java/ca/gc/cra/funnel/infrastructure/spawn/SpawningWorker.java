package ca.gc.cra.funnel.infrastructure.spawn;

import ca.gc.cra.funnel.domain.WorkerSpec;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Worker that starts an {@link EmittingWorker} with its own arguments and reports the grandchild's pid. */
public final class SpawningWorker {
  private static final Logger log = LoggerFactory.getLogger("spawner");

  private SpawningWorker() {}

  public static void main(String[] args) throws Exception {
    Process grandchild = WorkerLauncherRegistry.global()
        .launch(WorkerSpec.of(EmittingWorker.class, args).withInheritIo(false));
    log.info("spawned {}", grandchild.pid());
    if (!grandchild.waitFor(60, TimeUnit.SECONDS)) {
      grandchild.destroyForcibly();
      throw new IllegalStateException("grandchild did not finish");
    }
  }
}
