package ca.gc.cra.funnel.infrastructure.spawn;

import ca.gc.cra.funnel.config.AggregatorSettings;
import ca.gc.cra.funnel.infrastructure.channel.TransportDiagnostics;
import ca.gc.cra.funnel.infrastructure.intercept.LogbackBackbone;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Arrays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of worker JVMs started by {@link JvmWorkerLauncher}.
 *
 * <p>Usage: {@code WorkerBootstrap <main-class> [args...]}. Installs the interceptors passed in
 * {@value #SNAPSHOT_ENV}, runs {@code main-class.main(args)}, then uninstalls them and flushes pending records to
 * the parent. A shutdown hook performs the same cleanup when the target calls {@link System#exit(int)}.</p>
 *
 * <p>Exit status: 0 when the target returns normally, {@value #EXIT_TARGET_FAILED} when the target throws,
 * {@value #EXIT_USAGE} when the target cannot be loaded.</p>
 *
 * @since FUNNEL 0.1
 */
public final class WorkerBootstrap {
  /** Environment variable carrying the parent's interception snapshots as a JSON array. */
  public static final String SNAPSHOT_ENV = "FUNNEL_INTERCEPT_SNAPSHOT";

  static final int EXIT_TARGET_FAILED = 1;
  static final int EXIT_USAGE = 2;

  private static final Logger log = LoggerFactory.getLogger(WorkerBootstrap.class);

  private WorkerBootstrap() {}

  public static void main(String[] args) {
    if (args.length == 0) {
      System.err.println("usage: WorkerBootstrap <main-class> [args...]");
      System.exit(EXIT_USAGE);
    }
    Method entry;
    try {
      entry = resolveEntry(args[0]);
    } catch (ReflectiveOperationException | IllegalArgumentException ex) {
      log.error("Cannot start worker {}", args[0], ex);
      System.exit(EXIT_USAGE);
      return;
    }

    LogbackBackbone backbone = LogbackBackbone.fromSlf4j();
    InterceptInstallation installation = InterceptInstallation.fromEnvironment(
        System.getenv(),
        backbone,
        WorkerLauncherRegistry.global(),
        AggregatorSettings.fromSystemProperties(),
        TransportDiagnostics.toStandardError(backbone.context()));
    Runtime.getRuntime().addShutdownHook(new Thread(installation::afterEntry, "funnel-worker-shutdown"));

    String[] targetArgs = Arrays.copyOfRange(args, 1, args.length);
    boolean failed = false;
    installation.beforeEntry();
    try {
      entry.invoke(null, (Object) targetArgs);
    } catch (InvocationTargetException ex) {
      failed = true;
      // Still inside the interception window: the parent's sink receives this.
      log.error("Worker {} terminated with an exception", args[0], ex.getCause());
    } catch (IllegalAccessException ex) {
      failed = true;
      log.error("Worker {} entry point is not accessible", args[0], ex);
    } finally {
      installation.afterEntry();
    }
    if (failed) {
      System.exit(EXIT_TARGET_FAILED);
    }
  }

  static Method resolveEntry(String className) throws ReflectiveOperationException {
    ClassLoader loader = Thread.currentThread().getContextClassLoader();
    Class<?> target = Class.forName(className, true, loader);
    Method entry = target.getMethod("main", String[].class);
    if (!Modifier.isStatic(entry.getModifiers())) {
      throw new IllegalArgumentException(className + ".main(String[]) is not static");
    }
    return entry;
  }
}
