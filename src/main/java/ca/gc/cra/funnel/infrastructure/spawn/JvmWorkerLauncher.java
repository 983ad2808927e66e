package ca.gc.cra.funnel.infrastructure.spawn;

import ca.gc.cra.funnel.application.port.WorkerLauncher;
import ca.gc.cra.funnel.domain.WorkerSpec;
import java.io.IOException;
import java.lang.ProcessBuilder.Redirect;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Starts workers as child JVMs running {@link WorkerBootstrap} on the parent's class path.
 *
 * <p>Command line: {@code <java> <jvmOptions> -cp <classPath> WorkerBootstrap <mainClass> <arguments>}. The child
 * inherits the parent's environment except {@value WorkerBootstrap#SNAPSHOT_ENV}, which only reaches the child
 * when the {@link WorkerSpec} sets it.</p>
 *
 * @since FUNNEL 0.1
 */
public final class JvmWorkerLauncher implements WorkerLauncher {
  private final Path javaExecutable;
  private final String classPath;

  /** Uses the running JVM's {@code java} binary and class path. */
  public JvmWorkerLauncher() {
    this(Path.of(System.getProperty("java.home"), "bin", "java"), System.getProperty("java.class.path", ""));
  }

  /**
   * Creates a launcher with an explicit JVM and class path.
   *
   * @param javaExecutable path to the {@code java} binary
   * @param classPath class path handed to the child
   */
  public JvmWorkerLauncher(Path javaExecutable, String classPath) {
    this.javaExecutable = Objects.requireNonNull(javaExecutable, "javaExecutable");
    this.classPath = Objects.requireNonNull(classPath, "classPath");
  }

  @Override
  public Process launch(WorkerSpec spec) throws IOException {
    ProcessBuilder builder = new ProcessBuilder(command(spec));
    Map<String, String> environment = builder.environment();
    environment.remove(WorkerBootstrap.SNAPSHOT_ENV);
    environment.putAll(spec.environment());
    if (spec.inheritIo()) {
      builder.inheritIO();
    } else {
      builder.redirectOutput(Redirect.DISCARD);
      builder.redirectError(Redirect.DISCARD);
    }
    return builder.start();
  }

  List<String> command(WorkerSpec spec) {
    List<String> command = new ArrayList<>();
    command.add(javaExecutable.toString());
    command.addAll(spec.jvmOptions());
    command.add("-cp");
    command.add(classPath);
    command.add(WorkerBootstrap.class.getName());
    command.add(spec.mainClass());
    command.addAll(spec.arguments());
    return command;
  }
}
