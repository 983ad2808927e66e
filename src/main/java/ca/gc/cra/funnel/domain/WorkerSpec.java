package ca.gc.cra.funnel.domain;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Describes a worker process: the class whose {@code main(String[])} runs in the worker, its arguments,
 * extra JVM options and environment, and whether the worker shares the parent's standard streams.
 *
 * @param mainClass fully qualified name of the worker entry class
 * @param arguments arguments passed to the entry point
 * @param jvmOptions extra options placed before the class path (e.g. {@code -Xmx64m})
 * @param environment variables added to the inherited environment
 * @param inheritIo {@code true} to share stdin/stdout/stderr with the parent
 * @since FUNNEL 0.1
 */
public record WorkerSpec(
    String mainClass,
    List<String> arguments,
    List<String> jvmOptions,
    Map<String, String> environment,
    boolean inheritIo) {

  public WorkerSpec {
    Objects.requireNonNull(mainClass, "mainClass");
    if (mainClass.isBlank()) {
      throw new IllegalArgumentException("mainClass must not be blank");
    }
    arguments = List.copyOf(Objects.requireNonNull(arguments, "arguments"));
    jvmOptions = List.copyOf(Objects.requireNonNull(jvmOptions, "jvmOptions"));
    environment = Map.copyOf(Objects.requireNonNull(environment, "environment"));
  }

  /**
   * Creates a spec for {@code mainClass} with the given arguments, no extra options and shared IO.
   *
   * @param mainClass worker entry class
   * @param arguments entry point arguments
   * @return worker spec
   */
  public static WorkerSpec of(Class<?> mainClass, String... arguments) {
    Objects.requireNonNull(mainClass, "mainClass");
    return new WorkerSpec(mainClass.getName(), List.of(arguments), List.of(), Map.of(), true);
  }

  /**
   * Returns a copy with one more environment variable.
   *
   * @param name variable name
   * @param value variable value
   * @return new spec
   */
  public WorkerSpec withEnvironment(String name, String value) {
    Map<String, String> merged = new LinkedHashMap<>(environment);
    merged.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
    return new WorkerSpec(mainClass, arguments, jvmOptions, merged, inheritIo);
  }

  /**
   * Returns a copy with the given JVM options.
   *
   * @param options options placed before the class path
   * @return new spec
   */
  public WorkerSpec withJvmOptions(String... options) {
    return new WorkerSpec(mainClass, arguments, List.of(options), environment, inheritIo);
  }

  /**
   * Returns a copy that discards or shares standard streams.
   *
   * @param inherit {@code true} to share the parent's streams
   * @return new spec
   */
  public WorkerSpec withInheritIo(boolean inherit) {
    return new WorkerSpec(mainClass, arguments, jvmOptions, environment, inherit);
  }
}
