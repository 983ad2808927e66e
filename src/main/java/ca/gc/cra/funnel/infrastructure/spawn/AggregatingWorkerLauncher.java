package ca.gc.cra.funnel.infrastructure.spawn;

import ca.gc.cra.funnel.application.port.LogBackbone;
import ca.gc.cra.funnel.application.port.WorkerLauncher;
import ca.gc.cra.funnel.config.AggregatorSettings;
import ca.gc.cra.funnel.domain.HandlerSnapshot;
import ca.gc.cra.funnel.domain.WorkerSpec;
import ca.gc.cra.funnel.infrastructure.channel.RecordCodec;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Launcher decorator that hands the parent's interception points to each new worker.
 * <p><strong>How:</strong> At launch time it snapshots every interception point installed on the backbone,
 * encodes the snapshots as JSON into {@value WorkerBootstrap#SNAPSHOT_ENV} and passes the session settings as
 * {@code -Dfunnel.*} options; {@link WorkerBootstrap} rebuilds the interceptors in the child before its entry
 * point runs. With nothing installed the worker spec passes through unchanged.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from its collaborators; safe from any thread.</p>
 *
 * @since FUNNEL 0.1
 */
public final class AggregatingWorkerLauncher implements WorkerLauncher {
  private final WorkerLauncher delegate;
  private final LogBackbone backbone;
  private final AggregatorSettings settings;
  private final RecordCodec codec = new RecordCodec();

  /**
   * Wraps a launcher.
   *
   * @param delegate launcher that actually starts processes
   * @param backbone backbone whose interception points are propagated
   * @param settings settings forwarded to workers
   */
  public AggregatingWorkerLauncher(WorkerLauncher delegate, LogBackbone backbone, AggregatorSettings settings) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    this.backbone = Objects.requireNonNull(backbone, "backbone");
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  /**
   * Returns {@code previous} if it already propagates this backbone's interception points, otherwise a new
   * decorator around it. Nested sessions therefore never stack decorators.
   *
   * @param previous currently installed launcher
   * @param backbone backbone to snapshot
   * @param settings settings forwarded to workers
   * @return aggregating launcher
   */
  public static WorkerLauncher wrap(WorkerLauncher previous, LogBackbone backbone, AggregatorSettings settings) {
    if (previous instanceof AggregatingWorkerLauncher aggregating && aggregating.backbone == backbone) {
      return aggregating;
    }
    return new AggregatingWorkerLauncher(previous, backbone, settings);
  }

  public WorkerLauncher delegate() {
    return delegate;
  }

  @Override
  public Process launch(WorkerSpec spec) throws IOException {
    return delegate.launch(prepare(spec));
  }

  WorkerSpec prepare(WorkerSpec spec) {
    List<HandlerSnapshot> snapshots = backbone.snapshotInterceptors();
    if (snapshots.isEmpty()) {
      return spec;
    }
    List<String> options = new ArrayList<>(spec.jvmOptions());
    for (Map.Entry<String, String> property : settings.toSystemProperties().entrySet()) {
      String prefix = "-D" + property.getKey() + "=";
      if (options.stream().noneMatch(option -> option.startsWith(prefix))) {
        options.add(prefix + property.getValue());
      }
    }
    return spec.withJvmOptions(options.toArray(String[]::new))
        .withEnvironment(WorkerBootstrap.SNAPSHOT_ENV, codec.encodeSnapshots(snapshots));
  }
}
