package ca.gc.cra.funnel.infrastructure.spawn;

import ca.gc.cra.funnel.application.port.LogBackbone;
import ca.gc.cra.funnel.application.port.MetricsPort;
import ca.gc.cra.funnel.application.port.WorkerLauncher;
import ca.gc.cra.funnel.config.AggregatorSettings;
import ca.gc.cra.funnel.domain.HandlerSnapshot;
import ca.gc.cra.funnel.infrastructure.channel.RecordCodec;
import ca.gc.cra.funnel.infrastructure.channel.RemoteRecordChannel;
import ca.gc.cra.funnel.infrastructure.channel.TransportDiagnostics;
import ca.gc.cra.funnel.infrastructure.exec.ThreadFactories;
import ca.gc.cra.funnel.infrastructure.intercept.InterceptAppender;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Worker-side half of spawn-time propagation.
 * <p><strong>Lifecycle:</strong> {@link #beforeEntry()} rebuilds one interceptor per parent snapshot, each
 * producing into the parent's channel over a {@link RemoteRecordChannel}, and swaps in an
 * {@link AggregatingWorkerLauncher} so workers started from here inherit interception too.
 * {@link #afterEntry()} undoes both and flushes pending records. Each step runs at most once.</p>
 * <p><strong>Thread-safety:</strong> Both hooks are synchronized; {@link #afterEntry()} may race between the
 * bootstrap's {@code finally} block and its shutdown hook.</p>
 *
 * @since FUNNEL 0.1
 */
public final class InterceptInstallation {
  private enum State { PENDING, ACTIVE, DONE }

  private final List<HandlerSnapshot> snapshots;
  private final LogBackbone backbone;
  private final WorkerLauncherRegistry registry;
  private final AggregatorSettings settings;
  private final TransportDiagnostics diagnostics;
  private final MetricsPort metrics;

  private final List<InterceptAppender> appenders = new ArrayList<>();
  private final List<RemoteRecordChannel> channels = new ArrayList<>();
  private WorkerLauncher savedLauncher;
  private State state = State.PENDING;

  /**
   * Creates an installation for explicit snapshots.
   *
   * @param snapshots parent interception points, in installation order
   * @param backbone this process's backbone
   * @param registry launcher registry to make spawn-aware
   * @param settings channel capacity and flush timeout
   * @param diagnostics transport failure reporter
   * @param metrics capture counters
   */
  public InterceptInstallation(
      List<HandlerSnapshot> snapshots,
      LogBackbone backbone,
      WorkerLauncherRegistry registry,
      AggregatorSettings settings,
      TransportDiagnostics diagnostics,
      MetricsPort metrics) {
    this.snapshots = List.copyOf(Objects.requireNonNull(snapshots, "snapshots"));
    this.backbone = Objects.requireNonNull(backbone, "backbone");
    this.registry = Objects.requireNonNull(registry, "registry");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Reads snapshots from {@value WorkerBootstrap#SNAPSHOT_ENV} in {@code environment}.
   *
   * @param environment process environment
   * @param backbone this process's backbone
   * @param registry launcher registry
   * @param settings worker settings
   * @param diagnostics transport failure reporter
   * @return installation; empty when the variable is absent
   * @throws IllegalArgumentException when the variable holds malformed JSON
   */
  public static InterceptInstallation fromEnvironment(
      Map<String, String> environment,
      LogBackbone backbone,
      WorkerLauncherRegistry registry,
      AggregatorSettings settings,
      TransportDiagnostics diagnostics) {
    List<HandlerSnapshot> snapshots =
        new RecordCodec().decodeSnapshots(environment.get(WorkerBootstrap.SNAPSHOT_ENV));
    return new InterceptInstallation(snapshots, backbone, registry, settings, diagnostics, MetricsPort.NO_OP);
  }

  /** Installs the interceptors described by the snapshots. */
  public synchronized void beforeEntry() {
    if (state != State.PENDING) {
      return;
    }
    state = State.ACTIVE;
    if (snapshots.isEmpty()) {
      return;
    }
    for (HandlerSnapshot snapshot : snapshots) {
      RemoteRecordChannel channel = new RemoteRecordChannel(
          snapshot.endpoint(),
          settings.channelCapacity(),
          settings.drainGrace(),
          diagnostics,
          ThreadFactories.daemon("funnel-remote-" + snapshot.endpoint().port()));
      channels.add(channel);
      InterceptAppender appender = new InterceptAppender(snapshot.level(), channel, backbone, metrics);
      appender.install();
      appenders.add(appender);
    }
    savedLauncher = registry.replace(AggregatingWorkerLauncher.wrap(registry.current(), backbone, settings));
  }

  /** Uninstalls the interceptors, restores the launcher and flushes records to the parent. */
  public synchronized void afterEntry() {
    if (state != State.ACTIVE) {
      state = State.DONE;
      return;
    }
    state = State.DONE;
    if (savedLauncher != null) {
      registry.restore(savedLauncher);
      savedLauncher = null;
    }
    for (int i = appenders.size() - 1; i >= 0; i--) {
      appenders.get(i).uninstall();
    }
    appenders.clear();
    for (RemoteRecordChannel channel : channels) {
      channel.close();
    }
    channels.clear();
  }

  public synchronized boolean isActive() {
    return state == State.ACTIVE && !appenders.isEmpty();
  }

  public int interceptorCount() {
    return snapshots.size();
  }
}
