package ca.gc.cra.funnel.application.aggregation;

import ca.gc.cra.funnel.application.port.LogBackbone;
import ca.gc.cra.funnel.application.port.MetricsPort;
import ca.gc.cra.funnel.application.port.SinkPort;
import ca.gc.cra.funnel.application.port.WorkerLauncher;
import ca.gc.cra.funnel.config.AggregatorSettings;
import ca.gc.cra.funnel.config.SinkOptions;
import ca.gc.cra.funnel.infrastructure.channel.AggregationChannel;
import ca.gc.cra.funnel.infrastructure.channel.TransportDiagnostics;
import ca.gc.cra.funnel.infrastructure.exec.ThreadFactories;
import ca.gc.cra.funnel.infrastructure.intercept.InterceptAppender;
import ca.gc.cra.funnel.infrastructure.intercept.LogbackBackbone;
import ca.gc.cra.funnel.infrastructure.intercept.LogbackSink;
import ca.gc.cra.funnel.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.funnel.infrastructure.spawn.AggregatingWorkerLauncher;
import ca.gc.cra.funnel.infrastructure.spawn.WorkerLauncherRegistry;
import ca.gc.cra.funnel.logging.SinkLoggers;
import ch.qos.logback.core.status.ErrorStatus;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.ThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Aggregation session that funnels every log event emitted in this process, and in
 * worker processes started while it runs, into one sink logger.
 * <p><strong>Usage:</strong>
 * <pre>{@code
 * try (Aggregator session = Aggregator.forLogger(LoggerFactory.getLogger("build")).start()) {
 *   runBuild();
 * }
 * }</pre>
 * <p><strong>Lifecycle:</strong> {@link #start()} creates the channel, installs a root interceptor at the sink's
 * effective level, makes the launcher registry spawn-aware and starts the consumer thread. {@link #stop()}
 * closes the channel, waits for the consumer to drain it, then uninstalls the interceptor and restores the
 * launcher. Both are idempotent and a stopped session can be started again. Unless a metrics port was supplied,
 * each run opens its own from the settings and shuts it down on stop.</p>
 * <p><strong>Nesting:</strong> Sessions compose; each installs its own interceptor, so an event emitted inside an
 * inner session reaches both sinks, while records one session dispatched are ignored by the others.</p>
 * <p><strong>Thread-safety:</strong> {@link #start()} and {@link #stop()} are synchronized on the session.</p>
 *
 * @since FUNNEL 0.1
 */
public final class Aggregator implements AutoCloseable {
  /** Histogram of the milliseconds {@link #stop()} waited for the consumer to drain the channel. */
  public static final String DRAIN_MILLIS = "funnel.session.drain.millis";

  private static final Logger log = LoggerFactory.getLogger(Aggregator.class);

  private final SinkPort sink;
  private final LogBackbone backbone;
  private final WorkerLauncherRegistry registry;
  private final AggregatorSettings settings;
  private final MetricsPort suppliedMetrics;
  private final ThreadFactory consumerThreads;
  private final long sessionPid;

  private SessionState state = SessionState.UNSTARTED;
  private MetricsPort metrics;
  private AggregationChannel channel;
  private InterceptAppender appender;
  private WorkerLauncher savedLauncher;
  private Thread consumerThread;

  private Aggregator(Builder builder) {
    this.sink = builder.sink;
    this.backbone = builder.backbone;
    this.registry = builder.registry;
    this.settings = builder.settings;
    this.suppliedMetrics = builder.metrics;
    this.consumerThreads = builder.consumerThreads != null
        ? builder.consumerThreads
        : ThreadFactories.named(
            "funnel-consumer-" + builder.sink.name(), builder.settings.consumerDaemon(), this::consumerFailed);
    this.sessionPid = ProcessHandle.current().pid();
  }

  /**
   * Creates a session funnelling into an existing Logback-backed SLF4J logger.
   *
   * @param sink destination logger; its context becomes the intercepted backbone
   * @return unstarted session
   * @throws IllegalArgumentException when the logger is not backed by Logback
   */
  public static Aggregator forLogger(Logger sink) {
    LogbackSink adapted = LogbackSink.of(sink);
    return builder(adapted)
        .backbone(new LogbackBackbone(adapted.logger().getLoggerContext()))
        .build();
  }

  /**
   * Creates a session funnelling into a new console and/or file sink.
   *
   * @param options sink destinations, level and name
   * @return unstarted session
   * @throws ca.gc.cra.funnel.config.InvalidConfigurationException when the options name no destination
   */
  public static Aggregator forDestinations(SinkOptions options) {
    Objects.requireNonNull(options, "options").validate();
    LogbackBackbone backbone = LogbackBackbone.fromSlf4j();
    ch.qos.logback.classic.Logger logger = SinkLoggers.create(
        backbone.loggerContext(),
        options.name(),
        options.level(),
        options.file(),
        options.mode(),
        options.effectiveConsole());
    return builder(new LogbackSink(logger)).backbone(backbone).build();
  }

  /**
   * Creates a session from the {@code sink} section of a YAML file.
   *
   * @param yaml configuration file; a missing file means default sink options
   * @return unstarted session
   * @throws IOException when the file cannot be read
   * @throws ca.gc.cra.funnel.config.InvalidConfigurationException when the section names no destination
   */
  public static Aggregator forDestinations(Path yaml) throws IOException {
    return forDestinations(SinkOptions.load(yaml));
  }

  /**
   * Starts a builder for sessions with explicit collaborators.
   *
   * @param sink destination
   * @return builder defaulting to the SLF4J-bound backbone, the global launcher registry and system-property
   *     settings
   */
  public static Builder builder(SinkPort sink) {
    return new Builder(sink);
  }

  /**
   * Starts the session. No-op while started. If the consumer thread cannot be started, every step taken so far
   * is undone and the session stays not started.
   *
   * @return this session
   */
  public synchronized Aggregator start() {
    if (state == SessionState.STARTED) {
      return this;
    }
    MetricsPort runMetrics =
        suppliedMetrics != null ? suppliedMetrics : OpenTelemetryMetricsAdapter.forSettings(settings);
    TransportDiagnostics diagnostics = TransportDiagnostics.toStandardError(backbone.context());
    AggregationChannel newChannel = new AggregationChannel(
        settings.channelCapacity(),
        settings.bridgeHost(),
        settings.drainGrace(),
        diagnostics,
        runMetrics,
        "funnel-" + sink.name());
    InterceptAppender newAppender = new InterceptAppender(sink.effectiveLevel(), newChannel, backbone, runMetrics);
    newAppender.install();
    WorkerLauncher previous =
        registry.replace(AggregatingWorkerLauncher.wrap(registry.current(), backbone, settings));

    Thread thread;
    try {
      thread = consumerThreads.newThread(
          new AggregationConsumer(newChannel.drain(), sink, sessionPid, runMetrics, backbone.context()));
      if (thread == null) {
        throw new IllegalStateException("Consumer thread factory returned no thread");
      }
      thread.start();
    } catch (RuntimeException | OutOfMemoryError ex) {
      registry.restore(previous);
      newAppender.uninstall();
      newChannel.close();
      release(runMetrics);
      log.warn("Could not start log aggregation into {}; session not started", sink.name(), ex);
      return this;
    }

    metrics = runMetrics;
    channel = newChannel;
    appender = newAppender;
    savedLauncher = previous;
    consumerThread = thread;
    state = SessionState.STARTED;
    return this;
  }

  /**
   * Stops the session after every record accepted so far has been dispatched. No-op unless started.
   */
  public synchronized void stop() {
    if (state != SessionState.STARTED) {
      return;
    }
    long drainStart = System.nanoTime();
    channel.close();
    joinUninterruptibly(consumerThread);
    long drainMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - drainStart);
    appender.uninstall();
    registry.restore(savedLauncher);
    long dropped = channel.droppedCount();
    metrics.observe(DRAIN_MILLIS, drainMillis);
    release(metrics);

    metrics = null;
    channel = null;
    appender = null;
    savedLauncher = null;
    consumerThread = null;
    state = SessionState.STOPPED;
    if (dropped > 0) {
      log.warn("Log aggregation into {} dropped {} records", sink.name(), dropped);
    }
  }

  /** Same as {@link #stop()}. */
  @Override
  public void close() {
    stop();
  }

  public synchronized boolean isStarted() {
    return state == SessionState.STARTED;
  }

  public synchronized SessionState state() {
    return state;
  }

  public SinkPort sink() {
    return sink;
  }

  public long sessionPid() {
    return sessionPid;
  }

  private void release(MetricsPort runMetrics) {
    if (runMetrics != suppliedMetrics && runMetrics instanceof OpenTelemetryMetricsAdapter) {
      ((OpenTelemetryMetricsAdapter) runMetrics).close();
    }
  }

  private void consumerFailed(Thread thread, Throwable failure) {
    backbone.context().getStatusManager().add(new ErrorStatus(
        "Log aggregation consumer " + thread.getName() + " died; records for " + sink.name() + " are lost",
        this,
        failure));
  }

  private static void joinUninterruptibly(Thread thread) {
    boolean interrupted = false;
    while (true) {
      try {
        thread.join();
        break;
      } catch (InterruptedException ex) {
        interrupted = true;
      }
    }
    if (interrupted) {
      Thread.currentThread().interrupt();
    }
  }

  /** Builder for sessions with explicit collaborators. */
  public static final class Builder {
    private final SinkPort sink;
    private LogBackbone backbone;
    private WorkerLauncherRegistry registry;
    private AggregatorSettings settings;
    private MetricsPort metrics;
    private ThreadFactory consumerThreads;

    private Builder(SinkPort sink) {
      this.sink = Objects.requireNonNull(sink, "sink");
    }

    public Builder backbone(LogBackbone backbone) {
      this.backbone = Objects.requireNonNull(backbone, "backbone");
      return this;
    }

    public Builder launcherRegistry(WorkerLauncherRegistry registry) {
      this.registry = Objects.requireNonNull(registry, "registry");
      return this;
    }

    public Builder settings(AggregatorSettings settings) {
      this.settings = Objects.requireNonNull(settings, "settings");
      return this;
    }

    public Builder metrics(MetricsPort metrics) {
      this.metrics = Objects.requireNonNull(metrics, "metrics");
      return this;
    }

    /**
     * Overrides how the consumer thread is created.
     *
     * @param consumerThreads factory; must return an unstarted thread
     * @return this builder
     */
    public Builder consumerThreads(ThreadFactory consumerThreads) {
      this.consumerThreads = Objects.requireNonNull(consumerThreads, "consumerThreads");
      return this;
    }

    public Aggregator build() {
      if (backbone == null) {
        backbone = LogbackBackbone.fromSlf4j();
      }
      if (registry == null) {
        registry = WorkerLauncherRegistry.global();
      }
      if (settings == null) {
        settings = AggregatorSettings.fromSystemProperties();
      }
      return new Aggregator(this);
    }
  }
}
