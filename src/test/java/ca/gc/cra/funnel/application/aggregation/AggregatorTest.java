package ca.gc.cra.funnel.application.aggregation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.funnel.application.port.WorkerLauncher;
import ca.gc.cra.funnel.config.AggregatorSettings;
import ca.gc.cra.funnel.config.InvalidConfigurationException;
import ca.gc.cra.funnel.config.SinkOptions;
import ca.gc.cra.funnel.infrastructure.intercept.AggregationMarkers;
import ca.gc.cra.funnel.infrastructure.intercept.LogbackBackbone;
import ca.gc.cra.funnel.infrastructure.intercept.LogbackSink;
import ca.gc.cra.funnel.infrastructure.spawn.AggregatingWorkerLauncher;
import ca.gc.cra.funnel.infrastructure.spawn.JvmWorkerLauncher;
import ca.gc.cra.funnel.infrastructure.spawn.WorkerLauncherRegistry;
import ca.gc.cra.funnel.logging.SinkLoggers;
import ca.gc.cra.funnel.testutil.LogbackFixtures;
import ca.gc.cra.funnel.testutil.LogbackFixtures.CapturingSink;
import ca.gc.cra.funnel.testutil.RecordingMetricsPort;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class AggregatorTest {

  @TempDir Path tempDir;

  private final LoggerContext context = LogbackFixtures.newContext();
  private final WorkerLauncher originalLauncher = new JvmWorkerLauncher();
  private final WorkerLauncherRegistry registry = new WorkerLauncherRegistry(originalLauncher);
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();

  @AfterEach
  void stopContext() {
    context.stop();
  }

  @Test
  void recordsFromAnyLoggerAreAttributedToTheSink() {
    CapturingSink sink = LogbackFixtures.sink(context, "S", Level.INFO);

    try (Aggregator session = session(sink).start()) {
      assertTrue(session.isStarted());
      context.getLogger("X").info("hello");
    }

    assertEquals(List.of("X [S] - hello"), sink.lines());
    assertTrue(sink.events().get(0).getMarkerList().contains(AggregationMarkers.HANDLED));
  }

  @Test
  void stopDeliversEverythingAcceptedInEmissionOrder() {
    CapturingSink sink = LogbackFixtures.sink(context, "S", Level.INFO);
    Logger emitter = context.getLogger("X");
    List<String> expected = new ArrayList<>();

    Aggregator session = session(sink).start();
    for (int i = 0; i < 1_000; i++) {
      emitter.info("message {}", i);
      expected.add("X [S] - message " + i);
    }
    session.stop();

    assertEquals(expected, sink.lines());
    assertEquals(1_000, metrics.count("funnel.consumer.forwarded"));
  }

  @Test
  void sinkOwnRecordsAreNotEchoed() {
    CapturingSink sink = LogbackFixtures.sink(context, "S", Level.INFO);
    sink.logger().setAdditive(true);

    try (Aggregator session = session(sink).start()) {
      sink.logger().info("direct");
      context.getLogger("X").info("hello");
    }

    List<String> lines = sink.lines();
    assertEquals(2, lines.size(), lines.toString());
    assertTrue(lines.contains("S direct"));
    assertTrue(lines.contains("X [S] - hello"));
    assertFalse(lines.stream().anyMatch(line -> line.startsWith("S [S]")));
    assertEquals(1, metrics.count("funnel.consumer.suppressed.echo"));
  }

  @Test
  void sinkLevelFiltersRecords() {
    CapturingSink sink = LogbackFixtures.sink(context, "S", Level.WARN);

    try (Aggregator session = session(sink).start()) {
      Logger emitter = context.getLogger("X");
      emitter.debug("debug");
      emitter.info("info");
      emitter.warn("warn");
      emitter.error("error");
    }

    assertEquals(List.of("X [S] - warn", "X [S] - error"), sink.lines());
  }

  @Test
  void recordsBelowTheOriginalRootLevelAreCapturedWhileStarted() {
    CapturingSink sink = LogbackFixtures.sink(context, "S", Level.DEBUG);
    Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    assertEquals(Level.WARN, root.getLevel());

    try (Aggregator session = session(sink).start()) {
      assertEquals(Level.TRACE, root.getLevel());
      context.getLogger("X").debug("details");
    }

    assertEquals(Level.WARN, root.getLevel());
    assertEquals(List.of("X [S] - details"), sink.lines());
  }

  @Test
  void nestedSessionsEachReceiveTheirOwnCopy() {
    CapturingSink outer = LogbackFixtures.sink(context, "outer", Level.INFO);
    CapturingSink inner = LogbackFixtures.sink(context, "inner", Level.INFO);
    Logger emitter = context.getLogger("X");

    try (Aggregator outerSession = session(outer).start()) {
      emitter.info("before");
      try (Aggregator innerSession = session(inner).start()) {
        emitter.info("both");
      }
      emitter.info("after");
    }

    assertEquals(List.of("X [inner] - both"), inner.lines());
    assertEquals(List.of("X [outer] - before", "X [outer] - both", "X [outer] - after"), outer.lines());
  }

  @Test
  void nestedAdditiveSinksDoNotRecaptureDispatchedRecords() {
    CapturingSink outer = LogbackFixtures.sink(context, "outer", Level.INFO);
    CapturingSink inner = LogbackFixtures.sink(context, "inner", Level.INFO);
    inner.logger().setAdditive(true);

    try (Aggregator outerSession = session(outer).start()) {
      try (Aggregator innerSession = session(inner).start()) {
        context.getLogger("X").info("once");
      }
    }

    assertEquals(List.of("X [inner] - once"), inner.lines());
    assertEquals(List.of("X [outer] - once"), outer.lines());
  }

  @Test
  void startAndStopAreIdempotentAndSessionsRestart() {
    CapturingSink sink = LogbackFixtures.sink(context, "S", Level.INFO);
    Aggregator session = session(sink);
    assertEquals(SessionState.UNSTARTED, session.state());

    session.stop();
    assertEquals(SessionState.UNSTARTED, session.state());

    assertSame(session, session.start());
    session.start();
    context.getLogger("X").info("first");
    session.stop();
    session.stop();
    assertEquals(SessionState.STOPPED, session.state());

    context.getLogger("X").warn("between");

    session.start();
    context.getLogger("X").info("second");
    session.stop();

    assertEquals(List.of("X [S] - first", "X [S] - second"), sink.lines());
  }

  @Test
  void launcherIsSpawnAwareOnlyWhileStarted() {
    CapturingSink sink = LogbackFixtures.sink(context, "S", Level.INFO);

    try (Aggregator session = session(sink).start()) {
      AggregatingWorkerLauncher active = assertInstanceOf(AggregatingWorkerLauncher.class, registry.current());
      assertSame(originalLauncher, active.delegate());
    }

    assertSame(originalLauncher, registry.current());
  }

  @Test
  void consumerStartFailureRollsEverythingBack() {
    CapturingSink sink = LogbackFixtures.sink(context, "S", Level.INFO);
    Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    AtomicInteger attempts = new AtomicInteger();
    Aggregator session = builder(sink)
        .consumerThreads(task -> {
          attempts.incrementAndGet();
          throw new IllegalStateException("no threads left");
        })
        .build();

    assertSame(session, session.start());

    assertEquals(1, attempts.get());
    assertFalse(session.isStarted());
    assertEquals(SessionState.UNSTARTED, session.state());
    assertEquals(Level.WARN, root.getLevel());
    assertFalse(root.iteratorForAppenders().hasNext());
    assertSame(originalLauncher, registry.current());

    context.getLogger("X").error("not captured");
    assertTrue(sink.lines().isEmpty());
  }

  @Test
  void factoryReturningNoThreadIsTreatedAsAFailure() {
    CapturingSink sink = LogbackFixtures.sink(context, "S", Level.INFO);
    Aggregator session = builder(sink).consumerThreads(task -> null).build();

    session.start();

    assertFalse(session.isStarted());
    assertSame(originalLauncher, registry.current());
  }

  @Test
  void forLoggerRequiresLogback() {
    assertThrows(IllegalArgumentException.class,
        () -> Aggregator.forLogger(org.slf4j.helpers.NOPLogger.NOP_LOGGER));
  }

  @Test
  void forDestinationsRequiresADestination() {
    assertThrows(InvalidConfigurationException.class,
        () -> Aggregator.forDestinations(SinkOptions.defaults().withConsole(false)));
  }

  @Test
  void forDestinationsWritesAggregatedRecordsToTheFile() throws IOException {
    Path file = tempDir.resolve("aggregated.log");
    String name = "file-sink-" + System.nanoTime();
    Aggregator session = Aggregator.forDestinations(SinkOptions.toFile(file).withName(name));
    try {
      session.start();
      LoggerFactory.getLogger("X").warn("hello");
      session.stop();
    } finally {
      SinkLoggers.release(((LogbackSink) session.sink()).logger());
    }

    List<String> lines = Files.readAllLines(file);
    assertTrue(lines.stream().anyMatch(line -> line.endsWith(" X WARN [" + name + "] - hello")), lines.toString());
  }

  @Test
  void forDestinationsReadsTheSinkSectionOfAYamlFile() throws IOException {
    Path yaml = tempDir.resolve("funnel.yaml");
    Files.writeString(yaml, """
        sink:
          console: false
        """);

    assertThrows(InvalidConfigurationException.class, () -> Aggregator.forDestinations(yaml));
  }

  @Test
  void stopRecordsHowLongTheDrainTook() {
    CapturingSink sink = LogbackFixtures.sink(context, "S", Level.INFO);
    Aggregator session = session(sink);

    session.start();
    context.getLogger("X").info("hello");
    session.stop();
    session.start();
    session.stop();

    List<Long> drains = metrics.observed(Aggregator.DRAIN_MILLIS);
    assertEquals(2, drains.size());
    assertTrue(drains.stream().allMatch(millis -> millis >= 0), drains.toString());
  }

  @Test
  void defaultConsumerThreadIsNamedAfterTheSinkAndFollowsTheDaemonSetting() {
    CapturingSink sink = LogbackFixtures.sink(context, "S", Level.INFO);
    AggregatorSettings settings = AggregatorSettings.fromMap(Map.of("consumer.daemon", "false"));

    try (Aggregator session = builder(sink).settings(settings).build().start()) {
      Optional<Thread> consumer = liveThreads("funnel-consumer-S-").stream().findFirst();
      assertTrue(consumer.isPresent());
      assertFalse(consumer.get().isDaemon());
    }
  }

  @Test
  void selfCreatedMetricsAreShutDownWithEachRun() throws InterruptedException {
    CapturingSink sink = LogbackFixtures.sink(context, "S", Level.INFO);
    int before = liveThreads("PeriodicMetricReader").size();
    Aggregator session = Aggregator.builder(new LogbackSink(sink.logger()))
        .backbone(new LogbackBackbone(context))
        .launcherRegistry(registry)
        .settings(AggregatorSettings.fromMap(Map.of("metrics.exporter", "otlp")))
        .build();

    for (int run = 0; run < 3; run++) {
      session.start();
      context.getLogger("X").info("run {}", run);
      session.stop();
    }

    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
    while (liveThreads("PeriodicMetricReader").size() > before && System.nanoTime() < deadline) {
      Thread.sleep(50);
    }
    assertEquals(before, liveThreads("PeriodicMetricReader").size());
    assertEquals(List.of("X [S] - run 0", "X [S] - run 1", "X [S] - run 2"), sink.lines());
  }

  private static List<Thread> liveThreads(String namePrefix) {
    List<Thread> threads = new ArrayList<>();
    for (Thread thread : Thread.getAllStackTraces().keySet()) {
      if (thread.isAlive() && thread.getName().startsWith(namePrefix)) {
        threads.add(thread);
      }
    }
    return threads;
  }

  private Aggregator session(CapturingSink sink) {
    return builder(sink).build();
  }

  private Aggregator.Builder builder(CapturingSink sink) {
    return Aggregator.builder(new LogbackSink(sink.logger()))
        .backbone(new LogbackBackbone(context))
        .launcherRegistry(registry)
        .settings(AggregatorSettings.defaults())
        .metrics(metrics);
  }
}
