package ca.gc.cra.funnel.infrastructure.intercept;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.funnel.application.port.RecordChannel;
import ca.gc.cra.funnel.domain.ChannelEndpoint;
import ca.gc.cra.funnel.domain.HandlerSnapshot;
import ca.gc.cra.funnel.domain.TaggedRecord;
import ca.gc.cra.funnel.testutil.LogbackFixtures;
import ca.gc.cra.funnel.testutil.RecordingMetricsPort;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class InterceptAppenderTest {
  private LoggerContext context;
  private LogbackBackbone backbone;
  private ListChannel channel;
  private RecordingMetricsPort metrics;

  @BeforeEach
  void setUp() {
    context = LogbackFixtures.newContext();
    backbone = new LogbackBackbone(context);
    channel = new ListChannel();
    metrics = new RecordingMetricsPort();
  }

  @AfterEach
  void tearDown() {
    context.stop();
  }

  @Test
  void installLowersRootLevelAndUninstallRestoresIt() {
    InterceptAppender appender = new InterceptAppender(Level.INFO, channel, backbone, metrics, 11L);

    appender.install();
    assertEquals(Level.TRACE, backbone.minimumLevel());
    assertTrue(backbone.isAttached(appender));
    assertTrue(appender.isInstalled());

    appender.uninstall();
    assertEquals(Level.WARN, backbone.minimumLevel());
    assertFalse(backbone.isAttached(appender));
    assertFalse(appender.isInstalled());
  }

  @Test
  void installTwiceAttachesOnceAndKeepsOriginalLevel() {
    InterceptAppender appender = new InterceptAppender(Level.INFO, channel, backbone, metrics, 11L);
    appender.install();
    appender.install();

    context.getLogger("x").info("once");
    assertEquals(1, channel.records.size());

    appender.uninstall();
    assertEquals(Level.WARN, backbone.minimumLevel());
  }

  @Test
  void reinstallAfterExternalDetachKeepsTheLevelSavedBeforeFirstInstall() {
    InterceptAppender appender = new InterceptAppender(Level.INFO, channel, backbone, metrics, 11L);
    appender.install();
    backbone.detach(appender);
    assertFalse(backbone.isAttached(appender));

    appender.install();
    assertTrue(backbone.isAttached(appender));
    assertEquals(Level.TRACE, backbone.minimumLevel());
    context.getLogger("x").info("back");
    assertEquals(1, channel.records.size());

    appender.uninstall();
    assertEquals(Level.WARN, backbone.minimumLevel());
    assertFalse(backbone.isAttached(appender));
  }

  @Test
  void uninstallBeforeInstallFailsAndRepeatedUninstallIsNoOp() {
    InterceptAppender appender = new InterceptAppender(Level.INFO, channel, backbone, metrics, 11L);
    assertThrows(IllegalStateException.class, appender::uninstall);

    appender.install();
    appender.uninstall();
    appender.uninstall();
    assertEquals(Level.WARN, backbone.minimumLevel());
  }

  @Test
  void nestedAppendersRestoreLevelsInReverseOrder() {
    InterceptAppender outer = new InterceptAppender(Level.INFO, channel, backbone, metrics, 11L);
    InterceptAppender inner = new InterceptAppender(Level.DEBUG, new ListChannel(), backbone, metrics, 11L);
    outer.install();
    inner.install();
    inner.uninstall();
    assertEquals(Level.TRACE, backbone.minimumLevel());
    outer.uninstall();
    assertEquals(Level.WARN, backbone.minimumLevel());
  }

  @Test
  void capturesEventsAtOrAboveThresholdWithOriginAndContext() {
    InterceptAppender appender = new InterceptAppender(Level.INFO, channel, backbone, metrics, 4242L);
    appender.install();
    Logger logger = context.getLogger("X");
    MDC.put("request", "r-1");
    try {
      logger.debug("too quiet");
      logger.info("hello {}", "world");
    } finally {
      MDC.remove("request");
      appender.uninstall();
    }

    assertEquals(1, channel.records.size());
    TaggedRecord tagged = channel.records.get(0);
    assertEquals(4242L, tagged.originPid());
    assertEquals("X", tagged.record().loggerName());
    assertEquals(Level.INFO, tagged.record().level());
    assertEquals("hello world", tagged.record().message());
    assertEquals(Thread.currentThread().getName(), tagged.record().threadName());
    assertEquals("r-1", tagged.record().attributes().get("request"));
    assertNull(tagged.record().throwableText());
    assertFalse(tagged.record().handled());
    assertEquals(1, metrics.count("funnel.intercept.captured"));
  }

  @Test
  void throwablesAreRenderedToText() {
    InterceptAppender appender = new InterceptAppender(Level.INFO, channel, backbone, metrics, 1L);
    appender.install();
    try {
      context.getLogger("X").error("failed", new IllegalStateException("boom"));
    } finally {
      appender.uninstall();
    }

    String text = channel.records.get(0).record().throwableText();
    assertNotNull(text);
    assertTrue(text.contains("java.lang.IllegalStateException: boom"), text);
    assertTrue(text.contains("throwablesAreRenderedToText"), text);
  }

  @Test
  void eventsCarryingTheHandledMarkerAreIgnored() {
    InterceptAppender appender = new InterceptAppender(Level.TRACE, channel, backbone, metrics, 1L);
    appender.install();
    try {
      context.getLogger("X").info(AggregationMarkers.HANDLED, "already aggregated");
      context.getLogger("X").info("fresh");
    } finally {
      appender.uninstall();
    }

    assertEquals(1, channel.records.size());
    assertEquals("fresh", channel.records.get(0).record().message());
  }

  @Test
  void eventsOutsideTheWindowAreNotCaptured() {
    InterceptAppender appender = new InterceptAppender(Level.TRACE, channel, backbone, metrics, 1L);
    context.getLogger("X").error("before");
    appender.install();
    context.getLogger("X").error("during");
    appender.uninstall();
    context.getLogger("X").error("after");

    assertEquals(1, channel.records.size());
    assertEquals("during", channel.records.get(0).record().message());
  }

  @Test
  void snapshotFollowsChannelReachability() {
    InterceptAppender appender = new InterceptAppender(Level.DEBUG, channel, backbone, metrics, 1L);
    assertEquals(Optional.empty(), appender.snapshot());

    ChannelEndpoint endpoint = new ChannelEndpoint("127.0.0.1", 4711, "token");
    channel.endpoint = endpoint;
    appender.install();
    try {
      assertEquals(Optional.of(new HandlerSnapshot(Level.DEBUG, endpoint)), appender.snapshot());
      assertEquals(List.of(new HandlerSnapshot(Level.DEBUG, endpoint)), backbone.snapshotInterceptors());
    } finally {
      appender.uninstall();
    }
    assertEquals(List.of(), backbone.snapshotInterceptors());
  }

  private static final class ListChannel implements RecordChannel {
    private final List<TaggedRecord> records = new ArrayList<>();
    private ChannelEndpoint endpoint;
    private boolean closed;

    @Override
    public synchronized void put(TaggedRecord record) {
      records.add(record);
    }

    @Override
    public Optional<ChannelEndpoint> endpoint() {
      return Optional.ofNullable(endpoint);
    }

    @Override
    public void close() {
      closed = true;
    }

    @Override
    public boolean isClosed() {
      return closed;
    }
  }
}
