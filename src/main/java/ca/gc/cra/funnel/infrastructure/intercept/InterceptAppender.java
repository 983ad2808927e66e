package ca.gc.cra.funnel.infrastructure.intercept;

import ca.gc.cra.funnel.application.port.InterceptionPoint;
import ca.gc.cra.funnel.application.port.LogBackbone;
import ca.gc.cra.funnel.application.port.MetricsPort;
import ca.gc.cra.funnel.application.port.RecordChannel;
import ca.gc.cra.funnel.domain.CapturedRecord;
import ca.gc.cra.funnel.domain.HandlerSnapshot;
import ca.gc.cra.funnel.domain.TaggedRecord;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.classic.spi.ThrowableProxyUtil;
import ch.qos.logback.core.UnsynchronizedAppenderBase;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * <strong>What:</strong> Root-level Logback appender that copies every event emitted in this process into an
 * aggregation channel.
 * <p><strong>Why:</strong> Attaching to the root of the backbone is the one place every logger's output passes
 * through, whatever logger the application used.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Skip events already dispatched by an aggregation consumer (handled-marker), which breaks cycles.</li>
 *   <li>Drop events below the threshold captured when the session started.</li>
 *   <li>Render throwables to text; throwable objects never enter the channel.</li>
 *   <li>Tag each record with this process id and enqueue it without blocking.</li>
 * </ul>
 * <p><strong>Lifecycle:</strong> {@link #install()} lowers the backbone's minimum level to {@code TRACE} so no
 * event is filtered before it reaches this appender, remembering the previous level;
 * {@link #uninstall()} restores it. Install is a no-op while installed; uninstalling an appender that was
 * never installed is a programming error.</p>
 * <p><strong>Thread-safety:</strong> {@link #append(ILoggingEvent)} runs unsynchronized on every logging thread;
 * install/uninstall are serialized on the instance.</p>
 *
 * @since FUNNEL 0.1
 */
public final class InterceptAppender extends UnsynchronizedAppenderBase<ILoggingEvent>
    implements InterceptionPoint {
  private static final AtomicInteger INSTANCE_IDS = new AtomicInteger();

  private enum State { NEW, INSTALLED, UNINSTALLED }

  private final Level threshold;
  private final RecordChannel channel;
  private final LogBackbone backbone;
  private final MetricsPort metrics;
  private final long pid;

  private State state = State.NEW;
  private Level savedMinimumLevel;

  /**
   * Creates an appender tagging records with the current process id.
   *
   * @param threshold lowest level forwarded
   * @param channel destination channel
   * @param backbone backbone to install into
   * @param metrics capture counters
   */
  public InterceptAppender(Level threshold, RecordChannel channel, LogBackbone backbone, MetricsPort metrics) {
    this(threshold, channel, backbone, metrics, ProcessHandle.current().pid());
  }

  InterceptAppender(
      Level threshold, RecordChannel channel, LogBackbone backbone, MetricsPort metrics, long pid) {
    this.threshold = Objects.requireNonNull(threshold, "threshold");
    this.channel = Objects.requireNonNull(channel, "channel");
    this.backbone = Objects.requireNonNull(backbone, "backbone");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.pid = pid;
    setName("FUNNEL_INTERCEPT_" + INSTANCE_IDS.incrementAndGet());
  }

  /**
   * Registers this appender on the backbone. No-op while already installed; an installed appender
   * that something else detached is attached again, keeping the level saved by the first install.
   */
  public synchronized void install() {
    if (state == State.INSTALLED) {
      if (!backbone.isAttached(this)) {
        backbone.setMinimumLevel(Level.TRACE);
        start();
        backbone.attach(this);
      }
      return;
    }
    savedMinimumLevel = backbone.minimumLevel();
    backbone.setMinimumLevel(Level.TRACE);
    if (getContext() == null) {
      setContext(backbone.context());
    }
    start();
    backbone.attach(this);
    state = State.INSTALLED;
  }

  /**
   * Removes this appender from the backbone and restores the minimum level seen at install time.
   *
   * @throws IllegalStateException if the appender was never installed
   */
  public synchronized void uninstall() {
    if (state == State.NEW) {
      throw new IllegalStateException("Cannot uninstall " + getName() + ": it was never installed");
    }
    if (state == State.UNINSTALLED) {
      return;
    }
    backbone.detach(this);
    stop();
    backbone.setMinimumLevel(savedMinimumLevel);
    savedMinimumLevel = null;
    state = State.UNINSTALLED;
  }

  public synchronized boolean isInstalled() {
    return state == State.INSTALLED;
  }

  public Level threshold() {
    return threshold;
  }

  public RecordChannel channel() {
    return channel;
  }

  @Override
  public Optional<HandlerSnapshot> snapshot() {
    return channel.endpoint().map(endpoint -> new HandlerSnapshot(threshold, endpoint));
  }

  @Override
  protected void append(ILoggingEvent event) {
    if (AggregationMarkers.isHandled(event.getMarkerList())) {
      return;
    }
    if (!event.getLevel().isGreaterOrEqual(threshold)) {
      return;
    }
    metrics.increment("funnel.intercept.captured");
    channel.put(new TaggedRecord(pid, capture(event)));
  }

  static CapturedRecord capture(ILoggingEvent event) {
    IThrowableProxy proxy = event.getThrowableProxy();
    String throwableText = proxy == null ? null : ThrowableProxyUtil.asString(proxy);
    return new CapturedRecord(
        event.getLoggerName(),
        event.getLevel(),
        event.getFormattedMessage(),
        event.getThreadName(),
        event.getTimeStamp(),
        throwableText,
        copyAttributes(event.getMDCPropertyMap()),
        false);
  }

  private static Map<String, String> copyAttributes(Map<String, String> mdc) {
    if (mdc == null || mdc.isEmpty()) {
      return Map.of();
    }
    Map<String, String> copy = new LinkedHashMap<>();
    for (Map.Entry<String, String> entry : mdc.entrySet()) {
      if (entry.getKey() != null && entry.getValue() != null) {
        copy.put(entry.getKey(), entry.getValue());
      }
    }
    return copy;
  }
}
