package ca.gc.cra.funnel.infrastructure.channel;

import ca.gc.cra.funnel.application.port.MetricsPort;
import ca.gc.cra.funnel.application.port.RecordChannel;
import ca.gc.cra.funnel.domain.ChannelEndpoint;
import ca.gc.cra.funnel.domain.TaggedRecord;
import ca.gc.cra.funnel.infrastructure.exec.ThreadFactories;
import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Session channel: an in-process {@link HandoffChannel} plus, once a worker process needs it, a loopback
 * {@link ChannelBridgeServer} feeding the same queue.
 *
 * <p>The bridge is created lazily by {@link #endpoint()}, so sessions that never launch a worker never open
 * a socket. {@link #close()} drains the bridge first and then closes the queue, so records a worker sent
 * before it exited are delivered ahead of the end of stream.</p>
 *
 * @since FUNNEL 0.1
 */
public final class AggregationChannel implements RecordChannel {
  private final HandoffChannel<TaggedRecord> queue;
  private final String bridgeHost;
  private final Duration drainGrace;
  private final RecordCodec codec;
  private final TransportDiagnostics diagnostics;
  private final MetricsPort metrics;
  private final String threadPrefix;

  private ChannelBridgeServer bridge;
  private boolean bridgeFailed;
  private boolean closing;

  /**
   * Creates a session channel.
   *
   * @param capacity maximum number of undelivered records
   * @param bridgeHost loopback host the bridge binds when first needed
   * @param drainGrace time connected workers get to finish streaming on close
   * @param diagnostics one-shot failure reporter
   * @param metrics drop and bridge counters
   * @param threadPrefix prefix for bridge thread names
   */
  public AggregationChannel(
      int capacity,
      String bridgeHost,
      Duration drainGrace,
      TransportDiagnostics diagnostics,
      MetricsPort metrics,
      String threadPrefix) {
    this.queue = new HandoffChannel<>(capacity);
    this.bridgeHost = Objects.requireNonNull(bridgeHost, "bridgeHost");
    this.drainGrace = Objects.requireNonNull(drainGrace, "drainGrace");
    this.codec = new RecordCodec();
    this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.threadPrefix = Objects.requireNonNull(threadPrefix, "threadPrefix");
  }

  @Override
  public void put(TaggedRecord record) {
    if (!queue.put(record)) {
      metrics.increment("funnel.channel.dropped");
    }
  }

  @Override
  public synchronized Optional<ChannelEndpoint> endpoint() {
    if (closing || bridgeFailed) {
      return Optional.empty();
    }
    if (bridge == null) {
      ChannelBridgeServer candidate = new ChannelBridgeServer(
          queue,
          codec,
          ThreadFactories.daemon(threadPrefix + "-bridge-accept"),
          ThreadFactories.daemon(threadPrefix + "-bridge-read"),
          diagnostics,
          metrics);
      try {
        candidate.start(bridgeHost);
      } catch (IOException ex) {
        bridgeFailed = true;
        diagnostics.reportOnce(
            "bridge-bind:" + threadPrefix,
            "Could not open a worker bridge on " + bridgeHost + "; workers will not be aggregated",
            ex);
        return Optional.empty();
      }
      bridge = candidate;
    }
    return Optional.of(bridge.endpoint());
  }

  @Override
  public void close() {
    ChannelBridgeServer current;
    synchronized (this) {
      closing = true;
      current = bridge;
    }
    if (current != null) {
      current.shutdown(drainGrace);
    }
    queue.close();
  }

  @Override
  public boolean isClosed() {
    return queue.isClosed();
  }

  /**
   * Consumer view of the channel; see {@link HandoffChannel#drain()}.
   *
   * @return single-pass blocking sequence
   */
  public Iterable<TaggedRecord> drain() {
    return queue.drain();
  }

  /**
   * Records dropped because the channel was closed or saturated.
   *
   * @return drop count
   */
  public long droppedCount() {
    return queue.droppedCount();
  }
}
