package ca.gc.cra.funnel.application.aggregation;

import ca.gc.cra.funnel.application.port.MetricsPort;
import ca.gc.cra.funnel.application.port.SinkPort;
import ca.gc.cra.funnel.domain.CapturedRecord;
import ca.gc.cra.funnel.domain.TaggedRecord;
import ch.qos.logback.core.Context;
import ch.qos.logback.core.status.ErrorStatus;
import java.util.Objects;

/**
 * <strong>What:</strong> Consumer loop of an aggregation session.
 * <p><strong>Responsibilities:</strong> For each record, in channel order:
 * <ol>
 *   <li>drop it when the sink's current level rejects it;</li>
 *   <li>drop it when the sink logger itself emitted it in this process (echo);</li>
 *   <li>prefix the message with {@code [<sink>] - }, or {@code [<sink> PID <pid>] - } for worker records;</li>
 *   <li>mark it handled and dispatch it to the sink's appenders.</li>
 * </ol>
 * <p><strong>Thread-safety:</strong> Runs on exactly one thread per session.</p>
 * <p><strong>Observability:</strong> Counts {@code funnel.consumer.forwarded}, {@code funnel.consumer.filtered.level}
 * and {@code funnel.consumer.suppressed.echo}; dispatch failures become Logback error statuses.</p>
 *
 * @since FUNNEL 0.1
 */
public final class AggregationConsumer implements Runnable {
  private final Iterable<TaggedRecord> records;
  private final SinkPort sink;
  private final long sessionPid;
  private final MetricsPort metrics;
  private final Context statusContext;

  /**
   * Creates a consumer.
   *
   * @param records channel sequence; iteration ends when the channel is closed and drained
   * @param sink destination logger
   * @param sessionPid process id of the session's creator
   * @param metrics consumer counters
   * @param statusContext context receiving dispatch failures
   */
  public AggregationConsumer(
      Iterable<TaggedRecord> records, SinkPort sink, long sessionPid, MetricsPort metrics, Context statusContext) {
    this.records = Objects.requireNonNull(records, "records");
    this.sink = Objects.requireNonNull(sink, "sink");
    this.sessionPid = sessionPid;
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.statusContext = Objects.requireNonNull(statusContext, "statusContext");
  }

  @Override
  public void run() {
    for (TaggedRecord tagged : records) {
      try {
        forward(tagged);
      } catch (RuntimeException ex) {
        reportFailure(tagged, ex);
      }
    }
  }

  /**
   * Applies the loop body to a single record.
   *
   * @param tagged record and its origin
   * @return {@code true} when the record reached the sink
   */
  boolean forward(TaggedRecord tagged) {
    CapturedRecord record = tagged.record();
    if (!sink.isEnabledFor(record.level())) {
      metrics.increment("funnel.consumer.filtered.level");
      return false;
    }
    boolean local = tagged.originPid() == sessionPid;
    if (local && record.loggerName().equals(sink.name())) {
      metrics.increment("funnel.consumer.suppressed.echo");
      return false;
    }
    record.rewriteMessage("[" + attribution(sink.name(), tagged.originPid(), sessionPid) + "] - " + record.message());
    record.markHandled();
    sink.dispatch(record);
    metrics.increment("funnel.consumer.forwarded");
    return true;
  }

  static String attribution(String sinkName, long originPid, long sessionPid) {
    return originPid == sessionPid ? sinkName : sinkName + " PID " + originPid;
  }

  private void reportFailure(TaggedRecord tagged, RuntimeException ex) {
    statusContext.getStatusManager().add(new ErrorStatus(
        "Failed to dispatch record from " + tagged.record().loggerName() + " into sink " + sink.name(),
        this,
        ex));
  }
}
