package ca.gc.cra.funnel.infrastructure.channel;

import ca.gc.cra.funnel.application.port.RecordChannel;
import ca.gc.cra.funnel.domain.ChannelEndpoint;
import ca.gc.cra.funnel.domain.TaggedRecord;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ThreadFactory;

/**
 * Worker-side producer for a channel owned by an ancestor process.
 *
 * <p>Producers enqueue into a local {@link HandoffChannel}; a single writer thread connects to the bridge,
 * sends the handshake and streams records as JSON lines. Producers therefore never block on the socket.
 * If the link breaks, the failure is reported once and the writer keeps draining so the local queue
 * cannot fill up; records after the break are lost.</p>
 *
 * @since FUNNEL 0.1
 */
public final class RemoteRecordChannel implements RecordChannel {
  private static final int CONNECT_TIMEOUT_MILLIS = 5_000;

  private final ChannelEndpoint endpoint;
  private final HandoffChannel<TaggedRecord> pending;
  private final RecordCodec codec = new RecordCodec();
  private final TransportDiagnostics diagnostics;
  private final Duration flushTimeout;
  private final Thread writer;

  /**
   * Creates the channel and starts its writer thread.
   *
   * @param endpoint bridge to produce into
   * @param capacity maximum records waiting for the writer
   * @param flushTimeout how long {@link #close()} waits for pending records to be written
   * @param diagnostics one-shot failure reporter
   * @param writerThreads factory for the writer thread
   */
  public RemoteRecordChannel(
      ChannelEndpoint endpoint,
      int capacity,
      Duration flushTimeout,
      TransportDiagnostics diagnostics,
      ThreadFactory writerThreads) {
    this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
    this.pending = new HandoffChannel<>(capacity);
    this.flushTimeout = Objects.requireNonNull(flushTimeout, "flushTimeout");
    this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    this.writer = writerThreads.newThread(this::writeLoop);
    this.writer.start();
  }

  @Override
  public void put(TaggedRecord record) {
    pending.put(record);
  }

  @Override
  public Optional<ChannelEndpoint> endpoint() {
    return pending.isClosed() ? Optional.empty() : Optional.of(endpoint);
  }

  /**
   * Stops accepting records and waits up to the flush timeout for queued ones to reach the bridge.
   */
  @Override
  public void close() {
    pending.close();
    if (Thread.currentThread() == writer) {
      return;
    }
    try {
      writer.join(flushTimeout.toMillis());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
    if (writer.isAlive()) {
      diagnostics.reportOnce(
          "remote-flush:" + endpoint,
          "Timed out flushing records to " + endpoint + "; unsent records are lost",
          null);
    }
  }

  @Override
  public boolean isClosed() {
    return pending.isClosed();
  }

  private void writeLoop() {
    Iterable<TaggedRecord> records = pending.drain();
    Socket socket = new Socket();
    Writer out = null;
    try {
      socket.connect(new InetSocketAddress(endpoint.host(), endpoint.port()), CONNECT_TIMEOUT_MILLIS);
      out = new BufferedWriter(new OutputStreamWriter(socket.getOutputStream(), StandardCharsets.UTF_8));
      out.write(codec.encodeHandshake(endpoint.token()));
      out.write('\n');
      out.flush();
    } catch (IOException ex) {
      out = null;
      diagnostics.reportOnce(
          "remote-connect:" + endpoint, "Could not reach log aggregation bridge " + endpoint, ex);
    }
    for (TaggedRecord record : records) {
      if (out == null) {
        continue;
      }
      try {
        out.write(codec.encode(record));
        out.write('\n');
        out.flush();
      } catch (IOException ex) {
        out = null;
        diagnostics.reportOnce(
            "remote-write:" + endpoint,
            "Lost connection to log aggregation bridge " + endpoint + "; further records are dropped",
            ex);
      }
    }
    try {
      socket.close();
    } catch (IOException ex) {
      diagnostics.reportOnce(
          "remote-close:" + endpoint, "Could not close connection to log aggregation bridge " + endpoint, ex);
    }
  }
}
