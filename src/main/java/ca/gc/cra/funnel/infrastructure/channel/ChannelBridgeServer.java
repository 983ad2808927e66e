package ca.gc.cra.funnel.infrastructure.channel;

import ca.gc.cra.funnel.application.port.MetricsPort;
import ca.gc.cra.funnel.domain.ChannelEndpoint;
import ca.gc.cra.funnel.domain.TaggedRecord;
import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStreamReader;
import java.net.InetSocketAddress;
import java.nio.channels.Channels;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Duration;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Loopback listener that lets worker processes produce into a {@link HandoffChannel} owned by this JVM.
 *
 * <p>One acceptor thread polls the server socket; every accepted connection gets its own reader thread,
 * so records from one worker keep their order. The first line of a connection must carry the session
 * token; connections presenting another token are dropped.</p>
 *
 * <p>{@link #shutdown(Duration)} accepts whatever is already waiting in the backlog, then gives connected
 * workers {@code grace} to finish their stream. Connections still open after that are closed and
 * reported once through {@link TransportDiagnostics}.</p>
 *
 * @since FUNNEL 0.1
 */
public final class ChannelBridgeServer {
  private static final long ACCEPT_POLL_MILLIS = 50L;
  private static final int TOKEN_BYTES = 16;

  private final HandoffChannel<TaggedRecord> target;
  private final RecordCodec codec;
  private final ThreadFactory acceptorThreads;
  private final ThreadFactory readerThreads;
  private final TransportDiagnostics diagnostics;
  private final MetricsPort metrics;
  private final Set<Connection> connections = ConcurrentHashMap.newKeySet();
  private final AtomicBoolean started = new AtomicBoolean();
  private final AtomicBoolean closing = new AtomicBoolean();
  private final AtomicInteger connectionIds = new AtomicInteger();

  private ServerSocketChannel server;
  private Selector selector;
  private Thread acceptor;
  private ChannelEndpoint endpoint;

  /**
   * Creates a bridge feeding {@code target}.
   *
   * @param target in-process channel records are delivered to
   * @param codec wire codec
   * @param acceptorThreads factory for the acceptor thread
   * @param readerThreads factory for per-connection reader threads
   * @param diagnostics one-shot failure reporter
   * @param metrics counters for connections and decode failures
   */
  public ChannelBridgeServer(
      HandoffChannel<TaggedRecord> target,
      RecordCodec codec,
      ThreadFactory acceptorThreads,
      ThreadFactory readerThreads,
      TransportDiagnostics diagnostics,
      MetricsPort metrics) {
    this.target = Objects.requireNonNull(target, "target");
    this.codec = Objects.requireNonNull(codec, "codec");
    this.acceptorThreads = Objects.requireNonNull(acceptorThreads, "acceptorThreads");
    this.readerThreads = Objects.requireNonNull(readerThreads, "readerThreads");
    this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Binds an ephemeral port on {@code host} and starts accepting.
   *
   * @param host interface to bind; loopback in practice
   * @return endpoint workers connect to
   * @throws IOException if the socket cannot be bound
   * @throws IllegalStateException if the bridge was already started
   */
  public ChannelEndpoint start(String host) throws IOException {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("Bridge already started");
    }
    server = ServerSocketChannel.open();
    try {
      server.bind(new InetSocketAddress(host, 0));
      server.configureBlocking(false);
      selector = Selector.open();
      server.register(selector, SelectionKey.OP_ACCEPT);
    } catch (IOException ex) {
      for (Closeable opened : new Closeable[] {selector, server}) {
        if (opened == null) {
          continue;
        }
        try {
          opened.close();
        } catch (IOException closeFailure) {
          ex.addSuppressed(closeFailure);
        }
      }
      throw ex;
    }
    int port = ((InetSocketAddress) server.getLocalAddress()).getPort();
    endpoint = new ChannelEndpoint(host, port, newToken());
    acceptor = acceptorThreads.newThread(this::acceptLoop);
    acceptor.start();
    return endpoint;
  }

  public ChannelEndpoint endpoint() {
    return endpoint;
  }

  /**
   * Stops accepting and drains connected workers.
   *
   * @param grace how long connected workers may keep streaming before they are cut off
   */
  public void shutdown(Duration grace) {
    if (!started.get() || !closing.compareAndSet(false, true)) {
      return;
    }
    selector.wakeup();
    joinUninterruptibly(acceptor);

    long deadline = System.nanoTime() + grace.toNanos();
    for (Connection connection : List.copyOf(connections)) {
      long remainingMillis = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
      if (remainingMillis > 0) {
        try {
          connection.reader.join(remainingMillis);
        } catch (InterruptedException ex) {
          Thread.currentThread().interrupt();
        }
      }
      if (connection.reader.isAlive()) {
        connection.forceClosed = true;
        release(connection.channel, "connection " + connection.id);
        diagnostics.reportOnce(
            "bridge-straggler:" + endpoint + '#' + connection.id,
            "Worker connection " + connection.id + " on " + endpoint
                + " still open after drain grace; closing it",
            null);
        joinUninterruptibly(connection.reader);
      }
    }
  }

  private void acceptLoop() {
    try {
      while (true) {
        selector.select(ACCEPT_POLL_MILLIS);
        selector.selectedKeys().clear();
        acceptPending();
        if (closing.get()) {
          acceptPending();
          break;
        }
      }
    } catch (IOException ex) {
      diagnostics.reportOnce(
          "bridge-accept:" + endpoint, "Bridge " + endpoint + " stopped accepting workers", ex);
    } finally {
      release(selector, "selector");
      release(server, "server socket");
    }
  }

  private void acceptPending() throws IOException {
    SocketChannel client;
    while ((client = server.accept()) != null) {
      client.configureBlocking(true);
      Connection connection = new Connection(connectionIds.incrementAndGet(), client);
      connection.reader = readerThreads.newThread(() -> readLoop(connection));
      connections.add(connection);
      connection.reader.start();
    }
  }

  private void readLoop(Connection connection) {
    try (BufferedReader reader = new BufferedReader(
        new InputStreamReader(Channels.newInputStream(connection.channel), StandardCharsets.UTF_8))) {
      String first = reader.readLine();
      if (first == null || !authenticated(first)) {
        metrics.increment("funnel.bridge.rejected");
        diagnostics.reportOnce(
            "bridge-token:" + endpoint, "Rejected a connection to " + endpoint + " without a valid token", null);
        return;
      }
      metrics.increment("funnel.bridge.connections");
      String line;
      while ((line = reader.readLine()) != null) {
        if (line.isBlank()) {
          continue;
        }
        TaggedRecord record;
        try {
          record = codec.decode(line);
        } catch (IllegalArgumentException ex) {
          metrics.increment("funnel.bridge.decode.failed");
          diagnostics.reportOnce(
              "bridge-decode:" + endpoint + '#' + connection.id,
              "Skipping malformed record from worker connection " + connection.id,
              ex);
          continue;
        }
        if (!target.put(record)) {
          metrics.increment("funnel.channel.dropped");
        }
      }
    } catch (IOException ex) {
      if (!connection.forceClosed) {
        diagnostics.reportOnce(
            "bridge-link:" + endpoint + '#' + connection.id,
            "Worker connection " + connection.id + " on " + endpoint + " broke; its pending records are lost",
            ex);
      }
    } finally {
      release(connection.channel, "connection " + connection.id);
      connections.remove(connection);
    }
  }

  private boolean authenticated(String handshake) {
    try {
      String presented = codec.decodeHandshake(handshake);
      return MessageDigest.isEqual(
          presented.getBytes(StandardCharsets.UTF_8), endpoint.token().getBytes(StandardCharsets.UTF_8));
    } catch (IllegalArgumentException ex) {
      return false;
    }
  }

  private static String newToken() {
    byte[] bytes = new byte[TOKEN_BYTES];
    new SecureRandom().nextBytes(bytes);
    return HexFormat.of().formatHex(bytes);
  }

  private static void joinUninterruptibly(Thread thread) {
    boolean interrupted = false;
    while (thread != null && thread.isAlive()) {
      try {
        thread.join();
      } catch (InterruptedException ex) {
        interrupted = true;
      }
    }
    if (interrupted) {
      Thread.currentThread().interrupt();
    }
  }

  private void release(Closeable closeable, String what) {
    if (closeable == null) {
      return;
    }
    try {
      closeable.close();
    } catch (IOException ex) {
      diagnostics.reportOnce(
          "bridge-release:" + endpoint + ':' + what, "Could not release " + what + " of bridge " + endpoint, ex);
    }
  }

  private static final class Connection {
    private final int id;
    private final SocketChannel channel;
    private Thread reader;
    private volatile boolean forceClosed;

    private Connection(int id, SocketChannel channel) {
      this.id = id;
      this.channel = channel;
    }
  }
}
