package ca.gc.cra.funnel.application.port;

import ca.gc.cra.funnel.domain.ChannelEndpoint;
import ca.gc.cra.funnel.domain.TaggedRecord;
import java.util.Optional;

/**
 * <strong>What:</strong> Producer-side view of a handoff channel.
 * <p><strong>Why:</strong> Interception points only need to enqueue; whether the consumer lives in this JVM or in
 * a parent process is an adapter concern.</p>
 * <p><strong>Thread-safety:</strong> {@link #put(TaggedRecord)} must be safe for any number of concurrent
 * producers.</p>
 * <p><strong>Performance:</strong> {@link #put(TaggedRecord)} runs on the caller's logging path and must never
 * block.</p>
 *
 * @since FUNNEL 0.1
 */
public interface RecordChannel {
  /**
   * Enqueues a record. Never blocks and never throws; records offered to a closed or saturated channel are
   * silently dropped.
   *
   * @param record tagged record
   */
  void put(TaggedRecord record);

  /**
   * Returns an address another process can use to produce into this channel.
   *
   * @return endpoint, or empty once the channel is closed
   */
  Optional<ChannelEndpoint> endpoint();

  /** Closes the producer side. Idempotent. */
  void close();

  /**
   * Reports whether {@link #close()} has been called.
   *
   * @return {@code true} once closed
   */
  boolean isClosed();
}
