package ca.gc.cra.funnel.application.port;

import ca.gc.cra.funnel.domain.CapturedRecord;
import ch.qos.logback.classic.Level;

/**
 * <strong>What:</strong> Destination logger that receives attributed, merged records.
 * <p><strong>Role:</strong> Borrowed collaborator of an aggregation session; it outlives the session.</p>
 * <p><strong>Thread-safety:</strong> {@link #name()} and {@link #isEnabledFor(Level)} may be called from any
 * thread; {@link #dispatch(CapturedRecord)} is only called from the session's consumer thread.</p>
 *
 * @since FUNNEL 0.1
 * @see ca.gc.cra.funnel.infrastructure.intercept.LogbackSink
 */
public interface SinkPort {
  /**
   * Returns the sink logger name; used for attribution and echo suppression.
   *
   * @return logger name
   */
  String name();

  /**
   * Returns the level currently in effect for the sink.
   *
   * @return effective level
   */
  Level effectiveLevel();

  /**
   * Evaluates the sink's current effective level.
   *
   * @param level record level
   * @return {@code true} when the sink accepts records at {@code level}
   */
  boolean isEnabledFor(Level level);

  /**
   * Runs the sink's own output appenders on a record without re-applying its level gate.
   *
   * @param record already attributed and handled-marked record
   */
  void dispatch(CapturedRecord record);
}
