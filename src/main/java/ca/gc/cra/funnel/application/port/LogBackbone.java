package ca.gc.cra.funnel.application.port;

import ca.gc.cra.funnel.domain.HandlerSnapshot;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.Context;
import java.util.List;

/**
 * <strong>What:</strong> Port over the process-wide logging backbone: the listener set every emitted event
 * reaches and the minimum level that gates dispatch.
 * <p><strong>Why:</strong> Interception mutates global state; routing that mutation through an injectable port
 * keeps tests isolated and lets callers target a specific {@link Context}.</p>
 * <p><strong>Role:</strong> Output port implemented by {@code LogbackBackbone}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate concurrent attach/detach from several
 * aggregation sessions.</p>
 *
 * @since FUNNEL 0.1
 */
public interface LogBackbone {
  /**
   * Registers a listener that receives every event dispatched in this process.
   *
   * @param listener started appender
   */
  void attach(Appender<ILoggingEvent> listener);

  /**
   * Unregisters a listener. Unknown listeners are ignored.
   *
   * @param listener appender previously attached
   */
  void detach(Appender<ILoggingEvent> listener);

  /**
   * Reports whether the listener is currently registered.
   *
   * @param listener appender to look up
   * @return {@code true} when attached
   */
  boolean isAttached(Appender<ILoggingEvent> listener);

  /**
   * Returns the process-wide minimum dispatch level.
   *
   * @return current minimum level
   */
  Level minimumLevel();

  /**
   * Replaces the process-wide minimum dispatch level.
   *
   * @param level new minimum level
   */
  void setMinimumLevel(Level level);

  /**
   * Captures every registered {@link InterceptionPoint} as serializable snapshots, in registration order.
   *
   * @return snapshots of interception points that can be reached from another process
   */
  List<HandlerSnapshot> snapshotInterceptors();

  /**
   * Returns the logging context listeners must be bound to before they are started.
   *
   * @return logging context
   */
  Context context();
}
