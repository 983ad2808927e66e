package ca.gc.cra.funnel.infrastructure.intercept;

import ca.gc.cra.funnel.application.port.SinkPort;
import ca.gc.cra.funnel.domain.CapturedRecord;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.LoggingEvent;
import java.util.Objects;

/**
 * {@link SinkPort} backed by a Logback {@link Logger}.
 *
 * <p>Dispatch rebuilds a Logback event from the captured record, keeps the emitting logger's name, thread,
 * timestamp and MDC, tags it with {@link AggregationMarkers#HANDLED} and hands it to
 * {@link Logger#callAppenders}, which runs the sink's appenders (and, with additivity on, its ancestors')
 * without a second level check. A rendered throwable is appended to the message on its own line.</p>
 *
 * @since FUNNEL 0.1
 */
public final class LogbackSink implements SinkPort {
  private static final String FQCN = LogbackSink.class.getName();

  private final Logger logger;

  /**
   * Wraps a Logback logger.
   *
   * @param logger sink logger; borrowed, not owned
   */
  public LogbackSink(Logger logger) {
    this.logger = Objects.requireNonNull(logger, "logger");
  }

  /**
   * Wraps an SLF4J logger that must be backed by Logback.
   *
   * @param logger SLF4J logger
   * @return sink adapter
   * @throws IllegalArgumentException when the logger is not a Logback logger
   */
  public static LogbackSink of(org.slf4j.Logger logger) {
    Objects.requireNonNull(logger, "logger");
    if (logger instanceof Logger logbackLogger) {
      return new LogbackSink(logbackLogger);
    }
    throw new IllegalArgumentException(
        "Sink logger " + logger.getName() + " is not a Logback logger: " + logger.getClass().getName());
  }

  public Logger logger() {
    return logger;
  }

  @Override
  public String name() {
    return logger.getName();
  }

  @Override
  public Level effectiveLevel() {
    return logger.getEffectiveLevel();
  }

  @Override
  public boolean isEnabledFor(Level level) {
    return logger.isEnabledFor(level);
  }

  @Override
  public void dispatch(CapturedRecord record) {
    String message = record.throwableText() == null
        ? record.message()
        : record.message() + System.lineSeparator() + record.throwableText();
    LoggingEvent event = new LoggingEvent(FQCN, logger, record.level(), message, null, null);
    event.setLoggerName(record.loggerName());
    event.setThreadName(record.threadName());
    event.setTimeStamp(record.timestamp());
    event.setMDCPropertyMap(record.attributes());
    event.addMarker(AggregationMarkers.HANDLED);
    logger.callAppenders(event);
  }
}
