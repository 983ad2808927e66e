package ca.gc.cra.funnel.infrastructure.intercept;

import ca.gc.cra.funnel.application.port.InterceptionPoint;
import ca.gc.cra.funnel.application.port.LogBackbone;
import ca.gc.cra.funnel.domain.HandlerSnapshot;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.Context;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link LogBackbone} backed by the root logger of a Logback {@link LoggerContext}.
 * <p><strong>Role:</strong> Adapter that bridges aggregation sessions to the active SLF4J backend.</p>
 * <p><strong>Thread-safety:</strong> Delegates to Logback, whose root appender list is copy-on-write and whose
 * level changes are synchronized by the logger context.</p>
 *
 * @implNote Only Logback supports the listener registration this library needs; other SLF4J bindings are
 *     rejected by {@link #fromSlf4j()}.
 * @since FUNNEL 0.1
 */
public final class LogbackBackbone implements LogBackbone {
  private final LoggerContext context;
  private final Logger root;

  /**
   * Creates a backbone over an explicit context.
   *
   * @param context Logback context
   */
  public LogbackBackbone(LoggerContext context) {
    this.context = Objects.requireNonNull(context, "context");
    this.root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
  }

  /**
   * Creates a backbone over the context SLF4J is bound to.
   *
   * @return backbone for the process-wide logging context
   * @throws IllegalStateException when SLF4J is not bound to Logback
   */
  public static LogbackBackbone fromSlf4j() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext loggerContext) {
      return new LogbackBackbone(loggerContext);
    }
    throw new IllegalStateException(
        "Log aggregation requires Logback as the SLF4J backend but found " + factory.getClass().getName());
  }

  @Override
  public void attach(Appender<ILoggingEvent> listener) {
    root.addAppender(Objects.requireNonNull(listener, "listener"));
  }

  @Override
  public void detach(Appender<ILoggingEvent> listener) {
    root.detachAppender(Objects.requireNonNull(listener, "listener"));
  }

  @Override
  public boolean isAttached(Appender<ILoggingEvent> listener) {
    return root.isAttached(listener);
  }

  @Override
  public Level minimumLevel() {
    return root.getLevel();
  }

  @Override
  public void setMinimumLevel(Level level) {
    root.setLevel(Objects.requireNonNull(level, "level"));
  }

  @Override
  public List<HandlerSnapshot> snapshotInterceptors() {
    List<HandlerSnapshot> snapshots = new ArrayList<>();
    for (Iterator<Appender<ILoggingEvent>> it = root.iteratorForAppenders(); it.hasNext(); ) {
      Appender<ILoggingEvent> appender = it.next();
      if (appender instanceof InterceptionPoint point) {
        point.snapshot().ifPresent(snapshots::add);
      }
    }
    return List.copyOf(snapshots);
  }

  @Override
  public Context context() {
    return context;
  }

  /**
   * Returns the underlying Logback context.
   *
   * @return logger context
   */
  public LoggerContext loggerContext() {
    return context;
  }
}
