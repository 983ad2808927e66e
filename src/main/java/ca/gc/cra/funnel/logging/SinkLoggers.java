package ca.gc.cra.funnel.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.FileAppender;
import ch.qos.logback.core.OutputStreamAppender;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Objects;

/**
 * <strong>What:</strong> Builds preconfigured Logback loggers that write to the console, a file, or both.
 * <p><strong>Why:</strong> Gives scripts and tests a ready sink without shipping a {@code logback.xml}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Attach a {@link ConsoleAppender} and/or {@link FileAppender} with the {@value #PATTERN} layout.</li>
 *   <li>Turn additivity off so sink output is not repeated by ancestor loggers.</li>
 *   <li>Replace earlier appenders when a logger of the same name is built again.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Build sinks from one thread; the resulting loggers are thread-safe.</p>
 *
 * @implNote Appender names are {@code <logger>-console} and {@code <logger>-file}.
 * @since FUNNEL 0.1
 */
public final class SinkLoggers {
  /** Layout of every sink built here: timestamp, emitting logger, level, message. */
  public static final String PATTERN = "%d{yyyy-MM-dd HH:mm:ss} %logger %level %msg%n";

  private SinkLoggers() {
    // Utility
  }

  /**
   * Builds a console-only sink in the SLF4J-bound context.
   *
   * @param name logger name
   * @param level logger level
   * @return configured logger
   */
  public static Logger console(String name, Level level) {
    return create(boundContext(), name, level, null, FileMode.APPEND, true);
  }

  /**
   * Builds a file-only sink in the SLF4J-bound context.
   *
   * @param name logger name
   * @param file log file; missing parent directories are created
   * @param mode append to or truncate an existing file
   * @param level logger level
   * @return configured logger
   */
  public static Logger file(String name, Path file, FileMode mode, Level level) {
    return create(boundContext(), name, level, Objects.requireNonNull(file, "file"), mode, false);
  }

  /**
   * Builds a sink writing to both a file and the console in the SLF4J-bound context.
   *
   * @param name logger name
   * @param file log file
   * @param mode append to or truncate an existing file
   * @param level logger level
   * @return configured logger
   */
  public static Logger fileAndConsole(String name, Path file, FileMode mode, Level level) {
    return create(boundContext(), name, level, Objects.requireNonNull(file, "file"), mode, true);
  }

  /**
   * Builds a sink in an explicit context.
   *
   * @param context Logback context owning the logger
   * @param name logger name
   * @param level logger level
   * @param file log file, or {@code null} for none
   * @param mode file mode; ignored without a file
   * @param console whether to attach a console appender
   * @return configured logger
   * @throws IllegalArgumentException when neither a file nor the console is requested
   */
  public static Logger create(
      LoggerContext context, String name, Level level, Path file, FileMode mode, boolean console) {
    Objects.requireNonNull(context, "context");
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(level, "level");
    if (file == null && !console) {
      throw new IllegalArgumentException("Sink " + name + " needs a file or the console");
    }
    Logger logger = context.getLogger(name);
    logger.detachAndStopAllAppenders();
    logger.setLevel(level);
    logger.setAdditive(false);
    if (file != null) {
      FileAppender<ILoggingEvent> appender = new FileAppender<>();
      appender.setFile(file.toAbsolutePath().toString());
      appender.setAppend(Objects.requireNonNullElse(mode, FileMode.APPEND) == FileMode.APPEND);
      logger.addAppender(startAppender(context, appender, name + "-file"));
    }
    if (console) {
      ConsoleAppender<ILoggingEvent> appender = new ConsoleAppender<>();
      logger.addAppender(startAppender(context, appender, name + "-console"));
    }
    return logger;
  }

  /**
   * Detaches and stops every appender of a sink, closing its file.
   *
   * @param sink logger built by this class
   */
  public static void release(Logger sink) {
    Objects.requireNonNull(sink, "sink").detachAndStopAllAppenders();
  }

  private static OutputStreamAppender<ILoggingEvent> startAppender(
      LoggerContext context, OutputStreamAppender<ILoggingEvent> appender, String appenderName) {
    PatternLayoutEncoder encoder = new PatternLayoutEncoder();
    encoder.setContext(context);
    encoder.setPattern(PATTERN);
    encoder.setCharset(StandardCharsets.UTF_8);
    encoder.start();
    appender.setContext(context);
    appender.setName(appenderName);
    appender.setEncoder(encoder);
    appender.start();
    return appender;
  }

  private static LoggerContext boundContext() {
    if (org.slf4j.LoggerFactory.getILoggerFactory() instanceof LoggerContext context) {
      return context;
    }
    throw new IllegalStateException("Sink loggers require Logback as the SLF4J backend");
  }
}
