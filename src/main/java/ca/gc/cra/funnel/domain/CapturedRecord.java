package ca.gc.cra.funnel.domain;

import ch.qos.logback.classic.Level;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Transport-safe copy of a single log event captured by an interception point.
 * <p><strong>Why:</strong> Logback events hold references (throwables, caller data, logger context) that
 * cannot be handed to another thread's mutation or shipped to another JVM; this record keeps only plain
 * values.</p>
 * <p><strong>Role:</strong> Domain value carried through the handoff channel inside a {@link TaggedRecord}.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe. A record is owned by exactly one thread at a time:
 * the producer until it is enqueued, the consumer afterwards. Only the consumer mutates it.</p>
 *
 * @since FUNNEL 0.1
 */
public final class CapturedRecord {
  private final String loggerName;
  private final Level level;
  private final String threadName;
  private final long timestamp;
  private final String throwableText;
  private final Map<String, String> attributes;
  private String message;
  private boolean handled;

  /**
   * Creates a captured record.
   *
   * @param loggerName name of the emitting logger
   * @param level event level
   * @param message formatted message; {@code null} is stored as an empty string
   * @param threadName emitting thread; {@code null} is stored as an empty string
   * @param timestamp emission time in epoch milliseconds
   * @param throwableText rendered stack trace, or {@code null} when the event carried no throwable
   * @param attributes MDC-style attributes; copied defensively
   * @param handled whether the record already passed through an aggregation consumer
   */
  public CapturedRecord(
      String loggerName,
      Level level,
      String message,
      String threadName,
      long timestamp,
      String throwableText,
      Map<String, String> attributes,
      boolean handled) {
    this.loggerName = Objects.requireNonNull(loggerName, "loggerName");
    this.level = Objects.requireNonNull(level, "level");
    this.message = message == null ? "" : message;
    this.threadName = threadName == null ? "" : threadName;
    this.timestamp = timestamp;
    this.throwableText = throwableText;
    this.attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    this.handled = handled;
  }

  public String loggerName() {
    return loggerName;
  }

  public Level level() {
    return level;
  }

  public String message() {
    return message;
  }

  public String threadName() {
    return threadName;
  }

  public long timestamp() {
    return timestamp;
  }

  /**
   * Returns the rendered throwable, if the original event carried one.
   *
   * @return stack trace text or {@code null}
   */
  public String throwableText() {
    return throwableText;
  }

  public Map<String, String> attributes() {
    return attributes;
  }

  public boolean handled() {
    return handled;
  }

  /**
   * Replaces the message text. Used by the consumer when it prefixes the attribution.
   *
   * @param message new message; must not be {@code null}
   */
  public void rewriteMessage(String message) {
    this.message = Objects.requireNonNull(message, "message");
  }

  /** Flags the record as already aggregated so no interception point forwards it again. */
  public void markHandled() {
    this.handled = true;
  }

  @Override
  public String toString() {
    return "CapturedRecord{logger=" + loggerName + ", level=" + level + ", message=" + message
        + ", handled=" + handled + '}';
  }
}
