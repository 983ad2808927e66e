package ca.gc.cra.funnel.infrastructure.channel;

import ch.qos.logback.core.Context;
import ch.qos.logback.core.status.ErrorStatus;
import java.io.PrintStream;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One-shot reporter for transport failures that happen while interception is active.
 *
 * <p>Going through SLF4J here would feed the failure back into the very channel that broke, so each
 * distinct failure key is written once to a local error stream and recorded as a Logback
 * {@link ErrorStatus}. Later failures with the same key are counted by the caller only.</p>
 *
 * @since FUNNEL 0.1
 */
public final class TransportDiagnostics {
  private static final String PREFIX = "[funnel] ";

  private final PrintStream errorStream;
  private final Context context;
  private final Set<String> reported = ConcurrentHashMap.newKeySet();

  /**
   * Creates diagnostics writing to {@code System.err}.
   *
   * @param context logging context receiving status entries; may be {@code null}
   * @return diagnostics instance
   */
  public static TransportDiagnostics toStandardError(Context context) {
    return new TransportDiagnostics(System.err, context);
  }

  /**
   * Creates diagnostics writing to an explicit stream.
   *
   * @param errorStream local error stream
   * @param context logging context receiving status entries; may be {@code null}
   */
  public TransportDiagnostics(PrintStream errorStream, Context context) {
    this.errorStream = Objects.requireNonNull(errorStream, "errorStream");
    this.context = context;
  }

  /**
   * Reports a failure the first time {@code key} is seen.
   *
   * @param key identity of the failing link (e.g. {@code bridge:127.0.0.1:4711})
   * @param message human-readable summary
   * @param cause underlying failure; may be {@code null}
   * @return {@code true} when this call produced output
   */
  public boolean reportOnce(String key, String message, Throwable cause) {
    if (!reported.add(key)) {
      return false;
    }
    String line = PREFIX + message + (cause == null ? "" : ": " + cause);
    errorStream.println(line);
    errorStream.flush();
    if (context != null) {
      context.getStatusManager().add(new ErrorStatus(message, this, cause));
    }
    return true;
  }
}
