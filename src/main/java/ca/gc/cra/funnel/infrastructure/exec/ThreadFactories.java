package ca.gc.cra.funnel.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory helpers for the named background threads used by aggregation sessions and channel bridges.
 */
public final class ThreadFactories {

  private ThreadFactories() {}

  /**
   * Builds a thread factory that names threads {@code prefix-N}.
   *
   * @param prefix thread-name prefix used to tag threads
   * @param daemon whether created threads are daemons
   * @param handler uncaught exception handler installed on each thread; {@code null} keeps the JVM default,
   *     which prints to {@code System.err}
   * @return configured thread factory
   */
  public static ThreadFactory named(String prefix, boolean daemon, UncaughtExceptionHandler handler) {
    String threadPrefix = (prefix == null || prefix.isBlank()) ? "funnel" : prefix;
    AtomicInteger index = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName(threadPrefix + "-" + index.getAndIncrement());
      thread.setDaemon(daemon);
      if (handler != null) {
        thread.setUncaughtExceptionHandler(handler);
      }
      return thread;
    };
  }

  /**
   * Builds a daemon thread factory with the JVM's default uncaught exception handling.
   *
   * @param prefix thread-name prefix
   * @return configured thread factory
   */
  public static ThreadFactory daemon(String prefix) {
    return named(prefix, true, null);
  }
}
