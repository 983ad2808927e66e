package ca.gc.cra.funnel.application.port;

/**
 * <strong>What:</strong> Port abstracting aggregation metrics emission.
 * <p><strong>Why:</strong> Lets channels and consumers count drops and forwards without binding to a vendor SDK.</p>
 * <p><strong>Role:</strong> Output port implemented by adapters such as {@code OpenTelemetryMetricsAdapter}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Expose counter increments for events like dropped or forwarded records.</li>
 *   <li>Record numeric observations such as drain durations.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent updates from any producer thread
 * and from the consumer thread.</p>
 * <p><strong>Performance:</strong> Calls sit on the logging hot path; they must be non-blocking and amortized O(1).</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code funnel.channel.dropped}).</p>
 *
 * @implNote Implementations must never log through SLF4J from these methods; they run inside an
 *     interception window.
 * @since FUNNEL 0.1
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key metric identifier using dotted naming (e.g., {@code funnel.consumer.forwarded}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key metric identifier using dotted naming; must not be {@code null}
   * @param value observed value (e.g., milliseconds); semantics defined by the caller
   */
  void observe(String key, long value);

  /**
   * Metrics implementation that ignores all updates.
   *
   * <p><strong>Concurrency:</strong> Thread-safe.</p>
   * <p><strong>Observability:</strong> Drops all metrics; useful for tests.</p>
   */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
