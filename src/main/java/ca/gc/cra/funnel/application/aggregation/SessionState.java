package ca.gc.cra.funnel.application.aggregation;

/**
 * Lifecycle of an {@link Aggregator}: {@code UNSTARTED -> STARTED -> STOPPED}, and {@code STOPPED -> STARTED}
 * when a session is reused.
 *
 * @since FUNNEL 0.1
 */
public enum SessionState {
  UNSTARTED,
  STARTED,
  STOPPED
}
