package ca.gc.cra.funnel.application.port;

import ca.gc.cra.funnel.domain.HandlerSnapshot;
import java.util.Optional;

/**
 * A backbone listener that forwards events into an aggregation channel and can describe itself to a
 * worker process.
 *
 * @since FUNNEL 0.1
 */
public interface InterceptionPoint {
  /**
   * Describes this interception point as serializable data.
   *
   * @return snapshot, or empty when its channel cannot be reached from another process
   */
  Optional<HandlerSnapshot> snapshot();
}
