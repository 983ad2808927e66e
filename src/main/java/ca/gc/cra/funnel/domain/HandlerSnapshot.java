package ca.gc.cra.funnel.domain;

import ch.qos.logback.classic.Level;
import java.util.Objects;

/**
 * Serializable description of an installed interception point: enough to rebuild an equivalent one
 * inside a freshly launched worker process.
 *
 * @param level threshold of the interception point
 * @param endpoint channel bridge the rebuilt interception point forwards to
 * @since FUNNEL 0.1
 */
public record HandlerSnapshot(Level level, ChannelEndpoint endpoint) {
  public HandlerSnapshot {
    Objects.requireNonNull(level, "level");
    Objects.requireNonNull(endpoint, "endpoint");
  }
}
