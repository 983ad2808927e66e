package ca.gc.cra.funnel.domain;

import java.util.Objects;

/**
 * Address of a channel bridge that worker processes connect to.
 *
 * <p>The token is a per-session secret sent as the first line of every connection; connections that
 * present another token are rejected.</p>
 *
 * @param host loopback host the bridge listens on
 * @param port bridge port
 * @param token session token
 * @since FUNNEL 0.1
 */
public record ChannelEndpoint(String host, int port, String token) {
  public ChannelEndpoint {
    Objects.requireNonNull(host, "host");
    Objects.requireNonNull(token, "token");
    if (port <= 0 || port > 65535) {
      throw new IllegalArgumentException("port out of range: " + port);
    }
  }

  @Override
  public String toString() {
    return host + ':' + port;
  }
}
