package ca.gc.cra.meshradar.infrastructure.decode;

import java.util.Objects;

/**
 * Gateway and channel captured from a broker topic.
 *
 * @param gatewayId gateway token
 * @param channel channel name
 */
public record TopicRoute(String gatewayId, String channel) {
  public TopicRoute {
    Objects.requireNonNull(gatewayId, "gatewayId");
    Objects.requireNonNull(channel, "channel");
  }
}
