package ca.gc.cra.meshradar.application.query;

import ca.gc.cra.meshradar.application.port.ClockPort;
import ca.gc.cra.meshradar.application.port.MeshQueryPort;
import ca.gc.cra.meshradar.domain.mesh.KindCount;
import ca.gc.cra.meshradar.domain.mesh.TrafficSummary;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Windowed traffic tables relative to the current time.
 *
 * @since 0.1.0
 */
public final class TopTrafficAggregator {
  private final MeshQueryPort query;
  private final ClockPort clock;

  public TopTrafficAggregator(MeshQueryPort query, ClockPort clock) {
    this.query = Objects.requireNonNull(query, "query");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Ranks senders over the trailing window.
   *
   * @param window trailing window
   * @param limit maximum rows; must be positive
   * @return rows ordered by times seen desc, packets sent desc, node id asc
   */
  public List<TrafficSummary> top(Duration window, int limit) {
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be positive");
    }
    return query.topTraffic(since(window), limit);
  }

  /**
   * Packets per kind sent by one node over the trailing window.
   *
   * @param nodeId sender node number
   * @param window trailing window
   * @return counts per kind
   */
  public List<KindCount> nodeTraffic(long nodeId, Duration window) {
    return query.nodeTraffic(nodeId, since(window));
  }

  /**
   * Nodes seen over the trailing window.
   *
   * @param window trailing window
   * @param channel optional channel filter
   * @return node count
   */
  public long activeNodes(Duration window, Optional<String> channel) {
    return query.activeNodeCount(since(window), channel);
  }

  private long since(Duration window) {
    Objects.requireNonNull(window, "window");
    if (window.isNegative() || window.isZero()) {
      throw new IllegalArgumentException("window must be positive");
    }
    return clock.nowMillis() - window.toMillis();
  }
}
