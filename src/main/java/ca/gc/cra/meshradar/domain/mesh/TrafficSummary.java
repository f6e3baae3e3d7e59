package ca.gc.cra.meshradar.domain.mesh;

import java.util.Comparator;

/**
 * Row of the top-traffic ranking.
 *
 * @param nodeId sender node number
 * @param longName long name, or {@code null}
 * @param shortName short name, or {@code null}
 * @param channel last known channel, or {@code null}
 * @param packetsSent distinct packets sent in the window
 * @param timesSeen gateway observations of those packets
 */
public record TrafficSummary(
    long nodeId, String longName, String shortName, String channel, long packetsSent, long timesSeen) {

  /** Ranking order: times seen desc, packets sent desc, node id asc. */
  public static final Comparator<TrafficSummary> RANKING =
      Comparator.comparingLong(TrafficSummary::timesSeen).reversed()
          .thenComparing(Comparator.comparingLong(TrafficSummary::packetsSent).reversed())
          .thenComparingLong(TrafficSummary::nodeId);
}
