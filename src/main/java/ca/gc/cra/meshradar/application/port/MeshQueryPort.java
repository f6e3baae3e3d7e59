package ca.gc.cra.meshradar.application.port;

import ca.gc.cra.meshradar.domain.mesh.CanonicalPacket;
import ca.gc.cra.meshradar.domain.mesh.KindCount;
import ca.gc.cra.meshradar.domain.mesh.MeshNode;
import ca.gc.cra.meshradar.domain.mesh.MessageKind;
import ca.gc.cra.meshradar.domain.mesh.PacketObservation;
import ca.gc.cra.meshradar.domain.mesh.Traceroute;
import ca.gc.cra.meshradar.domain.mesh.TrafficSummary;
import java.util.List;
import java.util.Optional;

/**
 * <strong>What:</strong> Synchronous read contract over stored nodes, packets, observations, and traceroutes.
 * <p><strong>Role:</strong> Consumed by the graph and top-traffic aggregators and by external report views.</p>
 * <p><strong>Thread-safety:</strong> Implementations must allow reads concurrently with ingestion writes.</p>
 * <p><strong>Performance:</strong> Windowed queries are served by the {@code (from_node_id, import_time)} packet
 * index and the {@code (packet_id, from_node_id)} observation index.</p>
 *
 * @since 0.1.0
 */
public interface MeshQueryPort {
  Optional<MeshNode> findNode(long nodeId);

  /**
   * Finds nodes whose hex id, long name, or short name starts with {@code prefix} (case-insensitive).
   *
   * @param prefix search prefix; must not be blank
   * @param limit maximum rows
   * @return matches ordered by node id
   */
  List<MeshNode> searchNodes(String prefix, int limit);

  Optional<CanonicalPacket> findPacket(long packetId, long fromNodeId);

  /**
   * Packets sent by a node, newest first.
   *
   * @param nodeId sender node number
   * @param sinceMillis window start (inclusive) on import time
   * @param limit maximum rows
   * @return canonical packets ordered by import time descending
   */
  List<CanonicalPacket> packetsFrom(long nodeId, long sinceMillis, int limit);

  /**
   * Decoded packets of one kind in a window, oldest first.
   *
   * @param kind message kind
   * @param sinceMillis window start (inclusive) on import time
   * @param limit maximum rows
   * @return canonical packets ordered by import time ascending
   */
  List<CanonicalPacket> packetsOfKindSince(MessageKind kind, long sinceMillis, int limit);

  /**
   * Gateway observations of one packet, newest first.
   *
   * @param packetId mesh packet id
   * @param fromNodeId sender node number
   * @return observations ordered by import time descending
   */
  List<PacketObservation> observations(long packetId, long fromNodeId);

  Optional<Traceroute> findTraceroute(long packetId, long fromNodeId);

  /**
   * Traceroutes first seen in a window.
   *
   * @param sinceMillis window start (inclusive) on import time
   * @return traceroutes ordered by import time ascending
   */
  List<Traceroute> traceroutesSince(long sinceMillis);

  /**
   * Ranks senders by traffic in a window: distinct packets sent and the gateway observations of those packets.
   *
   * @param sinceMillis window start (inclusive) on packet import time
   * @param limit maximum rows
   * @return rows ordered by times seen desc, packets sent desc, node id asc
   */
  List<TrafficSummary> topTraffic(long sinceMillis, int limit);

  /**
   * Packets sent by a node grouped by kind.
   *
   * @param nodeId sender node number
   * @param sinceMillis window start (inclusive)
   * @return counts ordered by count desc then port number
   */
  List<KindCount> nodeTraffic(long nodeId, long sinceMillis);

  /**
   * Number of nodes seen in a window.
   *
   * @param sinceMillis window start (inclusive) on {@code lastSeen}
   * @param channel channel filter, or empty for all channels
   * @return node count
   */
  long activeNodeCount(long sinceMillis, Optional<String> channel);
}
