package ca.gc.cra.meshradar.application.query;

import ca.gc.cra.meshradar.application.mesh.PathAssembler;
import ca.gc.cra.meshradar.application.port.MeshQueryPort;
import ca.gc.cra.meshradar.application.port.MetricsPort;
import ca.gc.cra.meshradar.application.port.PayloadDecoderPort;
import ca.gc.cra.meshradar.domain.error.DecodeException;
import ca.gc.cra.meshradar.domain.mesh.CanonicalPacket;
import ca.gc.cra.meshradar.domain.mesh.Edge;
import ca.gc.cra.meshradar.domain.mesh.MessageKind;
import ca.gc.cra.meshradar.domain.mesh.Traceroute;
import ca.gc.cra.meshradar.domain.msg.NeighborList;
import ca.gc.cra.meshradar.domain.msg.NormalizedRecord;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Builds the topology edge set from stored traceroutes and neighbor reports.
 * <p><strong>Role:</strong> Read-side aggregator; runs independently of ingestion.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class GraphAggregator {
  private static final Logger log = LoggerFactory.getLogger(GraphAggregator.class);
  private static final int NEIGHBOR_SCAN_LIMIT = 10_000;
  private static final Comparator<Edge> BY_ENDPOINTS =
      Comparator.comparingLong(Edge::from).thenComparingLong(Edge::to);

  private final MeshQueryPort query;
  private final PayloadDecoderPort payloads;
  private final MetricsPort metrics;

  public GraphAggregator(MeshQueryPort query, PayloadDecoderPort payloads, MetricsPort metrics) {
    this.query = Objects.requireNonNull(query, "query");
    this.payloads = Objects.requireNonNull(payloads, "payloads");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Edges along every traceroute first seen in the window.
   *
   * @param sinceMillis window start (inclusive)
   * @return trace edges stamped with the traceroute import time
   */
  public List<Edge> traceEdgesSince(long sinceMillis) {
    List<Edge> edges = new ArrayList<>();
    for (Traceroute traceroute : query.traceroutesSince(sinceMillis)) {
      edges.addAll(PathAssembler.edgesOf(traceroute, traceroute.importTime()));
    }
    return edges;
  }

  /**
   * Edges from each neighbor report stored in the window. Reports that no longer decode are skipped.
   *
   * @param sinceMillis window start (inclusive)
   * @return neighbor edges stamped with the report import time
   */
  public List<Edge> neighborEdgesSince(long sinceMillis) {
    List<Edge> edges = new ArrayList<>();
    for (CanonicalPacket packet : query.packetsOfKindSince(MessageKind.NEIGHBORINFO, sinceMillis, NEIGHBOR_SCAN_LIMIT)) {
      NormalizedRecord record;
      try {
        record = payloads.decode(MessageKind.NEIGHBORINFO, packet.portNum(), packet.payload());
      } catch (DecodeException ex) {
        metrics.increment("graph.neighbor.undecodable");
        log.debug("Skipping neighbor report {}: {}", packet.key(), ex.getMessage());
        continue;
      }
      NeighborList list = (NeighborList) record;
      long reporter = list.nodeId() != 0 ? list.nodeId() : packet.fromNodeId();
      edges.addAll(PathAssembler.edgesOf(list, reporter, packet.importTime()));
    }
    return edges;
  }

  /**
   * Trace and neighbor edges in the window, one per {@code (from, to)} pair keeping the latest observation.
   *
   * @param sinceMillis window start (inclusive)
   * @return deduplicated edges sorted by {@code (from, to)}
   */
  public List<Edge> edges(long sinceMillis) {
    List<Edge> all = new ArrayList<>(traceEdgesSince(sinceMillis));
    all.addAll(neighborEdgesSince(sinceMillis));
    List<Edge> merged = dedup(all);
    metrics.observe("graph.edges", merged.size());
    return merged;
  }

  static List<Edge> dedup(Collection<Edge> edges) {
    Map<Endpoints, Edge> latest = new LinkedHashMap<>();
    for (Edge edge : edges) {
      latest.merge(new Endpoints(edge.from(), edge.to()), edge,
          (current, candidate) -> candidate.observedAt() > current.observedAt() ? candidate : current);
    }
    List<Edge> sorted = new ArrayList<>(latest.values());
    sorted.sort(BY_ENDPOINTS);
    return sorted;
  }

  private record Endpoints(long from, long to) {}
}
