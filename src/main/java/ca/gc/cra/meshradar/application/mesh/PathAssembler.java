package ca.gc.cra.meshradar.application.mesh;

import ca.gc.cra.meshradar.application.health.HealthCounter;
import ca.gc.cra.meshradar.application.health.PipelineHealth;
import ca.gc.cra.meshradar.application.port.MeshStorePort;
import ca.gc.cra.meshradar.domain.mesh.DecodedEnvelope;
import ca.gc.cra.meshradar.domain.mesh.Edge;
import ca.gc.cra.meshradar.domain.mesh.EdgeKind;
import ca.gc.cra.meshradar.domain.mesh.MergeOutcome;
import ca.gc.cra.meshradar.domain.mesh.NodeIds;
import ca.gc.cra.meshradar.domain.mesh.Traceroute;
import ca.gc.cra.meshradar.domain.msg.NeighborList;
import ca.gc.cra.meshradar.domain.msg.PathTrace;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Reconstructs traceroute records from route discovery packets and derives topology edges.
 * <p><strong>Keying:</strong> a request ({@code wantResponse}) is keyed by its own {@code (packetId, from)}; a reply
 * travels back to the requester and is keyed by {@code (requestId, to)} and marks the record done.</p>
 * <p><strong>Thread-safety:</strong> Stateless; read-merge-write atomicity is provided by the store.</p>
 * <p><strong>Observability:</strong> Conflicting routes increment {@code path.anomaly.conflict} and log at WARN.</p>
 *
 * @since 0.1.0
 */
public final class PathAssembler {
  private static final Logger log = LoggerFactory.getLogger(PathAssembler.class);

  private final MeshStorePort store;
  private final PipelineHealth health;

  public PathAssembler(MeshStorePort store, PipelineHealth health) {
    this.store = Objects.requireNonNull(store, "store");
    this.health = Objects.requireNonNull(health, "health");
  }

  /**
   * Folds one traceroute packet into its record.
   *
   * @param envelope envelope of the traceroute packet
   * @param trace decoded route discovery payload
   * @return merged record with derived edges, or empty when a reply does not name its request
   */
  public Optional<PathAssembly> assemble(DecodedEnvelope envelope, PathTrace trace) {
    Objects.requireNonNull(trace, "trace");
    Traceroute incoming;
    if (envelope.wantResponse()) {
      incoming = new Traceroute(
          envelope.packetId(),
          envelope.fromNodeId(),
          envelope.toNodeId(),
          trace.route(),
          trace.snrTowards(),
          List.of(),
          List.of(),
          false,
          envelope.gatewayId(),
          envelope.receivedAt());
    } else {
      if (envelope.requestId() == 0) {
        log.debug("Traceroute reply {} does not reference a request; ignoring", envelope.key());
        return Optional.empty();
      }
      incoming = new Traceroute(
          envelope.requestId(),
          envelope.toNodeId(),
          envelope.fromNodeId(),
          trace.route(),
          trace.snrTowards(),
          trace.routeBack(),
          trace.snrBack(),
          true,
          envelope.gatewayId(),
          envelope.receivedAt());
    }

    Traceroute.Merge merge = store.recordTraceroute(incoming);
    if (merge.outcome() == MergeOutcome.CONFLICT) {
      health.record(HealthCounter.PATH_ANOMALY);
      log.warn("Conflicting route for traceroute {}: kept {} back {}, ignored {} back {}",
          incoming.key(),
          render(merge.traceroute().route()),
          render(merge.traceroute().routeBack()),
          render(incoming.route()),
          render(incoming.routeBack()));
    }
    return Optional.of(new PathAssembly(merge, edgesOf(merge.traceroute(), envelope.observedAt())));
  }

  /**
   * Edges along a traceroute: requester through the forward hops (and on to the target once done), then the target
   * back through the return hops to the requester.
   *
   * @param traceroute traceroute record
   * @param observedAt time stamped on every edge
   * @return directed edges in hop order
   */
  public static List<Edge> edgesOf(Traceroute traceroute, long observedAt) {
    List<Edge> edges = new ArrayList<>();
    List<Long> forward = new ArrayList<>();
    forward.add(traceroute.fromNodeId());
    forward.addAll(traceroute.route());
    if (traceroute.done()) {
      forward.add(traceroute.toNodeId());
    }
    chain(forward, observedAt, edges);
    if (traceroute.done() && traceroute.hasRouteBack()) {
      List<Long> back = new ArrayList<>();
      back.add(traceroute.toNodeId());
      back.addAll(traceroute.routeBack());
      back.add(traceroute.fromNodeId());
      chain(back, observedAt, edges);
    }
    return edges;
  }

  /**
   * Edges from each heard neighbor to the reporting node.
   *
   * @param list neighbor report
   * @param reporter node that sent the report
   * @param observedAt time stamped on every edge
   * @return one edge per neighbor
   */
  public static List<Edge> edgesOf(NeighborList list, long reporter, long observedAt) {
    List<Edge> edges = new ArrayList<>(list.neighbors().size());
    for (NeighborList.Neighbor neighbor : list.neighbors()) {
      if (neighbor.nodeId() != reporter) {
        edges.add(new Edge(neighbor.nodeId(), reporter, EdgeKind.NEIGHBOR, observedAt));
      }
    }
    return edges;
  }

  private static void chain(List<Long> hops, long observedAt, List<Edge> into) {
    for (int i = 1; i < hops.size(); i++) {
      long from = hops.get(i - 1);
      long to = hops.get(i);
      if (from != to) {
        into.add(new Edge(from, to, EdgeKind.TRACE, observedAt));
      }
    }
  }

  private static String render(List<Long> route) {
    List<String> hex = new ArrayList<>(route.size());
    for (long hop : route) {
      hex.add(NodeIds.toHex(hop));
    }
    return hex.toString();
  }
}
