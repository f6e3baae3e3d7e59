package ca.gc.cra.meshradar.infrastructure.persistence.memory;

import ca.gc.cra.meshradar.application.port.MeshQueryPort;
import ca.gc.cra.meshradar.application.port.MeshStorePort;
import ca.gc.cra.meshradar.domain.mesh.CanonicalPacket;
import ca.gc.cra.meshradar.domain.mesh.DecodedEnvelope;
import ca.gc.cra.meshradar.domain.mesh.KindCount;
import ca.gc.cra.meshradar.domain.mesh.MeshNode;
import ca.gc.cra.meshradar.domain.mesh.MessageKind;
import ca.gc.cra.meshradar.domain.mesh.NodeField;
import ca.gc.cra.meshradar.domain.mesh.PacketKey;
import ca.gc.cra.meshradar.domain.mesh.PacketObservation;
import ca.gc.cra.meshradar.domain.mesh.RecordOutcome;
import ca.gc.cra.meshradar.domain.mesh.Traceroute;
import ca.gc.cra.meshradar.domain.mesh.TrafficSummary;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;

/**
 * <strong>What:</strong> Heap-backed mesh store for tests, dry runs, and single-process deployments.
 * <p><strong>Thread-safety:</strong> Every write is a {@link ConcurrentHashMap#compute} on its own key, so updates to
 * one packet or node are serialized while distinct keys proceed in parallel.</p>
 * <p><strong>Performance:</strong> Windowed queries scan the maps; intended for modest data volumes.</p>
 *
 * @since 0.1.0
 */
public final class InMemoryMeshStore implements MeshStorePort, MeshQueryPort {
  private static final Comparator<CanonicalPacket> NEWEST_FIRST =
      Comparator.comparingLong(CanonicalPacket::importTime).reversed()
          .thenComparing(Comparator.comparingLong(CanonicalPacket::packetId).reversed());

  private final ConcurrentMap<Long, MeshNode> nodes = new ConcurrentHashMap<>();
  private final ConcurrentMap<PacketKey, CanonicalPacket> packets = new ConcurrentHashMap<>();
  private final ConcurrentMap<PacketKey, ConcurrentMap<String, PacketObservation>> observations =
      new ConcurrentHashMap<>();
  private final ConcurrentMap<PacketKey, Traceroute> traceroutes = new ConcurrentHashMap<>();

  @Override
  public RecordOutcome recordPacket(DecodedEnvelope envelope) {
    Objects.requireNonNull(envelope, "envelope");
    PacketKey key = envelope.key();
    boolean[] createdOrEnriched = new boolean[2];
    packets.compute(key, (k, existing) -> {
      if (existing == null) {
        createdOrEnriched[0] = true;
        return CanonicalPacket.from(envelope);
      }
      CanonicalPacket enriched = existing.enrichWith(envelope);
      createdOrEnriched[1] = enriched != existing;
      return enriched;
    });
    boolean observationCreated = observations
        .computeIfAbsent(key, k -> new ConcurrentHashMap<>())
        .putIfAbsent(envelope.gatewayId(), PacketObservation.from(envelope)) == null;
    return new RecordOutcome(createdOrEnriched[0], observationCreated, createdOrEnriched[1]);
  }

  @Override
  public <T> MeshNode mergeObservation(long nodeId, NodeField<T> field, T value, long observedAt) {
    return nodes.compute(nodeId,
        (id, existing) -> (existing == null ? MeshNode.empty(id) : existing).merge(field, value, observedAt));
  }

  @Override
  public MeshNode touchNode(long nodeId, long observedAt) {
    return nodes.compute(nodeId, (id, existing) -> (existing == null ? MeshNode.empty(id) : existing).touch(observedAt));
  }

  @Override
  public Traceroute.Merge recordTraceroute(Traceroute incoming) {
    Objects.requireNonNull(incoming, "incoming");
    Traceroute.Merge[] result = new Traceroute.Merge[1];
    traceroutes.compute(incoming.key(), (key, existing) -> {
      result[0] = Traceroute.merge(existing, incoming);
      return result[0].traceroute();
    });
    return result[0];
  }

  @Override
  public Optional<MeshNode> findNode(long nodeId) {
    return Optional.ofNullable(nodes.get(nodeId));
  }

  @Override
  public List<MeshNode> searchNodes(String prefix, int limit) {
    String needle = Objects.requireNonNull(prefix, "prefix").trim().toLowerCase(Locale.ROOT);
    if (needle.isEmpty()) {
      throw new IllegalArgumentException("search prefix must not be blank");
    }
    return nodes.values().stream()
        .filter(node -> matches(node, needle))
        .sorted(Comparator.comparingLong(MeshNode::nodeId))
        .limit(limit)
        .collect(Collectors.toList());
  }

  private static boolean matches(MeshNode node, String needle) {
    String hex = node.hexId();
    if (hex.startsWith(needle) || hex.substring(1).startsWith(needle)) {
      return true;
    }
    return startsWith(node.get(NodeField.LONG_NAME), needle) || startsWith(node.get(NodeField.SHORT_NAME), needle);
  }

  private static boolean startsWith(Optional<String> value, String needle) {
    return value.map(v -> v.toLowerCase(Locale.ROOT).startsWith(needle)).orElse(false);
  }

  @Override
  public Optional<CanonicalPacket> findPacket(long packetId, long fromNodeId) {
    return Optional.ofNullable(packets.get(new PacketKey(packetId, fromNodeId)));
  }

  @Override
  public List<CanonicalPacket> packetsFrom(long nodeId, long sinceMillis, int limit) {
    return packets.values().stream()
        .filter(p -> p.fromNodeId() == nodeId && p.importTime() >= sinceMillis)
        .sorted(NEWEST_FIRST)
        .limit(limit)
        .collect(Collectors.toList());
  }

  @Override
  public List<CanonicalPacket> packetsOfKindSince(MessageKind kind, long sinceMillis, int limit) {
    return packets.values().stream()
        .filter(p -> p.decoded() && p.kind() == kind && p.importTime() >= sinceMillis)
        .sorted(Comparator.comparingLong(CanonicalPacket::importTime).thenComparingLong(CanonicalPacket::packetId))
        .limit(limit)
        .collect(Collectors.toList());
  }

  @Override
  public List<PacketObservation> observations(long packetId, long fromNodeId) {
    Map<String, PacketObservation> seen = observations.get(new PacketKey(packetId, fromNodeId));
    if (seen == null) {
      return List.of();
    }
    List<PacketObservation> rows = new ArrayList<>(seen.values());
    rows.sort(Comparator.comparingLong(PacketObservation::importTime).reversed()
        .thenComparing(PacketObservation::gatewayId));
    return rows;
  }

  @Override
  public Optional<Traceroute> findTraceroute(long packetId, long fromNodeId) {
    return Optional.ofNullable(traceroutes.get(new PacketKey(packetId, fromNodeId)));
  }

  @Override
  public List<Traceroute> traceroutesSince(long sinceMillis) {
    return traceroutes.values().stream()
        .filter(t -> t.importTime() >= sinceMillis)
        .sorted(Comparator.comparingLong(Traceroute::importTime).thenComparingLong(Traceroute::packetId))
        .collect(Collectors.toList());
  }

  @Override
  public List<TrafficSummary> topTraffic(long sinceMillis, int limit) {
    Map<Long, long[]> totals = new HashMap<>();
    for (CanonicalPacket packet : packets.values()) {
      if (packet.importTime() < sinceMillis) {
        continue;
      }
      long[] counts = totals.computeIfAbsent(packet.fromNodeId(), id -> new long[2]);
      counts[0]++;
      Map<String, PacketObservation> seen = observations.get(packet.key());
      counts[1] += seen == null ? 0 : seen.size();
    }
    List<TrafficSummary> rows = new ArrayList<>(totals.size());
    totals.forEach((nodeId, counts) -> {
      MeshNode node = nodes.get(nodeId);
      rows.add(new TrafficSummary(
          nodeId,
          node == null ? null : node.get(NodeField.LONG_NAME).orElse(null),
          node == null ? null : node.get(NodeField.SHORT_NAME).orElse(null),
          node == null ? null : node.get(NodeField.CHANNEL).orElse(null),
          counts[0],
          counts[1]));
    });
    rows.sort(TrafficSummary.RANKING);
    return rows.size() > limit ? List.copyOf(rows.subList(0, limit)) : rows;
  }

  @Override
  public List<KindCount> nodeTraffic(long nodeId, long sinceMillis) {
    Map<Integer, KindCount> byPort = new HashMap<>();
    for (CanonicalPacket packet : packets.values()) {
      if (packet.fromNodeId() != nodeId || packet.importTime() < sinceMillis) {
        continue;
      }
      byPort.merge(packet.portNum(), new KindCount(packet.portNum(), packet.kind(), 1),
          (a, b) -> new KindCount(a.portNum(), a.kind(), a.count() + b.count()));
    }
    List<KindCount> rows = new ArrayList<>(byPort.values());
    rows.sort(Comparator.comparingLong(KindCount::count).reversed().thenComparingInt(KindCount::portNum));
    return rows;
  }

  @Override
  public long activeNodeCount(long sinceMillis, Optional<String> channel) {
    return nodes.values().stream()
        .filter(node -> node.lastSeen() >= sinceMillis)
        .filter(node -> channel.isEmpty() || channel.equals(node.get(NodeField.CHANNEL)))
        .count();
  }
}
