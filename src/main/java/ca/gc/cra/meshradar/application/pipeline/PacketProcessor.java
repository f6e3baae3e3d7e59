package ca.gc.cra.meshradar.application.pipeline;

import ca.gc.cra.meshradar.application.health.HealthCounter;
import ca.gc.cra.meshradar.application.health.PipelineHealth;
import ca.gc.cra.meshradar.application.hub.LiveHub;
import ca.gc.cra.meshradar.application.mesh.NodeStateMerger;
import ca.gc.cra.meshradar.application.mesh.PathAssembler;
import ca.gc.cra.meshradar.application.mesh.PathAssembly;
import ca.gc.cra.meshradar.application.port.MeshQueryPort;
import ca.gc.cra.meshradar.application.port.MeshStorePort;
import ca.gc.cra.meshradar.application.port.MetricsPort;
import ca.gc.cra.meshradar.application.port.PayloadDecoderPort;
import ca.gc.cra.meshradar.domain.error.DecodeException;
import ca.gc.cra.meshradar.domain.error.StoreException;
import ca.gc.cra.meshradar.domain.geo.Haversine;
import ca.gc.cra.meshradar.domain.mesh.DecodedEnvelope;
import ca.gc.cra.meshradar.domain.mesh.MeshNode;
import ca.gc.cra.meshradar.domain.mesh.MessageKind;
import ca.gc.cra.meshradar.domain.mesh.NodeField;
import ca.gc.cra.meshradar.domain.mesh.NodeIds;
import ca.gc.cra.meshradar.domain.mesh.NormalizedEvent;
import ca.gc.cra.meshradar.domain.mesh.Position;
import ca.gc.cra.meshradar.domain.mesh.RecordOutcome;
import ca.gc.cra.meshradar.domain.msg.NeighborList;
import ca.gc.cra.meshradar.domain.msg.NormalizedRecord;
import ca.gc.cra.meshradar.domain.msg.PathTrace;
import ca.gc.cra.meshradar.logging.Logs;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Store stage for one decoded envelope: payload decode, dedup, node merge, path assembly, distance, and live
 * publication.
 * <p><strong>Why:</strong> Keeps the per-envelope write sequence in one place so every store worker applies it the
 * same way.</p>
 * <p><strong>Role:</strong> Called by the pipeline's store workers.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe to share across store workers.</p>
 * <p><strong>Observability:</strong> Dedup no-ops, enrichment, and payload decode failures are counted. An unreadable
 * payload is counted before any store write and leaves the store untouched.</p>
 *
 * @since 0.1.0
 */
public final class PacketProcessor {
  private static final Logger log = LoggerFactory.getLogger(PacketProcessor.class);
  private static final int TEXT_LOG_CHARS = 120;

  private final MeshStorePort store;
  private final MeshQueryPort query;
  private final PayloadDecoderPort payloads;
  private final NodeStateMerger merger;
  private final PathAssembler paths;
  private final LiveHub hub;
  private final PipelineHealth health;
  private final MetricsPort metrics;

  /**
   * Creates the store stage.
   *
   * @param store write side of the mesh store, usually a {@code RetryingMeshStore}
   * @param query read side used to resolve node names and gateway positions
   * @param payloads kind decoders
   * @param hub live hub receiving processed events
   * @param health health surface
   */
  public PacketProcessor(
      MeshStorePort store,
      MeshQueryPort query,
      PayloadDecoderPort payloads,
      LiveHub hub,
      PipelineHealth health) {
    this.store = Objects.requireNonNull(store, "store");
    this.query = Objects.requireNonNull(query, "query");
    this.payloads = Objects.requireNonNull(payloads, "payloads");
    this.hub = Objects.requireNonNull(hub, "hub");
    this.health = Objects.requireNonNull(health, "health");
    this.metrics = health.metrics();
    this.merger = new NodeStateMerger(store);
    this.paths = new PathAssembler(store, health);
  }

  /**
   * Processes one envelope.
   *
   * @param envelope decoded envelope
   * @return published event, or empty for duplicates, opaque packets, unreadable payloads, and dropped writes
   */
  public Optional<NormalizedEvent> process(DecodedEnvelope envelope) {
    Objects.requireNonNull(envelope, "envelope");
    try {
      return doProcess(envelope);
    } catch (StoreException ex) {
      log.debug("Store write for {} abandoned: {}", envelope.key(), ex.getMessage());
      return Optional.empty();
    }
  }

  private Optional<NormalizedEvent> doProcess(DecodedEnvelope envelope) {
    NormalizedRecord record = null;
    if (envelope.decoded()) {
      try {
        record = payloads.decode(envelope.kind(), envelope.portNum(), envelope.innerPayload());
      } catch (DecodeException ex) {
        health.record(HealthCounter.PAYLOAD_FAILED);
        log.debug("Dropping {} payload of {}: {}", envelope.kind(), envelope.key(), ex.getMessage());
        return Optional.empty();
      }
    }

    RecordOutcome outcome = store.recordPacket(envelope);
    if (outcome.enriched()) {
      metrics.increment("store.packet.enriched");
    }
    if (!outcome.observationCreated()) {
      health.record(HealthCounter.DEDUP_NOOP);
      if (!outcome.enriched()) {
        log.debug("Duplicate delivery of {} via {}", envelope.key(), envelope.gatewayId());
        return Optional.empty();
      }
    }
    if (record == null) {
      return Optional.empty();
    }

    MeshNode sender = merger.apply(envelope, record);
    if (record instanceof PathTrace trace) {
      paths.assemble(envelope, trace)
          .map(PathAssembly::edges)
          .ifPresent(edges -> metrics.observe("path.edges", edges.size()));
    } else if (record instanceof NeighborList neighbors) {
      metrics.observe("path.neighbor.edges",
          PathAssembler.edgesOf(neighbors, envelope.fromNodeId(), envelope.observedAt()).size());
    } else if (log.isDebugEnabled() && envelope.kind() == MessageKind.TEXT) {
      log.debug("Text from {} on {}: {}",
          sender.displayName(), envelope.channel(), Logs.text(envelope.innerPayload(), TEXT_LOG_CHARS));
    }

    NormalizedEvent event = toEvent(envelope, record, sender, outcome.packetCreated());
    hub.publish(event);
    metrics.increment("pipeline.event.published");
    return Optional.of(event);
  }

  private NormalizedEvent toEvent(
      DecodedEnvelope envelope, NormalizedRecord record, MeshNode sender, boolean firstSighting) {
    Optional<MeshNode> gateway = envelope.gatewayNodeId() == null
        ? Optional.empty()
        : query.findNode(envelope.gatewayNodeId());
    String toName = envelope.toNodeId() == NodeIds.BROADCAST
        ? NodeIds.destinationLabel(envelope.toNodeId())
        : query.findNode(envelope.toNodeId()).map(MeshNode::displayName)
            .orElse(NodeIds.toHex(envelope.toNodeId()));
    Position senderPosition = sender.get(NodeField.LAST_POSITION).orElse(null);
    Position gatewayPosition = gateway.flatMap(node -> node.get(NodeField.LAST_POSITION)).orElse(null);

    return new NormalizedEvent(
        envelope.packetId(),
        envelope.fromNodeId(),
        envelope.toNodeId(),
        sender.displayName(),
        toName,
        envelope.gatewayId(),
        gateway.map(MeshNode::displayName).orElse(envelope.gatewayId()),
        envelope.channel(),
        record,
        envelope.rssi(),
        envelope.snr(),
        envelope.hopCount(),
        Haversine.distanceKm(senderPosition, gatewayPosition),
        firstSighting,
        envelope.observedAt());
  }
}
