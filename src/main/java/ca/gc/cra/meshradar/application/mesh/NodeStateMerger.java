package ca.gc.cra.meshradar.application.mesh;

import ca.gc.cra.meshradar.application.port.MeshStorePort;
import ca.gc.cra.meshradar.domain.mesh.DecodedEnvelope;
import ca.gc.cra.meshradar.domain.mesh.MeshNode;
import ca.gc.cra.meshradar.domain.mesh.NodeField;
import ca.gc.cra.meshradar.domain.mesh.Position;
import ca.gc.cra.meshradar.domain.msg.MapReport;
import ca.gc.cra.meshradar.domain.msg.NodeIdentity;
import ca.gc.cra.meshradar.domain.msg.NormalizedRecord;
import ca.gc.cra.meshradar.domain.msg.PositionReport;
import ca.gc.cra.meshradar.domain.msg.TelemetryReport;
import java.util.Objects;

/**
 * <strong>What:</strong> Turns decoded records into per-field node observations for the sender.
 * <p><strong>Why:</strong> Identity, position, and telemetry arrive independently; each field is merged on its own
 * observation time so a late, older packet never overwrites fresher state.</p>
 * <p><strong>Role:</strong> Invoked by the store stage after the canonical packet is recorded.</p>
 * <p><strong>Thread-safety:</strong> Stateless; per-node serialization is provided by the store.</p>
 *
 * @since 0.1.0
 */
public final class NodeStateMerger {
  private final MeshStorePort store;

  public NodeStateMerger(MeshStorePort store) {
    this.store = Objects.requireNonNull(store, "store");
  }

  /**
   * Applies every field observation carried by a decoded packet to its sender.
   *
   * @param envelope decoded envelope; opaque envelopes must not be passed
   * @param record decoded payload
   * @return sender state after the merge
   */
  public MeshNode apply(DecodedEnvelope envelope, NormalizedRecord record) {
    Objects.requireNonNull(record, "record");
    if (!envelope.decoded()) {
      throw new IllegalArgumentException("Opaque envelope " + envelope.key() + " carries no node state");
    }
    long nodeId = envelope.fromNodeId();
    long observedAt = envelope.observedAt();
    MeshNode node = store.mergeObservation(nodeId, NodeField.CHANNEL, envelope.channel(), observedAt);

    if (record instanceof NodeIdentity identity) {
      node = mergeText(node, NodeField.LONG_NAME, identity.longName(), observedAt);
      node = mergeText(node, NodeField.SHORT_NAME, identity.shortName(), observedAt);
      node = mergeText(node, NodeField.HW_MODEL, identity.hwModel(), observedAt);
      node = mergeText(node, NodeField.ROLE, identity.role(), observedAt);
    } else if (record instanceof PositionReport report) {
      node = mergePosition(node, report.position(), observedAt);
    } else if (record instanceof TelemetryReport report) {
      if (report.snapshot().hasAnyMetric()) {
        node = store.mergeObservation(nodeId, NodeField.LAST_TELEMETRY, report.snapshot(), observedAt);
      }
    } else if (record instanceof MapReport report) {
      node = mergeText(node, NodeField.LONG_NAME, report.longName(), observedAt);
      node = mergeText(node, NodeField.SHORT_NAME, report.shortName(), observedAt);
      node = mergeText(node, NodeField.HW_MODEL, report.hwModel(), observedAt);
      node = mergeText(node, NodeField.ROLE, report.role(), observedAt);
      node = mergeText(node, NodeField.FIRMWARE, report.firmwareVersion(), observedAt);
      node = mergePosition(node, report.position(), observedAt);
    }
    return node;
  }

  private MeshNode mergeText(MeshNode node, NodeField<String> field, String value, long observedAt) {
    if (value == null || value.isBlank()) {
      return node;
    }
    return store.mergeObservation(node.nodeId(), field, value, observedAt);
  }

  private MeshNode mergePosition(MeshNode node, Position position, long observedAt) {
    if (position == null) {
      return node;
    }
    return store.mergeObservation(node.nodeId(), NodeField.LAST_POSITION, position, observedAt);
  }
}
