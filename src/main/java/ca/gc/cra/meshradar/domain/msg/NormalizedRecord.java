package ca.gc.cra.meshradar.domain.msg;

import ca.gc.cra.meshradar.domain.mesh.MessageKind;

/**
 * <strong>What:</strong> Closed set of decoded application payloads, one variant per {@link MessageKind}.
 * <p><strong>Role:</strong> Output of the kind decoders; consumed by node merge, path assembly, and the live hub.</p>
 * <p><strong>Thread-safety:</strong> All variants are immutable records.</p>
 *
 * @since 0.1.0
 */
public sealed interface NormalizedRecord
    permits TextMessage,
        PositionReport,
        TelemetryReport,
        NodeIdentity,
        PathTrace,
        NeighborList,
        RoutingReport,
        MapReport,
        UnknownRecord {

  /**
   * Kind this record was decoded as; callers dispatch on it with an exhaustive switch.
   *
   * @return message kind
   */
  MessageKind kind();
}
