package ca.gc.cra.meshradar.domain.mesh;

import ca.gc.cra.meshradar.domain.msg.NormalizedRecord;
import java.util.Objects;

/**
 * <strong>What:</strong> Processed-packet event pushed to live viewers.
 * <p><strong>Role:</strong> Output of the store stage fanned out by the live hub. Mirrors the decoded record plus
 * resolved node display names, radio metadata, and the sender-to-gateway distance.</p>
 *
 * @param packetId mesh packet id
 * @param fromNodeId sender node number
 * @param toNodeId destination node number
 * @param fromName sender display name
 * @param toName destination display name ({@code ^all} for broadcasts)
 * @param gatewayId reporting gateway token
 * @param gatewayName gateway display name
 * @param channel channel name
 * @param record decoded payload
 * @param rssi signal strength in dBm, or {@code null}
 * @param snr signal-to-noise ratio in dB, or {@code null}
 * @param hopCount hops taken before the gateway heard the packet, or {@code null}
 * @param distanceKm great-circle distance between sender and gateway, or {@code null} when unknown
 * @param firstSighting whether this observation created the canonical packet
 * @param observedAt observation time in epoch milliseconds
 * @since 0.1.0
 */
public record NormalizedEvent(
    long packetId,
    long fromNodeId,
    long toNodeId,
    String fromName,
    String toName,
    String gatewayId,
    String gatewayName,
    String channel,
    NormalizedRecord record,
    Integer rssi,
    Float snr,
    Integer hopCount,
    Double distanceKm,
    boolean firstSighting,
    long observedAt) {

  public NormalizedEvent {
    Objects.requireNonNull(fromName, "fromName");
    Objects.requireNonNull(toName, "toName");
    Objects.requireNonNull(gatewayId, "gatewayId");
    Objects.requireNonNull(gatewayName, "gatewayName");
    Objects.requireNonNull(channel, "channel");
    Objects.requireNonNull(record, "record");
  }

  /**
   * Kind of the carried record.
   *
   * @return message kind
   */
  public MessageKind kind() {
    return record.kind();
  }
}
