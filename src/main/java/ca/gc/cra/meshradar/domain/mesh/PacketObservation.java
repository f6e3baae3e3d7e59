package ca.gc.cra.meshradar.domain.mesh;

import java.util.Objects;

/**
 * One gateway's report of having heard a packet ({@code packet_seen}).
 *
 * <p>Unique per {@code (packetId, fromNodeId, gatewayId)}; rows are append-only.</p>
 *
 * @param packetId mesh packet id
 * @param fromNodeId sender node number
 * @param gatewayId reporting gateway token
 * @param rssi signal strength in dBm, or {@code null}
 * @param snr signal-to-noise ratio in dB, or {@code null}
 * @param hopLimit remaining hops at the gateway
 * @param hopStart starting hop limit advertised by the sender
 * @param rxTime radio receive time in epoch seconds; {@code 0} when unknown
 * @param topic broker topic
 * @param importTime local receive time in epoch milliseconds
 */
public record PacketObservation(
    long packetId,
    long fromNodeId,
    String gatewayId,
    Integer rssi,
    Float snr,
    int hopLimit,
    int hopStart,
    long rxTime,
    String topic,
    long importTime) {

  /**
   * Validates required fields.
   */
  public PacketObservation {
    Objects.requireNonNull(gatewayId, "gatewayId");
    Objects.requireNonNull(topic, "topic");
  }

  /**
   * Builds the observation for an envelope.
   *
   * @param envelope decoded envelope
   * @return observation row
   */
  public static PacketObservation from(DecodedEnvelope envelope) {
    return new PacketObservation(
        envelope.packetId(),
        envelope.fromNodeId(),
        envelope.gatewayId(),
        envelope.rssi(),
        envelope.snr(),
        envelope.hopLimit(),
        envelope.hopStart(),
        envelope.rxTime(),
        envelope.topic(),
        envelope.receivedAt());
  }

  /**
   * Hops taken before the gateway heard the packet.
   *
   * @return hop count, or {@code null} when unknown
   */
  public Integer hopCount() {
    if (hopStart <= 0 || hopStart < hopLimit) {
      return null;
    }
    return hopStart - hopLimit;
  }
}
