package ca.gc.cra.meshradar.domain.mesh;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Objects;

/**
 * <strong>What:</strong> Routing metadata and inner payload extracted from a broker message.
 * <p><strong>Role:</strong> Output of the envelope decoder consumed by the store stage.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param packetId mesh packet id (unsigned 32-bit)
 * @param fromNodeId sender node number
 * @param toNodeId destination node number; {@link NodeIds#BROADCAST} for broadcasts
 * @param channel channel name taken from the topic
 * @param gatewayId gateway token taken from the topic
 * @param gatewayNodeId gateway node number when the token uses the {@code !hex} form, otherwise {@code null}
 * @param status whether the inner payload was readable
 * @param kind message kind; {@code null} when {@code status} is {@link DecodeStatus#UNDECRYPTABLE}
 * @param portNum raw port number; {@code 0} when undecryptable
 * @param innerPayload application payload, or the ciphertext when undecryptable
 * @param hopLimit remaining hops when the gateway heard the packet
 * @param hopStart hop limit the sender started with; {@code 0} when unknown
 * @param rssi received signal strength in dBm, or {@code null}
 * @param snr signal-to-noise ratio in dB, or {@code null}
 * @param rxTime radio receive time in epoch seconds; {@code 0} when unknown
 * @param wantResponse whether the sender asked for a reply
 * @param requestId id of the packet this one answers; {@code 0} when none
 * @param topic broker topic the envelope arrived on
 * @param receivedAt local receive time in epoch milliseconds
 * @since 0.1.0
 */
public record DecodedEnvelope(
    long packetId,
    long fromNodeId,
    long toNodeId,
    String channel,
    String gatewayId,
    Long gatewayNodeId,
    DecodeStatus status,
    MessageKind kind,
    int portNum,
    byte[] innerPayload,
    int hopLimit,
    int hopStart,
    Integer rssi,
    Float snr,
    long rxTime,
    boolean wantResponse,
    long requestId,
    String topic,
    long receivedAt) {

  /**
   * Validates required fields and copies the payload.
   */
  public DecodedEnvelope {
    Objects.requireNonNull(channel, "channel");
    Objects.requireNonNull(gatewayId, "gatewayId");
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(topic, "topic");
    if (status == DecodeStatus.DECODED) {
      Objects.requireNonNull(kind, "kind");
    } else {
      kind = null;
    }
    innerPayload = innerPayload != null ? innerPayload.clone() : new byte[0];
  }

  /**
   * Returns the inner payload without copying.
   *
   * @return payload bytes; callers must not mutate
   */
  @SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "Payload is copied on construction and only read by kind decoders.")
  public byte[] innerPayload() {
    return innerPayload;
  }

  /**
   * Canonical packet identity.
   *
   * @return key of the canonical packet
   */
  public PacketKey key() {
    return new PacketKey(packetId, fromNodeId);
  }

  /**
   * Whether the inner payload was readable.
   *
   * @return {@code true} when decoded
   */
  public boolean decoded() {
    return status == DecodeStatus.DECODED;
  }

  /**
   * Observation time used for merge ordering: the radio receive time when present, otherwise the local receive
   * time.
   *
   * @return epoch milliseconds
   */
  public long observedAt() {
    return rxTime > 0 ? rxTime * 1_000L : receivedAt;
  }

  /**
   * Hops already taken when the gateway heard the packet.
   *
   * @return hop count, or {@code null} when the sender did not advertise its starting hop limit
   */
  public Integer hopCount() {
    if (hopStart <= 0 || hopStart < hopLimit) {
      return null;
    }
    return hopStart - hopLimit;
  }

  @Override
  public String toString() {
    return "DecodedEnvelope[" + key() + " to=" + NodeIds.destinationLabel(toNodeId)
        + " kind=" + (kind == null ? status : kind) + " gateway=" + gatewayId + " channel=" + channel + "]";
  }
}
