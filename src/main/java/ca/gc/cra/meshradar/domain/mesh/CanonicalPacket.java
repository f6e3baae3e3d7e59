package ca.gc.cra.meshradar.domain.mesh;

import java.util.Objects;

/**
 * <strong>What:</strong> Authoritative record of one logical packet, independent of how many gateways reported it.
 * <p><strong>Invariant:</strong> Exactly one per {@link PacketKey}. Canonical fields are first-writer-wins; only an
 * opaque (undecrypted) record may later be enriched with its kind and payload.</p>
 *
 * @param packetId mesh packet id
 * @param fromNodeId sender node number
 * @param toNodeId destination node number
 * @param channel channel name from the first sighting
 * @param kind message kind, or {@code null} while opaque
 * @param portNum raw port number; {@code 0} while opaque
 * @param payload application payload, or ciphertext while opaque
 * @param decoded whether the payload has been decoded
 * @param importTime first local receive time in epoch milliseconds
 * @since 0.1.0
 */
public record CanonicalPacket(
    long packetId,
    long fromNodeId,
    long toNodeId,
    String channel,
    MessageKind kind,
    int portNum,
    byte[] payload,
    boolean decoded,
    long importTime) {

  /**
   * Copies the payload.
   */
  public CanonicalPacket {
    Objects.requireNonNull(channel, "channel");
    payload = payload != null ? payload.clone() : new byte[0];
  }

  /**
   * Builds the canonical record from the first sighting of a packet.
   *
   * @param envelope decoded envelope
   * @return canonical packet
   */
  public static CanonicalPacket from(DecodedEnvelope envelope) {
    return new CanonicalPacket(
        envelope.packetId(),
        envelope.fromNodeId(),
        envelope.toNodeId(),
        envelope.channel(),
        envelope.kind(),
        envelope.portNum(),
        envelope.innerPayload(),
        envelope.decoded(),
        envelope.receivedAt());
  }

  /**
   * Fills the fields an opaque record could not know yet. Decoded records are returned unchanged.
   *
   * @param later a decoded sighting of the same packet
   * @return enriched record, or {@code this} when no enrichment applies
   */
  public CanonicalPacket enrichWith(DecodedEnvelope later) {
    if (decoded || !later.decoded()) {
      return this;
    }
    return new CanonicalPacket(
        packetId, fromNodeId, toNodeId, channel, later.kind(), later.portNum(), later.innerPayload(), true, importTime);
  }

  public PacketKey key() {
    return new PacketKey(packetId, fromNodeId);
  }

  /**
   * Returns a copy of the payload.
   *
   * @return payload bytes
   */
  public byte[] payload() {
    return payload.clone();
  }
}
