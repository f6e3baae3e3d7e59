package ca.gc.cra.meshradar.domain.mesh;

/**
 * Identity of a canonical packet. Mesh packet ids are only unique per sender.
 *
 * @param packetId mesh-assigned packet id
 * @param fromNodeId originating node number
 */
public record PacketKey(long packetId, long fromNodeId) {
  @Override
  public String toString() {
    return packetId + "@" + NodeIds.toHex(fromNodeId);
  }
}
