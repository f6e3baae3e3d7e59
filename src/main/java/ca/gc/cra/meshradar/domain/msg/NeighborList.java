package ca.gc.cra.meshradar.domain.msg;

import ca.gc.cra.meshradar.domain.mesh.MessageKind;
import java.util.List;

/**
 * Periodic list of directly heard peers.
 *
 * @param nodeId reporting node
 * @param lastSentById node that last relayed the report
 * @param broadcastIntervalSecs reporting interval
 * @param neighbors heard peers
 */
public record NeighborList(long nodeId, long lastSentById, int broadcastIntervalSecs, List<Neighbor> neighbors)
    implements NormalizedRecord {

  public NeighborList {
    neighbors = List.copyOf(neighbors);
  }

  @Override
  public MessageKind kind() {
    return MessageKind.NEIGHBORINFO;
  }

  /**
   * A directly heard peer.
   *
   * @param nodeId peer node number
   * @param snr SNR in dB of the peer as heard by the reporter
   */
  public record Neighbor(long nodeId, float snr) {}
}
