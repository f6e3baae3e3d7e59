package ca.gc.cra.meshradar.domain.msg;

import ca.gc.cra.meshradar.domain.mesh.MessageKind;

/**
 * Payload on a port the pipeline does not interpret. Stored and published, otherwise ignored.
 *
 * @param portNum raw port number
 */
public record UnknownRecord(int portNum) implements NormalizedRecord {
  @Override
  public MessageKind kind() {
    return MessageKind.UNKNOWN;
  }
}
