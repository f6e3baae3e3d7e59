package ca.gc.cra.meshradar.domain.msg;

import ca.gc.cra.meshradar.domain.mesh.MessageKind;
import ca.gc.cra.meshradar.domain.mesh.Position;
import java.util.Optional;

/**
 * Position broadcast.
 *
 * @param position reported position, or {@code null} when the node withheld its coordinates
 * @param time position fix time in epoch seconds; {@code 0} when absent
 */
public record PositionReport(Position position, long time) implements NormalizedRecord {

  /**
   * Reported position.
   *
   * @return position when present
   */
  public Optional<Position> maybePosition() {
    return Optional.ofNullable(position);
  }

  @Override
  public MessageKind kind() {
    return MessageKind.POSITION;
  }
}
