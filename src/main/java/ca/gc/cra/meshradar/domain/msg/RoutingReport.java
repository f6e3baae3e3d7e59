package ca.gc.cra.meshradar.domain.msg;

import ca.gc.cra.meshradar.domain.mesh.MessageKind;

/**
 * Routing acknowledgement or error.
 *
 * @param errorReason routing error code; {@code 0} means acknowledged
 */
public record RoutingReport(int errorReason) implements NormalizedRecord {

  /**
   * Whether the report acknowledges delivery.
   *
   * @return {@code true} when no error was reported
   */
  public boolean acknowledged() {
    return errorReason == 0;
  }

  @Override
  public MessageKind kind() {
    return MessageKind.ROUTING;
  }
}
