package ca.gc.cra.meshradar.domain.msg;

import ca.gc.cra.meshradar.domain.mesh.MessageKind;
import ca.gc.cra.meshradar.domain.mesh.Position;

/**
 * Summary a node publishes for public maps.
 *
 * @param longName long display name
 * @param shortName short display name
 * @param role device role name
 * @param hwModel hardware model name
 * @param firmwareVersion firmware version string
 * @param region LoRa region code
 * @param modemPreset modem preset code
 * @param position reported position, or {@code null}
 * @param onlineLocalNodes number of nodes the reporter currently hears
 */
public record MapReport(
    String longName,
    String shortName,
    String role,
    String hwModel,
    String firmwareVersion,
    int region,
    int modemPreset,
    Position position,
    int onlineLocalNodes) implements NormalizedRecord {

  @Override
  public MessageKind kind() {
    return MessageKind.MAP_REPORT;
  }
}
