package ca.gc.cra.meshradar.domain.msg;

import ca.gc.cra.meshradar.domain.mesh.MessageKind;

/**
 * Node identity announcement. Empty strings mean the field was not sent.
 *
 * @param userId identifier in {@code !xxxxxxxx} form
 * @param longName long display name
 * @param shortName short display name
 * @param hwModel hardware model name
 * @param role device role name
 */
public record NodeIdentity(String userId, String longName, String shortName, String hwModel, String role)
    implements NormalizedRecord {

  @Override
  public MessageKind kind() {
    return MessageKind.NODEINFO;
  }
}
