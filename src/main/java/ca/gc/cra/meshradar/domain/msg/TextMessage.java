package ca.gc.cra.meshradar.domain.msg;

import ca.gc.cra.meshradar.domain.mesh.MessageKind;
import java.util.Objects;

/**
 * Free-text chat message.
 *
 * @param text message body
 */
public record TextMessage(String text) implements NormalizedRecord {
  public TextMessage {
    Objects.requireNonNull(text, "text");
  }

  @Override
  public MessageKind kind() {
    return MessageKind.TEXT;
  }
}
