package ca.gc.cra.meshradar.infrastructure.decode.kind;

import ca.gc.cra.meshradar.domain.msg.TextMessage;
import java.nio.charset.StandardCharsets;

/**
 * Decodes chat text; malformed UTF-8 sequences are replaced rather than rejected.
 */
public final class TextDecoder implements PayloadDecoder<TextMessage> {
  @Override
  public TextMessage decode(byte[] payload) {
    return new TextMessage(new String(payload, StandardCharsets.UTF_8));
  }
}
