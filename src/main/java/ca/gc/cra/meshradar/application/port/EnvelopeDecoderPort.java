package ca.gc.cra.meshradar.application.port;

import ca.gc.cra.meshradar.domain.error.DecodeException;
import ca.gc.cra.meshradar.domain.mesh.DecodedEnvelope;
import ca.gc.cra.meshradar.domain.mesh.RawMessage;
import java.util.Optional;

/**
 * Turns a broker message into routing metadata plus inner payload.
 *
 * <p>Implementations are stateless per message and safe to call from several decode workers.</p>
 */
public interface EnvelopeDecoderPort {
  /**
   * Decodes the topic and outer envelope.
   *
   * @param message raw broker message
   * @return decoded envelope (possibly opaque), or empty when the message is filtered by policy (topic mismatch,
   *     zero packet id, ignored sender)
   * @throws DecodeException when the envelope bytes are malformed or truncated
   */
  Optional<DecodedEnvelope> decode(RawMessage message) throws DecodeException;
}
