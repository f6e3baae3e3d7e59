package ca.gc.cra.meshradar.application.port;

import ca.gc.cra.meshradar.domain.error.DecodeException;
import ca.gc.cra.meshradar.domain.mesh.MessageKind;
import ca.gc.cra.meshradar.domain.msg.NormalizedRecord;

/**
 * Decodes an inner application payload selected by its message kind.
 *
 * <p>Implementations are pure functions: they tolerate unknown fields and report truncation as a
 * {@link DecodeException}, never as a runtime crash.</p>
 */
public interface PayloadDecoderPort {
  /**
   * Decodes a payload.
   *
   * @param kind message kind from the data header
   * @param portNum raw port number, used for {@link MessageKind#UNKNOWN}
   * @param payload inner payload bytes
   * @return normalized record for the kind
   * @throws DecodeException when the payload is malformed or truncated
   */
  NormalizedRecord decode(MessageKind kind, int portNum, byte[] payload) throws DecodeException;
}
