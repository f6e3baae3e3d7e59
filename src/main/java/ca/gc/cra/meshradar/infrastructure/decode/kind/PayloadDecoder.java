package ca.gc.cra.meshradar.infrastructure.decode.kind;

import ca.gc.cra.meshradar.domain.error.DecodeException;
import ca.gc.cra.meshradar.domain.msg.NormalizedRecord;

/**
 * Pure decoder for one message kind.
 *
 * @param <T> record type produced
 */
@FunctionalInterface
public interface PayloadDecoder<T extends NormalizedRecord> {
  /**
   * Decodes a payload.
   *
   * @param payload inner payload bytes
   * @return decoded record
   * @throws DecodeException when the payload is malformed or truncated
   */
  T decode(byte[] payload) throws DecodeException;
}
