package ca.gc.cra.meshradar.domain.mesh;

/** Outcome of envelope decoding for a well-formed envelope. */
public enum DecodeStatus {
  /** Inner data header was present or decrypted with a configured key. */
  DECODED,
  /** Payload stayed encrypted; only an opaque observation is recorded. */
  UNDECRYPTABLE
}
