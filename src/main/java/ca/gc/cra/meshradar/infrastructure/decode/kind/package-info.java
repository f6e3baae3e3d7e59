/**
 * Per-kind payload decoders for the mesh application protocol.
 * <p><strong>Role:</strong> Pure functions from inner payload bytes to {@code NormalizedRecord} variants.</p>
 * <p><strong>Concurrency:</strong> All decoders are stateless.</p>
 */
package ca.gc.cra.meshradar.infrastructure.decode.kind;
