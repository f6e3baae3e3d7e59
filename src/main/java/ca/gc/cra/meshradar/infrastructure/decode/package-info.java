/**
 * Envelope decoding: topic layout matching, channel decryption, and the outer {@code ServiceEnvelope} wire format.
 * <p><strong>Role:</strong> Infrastructure adapters behind {@code EnvelopeDecoderPort}.</p>
 * <p><strong>Concurrency:</strong> Decoders are stateless and shared across decode workers.</p>
 * <p><strong>Observability:</strong> Filter and failure counts flow into {@code PipelineHealth}.</p>
 */
package ca.gc.cra.meshradar.infrastructure.decode;
