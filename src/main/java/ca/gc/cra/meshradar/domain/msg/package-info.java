/**
 * Decoded application payloads, one immutable record per message kind.
 * <p><strong>Role:</strong> Domain outputs of the kind decoders.</p>
 * <p><strong>Concurrency:</strong> Records are immutable; safe to share across threads.</p>
 */
package ca.gc.cra.meshradar.domain.msg;
