/**
 * Mesh network domain model: envelopes, canonical packets, gateway observations, node aggregates, traceroutes,
 * and derived topology edges.
 * <p><strong>Concurrency:</strong> Value objects are immutable. Node and traceroute merges are pure functions; stores
 * apply them atomically per key.</p>
 * <p><strong>Identity:</strong> Packets are keyed by {@code (packetId, fromNodeId)}; observations additionally by the
 * reporting gateway.</p>
 */
package ca.gc.cra.meshradar.domain.mesh;
