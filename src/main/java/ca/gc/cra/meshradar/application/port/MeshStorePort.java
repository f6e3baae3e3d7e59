package ca.gc.cra.meshradar.application.port;

import ca.gc.cra.meshradar.domain.error.StoreException;
import ca.gc.cra.meshradar.domain.mesh.DecodedEnvelope;
import ca.gc.cra.meshradar.domain.mesh.MeshNode;
import ca.gc.cra.meshradar.domain.mesh.NodeField;
import ca.gc.cra.meshradar.domain.mesh.RecordOutcome;
import ca.gc.cra.meshradar.domain.mesh.Traceroute;

/**
 * <strong>What:</strong> Write side of the mesh store: canonical packets, gateway observations, node state, and
 * traceroutes.
 * <p><strong>Why:</strong> The store stage needs idempotent writes so broker redeliveries and multi-gateway reports
 * collapse onto one canonical record.</p>
 * <p><strong>Role:</strong> Implemented by the in-memory and JDBC stores; decorated by {@code RetryingMeshStore}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent calls. Calls for distinct packet keys or
 * node ids must not serialize against each other.</p>
 * <p><strong>Performance:</strong> Each call touches at most a handful of rows.</p>
 *
 * @since 0.1.0
 */
public interface MeshStorePort extends AutoCloseable {
  /**
   * Records one sighting of a packet: the canonical packet is inserted if absent and the observation is inserted if
   * no row exists for the same gateway.
   *
   * @param envelope decoded envelope (possibly opaque)
   * @return what this call created
   * @throws StoreException on storage failure; duplicate keys are never failures
   */
  RecordOutcome recordPacket(DecodedEnvelope envelope);

  /**
   * Applies one node field observation with per-field last-write-wins on {@code observedAt}.
   *
   * @param nodeId node number
   * @param field field being observed
   * @param value observed value
   * @param observedAt observation time in epoch milliseconds
   * @param <T> value type
   * @return node state after the merge
   * @throws StoreException on storage failure
   */
  <T> MeshNode mergeObservation(long nodeId, NodeField<T> field, T value, long observedAt);

  /**
   * Advances {@code lastSeen} of a node, creating the node when unknown.
   *
   * @param nodeId node number
   * @param observedAt observation time in epoch milliseconds
   * @return node state after the update
   * @throws StoreException on storage failure
   */
  MeshNode touchNode(long nodeId, long observedAt);

  /**
   * Folds a traceroute sighting into the stored record with {@link Traceroute#merge(Traceroute, Traceroute)}.
   *
   * @param incoming record built from the sighting
   * @return merged record and merge outcome
   * @throws StoreException on storage failure
   */
  Traceroute.Merge recordTraceroute(Traceroute incoming);

  /**
   * Releases store resources.
   */
  @Override
  default void close() {}
}
