/**
 * Mesh state use cases: per-field node merges and traceroute reconstruction.
 * <p><strong>Concurrency:</strong> Components are stateless; the store serializes updates per key.</p>
 */
package ca.gc.cra.meshradar.application.mesh;
