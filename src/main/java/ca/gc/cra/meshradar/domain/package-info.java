/**
 * MESHRADAR domain layer: immutable mesh model, decoded payload records, errors, and geodesy.
 * <p><strong>Role:</strong> Shared vocabulary of the decode, store, and live distribution stages. No I/O.</p>
 */
package ca.gc.cra.meshradar.domain;
