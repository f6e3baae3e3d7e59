/**
 * Application ports: the seams between ingestion use cases and their adapters.
 * <p><strong>Role:</strong> Inbound message sources, decoder ports, the mesh store write and read contracts, and
 * the metrics and clock abstractions.</p>
 * <p><strong>Concurrency:</strong> Each port documents its own thread-safety contract.</p>
 */
package ca.gc.cra.meshradar.application.port;
