/**
 * Executor construction for pipeline workers and bounded store calls.
 */
package ca.gc.cra.meshradar.infrastructure.exec;
