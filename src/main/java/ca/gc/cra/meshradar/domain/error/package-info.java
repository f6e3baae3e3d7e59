/**
 * Exceptions shared across pipeline stages. Decode and store failures are handled inside the stage that detects
 * them; none of these may terminate the pipeline.
 */
package ca.gc.cra.meshradar.domain.error;
