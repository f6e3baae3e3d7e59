/**
 * Command-line entry points: {@code ingest}, {@code top} and {@code graph}.
 * <p><strong>Role:</strong> Driving-side adapters; parse arguments, resolve configuration, configure logging and
 * telemetry, then invoke the pipeline or a query.</p>
 * <p><strong>Security:</strong> Broker and database passwords are redacted in dry-run output and logs.</p>
 */
package ca.gc.cra.meshradar.api;
