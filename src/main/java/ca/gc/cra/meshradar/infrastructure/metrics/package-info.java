/**
 * OpenTelemetry implementation of the metrics port.
 */
package ca.gc.cra.meshradar.infrastructure.metrics;
