/**
 * Live distribution of processed events with per-subscriber drop-oldest backpressure.
 */
package ca.gc.cra.meshradar.application.hub;
