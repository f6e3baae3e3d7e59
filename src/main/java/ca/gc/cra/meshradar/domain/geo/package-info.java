/**
 * Geodesy helpers.
 */
package ca.gc.cra.meshradar.domain.geo;
