/**
 * Pipeline health surface: counters, broker connection state, and the store degraded flag.
 */
package ca.gc.cra.meshradar.application.health;
