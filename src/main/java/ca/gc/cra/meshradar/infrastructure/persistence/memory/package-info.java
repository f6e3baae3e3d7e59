/**
 * Heap-backed mesh store.
 */
package ca.gc.cra.meshradar.infrastructure.persistence.memory;
