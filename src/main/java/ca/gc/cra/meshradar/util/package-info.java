/** Small concurrency utilities shared across layers. */
package ca.gc.cra.meshradar.util;
