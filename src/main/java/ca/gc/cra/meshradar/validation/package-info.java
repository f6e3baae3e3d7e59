/**
 * Input validation helpers shared by configuration loading and the CLI.
 * <p><strong>Thread-safety:</strong> Stateless utilities.</p>
 * <p><strong>Failure mode:</strong> Violations raise {@link java.lang.IllegalArgumentException} with operator-facing
 * messages.</p>
 */
package ca.gc.cra.meshradar.validation;
