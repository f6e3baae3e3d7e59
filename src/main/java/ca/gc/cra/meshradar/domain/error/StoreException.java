package ca.gc.cra.meshradar.domain.error;

/**
 * Failure reported by a mesh store.
 *
 * <p>Duplicate-key conflicts never surface as this exception; stores resolve them as no-ops.</p>
 */
public class StoreException extends RuntimeException {
  private static final long serialVersionUID = 1L;
  private final boolean transientFailure;

  public StoreException(String message, Throwable cause, boolean transientFailure) {
    super(message, cause);
    this.transientFailure = transientFailure;
  }

  /**
   * Whether retrying the same operation may succeed.
   *
   * @return {@code true} for transient I/O failures
   */
  public boolean isTransient() {
    return transientFailure;
  }
}
