package ca.gc.cra.meshradar.domain.error;

/**
 * A store operation did not finish within its time budget. Always transient.
 */
public class StoreTimeoutException extends StoreException {
  private static final long serialVersionUID = 1L;

  public StoreTimeoutException(String message, Throwable cause) {
    super(message, cause, true);
  }
}
