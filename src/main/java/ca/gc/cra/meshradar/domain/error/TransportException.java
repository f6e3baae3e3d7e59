package ca.gc.cra.meshradar.domain.error;

/**
 * Broker unreachable or connection lost. Recoverable through the listener's reconnect loop.
 */
public class TransportException extends Exception {
  private static final long serialVersionUID = 1L;

  public TransportException(String message) {
    super(message);
  }

  public TransportException(String message, Throwable cause) {
    super(message, cause);
  }
}
