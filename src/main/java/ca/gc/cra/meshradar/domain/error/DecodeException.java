package ca.gc.cra.meshradar.domain.error;

/**
 * Malformed, truncated, or otherwise unreadable binary input.
 *
 * <p>Recoverable: the offending message is dropped and counted; the pipeline keeps running.</p>
 */
public class DecodeException extends Exception {
  private static final long serialVersionUID = 1L;

  public DecodeException(String message) {
    super(message);
  }

  public DecodeException(String message, Throwable cause) {
    super(message, cause);
  }
}
