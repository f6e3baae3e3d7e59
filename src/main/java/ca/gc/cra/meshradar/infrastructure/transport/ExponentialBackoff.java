package ca.gc.cra.meshradar.infrastructure.transport;

/**
 * Doubling reconnect delay with a ceiling. Not thread-safe; owned by the connection thread.
 */
public final class ExponentialBackoff {
  private final long initialMillis;
  private final long maxMillis;
  private long next;

  public ExponentialBackoff(long initialMillis, long maxMillis) {
    if (initialMillis <= 0 || maxMillis < initialMillis) {
      throw new IllegalArgumentException("backoff requires 0 < initial <= max");
    }
    this.initialMillis = initialMillis;
    this.maxMillis = maxMillis;
    this.next = initialMillis;
  }

  /** Returns the delay to wait now and doubles the following one, up to the ceiling. */
  public long nextDelayMillis() {
    long delay = next;
    next = Math.min(maxMillis, next * 2);
    return delay;
  }

  public void reset() {
    next = initialMillis;
  }
}
