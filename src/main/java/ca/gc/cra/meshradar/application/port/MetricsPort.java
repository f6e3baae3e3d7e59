package ca.gc.cra.meshradar.application.port;

/**
 * <strong>What:</strong> Port abstracting MESHRADAR metrics emission.
 * <p><strong>Why:</strong> Lets the decode, store, and hub stages record counters and observations without binding
 * to a vendor SDK.</p>
 * <p><strong>Role:</strong> Implemented by {@code OpenTelemetryMetricsAdapter}; {@link #NO_OP} for tests.</p>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate concurrent updates from the broker callback thread,
 * decode workers, and store workers.</p>
 * <p><strong>Performance:</strong> Calls must not block.</p>
 * <p><strong>Observability:</strong> Defines the dotted metric name contract (e.g., {@code store.dedup.noop}).</p>
 *
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier such as {@code decode.envelope.failed}; must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value (nanoseconds, queue depth, ...)
   */
  void observe(String key, long value);

  /**
   * Metrics implementation that ignores all updates.
   */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
