package ca.gc.cra.meshradar.application.health;

import ca.gc.cra.meshradar.application.port.MetricsPort;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Health counters, broker connection state, and the store degraded flag for one pipeline.
 * <p><strong>Why:</strong> Operators need decode failures, dedup no-ops, store drops, and evictions without scraping
 * logs; the same values feed {@link MetricsPort}.</p>
 * <p><strong>Role:</strong> Shared by the listener, decoder, store decorator, path assembler, and live hub.</p>
 * <p><strong>Thread-safety:</strong> Lock-free; counters use {@link LongAdder}.</p>
 * <p><strong>Observability:</strong> Connection changes and degraded transitions are logged at INFO/WARN.</p>
 *
 * @since 0.1.0
 */
public final class PipelineHealth {
  private static final Logger log = LoggerFactory.getLogger(PipelineHealth.class);

  private final MetricsPort metrics;
  private final Map<HealthCounter, LongAdder> counters = new EnumMap<>(HealthCounter.class);
  private final AtomicReference<ConnectionState> connectionState =
      new AtomicReference<>(ConnectionState.DISCONNECTED);
  private final AtomicReference<String> degradedReason = new AtomicReference<>();

  /**
   * Creates a health surface that mirrors counters into {@code metrics}.
   *
   * @param metrics metrics sink; must not be {@code null}
   */
  public PipelineHealth(MetricsPort metrics) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    for (HealthCounter counter : HealthCounter.values()) {
      counters.put(counter, new LongAdder());
    }
  }

  /**
   * Metrics sink shared with components that emit non-health metrics.
   *
   * @return metrics port
   */
  public MetricsPort metrics() {
    return metrics;
  }

  /**
   * Increments a counter and its metric.
   *
   * @param counter counter to increment
   */
  public void record(HealthCounter counter) {
    counters.get(counter).increment();
    metrics.increment(counter.metricKey());
  }

  /**
   * Current value of a counter.
   *
   * @param counter counter to read
   * @return value
   */
  public long count(HealthCounter counter) {
    return counters.get(counter).sum();
  }

  /**
   * Publishes a connection state change.
   *
   * @param state new state
   */
  public void connectionState(ConnectionState state) {
    Objects.requireNonNull(state, "state");
    ConnectionState previous = connectionState.getAndSet(state);
    if (previous == state) {
      return;
    }
    if (previous == ConnectionState.CONNECTED && state == ConnectionState.DISCONNECTED) {
      record(HealthCounter.CONNECTION_LOST);
    }
    metrics.increment("transport.state." + state.name().toLowerCase(Locale.ROOT));
    log.info("Broker connection {} -> {}", previous, state);
  }

  public ConnectionState connectionState() {
    return connectionState.get();
  }

  /**
   * Raises the degraded flag.
   *
   * @param reason human-readable reason
   */
  public void markDegraded(String reason) {
    if (degradedReason.getAndSet(Objects.requireNonNull(reason, "reason")) == null) {
      metrics.increment("health.degraded.raised");
      log.warn("Pipeline degraded: {}", reason);
    }
  }

  /**
   * Clears the degraded flag.
   */
  public void clearDegraded() {
    String previous = degradedReason.getAndSet(null);
    if (previous != null) {
      metrics.increment("health.degraded.cleared");
      log.info("Pipeline recovered from degraded state ({})", previous);
    }
  }

  public boolean isDegraded() {
    return degradedReason.get() != null;
  }

  /**
   * Captures current values.
   *
   * @return immutable snapshot
   */
  public HealthSnapshot snapshot() {
    Map<HealthCounter, Long> values = new EnumMap<>(HealthCounter.class);
    counters.forEach((counter, adder) -> values.put(counter, adder.sum()));
    String reason = degradedReason.get();
    return new HealthSnapshot(values, connectionState.get(), reason != null, reason);
  }
}
