package ca.gc.cra.meshradar.application.health;

import java.util.Map;
import java.util.Objects;

/**
 * Point-in-time view of pipeline health.
 *
 * @param counters value per counter; every {@link HealthCounter} is present
 * @param connectionState last published broker connection state
 * @param degraded whether store writes are currently being dropped
 * @param degradedReason reason for the degraded flag, or {@code null}
 */
public record HealthSnapshot(
    Map<HealthCounter, Long> counters, ConnectionState connectionState, boolean degraded, String degradedReason) {

  public HealthSnapshot {
    counters = Map.copyOf(counters);
    Objects.requireNonNull(connectionState, "connectionState");
  }

  /**
   * Value of one counter.
   *
   * @param counter counter to read
   * @return current value
   */
  public long count(HealthCounter counter) {
    return counters.getOrDefault(counter, 0L);
  }
}
