package ca.gc.cra.meshradar.domain.mesh;

import java.util.Objects;

/**
 * A node field value together with the observation time that produced it.
 *
 * @param value field value; never {@code null}
 * @param observedAt observation time in epoch milliseconds
 * @param <T> value type
 */
public record Stamped<T>(T value, long observedAt) {
  /**
   * Rejects {@code null} values; absence is modelled by a missing field.
   */
  public Stamped {
    Objects.requireNonNull(value, "value");
  }
}
