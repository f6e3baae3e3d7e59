package ca.gc.cra.meshradar.domain.mesh;

import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Typed handle for an independently merged node attribute.
 * <p><strong>Why:</strong> Node state is merged field by field with last-write-wins on observation time, so each
 * attribute needs its own identity and type.</p>
 * <p><strong>Thread-safety:</strong> Constants are immutable.</p>
 *
 * @param <T> value type carried by the field
 * @since 0.1.0
 */
public final class NodeField<T> {
  public static final NodeField<String> LONG_NAME = new NodeField<>("long_name", String.class);
  public static final NodeField<String> SHORT_NAME = new NodeField<>("short_name", String.class);
  public static final NodeField<String> HW_MODEL = new NodeField<>("hw_model", String.class);
  public static final NodeField<String> ROLE = new NodeField<>("role", String.class);
  public static final NodeField<String> FIRMWARE = new NodeField<>("firmware", String.class);
  public static final NodeField<String> CHANNEL = new NodeField<>("channel", String.class);
  public static final NodeField<Position> LAST_POSITION = new NodeField<>("last_position", Position.class);
  public static final NodeField<TelemetrySnapshot> LAST_TELEMETRY =
      new NodeField<>("last_telemetry", TelemetrySnapshot.class);

  private static final List<NodeField<?>> ALL = List.of(
      LONG_NAME, SHORT_NAME, HW_MODEL, ROLE, FIRMWARE, CHANNEL, LAST_POSITION, LAST_TELEMETRY);

  private final String name;
  private final Class<T> type;

  private NodeField(String name, Class<T> type) {
    this.name = name;
    this.type = type;
  }

  /**
   * Column-style name of the field.
   *
   * @return stable field name
   */
  public String name() {
    return name;
  }

  /**
   * Casts an untyped value to this field's type.
   *
   * @param value stored value
   * @return typed value
   * @throws ClassCastException when the value has the wrong type
   */
  public T cast(Object value) {
    return type.cast(value);
  }

  /**
   * All known fields in declaration order.
   *
   * @return immutable field list
   */
  public static List<NodeField<?>> all() {
    return ALL;
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof NodeField && name.equals(((NodeField<?>) o).name));
  }

  @Override
  public int hashCode() {
    return Objects.hash(name);
  }

  @Override
  public String toString() {
    return name;
  }
}
