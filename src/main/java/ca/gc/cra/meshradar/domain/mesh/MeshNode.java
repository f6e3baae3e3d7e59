package ca.gc.cra.meshradar.domain.mesh;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Immutable snapshot of the merged state of one mesh node.
 * <p><strong>Why:</strong> Identity, position, and telemetry arrive in separate packets at different times; each
 * field keeps the value of its newest observation and is never overwritten by an older one.</p>
 * <p><strong>Role:</strong> Aggregate stored per node id by the mesh stores.</p>
 * <p><strong>Thread-safety:</strong> Immutable; updates return new instances.</p>
 *
 * @since 0.1.0
 */
public final class MeshNode {
  private final long nodeId;
  private final Map<NodeField<?>, Stamped<?>> fields;
  private final long lastSeen;

  private MeshNode(long nodeId, Map<NodeField<?>, Stamped<?>> fields, long lastSeen) {
    this.nodeId = nodeId;
    this.fields = fields;
    this.lastSeen = lastSeen;
  }

  /**
   * Creates an empty node that has not been observed yet.
   *
   * @param nodeId node number
   * @return empty node
   */
  public static MeshNode empty(long nodeId) {
    return new MeshNode(nodeId, Map.of(), Long.MIN_VALUE);
  }

  /**
   * Rebuilds a node from persisted state.
   *
   * @param nodeId node number
   * @param fields stamped field values
   * @param lastSeen last observation time in epoch milliseconds
   * @return node snapshot
   */
  public static MeshNode restore(long nodeId, Map<NodeField<?>, Stamped<?>> fields, long lastSeen) {
    for (Map.Entry<NodeField<?>, Stamped<?>> entry : fields.entrySet()) {
      entry.getKey().cast(entry.getValue().value());
    }
    return new MeshNode(nodeId, Collections.unmodifiableMap(new LinkedHashMap<>(fields)), lastSeen);
  }

  /**
   * Applies one field observation.
   *
   * <p>The value is taken iff {@code observedAt} is not older than the field's current stamp; equal stamps let the
   * new write win so retries stay idempotent. {@code lastSeen} always advances to the maximum.</p>
   *
   * @param field field being observed
   * @param value observed value; must not be {@code null}
   * @param observedAt observation time in epoch milliseconds
   * @param <T> value type
   * @return updated snapshot, or {@code this} when nothing changed
   */
  public <T> MeshNode merge(NodeField<T> field, T value, long observedAt) {
    Objects.requireNonNull(field, "field");
    Objects.requireNonNull(value, "value");
    Stamped<?> current = fields.get(field);
    boolean apply = current == null || observedAt >= current.observedAt();
    boolean changed = apply && (current == null
        || current.observedAt() != observedAt
        || !current.value().equals(value));
    long seen = Math.max(lastSeen, observedAt);
    if (!changed && seen == lastSeen) {
      return this;
    }
    Map<NodeField<?>, Stamped<?>> next = fields;
    if (changed) {
      Map<NodeField<?>, Stamped<?>> copy = new LinkedHashMap<>(fields);
      copy.put(field, new Stamped<>(value, observedAt));
      next = Collections.unmodifiableMap(copy);
    }
    return new MeshNode(nodeId, next, seen);
  }

  /**
   * Advances {@code lastSeen} without touching any field.
   *
   * @param observedAt observation time in epoch milliseconds
   * @return updated snapshot, or {@code this} when the time is not newer
   */
  public MeshNode touch(long observedAt) {
    return observedAt > lastSeen ? new MeshNode(nodeId, fields, observedAt) : this;
  }

  public long nodeId() {
    return nodeId;
  }

  /**
   * Hex identifier ({@code !xxxxxxxx}).
   *
   * @return hex id
   */
  public String hexId() {
    return NodeIds.toHex(nodeId);
  }

  /**
   * Last observation time, or {@link Long#MIN_VALUE} when never seen.
   *
   * @return epoch milliseconds
   */
  public long lastSeen() {
    return lastSeen;
  }

  /**
   * Current value of a field.
   *
   * @param field field to read
   * @param <T> value type
   * @return value when known
   */
  public <T> Optional<T> get(NodeField<T> field) {
    Stamped<?> stamped = fields.get(field);
    return stamped == null ? Optional.empty() : Optional.of(field.cast(stamped.value()));
  }

  /**
   * Stamp of a field.
   *
   * @param field field to read
   * @return stamped value when known
   */
  public Optional<Stamped<?>> stamp(NodeField<?> field) {
    return Optional.ofNullable(fields.get(field));
  }

  /**
   * All known stamped fields.
   *
   * @return unmodifiable view
   */
  public Map<NodeField<?>, Stamped<?>> fields() {
    return fields;
  }

  /**
   * Best human-readable name: long name, then short name, then hex id.
   *
   * @return display name
   */
  public String displayName() {
    return get(NodeField.LONG_NAME)
        .filter(name -> !name.isBlank())
        .or(() -> get(NodeField.SHORT_NAME).filter(name -> !name.isBlank()))
        .orElse(hexId());
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof MeshNode)) {
      return false;
    }
    MeshNode other = (MeshNode) o;
    return nodeId == other.nodeId && lastSeen == other.lastSeen && fields.equals(other.fields);
  }

  @Override
  public int hashCode() {
    return Objects.hash(nodeId, fields, lastSeen);
  }

  @Override
  public String toString() {
    return "MeshNode[" + hexId() + " fields=" + fields.keySet() + " lastSeen=" + lastSeen + "]";
  }
}
