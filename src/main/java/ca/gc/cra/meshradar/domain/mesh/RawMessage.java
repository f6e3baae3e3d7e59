package ca.gc.cra.meshradar.domain.mesh;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Arrays;
import java.util.Objects;

/**
 * <strong>What:</strong> A message exactly as delivered by the broker.
 * <p><strong>Role:</strong> Hand-off unit between the transport listener and the decode workers; never persisted.</p>
 * <p><strong>Thread-safety:</strong> Immutable; payload copied on construction.</p>
 *
 * @param topic broker topic the message arrived on; never blank
 * @param payload raw envelope bytes
 * @param receivedAtMillis local receive time in epoch milliseconds
 * @since 0.1.0
 */
public record RawMessage(String topic, byte[] payload, long receivedAtMillis) {

  /**
   * Validates the topic and copies the payload.
   */
  public RawMessage {
    Objects.requireNonNull(topic, "topic");
    payload = payload != null ? payload.clone() : new byte[0];
  }

  /**
   * Returns the payload without copying.
   *
   * @return internal payload array; callers must not mutate it
   */
  @SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "Payload is copied on construction; decode workers read it once per message.")
  public byte[] payload() {
    return payload;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RawMessage)) {
      return false;
    }
    RawMessage other = (RawMessage) o;
    return receivedAtMillis == other.receivedAtMillis
        && topic.equals(other.topic)
        && Arrays.equals(payload, other.payload);
  }

  @Override
  public int hashCode() {
    int result = Objects.hash(topic, receivedAtMillis);
    return 31 * result + Arrays.hashCode(payload);
  }

  @Override
  public String toString() {
    return "RawMessage[topic=" + topic + ", bytes=" + payload.length + ", receivedAtMillis=" + receivedAtMillis + "]";
  }
}
