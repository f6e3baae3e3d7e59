package ca.gc.cra.meshradar.application.port;

import ca.gc.cra.meshradar.domain.mesh.RawMessage;
import java.util.Optional;

/**
 * <strong>What:</strong> Inbound port delivering broker messages to the decode stage.
 * <p><strong>Why:</strong> Replaces broker callbacks with an explicit hand-off: the pipeline blocks on
 * {@link #poll()} instead of running inside the client's callback thread.</p>
 * <p><strong>Role:</strong> Implemented by the MQTT transport listener and the Kafka bridge source.</p>
 * <p><strong>Thread-safety:</strong> {@link #poll()} may be called from several decode workers concurrently.</p>
 * <p><strong>Observability:</strong> Implementations report connection state and ingress drops to
 * {@code PipelineHealth}.</p>
 *
 * @since 0.1.0
 */
public interface MessageSource extends AutoCloseable {
  /**
   * Connects and subscribes. Connection failures after startup are retried internally.
   *
   * @throws Exception if the source cannot be configured at all
   */
  void start() throws Exception;

  /**
   * Waits briefly for the next message.
   *
   * @return next message, or empty when none arrived within the implementation's poll interval
   * @throws InterruptedException if the calling worker is interrupted while waiting
   */
  Optional<RawMessage> poll() throws InterruptedException;

  /**
   * Disconnects and releases client resources.
   *
   * @throws Exception if shutdown fails
   */
  @Override
  void close() throws Exception;
}
