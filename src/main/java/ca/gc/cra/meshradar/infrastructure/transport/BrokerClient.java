package ca.gc.cra.meshradar.infrastructure.transport;

import ca.gc.cra.meshradar.domain.error.TransportException;
import java.util.List;

/**
 * Minimal publish/subscribe broker session used by {@link TransportListener}.
 *
 * <p>Implementations deliver messages on their own callback thread and must not reconnect on their own; the listener
 * owns the reconnect policy.</p>
 *
 * @since 0.1.0
 */
public interface BrokerClient extends AutoCloseable {

  /**
   * Opens a session.
   *
   * @param listener receives messages and connection loss for this session
   * @throws TransportException if the broker cannot be reached or rejects the session
   */
  void connect(Listener listener) throws TransportException;

  /**
   * Subscribes the current session to every filter.
   *
   * @param filters topic filters
   * @throws TransportException if the subscription is refused
   */
  void subscribe(List<String> filters) throws TransportException;

  boolean isConnected();

  /**
   * Ends the current session; a no-op when not connected.
   *
   * @throws TransportException if the broker rejects the disconnect
   */
  void disconnect() throws TransportException;

  @Override
  void close() throws TransportException;

  /** Session callbacks. Both run on the client's callback thread and must not block. */
  interface Listener {
    void onMessage(String topic, byte[] payload);

    void onConnectionLost(Throwable cause);
  }
}
