package ca.gc.cra.meshradar.application.health;

/**
 * Broker connection lifecycle as seen by the transport listener.
 */
public enum ConnectionState {
  DISCONNECTED,
  CONNECTING,
  CONNECTED,
  STOPPED
}
