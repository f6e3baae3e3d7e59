/**
 * Broker transport: the {@link ca.gc.cra.meshradar.infrastructure.transport.BrokerClient} seam, its Paho MQTT
 * implementation, and the reconnecting {@link ca.gc.cra.meshradar.infrastructure.transport.TransportListener}.
 */
package ca.gc.cra.meshradar.infrastructure.transport;
