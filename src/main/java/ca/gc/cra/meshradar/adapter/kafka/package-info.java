/**
 * Kafka adapters: the MQTT bridge topic as a message source.
 */
package ca.gc.cra.meshradar.adapter.kafka;
