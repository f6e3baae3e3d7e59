package ca.gc.cra.meshradar.config;

import java.util.Locale;

/** Where raw mesh messages come from. */
public enum SourceMode {
  /** Direct MQTT subscription. */
  MQTT,
  /** MQTT-to-Kafka bridge topic. */
  KAFKA;

  static SourceMode parse(String raw, SourceMode fallback) {
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    try {
      return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("source must be MQTT or KAFKA (was '" + raw + "')", ex);
    }
  }
}
