package ca.gc.cra.meshradar.config;

import ca.gc.cra.meshradar.validation.Numbers;
import java.util.Map;
import java.util.Optional;

/** Typed lookups over flattened key/value configuration. */
final class ConfigValues {
  private ConfigValues() {}

  static Optional<String> optional(Map<String, String> options, String key) {
    String value = options.get(key);
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(value.trim());
  }

  static String string(Map<String, String> options, String key, String fallback) {
    return optional(options, key).orElse(fallback);
  }

  static int boundedInt(Map<String, String> options, String key, int fallback, int min, int max) {
    Optional<String> raw = optional(options, key);
    if (raw.isEmpty()) {
      return fallback;
    }
    try {
      return (int) Numbers.requireRange(key, Integer.parseInt(raw.get()), min, max);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer (was '" + raw.get() + "')", ex);
    }
  }

  static long boundedLong(Map<String, String> options, String key, long fallback, long min, long max) {
    Optional<String> raw = optional(options, key);
    if (raw.isEmpty()) {
      return fallback;
    }
    try {
      return Numbers.requireRange(key, Long.parseLong(raw.get()), min, max);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer (was '" + raw.get() + "')", ex);
    }
  }
}
