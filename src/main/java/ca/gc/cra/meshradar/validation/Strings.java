package ca.gc.cra.meshradar.validation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Validation utilities for strings supplied through MESHRADAR configuration and CLI layers.
 * <p><strong>Why:</strong> Broker credentials, topic filters, and Kafka bridge topics must be sanitized before the
 * transport adapters open connections.</p>
 * <p><strong>Role:</strong> Support utilities invoked by {@code IngestConfig} and the CLI parsers.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent access.</p>
 * <p><strong>Observability:</strong> No metrics or logs; violations raise {@link IllegalArgumentException}.</p>
 *
 * @since 0.1.0
 * @see Numbers
 * @see Net
 */
public final class Strings {
  private static final Pattern KAFKA_TOPIC_PATTERN = Pattern.compile("^([A-Za-z0-9._-]+)$");
  private static final Pattern MQTT_FILTER_PATTERN = Pattern.compile("^[^\\u0000]+$");

  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name logical parameter name for diagnostics; if {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return trimmed input
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Validates a Kafka topic identifier used by the bridge source.
   *
   * @param name logical parameter name included in exception messages
   * @param topic candidate topic
   * @return sanitized topic matching {@code [A-Za-z0-9._-]+}
   * @throws IllegalArgumentException if the topic contains unsupported characters
   */
  public static String sanitizeKafkaTopic(String name, String topic) {
    String sanitized = requireNonBlank(name, topic);
    if (!KAFKA_TOPIC_PATTERN.matcher(sanitized).matches()) {
      throw new IllegalArgumentException(message(name,
          "must only contain letters, digits, dot, underscore, or hyphen"));
    }
    return sanitized;
  }

  /**
   * Validates an MQTT subscription filter.
   *
   * <p>Multi-level wildcards ({@code #}) must be the final level and wildcards must occupy a whole level.</p>
   *
   * @param name logical parameter name for diagnostics
   * @param filter candidate topic filter
   * @return trimmed filter
   * @throws IllegalArgumentException when wildcard placement is invalid
   */
  public static String requireTopicFilter(String name, String filter) {
    String sanitized = requireNonBlank(name, filter);
    if (!MQTT_FILTER_PATTERN.matcher(sanitized).matches()) {
      throw new IllegalArgumentException(message(name, "must not contain null characters"));
    }
    String[] levels = sanitized.split("/", -1);
    for (int i = 0; i < levels.length; i++) {
      String level = levels[i];
      if (level.contains("#") && (!level.equals("#") || i != levels.length - 1)) {
        throw new IllegalArgumentException(message(name, "may only use '#' as the last level"));
      }
      if (level.contains("+") && !level.equals("+")) {
        throw new IllegalArgumentException(message(name, "must use '+' as a whole level"));
      }
    }
    return sanitized;
  }

  /**
   * Ensures a value contains only printable ASCII characters and is within the supplied length budget.
   *
   * @param name logical name for diagnostics
   * @param value candidate string
   * @param maxLength maximum permitted length in characters
   * @return validated value
   * @throws IllegalArgumentException if the value is too long or contains non-printable characters
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    String sanitized = requireNonBlank(name, value);
    if (sanitized.length() > maxLength) {
      throw new IllegalArgumentException(message(name, "length must be <= " + maxLength));
    }
    for (int i = 0; i < sanitized.length(); i++) {
      char c = sanitized.charAt(i);
      if (c < 0x20 || c > 0x7E) {
        throw new IllegalArgumentException(message(name, "must contain printable ASCII characters"));
      }
    }
    return sanitized;
  }

  /**
   * Splits a comma-separated configuration value into trimmed, non-empty entries.
   *
   * @param value raw value; {@code null} or blank yields an empty list
   * @return immutable list of entries in declaration order
   */
  public static List<String> splitList(String value) {
    if (value == null || value.isBlank()) {
      return List.of();
    }
    List<String> entries = new ArrayList<>();
    for (String token : value.split(",")) {
      String trimmed = token.trim();
      if (!trimmed.isEmpty()) {
        entries.add(trimmed);
      }
    }
    return List.copyOf(entries);
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
