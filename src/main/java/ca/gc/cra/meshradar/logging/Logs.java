package ca.gc.cra.meshradar.logging;

import java.nio.charset.StandardCharsets;

/**
 * <strong>What:</strong> Logging hygiene helpers for mesh payloads and broker credentials.
 * <p><strong>Why:</strong> Text messages and raw frames come from untrusted radios; dumps are bounded and
 * credentials never reach operator logs.</p>
 * <p><strong>Thread-safety:</strong> Stateless utilities.</p>
 *
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";
  private static final String REDACTED_PLACEHOLDER = "[REDACTED]";
  private static final char[] HEX = "0123456789abcdef".toCharArray();

  private Logs() {
    // Utility
  }

  /**
   * Truncates a string to {@code maxChars} code units, appending the original length.
   *
   * @param value string to truncate; {@code null} results in {@code "<null>"}
   * @param maxChars maximum characters to retain; must be positive
   * @return original value when short enough, otherwise a truncated copy
   * @throws IllegalArgumentException if {@code maxChars} is not positive
   */
  public static String truncate(String value, int maxChars) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxChars <= 0) {
      throw new IllegalArgumentException("maxChars must be positive");
    }
    if (value.length() <= maxChars) {
      return value;
    }
    int end = maxChars;
    if (Character.isHighSurrogate(value.charAt(end - 1))) {
      end--;
    }
    return value.substring(0, end) + "... (truncated, " + end + " of " + value.length() + ")";
  }

  /**
   * Renders the first {@code maxBytes} of a payload as lowercase hex for DEBUG diagnostics.
   *
   * @param payload raw bytes; {@code null} results in {@code "<null>"}
   * @param maxBytes maximum bytes rendered
   * @return hex preview, suffixed with the total length when truncated
   */
  public static String hexPreview(byte[] payload, int maxBytes) {
    if (payload == null) {
      return NULL_PLACEHOLDER;
    }
    int limit = Math.min(payload.length, Math.max(0, maxBytes));
    StringBuilder sb = new StringBuilder(limit * 2 + 24);
    for (int i = 0; i < limit; i++) {
      sb.append(HEX[(payload[i] >> 4) & 0x0F]).append(HEX[payload[i] & 0x0F]);
    }
    if (limit < payload.length) {
      sb.append("... (").append(payload.length).append(" bytes)");
    }
    return sb.toString();
  }

  /**
   * Decodes a UTF-8 text payload and bounds it for logging.
   *
   * @param payload UTF-8 bytes
   * @param maxChars maximum characters retained
   * @return bounded text
   */
  public static String text(byte[] payload, int maxChars) {
    if (payload == null) {
      return NULL_PLACEHOLDER;
    }
    return truncate(new String(payload, StandardCharsets.UTF_8), maxChars);
  }

  /**
   * Returns a standard redacted placeholder for sensitive content such as broker passwords.
   *
   * @param value ignored original value
   * @return the redacted placeholder, or an empty string when nothing was configured
   */
  public static String redact(String value) {
    return value == null || value.isEmpty() ? "" : REDACTED_PLACEHOLDER;
  }
}
