package ca.gc.cra.meshradar.validation;

/**
 * Numeric validation helpers used by configuration parsing.
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a numeric value falls within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics
   * @param value candidate value
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Parses an unsigned 32-bit mesh node number written in decimal, {@code 0x} hex, or {@code !} hex form.
   *
   * @param name logical parameter name included in diagnostics
   * @param raw candidate text
   * @return node number in {@code [0, 0xFFFFFFFF]}
   * @throws IllegalArgumentException when the text is not a valid node number
   */
  public static long parseNodeNumber(String name, String raw) {
    String trimmed = Strings.requireNonBlank(name, raw);
    long parsed;
    try {
      if (trimmed.startsWith("!")) {
        parsed = Long.parseLong(trimmed.substring(1), 16);
      } else if (trimmed.startsWith("0x") || trimmed.startsWith("0X")) {
        parsed = Long.parseLong(trimmed.substring(2), 16);
      } else {
        parsed = Long.parseLong(trimmed);
      }
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label(name) + " is not a node number: " + trimmed, ex);
    }
    return requireRange(name, parsed, 0L, 0xFFFF_FFFFL);
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
