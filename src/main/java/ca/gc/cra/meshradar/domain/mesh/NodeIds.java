package ca.gc.cra.meshradar.domain.mesh;

import java.util.Locale;
import java.util.OptionalLong;

/**
 * Helpers for unsigned 32-bit mesh node numbers and their {@code !xxxxxxxx} textual form.
 *
 * @since 0.1.0
 */
public final class NodeIds {
  /** Destination used by broadcast packets. */
  public static final long BROADCAST = 0xFFFF_FFFFL;

  private static final long MASK = 0xFFFF_FFFFL;

  private NodeIds() {}

  /**
   * Renders a node number in the hex form used by gateways and node identity messages.
   *
   * @param nodeId unsigned node number
   * @return {@code !} followed by eight lowercase hex digits
   */
  public static String toHex(long nodeId) {
    return String.format(Locale.ROOT, "!%08x", nodeId & MASK);
  }

  /**
   * Parses a {@code !xxxxxxxx} identifier into a node number.
   *
   * @param id candidate identifier; may be {@code null}
   * @return node number when {@code id} uses the hex form, otherwise empty
   */
  public static OptionalLong parseHex(String id) {
    if (id == null || id.length() < 2 || id.charAt(0) != '!' || id.length() > 9) {
      return OptionalLong.empty();
    }
    try {
      return OptionalLong.of(Long.parseLong(id.substring(1), 16) & MASK);
    } catch (NumberFormatException ex) {
      return OptionalLong.empty();
    }
  }

  /**
   * Label for a destination node, using {@code ^all} for broadcasts.
   *
   * @param nodeId unsigned node number
   * @return display label
   */
  public static String destinationLabel(long nodeId) {
    return nodeId == BROADCAST ? "^all" : toHex(nodeId);
  }
}
