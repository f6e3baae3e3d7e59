package ca.gc.cra.meshradar.domain.mesh;

/**
 * Closed set of application message kinds understood by the ingestion pipeline, keyed by mesh port number.
 *
 * <p>{@link #UNKNOWN} absorbs every other port number so dispatch never fails on new firmware.</p>
 */
public enum MessageKind {
  TEXT(1),
  POSITION(3),
  NODEINFO(4),
  ROUTING(5),
  TELEMETRY(67),
  TRACEROUTE(70),
  NEIGHBORINFO(71),
  MAP_REPORT(73),
  UNKNOWN(-1);

  private final int portNum;

  MessageKind(int portNum) {
    this.portNum = portNum;
  }

  /**
   * Returns the mesh port number for this kind.
   *
   * @return port number, or {@code -1} for {@link #UNKNOWN}
   */
  public int portNum() {
    return portNum;
  }

  /**
   * Resolves a port number to its kind.
   *
   * @param portNum port number from the decoded data header
   * @return matching kind or {@link #UNKNOWN}
   */
  public static MessageKind fromPortNum(int portNum) {
    for (MessageKind kind : values()) {
      if (kind.portNum == portNum && kind != UNKNOWN) {
        return kind;
      }
    }
    return UNKNOWN;
  }
}
