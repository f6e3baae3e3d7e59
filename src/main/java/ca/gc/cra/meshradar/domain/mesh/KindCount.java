package ca.gc.cra.meshradar.domain.mesh;

/**
 * Number of packets of one kind.
 *
 * @param portNum raw port number ({@code 0} for undecrypted packets)
 * @param kind resolved kind, or {@code null} for undecrypted packets
 * @param count packet count
 */
public record KindCount(int portNum, MessageKind kind, long count) {}
