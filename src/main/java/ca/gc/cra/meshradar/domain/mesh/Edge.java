package ca.gc.cra.meshradar.domain.mesh;

import java.util.Objects;

/**
 * Directed topology edge derived from traceroutes or neighbor lists. Not persisted as ingestion state.
 *
 * @param from node the signal left
 * @param to node that heard it
 * @param kind where the edge came from
 * @param observedAt observation time in epoch milliseconds
 */
public record Edge(long from, long to, EdgeKind kind, long observedAt) {
  /**
   * Validates the kind.
   */
  public Edge {
    Objects.requireNonNull(kind, "kind");
  }

  @Override
  public String toString() {
    return NodeIds.toHex(from) + " -> " + NodeIds.toHex(to) + " (" + kind + ")";
  }
}
