package ca.gc.cra.meshradar.domain.mesh;

/** Source of a topology edge. */
public enum EdgeKind {
  /** Consecutive hops of a traceroute. */
  TRACE,
  /** A neighbor reported in a neighbor-list broadcast. */
  NEIGHBOR
}
