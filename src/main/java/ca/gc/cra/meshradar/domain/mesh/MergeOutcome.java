package ca.gc.cra.meshradar.domain.mesh;

/** Result of folding a path-trace sighting into the stored traceroute. */
public enum MergeOutcome {
  /** No record existed; the sighting became the record. */
  CREATED,
  /** A route grew, a return route was attached, or the trace completed. */
  EXTENDED,
  /** The sighting added nothing new. */
  UNCHANGED,
  /** The sighting contradicted a stored route; the stored route was kept. */
  CONFLICT
}
