package ca.gc.cra.meshradar.application.mesh;

import ca.gc.cra.meshradar.domain.mesh.Edge;
import ca.gc.cra.meshradar.domain.mesh.Traceroute;
import java.util.List;
import java.util.Objects;

/**
 * Result of folding one traceroute packet into the stored record.
 *
 * @param merge merged record and outcome
 * @param edges edges derived from the merged record
 */
public record PathAssembly(Traceroute.Merge merge, List<Edge> edges) {
  public PathAssembly {
    Objects.requireNonNull(merge, "merge");
    edges = List.copyOf(edges);
  }
}
