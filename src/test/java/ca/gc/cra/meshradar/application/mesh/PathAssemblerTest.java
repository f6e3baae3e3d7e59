package ca.gc.cra.meshradar.application.mesh;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.meshradar.application.health.HealthCounter;
import ca.gc.cra.meshradar.application.health.PipelineHealth;
import ca.gc.cra.meshradar.domain.mesh.DecodedEnvelope;
import ca.gc.cra.meshradar.domain.mesh.Edge;
import ca.gc.cra.meshradar.domain.mesh.EdgeKind;
import ca.gc.cra.meshradar.domain.mesh.MergeOutcome;
import ca.gc.cra.meshradar.domain.mesh.Traceroute;
import ca.gc.cra.meshradar.domain.msg.NeighborList;
import ca.gc.cra.meshradar.domain.msg.PathTrace;
import ca.gc.cra.meshradar.infrastructure.persistence.memory.InMemoryMeshStore;
import ca.gc.cra.meshradar.testutil.MeshFixtures;
import ca.gc.cra.meshradar.testutil.RecordingMetricsPort;
import java.util.List;
import org.junit.jupiter.api.Test;

class PathAssemblerTest {
  private static final long REQUESTER = 0x100L;
  private static final long TARGET = 0x200L;

  private final InMemoryMeshStore store = new InMemoryMeshStore();
  private final PipelineHealth health = new PipelineHealth(new RecordingMetricsPort());
  private final PathAssembler assembler = new PathAssembler(store, health);

  @Test
  void forwardSightingsAppendHops() {
    assembler.assemble(request(1_000L), trace(List.of(0x10L), List.of()));

    PathAssembly assembly = assembler.assemble(request(2_000L), trace(List.of(0x10L, 0x11L), List.of()))
        .orElseThrow();

    assertEquals(MergeOutcome.EXTENDED, assembly.merge().outcome());
    Traceroute stored = store.findTraceroute(900L, REQUESTER).orElseThrow();
    assertEquals(List.of(0x10L, 0x11L), stored.route());
    assertEquals(List.of(
        new Edge(REQUESTER, 0x10L, EdgeKind.TRACE, 2_000L),
        new Edge(0x10L, 0x11L, EdgeKind.TRACE, 2_000L)), assembly.edges());
  }

  @Test
  void replyCompletesTheRecordUnderTheRequestKey() {
    assembler.assemble(request(1_000L), trace(List.of(0x10L), List.of()));

    PathAssembly assembly = assembler.assemble(
        MeshFixtures.decoded(901L, TARGET).to(REQUESTER).requestId(900L).receivedAt(3_000L).build(),
        trace(List.of(0x10L), List.of(0x20L))).orElseThrow();

    Traceroute stored = store.findTraceroute(900L, REQUESTER).orElseThrow();
    assertTrue(stored.done());
    assertEquals(List.of(0x20L), stored.routeBack());
    assertEquals(4, assembly.edges().size());
    assertEquals(new Edge(0x10L, TARGET, EdgeKind.TRACE, 3_000L), assembly.edges().get(1));
    assertEquals(new Edge(0x20L, REQUESTER, EdgeKind.TRACE, 3_000L), assembly.edges().get(3));
  }

  @Test
  void replyWithoutRequestIdIsIgnored() {
    assertTrue(assembler.assemble(MeshFixtures.decoded(902L, TARGET).to(REQUESTER).build(),
        trace(List.of(0x10L), List.of())).isEmpty());
    assertTrue(store.traceroutesSince(0L).isEmpty());
  }

  @Test
  void conflictingForwardRouteKeepsFirstAndRaisesAnomaly() {
    assembler.assemble(request(1_000L), trace(List.of(0x10L, 0x11L), List.of()));

    PathAssembly assembly = assembler.assemble(request(2_000L), trace(List.of(0x30L), List.of())).orElseThrow();

    assertEquals(MergeOutcome.CONFLICT, assembly.merge().outcome());
    assertEquals(List.of(0x10L, 0x11L), store.findTraceroute(900L, REQUESTER).orElseThrow().route());
    assertEquals(1, health.count(HealthCounter.PATH_ANOMALY));
  }

  @Test
  void neighborEdgesPointAtTheReporter() {
    NeighborList list = new NeighborList(0x500L, 0L, 900, List.of(
        new NeighborList.Neighbor(0x501L, 4.0f),
        new NeighborList.Neighbor(0x500L, 0.0f)));

    List<Edge> edges = PathAssembler.edgesOf(list, 0x500L, 7L);

    assertEquals(List.of(new Edge(0x501L, 0x500L, EdgeKind.NEIGHBOR, 7L)), edges);
  }

  private static DecodedEnvelope request(long receivedAt) {
    return MeshFixtures.decoded(900L, REQUESTER).to(TARGET).wantResponse().receivedAt(receivedAt).build();
  }

  private static PathTrace trace(List<Long> route, List<Long> routeBack) {
    return new PathTrace(route, List.of(), routeBack, List.of());
  }
}
