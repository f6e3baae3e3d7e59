package ca.gc.cra.meshradar.application.query;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.meshradar.domain.mesh.KindCount;
import ca.gc.cra.meshradar.domain.mesh.MessageKind;
import ca.gc.cra.meshradar.domain.mesh.NodeField;
import ca.gc.cra.meshradar.domain.mesh.TrafficSummary;
import ca.gc.cra.meshradar.infrastructure.persistence.memory.InMemoryMeshStore;
import ca.gc.cra.meshradar.testutil.MeshFixtures;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TopTrafficAggregatorTest {
  private static final long NOW = 1_700_100_000_000L;

  private final InMemoryMeshStore store = new InMemoryMeshStore();
  private final TopTrafficAggregator aggregator = new TopTrafficAggregator(store, () -> NOW);

  @BeforeEach
  void setUp() {
    long recent = NOW - Duration.ofMinutes(30).toMillis();
    store.recordPacket(MeshFixtures.decoded(1, 10).gateway("!0000aaaa").receivedAt(recent).build());
    store.recordPacket(MeshFixtures.decoded(1, 10).gateway("!0000bbbb").receivedAt(recent).build());
    store.recordPacket(MeshFixtures.decoded(2, 10).gateway("!0000aaaa").receivedAt(recent)
        .payload(MessageKind.POSITION, new byte[0]).build());
    store.recordPacket(MeshFixtures.decoded(3, 20).gateway("!0000aaaa").receivedAt(recent).build());
    store.recordPacket(MeshFixtures.decoded(4, 30).gateway("!0000aaaa")
        .receivedAt(NOW - Duration.ofHours(30).toMillis()).build());
    store.mergeObservation(10, NodeField.LONG_NAME, "Busy Node", recent);
    store.mergeObservation(10, NodeField.CHANNEL, "LongFast", recent);
    store.mergeObservation(20, NodeField.CHANNEL, "MediumFast", recent);
    store.mergeObservation(30, NodeField.CHANNEL, "LongFast", NOW - Duration.ofHours(30).toMillis());
  }

  @Test
  void rankingOrdersByTimesSeenWithinWindow() {
    List<TrafficSummary> rows = aggregator.top(Duration.ofHours(24), 10);

    assertEquals(2, rows.size());
    assertEquals(10L, rows.get(0).nodeId());
    assertEquals("Busy Node", rows.get(0).longName());
    assertEquals(2L, rows.get(0).packetsSent());
    assertEquals(3L, rows.get(0).timesSeen());
    assertEquals(20L, rows.get(1).nodeId());
  }

  @Test
  void limitTruncatesRanking() {
    assertEquals(1, aggregator.top(Duration.ofHours(24), 1).size());
    assertThrows(IllegalArgumentException.class, () -> aggregator.top(Duration.ofHours(24), 0));
  }

  @Test
  void activeNodesCanBeFilteredByChannel() {
    assertEquals(2, aggregator.activeNodes(Duration.ofHours(24), Optional.empty()));
    assertEquals(1, aggregator.activeNodes(Duration.ofHours(24), Optional.of("LongFast")));
    assertEquals(3, aggregator.activeNodes(Duration.ofHours(48), Optional.empty()));
  }

  @Test
  void nodeTrafficGroupsByKind() {
    List<KindCount> counts = aggregator.nodeTraffic(10, Duration.ofHours(24));

    assertEquals(List.of(
        new KindCount(MessageKind.TEXT.portNum(), MessageKind.TEXT, 1),
        new KindCount(MessageKind.POSITION.portNum(), MessageKind.POSITION, 1)), counts);
  }

  @Test
  void windowMustBePositive() {
    assertThrows(IllegalArgumentException.class, () -> aggregator.top(Duration.ZERO, 5));
  }
}
