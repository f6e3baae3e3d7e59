package ca.gc.cra.meshradar.domain.mesh;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

class MeshNodeTest {

  @Test
  void newerObservationReplacesOlderValue() {
    MeshNode node = MeshNode.empty(42)
        .merge(NodeField.LONG_NAME, "Old Name", 1_000L)
        .merge(NodeField.LONG_NAME, "New Name", 2_000L);

    assertEquals("New Name", node.get(NodeField.LONG_NAME).orElseThrow());
    assertEquals(2_000L, node.stamp(NodeField.LONG_NAME).orElseThrow().observedAt());
  }

  @Test
  void olderObservationIsIgnoredButAdvancesNothing() {
    MeshNode node = MeshNode.empty(42).merge(NodeField.SHORT_NAME, "NEW", 5_000L);

    MeshNode after = node.merge(NodeField.SHORT_NAME, "OLD", 4_000L);

    assertSame(node, after);
    assertEquals("NEW", after.get(NodeField.SHORT_NAME).orElseThrow());
    assertEquals(5_000L, after.lastSeen());
  }

  @Test
  void equalStampReplaysAreIdempotent() {
    MeshNode node = MeshNode.empty(7).merge(NodeField.ROLE, "ROUTER", 1_000L);

    assertSame(node, node.merge(NodeField.ROLE, "ROUTER", 1_000L));
  }

  @Test
  void fieldsAreStampedIndependently() {
    MeshNode node = MeshNode.empty(7)
        .merge(NodeField.LONG_NAME, "Alpha", 3_000L)
        .merge(NodeField.LAST_POSITION, new Position(45.0, -75.0, null), 1_000L);

    assertEquals("Alpha", node.get(NodeField.LONG_NAME).orElseThrow());
    assertEquals(45.0, node.get(NodeField.LAST_POSITION).orElseThrow().latitude());
    assertEquals(3_000L, node.lastSeen());
  }

  @Test
  void finalStateDoesNotDependOnDeliveryOrder() {
    List<Observation> observations = new ArrayList<>();
    for (int i = 1; i <= 12; i++) {
      observations.add(new Observation(NodeField.LONG_NAME, "name-" + i, i * 100L));
      observations.add(new Observation(NodeField.HW_MODEL, "model-" + i, i * 70L));
      observations.add(new Observation(NodeField.CHANNEL, "channel-" + i, i * 130L));
    }
    MeshNode expected = apply(observations);

    Random random = new Random(20240611L);
    for (int round = 0; round < 25; round++) {
      List<Observation> shuffled = new ArrayList<>(observations);
      Collections.shuffle(shuffled, random);
      MeshNode actual = apply(shuffled);
      assertEquals(expected.get(NodeField.LONG_NAME), actual.get(NodeField.LONG_NAME));
      assertEquals(expected.get(NodeField.HW_MODEL), actual.get(NodeField.HW_MODEL));
      assertEquals(expected.get(NodeField.CHANNEL), actual.get(NodeField.CHANNEL));
      assertEquals(expected.lastSeen(), actual.lastSeen());
    }
    assertEquals("name-12", expected.get(NodeField.LONG_NAME).orElseThrow());
    assertEquals(1_560L, expected.lastSeen());
  }

  @Test
  void touchOnlyMovesLastSeenForward() {
    MeshNode node = MeshNode.empty(9).touch(2_000L);

    assertEquals(2_000L, node.lastSeen());
    assertSame(node, node.touch(1_000L));
    assertTrue(node.get(NodeField.LONG_NAME).isEmpty());
  }

  @Test
  void displayNameFallsBackToHexId() {
    assertEquals("!0000002a", MeshNode.empty(42).displayName());
  }

  private static MeshNode apply(List<Observation> observations) {
    MeshNode node = MeshNode.empty(1);
    for (Observation observation : observations) {
      node = node.merge(observation.field, observation.value, observation.observedAt);
    }
    return node;
  }

  private record Observation(NodeField<String> field, String value, long observedAt) {}
}
