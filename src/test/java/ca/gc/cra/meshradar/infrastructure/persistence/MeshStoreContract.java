package ca.gc.cra.meshradar.infrastructure.persistence;

import static ca.gc.cra.meshradar.testutil.MeshFixtures.decoded;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.meshradar.application.port.MeshQueryPort;
import ca.gc.cra.meshradar.application.port.MeshStorePort;
import ca.gc.cra.meshradar.domain.mesh.CanonicalPacket;
import ca.gc.cra.meshradar.domain.mesh.KindCount;
import ca.gc.cra.meshradar.domain.mesh.MergeOutcome;
import ca.gc.cra.meshradar.domain.mesh.MeshNode;
import ca.gc.cra.meshradar.domain.mesh.MessageKind;
import ca.gc.cra.meshradar.domain.mesh.NodeField;
import ca.gc.cra.meshradar.domain.mesh.PacketObservation;
import ca.gc.cra.meshradar.domain.mesh.Position;
import ca.gc.cra.meshradar.domain.mesh.RecordOutcome;
import ca.gc.cra.meshradar.domain.mesh.Traceroute;
import ca.gc.cra.meshradar.domain.mesh.TrafficSummary;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Behaviour every mesh store must share; subclasses supply the backend. */
public abstract class MeshStoreContract {
  private static final byte[] HELLO = "hello".getBytes(StandardCharsets.UTF_8);
  private static final long T0 = 1_700_000_000_000L;

  protected MeshStorePort store;
  protected MeshQueryPort query;

  /** Opens a fresh, empty backend and assigns {@link #store} and {@link #query}. */
  protected abstract void openStore();

  @BeforeEach
  void setUpStore() {
    openStore();
  }

  @AfterEach
  void closeStore() {
    store.close();
  }

  @Test
  void recordPacketKeepsOneObservationPerGateway() {
    RecordOutcome first = store.recordPacket(
        decoded(10, 0x1111).gateway("!000000a1").payload(MessageKind.TEXT, HELLO).build());
    RecordOutcome again = store.recordPacket(
        decoded(10, 0x1111).gateway("!000000a1").payload(MessageKind.TEXT, HELLO).build());
    RecordOutcome second = store.recordPacket(
        decoded(10, 0x1111).gateway("!000000a2").payload(MessageKind.TEXT, HELLO).signal(-90, 4.5f).build());

    assertEquals(new RecordOutcome(true, true, false), first);
    assertTrue(again.duplicate());
    assertEquals(new RecordOutcome(false, true, false), second);

    List<PacketObservation> seen = query.observations(10, 0x1111);
    assertEquals(List.of("!000000a1", "!000000a2"),
        seen.stream().map(PacketObservation::gatewayId).sorted().collect(Collectors.toList()));
    PacketObservation withSignal = seen.stream()
        .filter(o -> o.gatewayId().equals("!000000a2"))
        .findFirst()
        .orElseThrow();
    assertEquals(-90, withSignal.rssi());
    assertEquals(4.5f, withSignal.snr());
  }

  @Test
  void packetKeyIncludesSender() {
    store.recordPacket(decoded(10, 0x1111).payload(MessageKind.TEXT, HELLO).build());
    RecordOutcome other = store.recordPacket(decoded(10, 0x2222).payload(MessageKind.TEXT, HELLO).build());

    assertTrue(other.packetCreated());
    assertTrue(query.findPacket(10, 0x1111).isPresent());
    assertTrue(query.findPacket(10, 0x2222).isPresent());
    assertTrue(query.findPacket(10, 0x3333).isEmpty());
  }

  @Test
  void opaqueCopyIsEnrichedByFirstDecodedCopy() {
    store.recordPacket(decoded(20, 0x1111).gateway("!000000a1").undecryptable(new byte[] {1, 2, 3}).build());
    assertTrue(query.packetsOfKindSince(MessageKind.TEXT, 0, 10).isEmpty());

    RecordOutcome enriched = store.recordPacket(
        decoded(20, 0x1111).gateway("!000000a2").payload(MessageKind.TEXT, HELLO).build());
    RecordOutcome later = store.recordPacket(
        decoded(20, 0x1111).gateway("!000000a3").payload(MessageKind.TEXT, HELLO).build());

    assertTrue(enriched.enriched());
    assertFalse(later.enriched());
    CanonicalPacket packet = query.findPacket(20, 0x1111).orElseThrow();
    assertTrue(packet.decoded());
    assertEquals(MessageKind.TEXT, packet.kind());
    assertEquals("hello", new String(packet.payload(), StandardCharsets.UTF_8));
    assertEquals(1, query.packetsOfKindSince(MessageKind.TEXT, 0, 10).size());
    assertEquals(3, query.observations(20, 0x1111).size());
  }

  @Test
  void newerObservationWinsAndStaleOneIsIgnored() {
    store.mergeObservation(0x42, NodeField.LONG_NAME, "Alpha", T0 + 2_000);
    MeshNode stale = store.mergeObservation(0x42, NodeField.LONG_NAME, "Old", T0 + 1_000);
    assertEquals(Optional.of("Alpha"), stale.get(NodeField.LONG_NAME));
    assertEquals(T0 + 2_000, stale.lastSeen());

    MeshNode newer = store.mergeObservation(0x42, NodeField.LONG_NAME, "Beta", T0 + 3_000);
    assertEquals(Optional.of("Beta"), newer.get(NodeField.LONG_NAME));
    assertEquals(T0 + 3_000, newer.lastSeen());
    assertEquals(Optional.of("Beta"), query.findNode(0x42).orElseThrow().get(NodeField.LONG_NAME));
  }

  @Test
  void fieldsAreStampedIndependently() {
    store.mergeObservation(0x42, NodeField.SHORT_NAME, "ALP", T0 + 5_000);
    store.mergeObservation(0x42, NodeField.LAST_POSITION, new Position(45.42, -75.69, 70), T0 + 1_000);

    MeshNode node = query.findNode(0x42).orElseThrow();
    assertEquals(Optional.of("ALP"), node.get(NodeField.SHORT_NAME));
    Position position = node.get(NodeField.LAST_POSITION).orElseThrow();
    assertEquals(45.42, position.latitude(), 1e-9);
    assertEquals(-75.69, position.longitude(), 1e-9);
    assertEquals(70, position.altitude());
    assertEquals(T0 + 5_000, node.lastSeen());
  }

  @Test
  void touchOnlyMovesLastSeenForward() {
    store.touchNode(0x77, T0 + 500);
    store.touchNode(0x77, T0 + 100);
    MeshNode node = store.touchNode(0x77, T0 + 900);

    assertEquals(T0 + 900, node.lastSeen());
    assertTrue(node.fields().isEmpty());
  }

  @Test
  void tracerouteIsCreatedThenExtended() {
    Traceroute request = new Traceroute(
        900, 0x100, 0x200, List.of(0x300L), List.of(6.0), List.of(), List.of(), false, "!000000a1", T0);
    Traceroute reply = new Traceroute(
        900, 0x100, 0x200, List.of(0x300L, 0x400L), List.of(6.0, 2.5), List.of(0x300L), List.of(1.5), true,
        "!000000a2", T0 + 10);

    assertEquals(MergeOutcome.CREATED, store.recordTraceroute(request).outcome());
    assertEquals(MergeOutcome.EXTENDED, store.recordTraceroute(reply).outcome());
    assertEquals(MergeOutcome.UNCHANGED, store.recordTraceroute(request).outcome());

    Traceroute stored = query.findTraceroute(900, 0x100).orElseThrow();
    assertEquals(List.of(0x300L, 0x400L), stored.route());
    assertEquals(List.of(6.0, 2.5), stored.snrTowards());
    assertEquals(List.of(0x300L), stored.routeBack());
    assertTrue(stored.done());
    assertEquals("!000000a1", stored.gatewayId());
    assertEquals(1, query.traceroutesSince(T0).size());
    assertTrue(query.traceroutesSince(T0 + 1).isEmpty());
  }

  @Test
  void topTrafficRanksByTimesSeenThenPacketsSent() {
    store.mergeObservation(0x1, NodeField.LONG_NAME, "Chatty", T0);
    for (long id = 1; id <= 2; id++) {
      store.recordPacket(decoded(id, 0x1).gateway("!000000a1").receivedAt(T0).build());
      store.recordPacket(decoded(id, 0x1).gateway("!000000a2").receivedAt(T0).build());
    }
    for (long id = 11; id <= 13; id++) {
      store.recordPacket(decoded(id, 0x2).gateway("!000000a1").receivedAt(T0).build());
    }
    store.recordPacket(decoded(99, 0x3).receivedAt(T0 - 60_000).build());

    List<TrafficSummary> top = query.topTraffic(T0 - 1_000, 10);
    assertEquals(2, top.size());
    assertEquals(new TrafficSummary(0x1, "Chatty", null, null, 2, 4), top.get(0));
    assertEquals(0x2, top.get(1).nodeId());
    assertEquals(3, top.get(1).packetsSent());
    assertEquals(3, top.get(1).timesSeen());
    assertEquals(1, query.topTraffic(T0 - 1_000, 1).size());
  }

  @Test
  void nodeTrafficCountsPacketsPerPort() {
    store.recordPacket(decoded(1, 0x5).payload(MessageKind.TEXT, HELLO).receivedAt(T0).build());
    store.recordPacket(decoded(2, 0x5).payload(MessageKind.POSITION, new byte[0]).receivedAt(T0).build());
    store.recordPacket(decoded(3, 0x5).payload(MessageKind.POSITION, new byte[0]).receivedAt(T0).build());

    List<KindCount> traffic = query.nodeTraffic(0x5, T0);
    assertEquals(2, traffic.size());
    assertEquals(new KindCount(MessageKind.POSITION.portNum(), MessageKind.POSITION, 2), traffic.get(0));
    assertEquals(new KindCount(MessageKind.TEXT.portNum(), MessageKind.TEXT, 1), traffic.get(1));
  }

  @Test
  void packetsFromReturnsNewestFirst() {
    store.recordPacket(decoded(1, 0x5).receivedAt(T0).build());
    store.recordPacket(decoded(2, 0x5).receivedAt(T0 + 100).build());
    store.recordPacket(decoded(3, 0x5).receivedAt(T0 + 200).build());

    List<Long> ids = query.packetsFrom(0x5, T0 + 50, 10).stream()
        .map(CanonicalPacket::packetId)
        .collect(Collectors.toList());
    assertEquals(List.of(3L, 2L), ids);
  }

  @Test
  void activeNodeCountHonoursWindowAndChannel() {
    store.mergeObservation(0x1, NodeField.CHANNEL, "LongFast", T0);
    store.mergeObservation(0x2, NodeField.CHANNEL, "MediumSlow", T0);
    store.touchNode(0x3, T0 - 10_000);

    assertEquals(2, query.activeNodeCount(T0 - 1, Optional.empty()));
    assertEquals(1, query.activeNodeCount(T0 - 1, Optional.of("LongFast")));
    assertEquals(3, query.activeNodeCount(T0 - 20_000, Optional.empty()));
  }

  @Test
  void searchMatchesHexIdAndNames() {
    store.mergeObservation(0x1234abcdL, NodeField.LONG_NAME, "Alpha Base", T0);
    store.mergeObservation(0x0000beefL, NodeField.SHORT_NAME, "BEEF", T0);

    assertEquals(1, query.searchNodes("!1234", 10).size());
    assertEquals(1, query.searchNodes("1234ab", 10).size());
    assertEquals(0x1234abcdL, query.searchNodes("alp", 10).get(0).nodeId());
    assertEquals(0x0000beefL, query.searchNodes("beef", 10).get(0).nodeId());
    assertTrue(query.searchNodes("zzz", 10).isEmpty());
    assertThrows(IllegalArgumentException.class, () -> query.searchNodes("  ", 10));
  }
}
