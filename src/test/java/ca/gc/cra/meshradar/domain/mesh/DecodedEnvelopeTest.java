package ca.gc.cra.meshradar.domain.mesh;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.meshradar.testutil.MeshFixtures;
import org.junit.jupiter.api.Test;

class DecodedEnvelopeTest {

  @Test
  void observedAtPrefersRadioReceiveTime() {
    DecodedEnvelope envelope = MeshFixtures.decoded(1, 2).rxTime(1_700_000_123L).receivedAt(5L).build();

    assertEquals(1_700_000_123_000L, envelope.observedAt());
  }

  @Test
  void observedAtFallsBackToLocalReceiveTime() {
    DecodedEnvelope envelope = MeshFixtures.decoded(1, 2).receivedAt(5L).build();

    assertEquals(5L, envelope.observedAt());
  }

  @Test
  void hopCountNeedsAdvertisedStart() {
    assertEquals(2, MeshFixtures.decoded(1, 2).hops(1, 3).build().hopCount());
    assertNull(MeshFixtures.decoded(1, 2).hops(3, 0).build().hopCount());
    assertNull(MeshFixtures.decoded(1, 2).hops(5, 3).build().hopCount());
  }

  @Test
  void undecryptableEnvelopeCarriesNoKind() {
    DecodedEnvelope envelope = MeshFixtures.decoded(1, 2).undecryptable(new byte[] {1, 2, 3}).build();

    assertFalse(envelope.decoded());
    assertNull(envelope.kind());
    assertEquals(new PacketKey(1, 2), envelope.key());
  }

  @Test
  void hexGatewayResolvesToNodeNumber() {
    DecodedEnvelope envelope = MeshFixtures.decoded(1, 2).gateway("!a1b2c3d4").build();

    assertEquals(0xa1b2c3d4L, envelope.gatewayNodeId());
    assertTrue(NodeIds.parseHex("gatewayA").isEmpty());
    assertEquals("^all", NodeIds.destinationLabel(NodeIds.BROADCAST));
  }
}
