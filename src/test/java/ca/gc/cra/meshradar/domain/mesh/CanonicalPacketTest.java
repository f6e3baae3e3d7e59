package ca.gc.cra.meshradar.domain.mesh;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.meshradar.testutil.MeshFixtures;
import org.junit.jupiter.api.Test;

class CanonicalPacketTest {

  @Test
  void payloadCannotBeMutatedThroughAccessor() {
    CanonicalPacket packet = CanonicalPacket.from(
        MeshFixtures.decoded(1, 2).payload(MessageKind.TEXT, new byte[] {'h', 'i'}).build());

    packet.payload()[0] = 'X';

    assertArrayEquals(new byte[] {'h', 'i'}, packet.payload());
  }

  @Test
  void opaquePacketIsEnrichedOnce() {
    CanonicalPacket opaque = CanonicalPacket.from(MeshFixtures.decoded(1, 2).undecryptable(new byte[] {9}).build());
    DecodedEnvelope later = MeshFixtures.decoded(1, 2).payload(MessageKind.TEXT, new byte[] {'a'}).build();

    CanonicalPacket enriched = opaque.enrichWith(later);

    assertTrue(enriched.decoded());
    assertEquals(MessageKind.TEXT, enriched.kind());
    assertEquals(opaque.importTime(), enriched.importTime());
    assertSame(enriched, enriched.enrichWith(later));
  }
}
