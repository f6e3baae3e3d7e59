package ca.gc.cra.meshradar.infrastructure.decode.kind;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.meshradar.domain.error.DecodeException;
import ca.gc.cra.meshradar.domain.mesh.MessageKind;
import ca.gc.cra.meshradar.domain.msg.NodeIdentity;
import ca.gc.cra.meshradar.domain.msg.PathTrace;
import ca.gc.cra.meshradar.domain.msg.PositionReport;
import ca.gc.cra.meshradar.domain.msg.RoutingReport;
import ca.gc.cra.meshradar.domain.msg.TelemetryReport;
import ca.gc.cra.meshradar.domain.msg.TextMessage;
import ca.gc.cra.meshradar.domain.msg.UnknownRecord;
import ca.gc.cra.meshradar.testutil.MeshFixtures;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Test;

class PayloadDecodersTest {
  private final PayloadDecoders decoders = new PayloadDecoders();

  @Test
  void textIsUtf8() throws DecodeException {
    byte[] payload = "caf\u00e9 on the mesh".getBytes(StandardCharsets.UTF_8);

    TextMessage text = assertInstanceOf(TextMessage.class, decoders.decode(MessageKind.TEXT, 1, payload));

    assertEquals("caf\u00e9 on the mesh", text.text());
  }

  @Test
  void positionScalesFixedPointCoordinates() throws DecodeException {
    byte[] payload = MeshFixtures.position(37.0, -122.0, 15, 1_700_000_000L);

    PositionReport report = assertInstanceOf(PositionReport.class,
        decoders.decode(MessageKind.POSITION, 3, payload));

    assertEquals(37.0, report.position().latitude(), 1e-6);
    assertEquals(-122.0, report.position().longitude(), 1e-6);
    assertEquals(15, report.position().altitude());
    assertEquals(1_700_000_000L, report.time());
  }

  @Test
  void zeroCoordinatesMeanNoFix() throws DecodeException {
    PositionReport report = assertInstanceOf(PositionReport.class,
        decoders.decode(MessageKind.POSITION, 3, new byte[0]));

    assertNull(report.position());
    assertTrue(report.maybePosition().isEmpty());
  }

  @Test
  void outOfRangePositionIsRejected() {
    byte[] payload = MeshFixtures.position(100.0, 10.0, 0, 0L);

    assertThrows(DecodeException.class, () -> decoders.decode(MessageKind.POSITION, 3, payload));
  }

  @Test
  void nodeInfoMapsHardwareAndRoleNames() throws DecodeException {
    byte[] payload = MeshFixtures.user("!0000002a", "Hilltop Relay", "HTR", 9, 2);

    NodeIdentity identity = assertInstanceOf(NodeIdentity.class,
        decoders.decode(MessageKind.NODEINFO, 4, payload));

    assertEquals("!0000002a", identity.userId());
    assertEquals("Hilltop Relay", identity.longName());
    assertEquals("HTR", identity.shortName());
    assertEquals("RAK4631", identity.hwModel());
    assertEquals("ROUTER", identity.role());
  }

  @Test
  void unmappedEnumValuesKeepTheirNumber() throws DecodeException {
    byte[] payload = MeshFixtures.user("!0000002a", "n", "n", 999, 77);

    NodeIdentity identity = assertInstanceOf(NodeIdentity.class,
        decoders.decode(MessageKind.NODEINFO, 4, payload));

    assertEquals("UNKNOWN_999", identity.hwModel());
    assertEquals("UNKNOWN_77", identity.role());
  }

  @Test
  void telemetryReadsDeviceMetrics() throws DecodeException {
    byte[] payload = MeshFixtures.deviceTelemetry(87, 4.1f, 1_700_000_100L);

    TelemetryReport report = assertInstanceOf(TelemetryReport.class,
        decoders.decode(MessageKind.TELEMETRY, 67, payload));

    assertEquals(87, report.snapshot().batteryLevel());
    assertEquals(4.1f, report.snapshot().voltage());
    assertNull(report.snapshot().temperature());
    assertTrue(report.snapshot().hasAnyMetric());
  }

  @Test
  void routeDiscoveryConvertsQuarterDecibels() throws DecodeException {
    byte[] payload = MeshFixtures.routeDiscovery(List.of(0xa1L, 0xffff_fff0L), List.of(24, -128, -6), List.of());

    PathTrace trace = assertInstanceOf(PathTrace.class, decoders.decode(MessageKind.TRACEROUTE, 70, payload));

    assertEquals(List.of(0xa1L, 0xffff_fff0L), trace.route());
    assertEquals(6.0, trace.snrTowards().get(0));
    assertTrue(Double.isNaN(trace.snrTowards().get(1)));
    assertEquals(-1.5, trace.snrTowards().get(2));
    assertTrue(trace.routeBack().isEmpty());
  }

  @Test
  void unknownPortsBecomeUnknownRecords() throws DecodeException {
    UnknownRecord record = assertInstanceOf(UnknownRecord.class,
        decoders.decode(MessageKind.UNKNOWN, 256, new byte[] {1, 2}));

    assertEquals(256, record.portNum());
  }

  @Test
  void truncatedPayloadFails() {
    byte[] truncated = {0x12, 0x05, 'a'};

    assertThrows(DecodeException.class, () -> decoders.decode(MessageKind.NODEINFO, 4, truncated));
  }

  @Test
  void routingReportsErrorReason() throws DecodeException {
    RoutingReport failed = assertInstanceOf(RoutingReport.class,
        decoders.decode(MessageKind.ROUTING, 5, new byte[] {0x18, 0x08}));
    RoutingReport acked = assertInstanceOf(RoutingReport.class,
        decoders.decode(MessageKind.ROUTING, 5, new byte[0]));

    assertEquals(8, failed.errorReason());
    assertFalse(failed.acknowledged());
    assertTrue(acked.acknowledged());
  }
}
