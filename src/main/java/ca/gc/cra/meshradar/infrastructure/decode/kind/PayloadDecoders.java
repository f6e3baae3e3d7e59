package ca.gc.cra.meshradar.infrastructure.decode.kind;

import ca.gc.cra.meshradar.application.port.PayloadDecoderPort;
import ca.gc.cra.meshradar.domain.error.DecodeException;
import ca.gc.cra.meshradar.domain.mesh.MessageKind;
import ca.gc.cra.meshradar.domain.msg.NormalizedRecord;
import ca.gc.cra.meshradar.domain.msg.UnknownRecord;
import java.util.Objects;

/**
 * <strong>What:</strong> Dispatches inner payloads to the decoder for their {@link MessageKind}.
 * <p><strong>Role:</strong> Second decode stage after the envelope decoder; also used by read-side aggregators to
 * interpret stored payloads.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class PayloadDecoders implements PayloadDecoderPort {
  private final TextDecoder text = new TextDecoder();
  private final PositionDecoder position = new PositionDecoder();
  private final NodeInfoDecoder nodeInfo = new NodeInfoDecoder();
  private final RoutingDecoder routing = new RoutingDecoder();
  private final TelemetryDecoder telemetry = new TelemetryDecoder();
  private final RouteDiscoveryDecoder routeDiscovery = new RouteDiscoveryDecoder();
  private final NeighborInfoDecoder neighborInfo = new NeighborInfoDecoder();
  private final MapReportDecoder mapReport = new MapReportDecoder();

  @Override
  public NormalizedRecord decode(MessageKind kind, int portNum, byte[] payload) throws DecodeException {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(payload, "payload");
    return switch (kind) {
      case TEXT -> text.decode(payload);
      case POSITION -> position.decode(payload);
      case NODEINFO -> nodeInfo.decode(payload);
      case ROUTING -> routing.decode(payload);
      case TELEMETRY -> telemetry.decode(payload);
      case TRACEROUTE -> routeDiscovery.decode(payload);
      case NEIGHBORINFO -> neighborInfo.decode(payload);
      case MAP_REPORT -> mapReport.decode(payload);
      case UNKNOWN -> new UnknownRecord(portNum);
    };
  }
}
