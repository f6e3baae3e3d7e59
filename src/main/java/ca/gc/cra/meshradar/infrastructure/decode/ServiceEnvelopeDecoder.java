package ca.gc.cra.meshradar.infrastructure.decode;

import ca.gc.cra.meshradar.application.health.HealthCounter;
import ca.gc.cra.meshradar.application.health.PipelineHealth;
import ca.gc.cra.meshradar.application.port.EnvelopeDecoderPort;
import ca.gc.cra.meshradar.application.port.MetricsPort;
import ca.gc.cra.meshradar.domain.error.DecodeException;
import ca.gc.cra.meshradar.domain.mesh.DecodeStatus;
import ca.gc.cra.meshradar.domain.mesh.DecodedEnvelope;
import ca.gc.cra.meshradar.domain.mesh.MessageKind;
import ca.gc.cra.meshradar.domain.mesh.NodeIds;
import ca.gc.cra.meshradar.domain.mesh.RawMessage;
import ca.gc.cra.meshradar.logging.Logs;
import com.google.protobuf.CodedInputStream;
import com.google.protobuf.WireFormat;
import java.io.IOException;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Decodes the outer {@code ServiceEnvelope} and its {@code MeshPacket} into a
 * {@link DecodedEnvelope}.
 * <p><strong>Why:</strong> Routing metadata (sender, packet id, gateway, channel, radio metrics) must be extracted
 * before the store can deduplicate; the inner payload is handed on to the kind decoders untouched.</p>
 * <p><strong>Role:</strong> First decode stage run by the pipeline's decode workers.</p>
 * <p><strong>Thread-safety:</strong> Stateless per message; safe for concurrent use.</p>
 * <p><strong>Observability:</strong> Counts topic mismatches, undecryptable payloads, zero-id packets, ignored
 * senders, and gateway mismatches. Filtered messages are logged at DEBUG.</p>
 *
 * @since 0.1.0
 */
public final class ServiceEnvelopeDecoder implements EnvelopeDecoderPort {
  private static final Logger log = LoggerFactory.getLogger(ServiceEnvelopeDecoder.class);
  private static final int PREVIEW_BYTES = 32;

  private static final int ENVELOPE_PACKET = 1 << 3 | WireFormat.WIRETYPE_LENGTH_DELIMITED;
  private static final int ENVELOPE_GATEWAY_ID = 3 << 3 | WireFormat.WIRETYPE_LENGTH_DELIMITED;

  private static final int PACKET_FROM = 1 << 3 | WireFormat.WIRETYPE_FIXED32;
  private static final int PACKET_TO = 2 << 3 | WireFormat.WIRETYPE_FIXED32;
  private static final int PACKET_DECODED = 4 << 3 | WireFormat.WIRETYPE_LENGTH_DELIMITED;
  private static final int PACKET_ENCRYPTED = 5 << 3 | WireFormat.WIRETYPE_LENGTH_DELIMITED;
  private static final int PACKET_ID = 6 << 3 | WireFormat.WIRETYPE_FIXED32;
  private static final int PACKET_RX_TIME = 7 << 3 | WireFormat.WIRETYPE_FIXED32;
  private static final int PACKET_RX_SNR = 8 << 3 | WireFormat.WIRETYPE_FIXED32;
  private static final int PACKET_HOP_LIMIT = 9 << 3 | WireFormat.WIRETYPE_VARINT;
  private static final int PACKET_RX_RSSI = 12 << 3 | WireFormat.WIRETYPE_VARINT;
  private static final int PACKET_HOP_START = 15 << 3 | WireFormat.WIRETYPE_VARINT;

  private static final int DATA_PORTNUM = 1 << 3 | WireFormat.WIRETYPE_VARINT;
  private static final int DATA_PAYLOAD = 2 << 3 | WireFormat.WIRETYPE_LENGTH_DELIMITED;
  private static final int DATA_WANT_RESPONSE = 3 << 3 | WireFormat.WIRETYPE_VARINT;
  private static final int DATA_REQUEST_ID = 6 << 3 | WireFormat.WIRETYPE_FIXED32;

  private final TopicLayout layout;
  private final ChannelCipher cipher;
  private final Set<Long> ignoredSenders;
  private final PipelineHealth health;
  private final MetricsPort metrics;

  /**
   * Creates a decoder.
   *
   * @param layout topic layout locating gateway and channel
   * @param cipher channel keys tried on encrypted payloads
   * @param ignoredSenders sender node numbers whose packets are skipped
   * @param health health surface receiving decode counters
   */
  public ServiceEnvelopeDecoder(
      TopicLayout layout, ChannelCipher cipher, Set<Long> ignoredSenders, PipelineHealth health) {
    this.layout = Objects.requireNonNull(layout, "layout");
    this.cipher = Objects.requireNonNull(cipher, "cipher");
    this.ignoredSenders = Set.copyOf(Objects.requireNonNull(ignoredSenders, "ignoredSenders"));
    this.health = Objects.requireNonNull(health, "health");
    this.metrics = health.metrics();
  }

  @Override
  public Optional<DecodedEnvelope> decode(RawMessage message) throws DecodeException {
    Objects.requireNonNull(message, "message");
    Optional<TopicRoute> route = layout.match(message.topic());
    if (route.isEmpty()) {
      health.record(HealthCounter.TOPIC_MISMATCH);
      log.debug("Topic {} does not match layout {}", message.topic(), layout);
      return Optional.empty();
    }

    Envelope envelope = readEnvelope(message.payload());
    if (envelope.packet == null) {
      throw new DecodeException("ServiceEnvelope on " + message.topic() + " carries no packet");
    }
    MeshPacket packet = readPacket(envelope.packet);
    if (packet.id == 0) {
      metrics.increment("decode.packet.zeroId");
      log.debug("Skipping packet without id from {}", NodeIds.toHex(packet.from));
      return Optional.empty();
    }
    if (ignoredSenders.contains(packet.from)) {
      metrics.increment("decode.packet.ignoredSender");
      log.debug("Skipping packet {} from ignored sender {}", packet.id, NodeIds.toHex(packet.from));
      return Optional.empty();
    }

    String gatewayId = route.get().gatewayId();
    if (!envelope.gatewayId.isEmpty() && !envelope.gatewayId.equals(gatewayId)) {
      metrics.increment("decode.gateway.mismatch");
      log.debug("Envelope gateway {} differs from topic gateway {}", envelope.gatewayId, gatewayId);
    }

    Optional<Data> data;
    if (packet.decoded != null) {
      data = Optional.of(readData(packet.decoded));
    } else {
      data = cipher.tryDecrypt(packet.id, packet.from, packet.encrypted, ServiceEnvelopeDecoder::tryReadData);
    }
    if (data.isEmpty()) {
      health.record(HealthCounter.UNDECRYPTABLE);
      log.debug("Packet {} from {} is undecryptable ({})",
          packet.id, NodeIds.toHex(packet.from), Logs.hexPreview(packet.encrypted, PREVIEW_BYTES));
    }
    return Optional.of(toEnvelope(message, route.get(), packet, data.orElse(null)));
  }

  private static DecodedEnvelope toEnvelope(RawMessage message, TopicRoute route, MeshPacket packet, Data data) {
    OptionalLong gatewayNode = NodeIds.parseHex(route.gatewayId());
    boolean decoded = data != null;
    return new DecodedEnvelope(
        packet.id,
        packet.from,
        packet.to,
        route.channel(),
        route.gatewayId(),
        gatewayNode.isPresent() ? gatewayNode.getAsLong() : null,
        decoded ? DecodeStatus.DECODED : DecodeStatus.UNDECRYPTABLE,
        decoded ? MessageKind.fromPortNum(data.portNum) : null,
        decoded ? data.portNum : 0,
        decoded ? data.payload : packet.encrypted,
        packet.hopLimit,
        packet.hopStart,
        packet.rssi,
        packet.snr,
        packet.rxTime,
        decoded && data.wantResponse,
        decoded ? data.requestId : 0L,
        message.topic(),
        message.receivedAtMillis());
  }

  private static Envelope readEnvelope(byte[] bytes) throws DecodeException {
    Envelope envelope = new Envelope();
    try {
      CodedInputStream in = ProtoReader.open(bytes);
      for (int tag = in.readTag(); tag != 0; tag = in.readTag()) {
        switch (tag) {
          case ENVELOPE_PACKET -> envelope.packet = in.readByteArray();
          case ENVELOPE_GATEWAY_ID -> envelope.gatewayId = in.readString();
          default -> ProtoReader.skip(in, tag);
        }
      }
    } catch (IOException ex) {
      throw ProtoReader.malformed("ServiceEnvelope", ex);
    }
    return envelope;
  }

  private static MeshPacket readPacket(byte[] bytes) throws DecodeException {
    MeshPacket packet = new MeshPacket();
    try {
      CodedInputStream in = ProtoReader.open(bytes);
      for (int tag = in.readTag(); tag != 0; tag = in.readTag()) {
        switch (tag) {
          case PACKET_FROM -> packet.from = Integer.toUnsignedLong(in.readFixed32());
          case PACKET_TO -> packet.to = Integer.toUnsignedLong(in.readFixed32());
          case PACKET_DECODED -> packet.decoded = in.readByteArray();
          case PACKET_ENCRYPTED -> packet.encrypted = in.readByteArray();
          case PACKET_ID -> packet.id = Integer.toUnsignedLong(in.readFixed32());
          case PACKET_RX_TIME -> packet.rxTime = Integer.toUnsignedLong(in.readFixed32());
          case PACKET_RX_SNR -> packet.snr = in.readFloat();
          case PACKET_HOP_LIMIT -> packet.hopLimit = in.readUInt32();
          case PACKET_RX_RSSI -> {
            int rssi = in.readInt32();
            packet.rssi = rssi == 0 ? null : rssi;
          }
          case PACKET_HOP_START -> packet.hopStart = in.readUInt32();
          default -> ProtoReader.skip(in, tag);
        }
      }
    } catch (IOException ex) {
      throw ProtoReader.malformed("MeshPacket", ex);
    }
    return packet;
  }

  private static Data readData(byte[] bytes) throws DecodeException {
    try {
      return parseData(bytes);
    } catch (IOException ex) {
      throw ProtoReader.malformed("Data", ex);
    }
  }

  /**
   * Key check: plaintext from a wrong key rarely parses as Data with a non-zero port. It can, so a wrong key may
   * occasionally be accepted and yield a garbage packet.
   */
  private static Optional<Data> tryReadData(byte[] plaintext) {
    try {
      Data data = parseData(plaintext);
      return data.portNum != 0 ? Optional.of(data) : Optional.empty();
    } catch (IOException ex) {
      log.trace("Channel key rejected: {}", ex.getMessage());
      return Optional.empty();
    }
  }

  private static Data parseData(byte[] bytes) throws IOException {
    Data data = new Data();
    CodedInputStream in = ProtoReader.open(bytes);
    for (int tag = in.readTag(); tag != 0; tag = in.readTag()) {
      switch (tag) {
        case DATA_PORTNUM -> data.portNum = in.readEnum();
        case DATA_PAYLOAD -> data.payload = in.readByteArray();
        case DATA_WANT_RESPONSE -> data.wantResponse = in.readBool();
        case DATA_REQUEST_ID -> data.requestId = Integer.toUnsignedLong(in.readFixed32());
        default -> ProtoReader.skip(in, tag);
      }
    }
    return data;
  }

  private static final class Envelope {
    byte[] packet;
    String gatewayId = "";
  }

  private static final class MeshPacket {
    long from;
    long to;
    long id;
    long rxTime;
    Float snr;
    Integer rssi;
    int hopLimit;
    int hopStart;
    byte[] decoded;
    byte[] encrypted = new byte[0];
  }

  private static final class Data {
    int portNum;
    byte[] payload = new byte[0];
    boolean wantResponse;
    long requestId;
  }
}
