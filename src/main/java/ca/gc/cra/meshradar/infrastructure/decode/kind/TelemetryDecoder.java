package ca.gc.cra.meshradar.infrastructure.decode.kind;

import ca.gc.cra.meshradar.domain.error.DecodeException;
import ca.gc.cra.meshradar.domain.mesh.TelemetrySnapshot;
import ca.gc.cra.meshradar.domain.msg.TelemetryReport;
import ca.gc.cra.meshradar.infrastructure.decode.ProtoReader;
import com.google.protobuf.CodedInputStream;
import com.google.protobuf.WireFormat;
import java.io.IOException;

/**
 * Decodes {@code Telemetry} payloads carrying device and environment metrics. Other metric variants are skipped.
 */
public final class TelemetryDecoder implements PayloadDecoder<TelemetryReport> {
  private static final int TIME = 1 << 3 | WireFormat.WIRETYPE_FIXED32;
  private static final int DEVICE_METRICS = 2 << 3 | WireFormat.WIRETYPE_LENGTH_DELIMITED;
  private static final int ENVIRONMENT_METRICS = 3 << 3 | WireFormat.WIRETYPE_LENGTH_DELIMITED;

  private static final int BATTERY_LEVEL = 1 << 3 | WireFormat.WIRETYPE_VARINT;
  private static final int VOLTAGE = 2 << 3 | WireFormat.WIRETYPE_FIXED32;
  private static final int CHANNEL_UTILIZATION = 3 << 3 | WireFormat.WIRETYPE_FIXED32;
  private static final int AIR_UTIL_TX = 4 << 3 | WireFormat.WIRETYPE_FIXED32;
  private static final int UPTIME_SECONDS = 5 << 3 | WireFormat.WIRETYPE_VARINT;

  private static final int TEMPERATURE = 1 << 3 | WireFormat.WIRETYPE_FIXED32;
  private static final int RELATIVE_HUMIDITY = 2 << 3 | WireFormat.WIRETYPE_FIXED32;
  private static final int BAROMETRIC_PRESSURE = 3 << 3 | WireFormat.WIRETYPE_FIXED32;

  @Override
  public TelemetryReport decode(byte[] payload) throws DecodeException {
    Metrics metrics = new Metrics();
    long time = 0;
    try {
      CodedInputStream in = ProtoReader.open(payload);
      for (int tag = in.readTag(); tag != 0; tag = in.readTag()) {
        switch (tag) {
          case TIME -> time = Integer.toUnsignedLong(in.readFixed32());
          case DEVICE_METRICS -> readDevice(ProtoReader.open(in.readByteArray()), metrics);
          case ENVIRONMENT_METRICS -> readEnvironment(ProtoReader.open(in.readByteArray()), metrics);
          default -> ProtoReader.skip(in, tag);
        }
      }
    } catch (IOException ex) {
      throw ProtoReader.malformed("Telemetry", ex);
    }
    return new TelemetryReport(metrics.toSnapshot(), time);
  }

  private static void readDevice(CodedInputStream in, Metrics metrics) throws IOException {
    for (int tag = in.readTag(); tag != 0; tag = in.readTag()) {
      switch (tag) {
        case BATTERY_LEVEL -> metrics.batteryLevel = in.readUInt32();
        case VOLTAGE -> metrics.voltage = in.readFloat();
        case CHANNEL_UTILIZATION -> metrics.channelUtilization = in.readFloat();
        case AIR_UTIL_TX -> metrics.airUtilTx = in.readFloat();
        case UPTIME_SECONDS -> metrics.uptimeSeconds = Integer.toUnsignedLong(in.readUInt32());
        default -> ProtoReader.skip(in, tag);
      }
    }
  }

  private static void readEnvironment(CodedInputStream in, Metrics metrics) throws IOException {
    for (int tag = in.readTag(); tag != 0; tag = in.readTag()) {
      switch (tag) {
        case TEMPERATURE -> metrics.temperature = in.readFloat();
        case RELATIVE_HUMIDITY -> metrics.relativeHumidity = in.readFloat();
        case BAROMETRIC_PRESSURE -> metrics.barometricPressure = in.readFloat();
        default -> ProtoReader.skip(in, tag);
      }
    }
  }

  private static final class Metrics {
    Integer batteryLevel;
    Float voltage;
    Float channelUtilization;
    Float airUtilTx;
    Long uptimeSeconds;
    Float temperature;
    Float relativeHumidity;
    Float barometricPressure;

    TelemetrySnapshot toSnapshot() {
      return new TelemetrySnapshot(
          batteryLevel,
          voltage,
          channelUtilization,
          airUtilTx,
          uptimeSeconds,
          temperature,
          relativeHumidity,
          barometricPressure);
    }
  }
}
