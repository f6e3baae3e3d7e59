package ca.gc.cra.meshradar.infrastructure.decode.kind;

import ca.gc.cra.meshradar.domain.error.DecodeException;
import ca.gc.cra.meshradar.domain.msg.MapReport;
import ca.gc.cra.meshradar.infrastructure.decode.ProtoReader;
import com.google.protobuf.CodedInputStream;
import com.google.protobuf.WireFormat;
import java.io.IOException;

/**
 * Decodes {@code MapReport} payloads published for public maps.
 */
public final class MapReportDecoder implements PayloadDecoder<MapReport> {
  private static final int LONG_NAME = 1 << 3 | WireFormat.WIRETYPE_LENGTH_DELIMITED;
  private static final int SHORT_NAME = 2 << 3 | WireFormat.WIRETYPE_LENGTH_DELIMITED;
  private static final int ROLE = 3 << 3 | WireFormat.WIRETYPE_VARINT;
  private static final int HW_MODEL = 4 << 3 | WireFormat.WIRETYPE_VARINT;
  private static final int FIRMWARE_VERSION = 5 << 3 | WireFormat.WIRETYPE_LENGTH_DELIMITED;
  private static final int REGION = 6 << 3 | WireFormat.WIRETYPE_VARINT;
  private static final int MODEM_PRESET = 7 << 3 | WireFormat.WIRETYPE_VARINT;
  private static final int LATITUDE_I = 9 << 3 | WireFormat.WIRETYPE_FIXED32;
  private static final int LONGITUDE_I = 10 << 3 | WireFormat.WIRETYPE_FIXED32;
  private static final int ALTITUDE = 11 << 3 | WireFormat.WIRETYPE_VARINT;
  private static final int ONLINE_LOCAL_NODES = 13 << 3 | WireFormat.WIRETYPE_VARINT;

  @Override
  public MapReport decode(byte[] payload) throws DecodeException {
    String longName = "";
    String shortName = "";
    int role = 0;
    int hwModel = 0;
    String firmware = "";
    int region = 0;
    int modemPreset = 0;
    int latitudeI = 0;
    int longitudeI = 0;
    Integer altitude = null;
    int onlineLocalNodes = 0;
    try {
      CodedInputStream in = ProtoReader.open(payload);
      for (int tag = in.readTag(); tag != 0; tag = in.readTag()) {
        switch (tag) {
          case LONG_NAME -> longName = in.readString();
          case SHORT_NAME -> shortName = in.readString();
          case ROLE -> role = in.readEnum();
          case HW_MODEL -> hwModel = in.readEnum();
          case FIRMWARE_VERSION -> firmware = in.readString();
          case REGION -> region = in.readEnum();
          case MODEM_PRESET -> modemPreset = in.readEnum();
          case LATITUDE_I -> latitudeI = in.readSFixed32();
          case LONGITUDE_I -> longitudeI = in.readSFixed32();
          case ALTITUDE -> altitude = in.readInt32();
          case ONLINE_LOCAL_NODES -> onlineLocalNodes = in.readUInt32();
          default -> ProtoReader.skip(in, tag);
        }
      }
    } catch (IOException ex) {
      throw ProtoReader.malformed("MapReport", ex);
    }
    return new MapReport(
        longName,
        shortName,
        MeshEnums.role(role),
        MeshEnums.hardwareModel(hwModel),
        firmware,
        region,
        modemPreset,
        PositionDecoder.toPosition(latitudeI, longitudeI, altitude),
        onlineLocalNodes);
  }
}
