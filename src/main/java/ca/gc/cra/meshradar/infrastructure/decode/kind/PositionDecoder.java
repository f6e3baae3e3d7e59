package ca.gc.cra.meshradar.infrastructure.decode.kind;

import ca.gc.cra.meshradar.domain.error.DecodeException;
import ca.gc.cra.meshradar.domain.mesh.Position;
import ca.gc.cra.meshradar.domain.msg.PositionReport;
import ca.gc.cra.meshradar.infrastructure.decode.ProtoReader;
import com.google.protobuf.CodedInputStream;
import com.google.protobuf.WireFormat;
import java.io.IOException;

/**
 * Decodes {@code Position} payloads. Coordinates are fixed point, degrees times 1e7.
 *
 * <p>A report with both coordinates zero means the node withheld its location and yields no position.</p>
 */
public final class PositionDecoder implements PayloadDecoder<PositionReport> {
  private static final int LATITUDE_I = 1 << 3 | WireFormat.WIRETYPE_FIXED32;
  private static final int LONGITUDE_I = 2 << 3 | WireFormat.WIRETYPE_FIXED32;
  private static final int ALTITUDE = 3 << 3 | WireFormat.WIRETYPE_VARINT;
  private static final int TIME = 4 << 3 | WireFormat.WIRETYPE_FIXED32;

  @Override
  public PositionReport decode(byte[] payload) throws DecodeException {
    int latitudeI = 0;
    int longitudeI = 0;
    Integer altitude = null;
    long time = 0;
    try {
      CodedInputStream in = ProtoReader.open(payload);
      for (int tag = in.readTag(); tag != 0; tag = in.readTag()) {
        switch (tag) {
          case LATITUDE_I -> latitudeI = in.readSFixed32();
          case LONGITUDE_I -> longitudeI = in.readSFixed32();
          case ALTITUDE -> altitude = in.readInt32();
          case TIME -> time = Integer.toUnsignedLong(in.readFixed32());
          default -> ProtoReader.skip(in, tag);
        }
      }
    } catch (IOException ex) {
      throw ProtoReader.malformed("Position", ex);
    }
    return new PositionReport(toPosition(latitudeI, longitudeI, altitude), time);
  }

  /**
   * Converts fixed-point coordinates, treating {@code (0, 0)} as absent.
   *
   * @param latitudeI fixed-point latitude
   * @param longitudeI fixed-point longitude
   * @param altitude altitude in metres or {@code null}
   * @return position or {@code null}
   * @throws DecodeException when the coordinates are out of range
   */
  static Position toPosition(int latitudeI, int longitudeI, Integer altitude) throws DecodeException {
    if (latitudeI == 0 && longitudeI == 0) {
      return null;
    }
    try {
      return Position.fromFixedPoint(latitudeI, longitudeI, altitude);
    } catch (IllegalArgumentException ex) {
      throw new DecodeException("Position coordinates out of range", ex);
    }
  }
}
