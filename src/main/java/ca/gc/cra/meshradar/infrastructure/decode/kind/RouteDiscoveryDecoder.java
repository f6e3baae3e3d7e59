package ca.gc.cra.meshradar.infrastructure.decode.kind;

import ca.gc.cra.meshradar.domain.error.DecodeException;
import ca.gc.cra.meshradar.domain.msg.PathTrace;
import ca.gc.cra.meshradar.infrastructure.decode.ProtoReader;
import com.google.protobuf.CodedInputStream;
import com.google.protobuf.WireFormat;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Decodes {@code RouteDiscovery} traceroute payloads.
 *
 * <p>Repeated fields are accepted packed and unpacked. SNR values are quarter-dB integers; {@code -128} marks an
 * unknown hop and becomes {@link Double#NaN}.</p>
 */
public final class RouteDiscoveryDecoder implements PayloadDecoder<PathTrace> {
  static final int SNR_UNKNOWN = -128;

  private static final int ROUTE = 1 << 3 | WireFormat.WIRETYPE_FIXED32;
  private static final int ROUTE_PACKED = 1 << 3 | WireFormat.WIRETYPE_LENGTH_DELIMITED;
  private static final int SNR_TOWARDS = 2 << 3 | WireFormat.WIRETYPE_VARINT;
  private static final int SNR_TOWARDS_PACKED = 2 << 3 | WireFormat.WIRETYPE_LENGTH_DELIMITED;
  private static final int ROUTE_BACK = 3 << 3 | WireFormat.WIRETYPE_FIXED32;
  private static final int ROUTE_BACK_PACKED = 3 << 3 | WireFormat.WIRETYPE_LENGTH_DELIMITED;
  private static final int SNR_BACK = 4 << 3 | WireFormat.WIRETYPE_VARINT;
  private static final int SNR_BACK_PACKED = 4 << 3 | WireFormat.WIRETYPE_LENGTH_DELIMITED;

  @Override
  public PathTrace decode(byte[] payload) throws DecodeException {
    List<Long> route = new ArrayList<>();
    List<Integer> snrTowards = new ArrayList<>();
    List<Long> routeBack = new ArrayList<>();
    List<Integer> snrBack = new ArrayList<>();
    try {
      CodedInputStream in = ProtoReader.open(payload);
      for (int tag = in.readTag(); tag != 0; tag = in.readTag()) {
        switch (tag) {
          case ROUTE -> route.add(Integer.toUnsignedLong(in.readFixed32()));
          case ROUTE_PACKED -> ProtoReader.readPackedFixed32(in, route);
          case SNR_TOWARDS -> snrTowards.add(in.readInt32());
          case SNR_TOWARDS_PACKED -> ProtoReader.readPackedInt32(in, snrTowards);
          case ROUTE_BACK -> routeBack.add(Integer.toUnsignedLong(in.readFixed32()));
          case ROUTE_BACK_PACKED -> ProtoReader.readPackedFixed32(in, routeBack);
          case SNR_BACK -> snrBack.add(in.readInt32());
          case SNR_BACK_PACKED -> ProtoReader.readPackedInt32(in, snrBack);
          default -> ProtoReader.skip(in, tag);
        }
      }
    } catch (IOException ex) {
      throw ProtoReader.malformed("RouteDiscovery", ex);
    }
    return new PathTrace(route, toDecibels(snrTowards), routeBack, toDecibels(snrBack));
  }

  static List<Double> toDecibels(List<Integer> quarterDb) {
    List<Double> db = new ArrayList<>(quarterDb.size());
    for (int value : quarterDb) {
      db.add(value == SNR_UNKNOWN ? Double.NaN : value / 4.0);
    }
    return db;
  }
}
