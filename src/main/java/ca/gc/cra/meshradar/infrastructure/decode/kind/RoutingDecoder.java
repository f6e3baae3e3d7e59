package ca.gc.cra.meshradar.infrastructure.decode.kind;

import ca.gc.cra.meshradar.domain.error.DecodeException;
import ca.gc.cra.meshradar.domain.msg.RoutingReport;
import ca.gc.cra.meshradar.infrastructure.decode.ProtoReader;
import com.google.protobuf.CodedInputStream;
import com.google.protobuf.WireFormat;
import java.io.IOException;

/**
 * Decodes {@code Routing} payloads; only the error reason is kept.
 */
public final class RoutingDecoder implements PayloadDecoder<RoutingReport> {
  private static final int ERROR_REASON = 3 << 3 | WireFormat.WIRETYPE_VARINT;

  @Override
  public RoutingReport decode(byte[] payload) throws DecodeException {
    int errorReason = 0;
    try {
      CodedInputStream in = ProtoReader.open(payload);
      for (int tag = in.readTag(); tag != 0; tag = in.readTag()) {
        if (tag == ERROR_REASON) {
          errorReason = in.readEnum();
        } else {
          ProtoReader.skip(in, tag);
        }
      }
    } catch (IOException ex) {
      throw ProtoReader.malformed("Routing", ex);
    }
    return new RoutingReport(errorReason);
  }
}
