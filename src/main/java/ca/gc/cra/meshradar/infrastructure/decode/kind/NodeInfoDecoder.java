package ca.gc.cra.meshradar.infrastructure.decode.kind;

import ca.gc.cra.meshradar.domain.error.DecodeException;
import ca.gc.cra.meshradar.domain.msg.NodeIdentity;
import ca.gc.cra.meshradar.infrastructure.decode.ProtoReader;
import com.google.protobuf.CodedInputStream;
import com.google.protobuf.WireFormat;
import java.io.IOException;

/**
 * Decodes {@code User} identity payloads. Hardware model and role are resolved to their names.
 */
public final class NodeInfoDecoder implements PayloadDecoder<NodeIdentity> {
  private static final int ID = 1 << 3 | WireFormat.WIRETYPE_LENGTH_DELIMITED;
  private static final int LONG_NAME = 2 << 3 | WireFormat.WIRETYPE_LENGTH_DELIMITED;
  private static final int SHORT_NAME = 3 << 3 | WireFormat.WIRETYPE_LENGTH_DELIMITED;
  private static final int HW_MODEL = 5 << 3 | WireFormat.WIRETYPE_VARINT;
  private static final int ROLE = 7 << 3 | WireFormat.WIRETYPE_VARINT;

  @Override
  public NodeIdentity decode(byte[] payload) throws DecodeException {
    String id = "";
    String longName = "";
    String shortName = "";
    int hwModel = 0;
    int role = 0;
    try {
      CodedInputStream in = ProtoReader.open(payload);
      for (int tag = in.readTag(); tag != 0; tag = in.readTag()) {
        switch (tag) {
          case ID -> id = in.readString();
          case LONG_NAME -> longName = in.readString();
          case SHORT_NAME -> shortName = in.readString();
          case HW_MODEL -> hwModel = in.readEnum();
          case ROLE -> role = in.readEnum();
          default -> ProtoReader.skip(in, tag);
        }
      }
    } catch (IOException ex) {
      throw ProtoReader.malformed("User", ex);
    }
    return new NodeIdentity(id, longName, shortName, MeshEnums.hardwareModel(hwModel), MeshEnums.role(role));
  }
}
