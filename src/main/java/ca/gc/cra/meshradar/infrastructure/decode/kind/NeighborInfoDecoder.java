package ca.gc.cra.meshradar.infrastructure.decode.kind;

import ca.gc.cra.meshradar.domain.error.DecodeException;
import ca.gc.cra.meshradar.domain.msg.NeighborList;
import ca.gc.cra.meshradar.infrastructure.decode.ProtoReader;
import com.google.protobuf.CodedInputStream;
import com.google.protobuf.WireFormat;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Decodes {@code NeighborInfo} payloads.
 */
public final class NeighborInfoDecoder implements PayloadDecoder<NeighborList> {
  private static final int NODE_ID = 1 << 3 | WireFormat.WIRETYPE_VARINT;
  private static final int LAST_SENT_BY_ID = 2 << 3 | WireFormat.WIRETYPE_VARINT;
  private static final int BROADCAST_INTERVAL = 3 << 3 | WireFormat.WIRETYPE_VARINT;
  private static final int NEIGHBORS = 4 << 3 | WireFormat.WIRETYPE_LENGTH_DELIMITED;

  private static final int NEIGHBOR_NODE_ID = 1 << 3 | WireFormat.WIRETYPE_VARINT;
  private static final int NEIGHBOR_SNR = 2 << 3 | WireFormat.WIRETYPE_FIXED32;

  @Override
  public NeighborList decode(byte[] payload) throws DecodeException {
    long nodeId = 0;
    long lastSentById = 0;
    int interval = 0;
    List<NeighborList.Neighbor> neighbors = new ArrayList<>();
    try {
      CodedInputStream in = ProtoReader.open(payload);
      for (int tag = in.readTag(); tag != 0; tag = in.readTag()) {
        switch (tag) {
          case NODE_ID -> nodeId = Integer.toUnsignedLong(in.readUInt32());
          case LAST_SENT_BY_ID -> lastSentById = Integer.toUnsignedLong(in.readUInt32());
          case BROADCAST_INTERVAL -> interval = in.readUInt32();
          case NEIGHBORS -> neighbors.add(readNeighbor(ProtoReader.open(in.readByteArray())));
          default -> ProtoReader.skip(in, tag);
        }
      }
    } catch (IOException ex) {
      throw ProtoReader.malformed("NeighborInfo", ex);
    }
    return new NeighborList(nodeId, lastSentById, interval, neighbors);
  }

  private static NeighborList.Neighbor readNeighbor(CodedInputStream in) throws IOException {
    long nodeId = 0;
    float snr = 0f;
    for (int tag = in.readTag(); tag != 0; tag = in.readTag()) {
      switch (tag) {
        case NEIGHBOR_NODE_ID -> nodeId = Integer.toUnsignedLong(in.readUInt32());
        case NEIGHBOR_SNR -> snr = in.readFloat();
        default -> ProtoReader.skip(in, tag);
      }
    }
    return new NeighborList.Neighbor(nodeId, snr);
  }
}
