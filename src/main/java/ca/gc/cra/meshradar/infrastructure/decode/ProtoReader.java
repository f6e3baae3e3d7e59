package ca.gc.cra.meshradar.infrastructure.decode;

import ca.gc.cra.meshradar.domain.error.DecodeException;
import com.google.protobuf.CodedInputStream;
import java.io.IOException;
import java.util.List;

/**
 * Protobuf wire helpers shared by the envelope and kind decoders.
 *
 * <p>Decoders read with {@link CodedInputStream} against field tags declared as
 * {@code fieldNumber << 3 | WireFormat.WIRETYPE_*} constants, so the pipeline depends only on
 * the wire format and tolerates fields added by newer firmware.</p>
 */
public final class ProtoReader {
  private ProtoReader() {}

  /**
   * Opens a reader over a payload.
   *
   * @param bytes payload
   * @return stream positioned at the first tag
   */
  public static CodedInputStream open(byte[] bytes) {
    return CodedInputStream.newInstance(bytes);
  }

  /**
   * Wraps a wire-level failure.
   *
   * @param what message type being decoded
   * @param cause parser failure
   * @return decode exception to throw
   */
  public static DecodeException malformed(String what, IOException cause) {
    return new DecodeException(what + " payload is malformed or truncated: " + cause.getMessage(), cause);
  }

  /**
   * Reads a packed run of fixed32 values as unsigned node numbers.
   *
   * @param in stream positioned after the tag
   * @param into destination list
   * @throws IOException if the run is truncated
   */
  public static void readPackedFixed32(CodedInputStream in, List<Long> into) throws IOException {
    int length = in.readRawVarint32();
    int limit = in.pushLimit(length);
    while (in.getBytesUntilLimit() > 0) {
      into.add(Integer.toUnsignedLong(in.readFixed32()));
    }
    in.popLimit(limit);
  }

  /**
   * Reads a packed run of int32 varints.
   *
   * @param in stream positioned after the tag
   * @param into destination list
   * @throws IOException if the run is truncated
   */
  public static void readPackedInt32(CodedInputStream in, List<Integer> into) throws IOException {
    int length = in.readRawVarint32();
    int limit = in.pushLimit(length);
    while (in.getBytesUntilLimit() > 0) {
      into.add(in.readInt32());
    }
    in.popLimit(limit);
  }

  /**
   * Skips a field the decoder does not interpret.
   *
   * @param in stream positioned after the tag
   * @param tag tag just read
   * @throws IOException if the field is truncated or uses an invalid wire type
   */
  public static void skip(CodedInputStream in, int tag) throws IOException {
    if (!in.skipField(tag)) {
      throw new IOException("unexpected end-group tag " + tag);
    }
  }
}
