package ca.gc.cra.meshradar.infrastructure.decode;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.security.GeneralSecurityException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import javax.crypto.Cipher;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;

/**
 * <strong>What:</strong> AES-CTR decryption of mesh payloads with a list of configured channel keys.
 * <p><strong>Nonce:</strong> packet id as 8 little-endian bytes followed by the sender node number as 8
 * little-endian bytes.</p>
 * <p><strong>Thread-safety:</strong> Immutable; a fresh {@link Cipher} is created per attempt.</p>
 *
 * @since 0.1.0
 */
public final class ChannelCipher {
  /** Publicly known default channel key. */
  public static final String DEFAULT_KEY = "1PG7OiApB1nwvP+rz05pAQ==";

  private static final String TRANSFORMATION = "AES/CTR/NoPadding";

  private final List<SecretKeySpec> keys;

  private ChannelCipher(List<SecretKeySpec> keys) {
    this.keys = List.copyOf(keys);
  }

  /**
   * Builds a cipher from base64 keys.
   *
   * @param base64Keys AES-128 or AES-256 keys in base64; may be empty to disable decryption
   * @return cipher
   * @throws IllegalArgumentException if a key is not valid base64 or has an unsupported length
   */
  public static ChannelCipher fromBase64(List<String> base64Keys) {
    List<SecretKeySpec> specs = new ArrayList<>(base64Keys.size());
    for (String encoded : base64Keys) {
      byte[] raw;
      try {
        raw = Base64.getDecoder().decode(encoded.trim());
      } catch (IllegalArgumentException ex) {
        throw new IllegalArgumentException("channelKeys entry is not valid base64", ex);
      }
      if (raw.length != 16 && raw.length != 32) {
        throw new IllegalArgumentException("channelKeys entry must decode to 16 or 32 bytes, got " + raw.length);
      }
      specs.add(new SecretKeySpec(raw, "AES"));
    }
    return new ChannelCipher(specs);
  }

  /**
   * Cipher holding only {@link #DEFAULT_KEY}.
   *
   * @return default cipher
   */
  public static ChannelCipher defaultKey() {
    return fromBase64(List.of(DEFAULT_KEY));
  }

  public int keyCount() {
    return keys.size();
  }

  /**
   * Tries each key in order and returns the first plaintext {@code accept} recognises.
   *
   * @param packetId mesh packet id
   * @param fromNodeId sender node number
   * @param ciphertext encrypted payload
   * @param accept parser returning a value when the plaintext is well formed
   * @param <T> parsed type
   * @return first accepted value, or empty when no key produced acceptable plaintext
   */
  public <T> Optional<T> tryDecrypt(
      long packetId, long fromNodeId, byte[] ciphertext, Function<byte[], Optional<T>> accept) {
    if (ciphertext.length == 0 || keys.isEmpty()) {
      return Optional.empty();
    }
    IvParameterSpec nonce = new IvParameterSpec(nonce(packetId, fromNodeId));
    for (SecretKeySpec key : keys) {
      Optional<T> result = accept.apply(apply(key, nonce, ciphertext));
      if (result.isPresent()) {
        return result;
      }
    }
    return Optional.empty();
  }

  /**
   * Encrypts or decrypts with one key; CTR mode is symmetric.
   *
   * @param base64Key key in base64
   * @param packetId mesh packet id
   * @param fromNodeId sender node number
   * @param input bytes to transform
   * @return transformed bytes
   */
  public static byte[] transform(String base64Key, long packetId, long fromNodeId, byte[] input) {
    SecretKeySpec key = new SecretKeySpec(Base64.getDecoder().decode(base64Key), "AES");
    return apply(key, new IvParameterSpec(nonce(packetId, fromNodeId)), input);
  }

  static byte[] nonce(long packetId, long fromNodeId) {
    return ByteBuffer.allocate(16).order(ByteOrder.LITTLE_ENDIAN).putLong(packetId).putLong(fromNodeId).array();
  }

  private static byte[] apply(SecretKeySpec key, IvParameterSpec nonce, byte[] input) {
    try {
      Cipher cipher = Cipher.getInstance(TRANSFORMATION);
      cipher.init(Cipher.DECRYPT_MODE, key, nonce);
      return cipher.doFinal(input);
    } catch (GeneralSecurityException ex) {
      throw new IllegalStateException("AES/CTR unavailable in this JVM", ex);
    }
  }
}
