package ca.gc.cra.meshradar.infrastructure.decode;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ChannelCipherTest {
  private static final String OTHER_KEY = "AAECAwQFBgcICQoLDA0ODw==";

  @Test
  void transformIsSymmetric() {
    byte[] plaintext = "hello mesh".getBytes(StandardCharsets.UTF_8);

    byte[] ciphertext = ChannelCipher.transform(ChannelCipher.DEFAULT_KEY, 77L, 42L, plaintext);

    assertFalse(Arrays.equals(plaintext, ciphertext));
    assertArrayEquals(plaintext, ChannelCipher.transform(ChannelCipher.DEFAULT_KEY, 77L, 42L, ciphertext));
  }

  @Test
  void nonceCombinesPacketIdAndSenderLittleEndian() {
    byte[] nonce = ChannelCipher.nonce(0x01020304L, 0x0A0B0C0DL);

    assertEquals(16, nonce.length);
    assertEquals(0x04, nonce[0]);
    assertEquals(0x01, nonce[3]);
    assertEquals(0x0D, nonce[8]);
    assertEquals(0x0A, nonce[11]);
  }

  @Test
  void tryDecryptReturnsFirstAcceptedPlaintext() {
    byte[] plaintext = "hello".getBytes(StandardCharsets.UTF_8);
    byte[] ciphertext = ChannelCipher.transform(OTHER_KEY, 5L, 6L, plaintext);
    ChannelCipher cipher = ChannelCipher.fromBase64(List.of(ChannelCipher.DEFAULT_KEY, OTHER_KEY));

    Optional<String> result = cipher.tryDecrypt(5L, 6L, ciphertext, bytes -> {
      String text = new String(bytes, StandardCharsets.UTF_8);
      return text.equals("hello") ? Optional.of(text) : Optional.empty();
    });

    assertEquals(Optional.of("hello"), result);
    assertEquals(2, cipher.keyCount());
  }

  @Test
  void emptyKeyListNeverDecrypts() {
    ChannelCipher cipher = ChannelCipher.fromBase64(List.of());

    assertTrue(cipher.tryDecrypt(1L, 2L, new byte[] {1}, Optional::of).isEmpty());
  }

  @Test
  void malformedKeysAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> ChannelCipher.fromBase64(List.of("not base64!")));
    assertThrows(IllegalArgumentException.class, () -> ChannelCipher.fromBase64(List.of("AQID")));
  }
}
