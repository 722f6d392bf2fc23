package com.scholary.vocalization.crypto;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import org.junit.jupiter.api.Test;

class AesGcmPayloadCipherTest {

  private static final String KEY = "dGVzdC1vbmx5LWtleS0wMTIzNDU2Nzg5YWJjZGVmZ2g=";

  private final AesGcmPayloadCipher cipher = AesGcmPayloadCipher.fromBase64(KEY);

  @Test
  void encrypt_shouldHidePlaintextAndDecryptBack() {
    byte[] plaintext = "RIFF....WAVEfmt crow call".getBytes(StandardCharsets.US_ASCII);

    byte[] sealed = cipher.encrypt(plaintext);

    assertThat(sealed).hasSize(plaintext.length + 12 + 16);
    assertThat(new String(sealed, StandardCharsets.ISO_8859_1)).doesNotContain("crow call");
    assertThat(cipher.decrypt(sealed)).isEqualTo(plaintext);
  }

  @Test
  void encrypt_shouldUseFreshNoncePerCall() {
    byte[] plaintext = new byte[64];

    assertThat(cipher.encrypt(plaintext)).isNotEqualTo(cipher.encrypt(plaintext));
  }

  @Test
  void decrypt_shouldRejectTamperedCiphertext() {
    byte[] sealed = cipher.encrypt(new byte[] {1, 2, 3, 4});
    sealed[sealed.length - 1] ^= 0x01;

    assertThatThrownBy(() -> cipher.decrypt(sealed)).isInstanceOf(PayloadCipherException.class);
  }

  @Test
  void decrypt_shouldRejectCiphertextFromAnotherKey() {
    byte[] otherKey = new byte[32];
    Arrays.fill(otherKey, (byte) 7);
    byte[] sealed = new AesGcmPayloadCipher(otherKey).encrypt(new byte[] {1, 2, 3});

    assertThatThrownBy(() -> cipher.decrypt(sealed)).isInstanceOf(PayloadCipherException.class);
  }

  @Test
  void decrypt_shouldRejectTruncatedInput() {
    assertThatThrownBy(() -> cipher.decrypt(new byte[10]))
        .isInstanceOf(PayloadCipherException.class)
        .hasMessageContaining("too short");
  }

  @Test
  void constructor_shouldRejectWrongKeyLength() {
    assertThatThrownBy(() -> new AesGcmPayloadCipher(new byte[16]))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> AesGcmPayloadCipher.fromBase64("not base64!"))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
