package com.scholary.vocalization.crypto;

import java.nio.ByteBuffer;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;

/**
 * AES-256-GCM payload cipher.
 *
 * <p>Output layout is {@code nonce (12 bytes) || ciphertext || tag (16 bytes)}. A fresh random
 * nonce is drawn for every payload, so encrypting the same audio twice yields different bytes.
 */
public class AesGcmPayloadCipher implements PayloadCipher {

  private static final String TRANSFORMATION = "AES/GCM/NoPadding";
  private static final int KEY_BYTES = 32;
  private static final int NONCE_BYTES = 12;
  private static final int TAG_BITS = 128;

  private final SecretKey key;
  private final SecureRandom random = new SecureRandom();

  public AesGcmPayloadCipher(byte[] rawKey) {
    if (rawKey == null || rawKey.length != KEY_BYTES) {
      throw new IllegalArgumentException("AES key must be exactly " + KEY_BYTES + " bytes");
    }
    this.key = new SecretKeySpec(rawKey, "AES");
  }

  public static AesGcmPayloadCipher fromBase64(String base64Key) {
    try {
      return new AesGcmPayloadCipher(Base64.getDecoder().decode(base64Key));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Encryption key is not valid base64 for a 256-bit key", e);
    }
  }

  @Override
  public byte[] encrypt(byte[] plaintext) {
    byte[] nonce = new byte[NONCE_BYTES];
    random.nextBytes(nonce);
    try {
      Cipher cipher = Cipher.getInstance(TRANSFORMATION);
      cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, nonce));
      byte[] sealed = cipher.doFinal(plaintext);
      return ByteBuffer.allocate(NONCE_BYTES + sealed.length).put(nonce).put(sealed).array();
    } catch (GeneralSecurityException e) {
      throw new PayloadCipherException("Failed to encrypt payload", e);
    }
  }

  @Override
  public byte[] decrypt(byte[] ciphertext) {
    if (ciphertext == null || ciphertext.length < NONCE_BYTES + TAG_BITS / 8) {
      throw new PayloadCipherException("Ciphertext too short to contain nonce and tag");
    }
    try {
      Cipher cipher = Cipher.getInstance(TRANSFORMATION);
      cipher.init(
          Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, ciphertext, 0, NONCE_BYTES));
      return cipher.doFinal(ciphertext, NONCE_BYTES, ciphertext.length - NONCE_BYTES);
    } catch (GeneralSecurityException e) {
      throw new PayloadCipherException("Failed to decrypt payload", e);
    }
  }
}
