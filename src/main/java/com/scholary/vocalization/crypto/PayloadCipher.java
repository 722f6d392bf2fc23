package com.scholary.vocalization.crypto;

/**
 * Encryption boundary in front of the artifact store.
 *
 * <p>Audio is encrypted before it is written and decrypted after it is read; the store itself
 * only ever handles ciphertext.
 */
public interface PayloadCipher {

  /**
   * @param plaintext raw audio bytes
   * @return self-contained ciphertext (including any nonce the algorithm needs)
   * @throws PayloadCipherException if encryption fails
   */
  byte[] encrypt(byte[] plaintext);

  /**
   * @param ciphertext bytes produced by {@link #encrypt}
   * @return the original plaintext
   * @throws PayloadCipherException if the ciphertext is malformed or fails authentication
   */
  byte[] decrypt(byte[] ciphertext);
}
