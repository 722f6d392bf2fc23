package com.scholary.vocalization.crypto;

/** Encryption or decryption of a stored payload failed. */
public class PayloadCipherException extends RuntimeException {

  public PayloadCipherException(String message) {
    super(message);
  }

  public PayloadCipherException(String message, Throwable cause) {
    super(message, cause);
  }
}
