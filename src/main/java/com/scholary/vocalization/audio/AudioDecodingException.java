package com.scholary.vocalization.audio;

/** Stored bytes could not be decoded into PCM. */
public class AudioDecodingException extends RuntimeException {

  public AudioDecodingException(String message) {
    super(message);
  }

  public AudioDecodingException(String message, Throwable cause) {
    super(message, cause);
  }
}
