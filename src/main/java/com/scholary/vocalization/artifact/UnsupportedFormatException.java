package com.scholary.vocalization.artifact;

public class UnsupportedFormatException extends UploadValidationException {

  public UnsupportedFormatException(String format) {
    super("Unsupported audio format: " + format + " (supported: wav, mp3, flac)");
  }
}
