package com.scholary.vocalization.artifact;

import java.util.Locale;
import java.util.Optional;

/** Container formats accepted for upload. */
public enum AudioFormat {
  WAV("wav", "audio/wav"),
  MP3("mp3", "audio/mpeg"),
  FLAC("flac", "audio/flac");

  private final String extension;
  private final String contentType;

  AudioFormat(String extension, String contentType) {
    this.extension = extension;
    this.contentType = contentType;
  }

  public String extension() {
    return extension;
  }

  public String contentType() {
    return contentType;
  }

  /**
   * Resolve a user-supplied format name or file extension, case-insensitively.
   *
   * @param value e.g. "wav", "MP3", ".flac"
   * @return the matching format, or empty if unsupported
   */
  public static Optional<AudioFormat> parse(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    if (normalized.startsWith(".")) {
      normalized = normalized.substring(1);
    }
    for (AudioFormat format : values()) {
      if (format.extension.equals(normalized)) {
        return Optional.of(format);
      }
    }
    return Optional.empty();
  }
}
