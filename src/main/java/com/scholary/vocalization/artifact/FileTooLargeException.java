package com.scholary.vocalization.artifact;

public class FileTooLargeException extends UploadValidationException {

  private final long sizeBytes;
  private final long maxBytes;

  public FileTooLargeException(long sizeBytes, long maxBytes) {
    super(String.format("File too large: %d bytes (max: %d bytes)", sizeBytes, maxBytes));
    this.sizeBytes = sizeBytes;
    this.maxBytes = maxBytes;
  }

  public long getSizeBytes() {
    return sizeBytes;
  }

  public long getMaxBytes() {
    return maxBytes;
  }
}
