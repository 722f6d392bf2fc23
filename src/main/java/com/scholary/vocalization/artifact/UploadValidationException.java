package com.scholary.vocalization.artifact;

/**
 * Upload input was rejected before any artifact or job was created.
 *
 * <p>Subclasses name the specific rule that failed.
 */
public class UploadValidationException extends RuntimeException {

  public UploadValidationException(String message) {
    super(message);
  }
}
