package com.scholary.vocalization.artifact;

public class UnsupportedSpeciesException extends UploadValidationException {

  public UnsupportedSpeciesException(String species) {
    super("Unsupported species: " + species);
  }
}
