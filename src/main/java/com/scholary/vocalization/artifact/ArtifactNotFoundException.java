package com.scholary.vocalization.artifact;

/** No artifact is registered under the given id. */
public class ArtifactNotFoundException extends RuntimeException {

  public ArtifactNotFoundException(String artifactId) {
    super("Artifact not found: " + artifactId);
  }
}
