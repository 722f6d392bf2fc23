package com.scholary.vocalization.result;

import com.scholary.vocalization.job.JobStatus;

/** A job over the artifact finished, but its outcome has since been evicted from the registry. */
public class ResultExpiredException extends RuntimeException {

  private final String artifactId;
  private final JobStatus status;

  public ResultExpiredException(String artifactId, JobStatus status) {
    super(
        "Outcome for artifact " + artifactId + " (" + status + ") has expired; trigger analysis"
            + " again to recompute it");
    this.artifactId = artifactId;
    this.status = status;
  }

  public String getArtifactId() {
    return artifactId;
  }

  public JobStatus getStatus() {
    return status;
  }
}
