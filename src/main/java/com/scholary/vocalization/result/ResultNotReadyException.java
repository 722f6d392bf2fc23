package com.scholary.vocalization.result;

import com.scholary.vocalization.job.JobStatus;

/** The artifact exists but no job over it has reached a terminal state yet. */
public class ResultNotReadyException extends RuntimeException {

  private final String artifactId;
  private final JobStatus status;

  public ResultNotReadyException(String artifactId, JobStatus status) {
    super("Analysis not finished for artifact " + artifactId + " (status " + status + ")");
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
