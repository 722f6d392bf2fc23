package com.scholary.vocalization.api;

import com.scholary.vocalization.job.AnalysisJob;
import com.scholary.vocalization.job.FailureReason;
import com.scholary.vocalization.job.JobHandle;
import com.scholary.vocalization.job.JobStatus;
import java.time.Instant;

/**
 * Response for job status queries and analysis triggers.
 *
 * <p>Timestamps, last error and failure reason are only filled in for status queries; trigger and
 * cancel responses carry the handle fields.
 */
public record JobStatusResponse(
    String jobId,
    String artifactId,
    JobStatus status,
    int attempts,
    boolean deduplicated,
    FailureReason failureReason,
    String lastError,
    Instant createdAt,
    Instant updatedAt) {

  public static JobStatusResponse from(JobHandle handle) {
    return new JobStatusResponse(
        handle.jobId(),
        handle.artifactId(),
        handle.status(),
        handle.attempts(),
        handle.deduplicated(),
        null,
        null,
        null,
        null);
  }

  public static JobStatusResponse from(AnalysisJob job) {
    return new JobStatusResponse(
        job.getJobId(),
        job.getArtifactId(),
        job.getStatus(),
        job.getAttempts(),
        false,
        job.getFailureReason(),
        job.getLastError(),
        job.getCreatedAt(),
        job.getUpdatedAt());
  }
}
