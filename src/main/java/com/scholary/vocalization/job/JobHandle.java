package com.scholary.vocalization.job;

/**
 * Snapshot returned to callers that trigger or cancel analysis.
 *
 * @param jobId job id
 * @param artifactId artifact the job runs over
 * @param status status at the time of the snapshot
 * @param attempts inference attempts so far
 * @param deduplicated true when an already-active job was returned instead of a new one
 */
public record JobHandle(
    String jobId, String artifactId, JobStatus status, int attempts, boolean deduplicated) {

  public static JobHandle of(AnalysisJob job) {
    return new JobHandle(
        job.getJobId(), job.getArtifactId(), job.getStatus(), job.getAttempts(), false);
  }

  public static JobHandle deduplicated(AnalysisJob job) {
    return new JobHandle(
        job.getJobId(), job.getArtifactId(), job.getStatus(), job.getAttempts(), true);
  }
}
