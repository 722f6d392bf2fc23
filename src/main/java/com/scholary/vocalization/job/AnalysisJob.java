package com.scholary.vocalization.job;

import com.scholary.vocalization.quality.QualityVerdict;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One run of the analysis pipeline over an artifact.
 *
 * <p>Status changes go through {@link #transitionTo}, which rejects backwards or skipped moves.
 * Only the pipeline orchestrator calls it, always while holding the artifact lease. The attempt
 * counter and dispatch token are atomics because the scheduler touches them from worker threads.
 */
public class AnalysisJob {

  private final String jobId;
  private final String artifactId;
  private final Instant createdAt;
  private final AtomicInteger attempts = new AtomicInteger();
  private final AtomicLong dispatchToken = new AtomicLong();

  private volatile JobStatus status;
  private volatile Instant updatedAt;
  private volatile String lastError;
  private volatile FailureReason failureReason;
  private volatile QualityVerdict qualityVerdict;

  public AnalysisJob(String jobId, String artifactId) {
    this.jobId = jobId;
    this.artifactId = artifactId;
    this.createdAt = Instant.now();
    this.updatedAt = createdAt;
    this.status = JobStatus.UPLOADED;
  }

  /**
   * Move to the next state.
   *
   * @throws IllegalStateException if the move is not a legal forward transition
   */
  public void transitionTo(JobStatus next) {
    requireTransition(next);
    this.status = next;
    this.updatedAt = Instant.now();
  }

  /** Record the failure details, then move to FAILED. */
  public void fail(FailureReason reason, String error) {
    requireTransition(JobStatus.FAILED);
    this.failureReason = reason;
    this.lastError = error;
    transitionTo(JobStatus.FAILED);
  }

  private void requireTransition(JobStatus next) {
    if (!status.canTransitionTo(next)) {
      throw new IllegalStateException(
          String.format("Illegal transition for job %s: %s -> %s", jobId, status, next));
    }
  }

  /** @return the attempt number just started, starting at 1 */
  public int recordAttempt() {
    this.updatedAt = Instant.now();
    return attempts.incrementAndGet();
  }

  /**
   * Invalidate any in-flight dispatch and return the new token. Results carrying an older token are
   * discarded at commit time.
   */
  public long issueDispatchToken() {
    return dispatchToken.incrementAndGet();
  }

  public void recordVerdict(QualityVerdict verdict) {
    this.qualityVerdict = verdict;
  }

  public long getDispatchToken() {
    return dispatchToken.get();
  }

  public String getJobId() {
    return jobId;
  }

  public String getArtifactId() {
    return artifactId;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public JobStatus getStatus() {
    return status;
  }

  public int getAttempts() {
    return attempts.get();
  }

  public String getLastError() {
    return lastError;
  }

  public FailureReason getFailureReason() {
    return failureReason;
  }

  /** @return the quality verdict, or null if quality control has not run */
  public QualityVerdict getQualityVerdict() {
    return qualityVerdict;
  }
}
