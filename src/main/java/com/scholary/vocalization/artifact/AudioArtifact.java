package com.scholary.vocalization.artifact;

import com.scholary.vocalization.job.JobStatus;
import java.time.Instant;

/**
 * One uploaded recording and its metadata.
 *
 * <p>Everything except {@code status} is fixed at upload. The status mirrors the state of the
 * artifact's most recent analysis job and is only written by the pipeline orchestrator.
 */
public class AudioArtifact {

  private final String artifactId;
  private final String species;
  private final AudioFormat format;
  private final long sizeBytes;
  private final String storageKey;
  private final Instant uploadedAt;
  private final String ownerId;

  private volatile JobStatus status;

  public AudioArtifact(
      String artifactId,
      String species,
      AudioFormat format,
      long sizeBytes,
      String storageKey,
      Instant uploadedAt,
      String ownerId) {
    this.artifactId = artifactId;
    this.species = species;
    this.format = format;
    this.sizeBytes = sizeBytes;
    this.storageKey = storageKey;
    this.uploadedAt = uploadedAt;
    this.ownerId = ownerId;
    this.status = JobStatus.UPLOADED;
  }

  /** Storage key layout: one encrypted object per artifact. */
  public static String storageKeyFor(String artifactId, AudioFormat format) {
    return "artifacts/" + artifactId + "." + format.extension() + ".enc";
  }

  public String getArtifactId() {
    return artifactId;
  }

  public String getSpecies() {
    return species;
  }

  public AudioFormat getFormat() {
    return format;
  }

  public long getSizeBytes() {
    return sizeBytes;
  }

  public String getStorageKey() {
    return storageKey;
  }

  public Instant getUploadedAt() {
    return uploadedAt;
  }

  public String getOwnerId() {
    return ownerId;
  }

  public JobStatus getStatus() {
    return status;
  }

  public void setStatus(JobStatus status) {
    this.status = status;
  }
}
