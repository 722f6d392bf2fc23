package com.scholary.vocalization.service;

import com.scholary.vocalization.artifact.ArtifactNotFoundException;
import com.scholary.vocalization.artifact.ArtifactRepository;
import com.scholary.vocalization.artifact.AudioArtifact;
import com.scholary.vocalization.artifact.AudioFormat;
import com.scholary.vocalization.artifact.UploadValidator;
import com.scholary.vocalization.audio.AudioDecoder;
import com.scholary.vocalization.audio.AudioDecodingException;
import com.scholary.vocalization.audio.DecodedAudio;
import com.scholary.vocalization.crypto.PayloadCipher;
import com.scholary.vocalization.crypto.PayloadCipherException;
import com.scholary.vocalization.inference.InferenceRequest;
import com.scholary.vocalization.job.AnalysisJob;
import com.scholary.vocalization.job.ArtifactLeaseTable;
import com.scholary.vocalization.job.ArtifactLeaseTable.Lease;
import com.scholary.vocalization.job.FailureReason;
import com.scholary.vocalization.job.JobHandle;
import com.scholary.vocalization.job.JobNotFoundException;
import com.scholary.vocalization.job.JobRepository;
import com.scholary.vocalization.job.JobStatus;
import com.scholary.vocalization.logging.StructuredLogger;
import com.scholary.vocalization.objectstore.ArtifactStore;
import com.scholary.vocalization.objectstore.ObjectStoreException;
import com.scholary.vocalization.quality.QualityControlEngine;
import com.scholary.vocalization.quality.QualityVerdict;
import com.scholary.vocalization.result.AnalysisOutcome;
import com.scholary.vocalization.result.OutcomeRepository;
import com.scholary.vocalization.result.Reconciliation;
import com.scholary.vocalization.result.ResultExpiredException;
import com.scholary.vocalization.result.ResultAggregator;
import com.scholary.vocalization.result.ResultNotReadyException;
import com.scholary.vocalization.scheduler.DispatchOutcome;
import com.scholary.vocalization.scheduler.JobScheduler;
import com.scholary.vocalization.scheduler.SchedulerSaturatedException;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Top-level analysis pipeline.
 *
 * <p>Owns the job state machine:
 *
 * <pre>
 * UPLOADED -> QUALITY_CHECKED -> REJECTED
 *                             -> DISPATCHED -> SUCCEEDED | PARTIAL | FAILED
 * </pre>
 *
 * <p>Any non-terminal job may also fail (storage failure, full queue, cancellation). Every
 * transition happens under the artifact lease. Terminal commits additionally check the dispatch
 * token, so a result that arrives after cancellation or a newer dispatch is discarded instead of
 * overwriting the committed outcome.
 */
public class PipelineOrchestrator {

  private static final Logger LOGGER = LoggerFactory.getLogger(PipelineOrchestrator.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final ArtifactRepository artifactRepository;
  private final JobRepository jobRepository;
  private final OutcomeRepository outcomeRepository;
  private final ArtifactStore artifactStore;
  private final PayloadCipher payloadCipher;
  private final AudioDecoder audioDecoder;
  private final QualityControlEngine qualityControlEngine;
  private final JobScheduler jobScheduler;
  private final ResultAggregator resultAggregator;
  private final ArtifactLeaseTable leaseTable;
  private final UploadValidator uploadValidator;
  private final SortedSet<String> supportedSpecies;

  public PipelineOrchestrator(
      ArtifactRepository artifactRepository,
      JobRepository jobRepository,
      OutcomeRepository outcomeRepository,
      ArtifactStore artifactStore,
      PayloadCipher payloadCipher,
      AudioDecoder audioDecoder,
      QualityControlEngine qualityControlEngine,
      JobScheduler jobScheduler,
      ResultAggregator resultAggregator,
      ArtifactLeaseTable leaseTable,
      UploadValidator uploadValidator,
      Set<String> supportedSpecies) {

    this.artifactRepository = artifactRepository;
    this.jobRepository = jobRepository;
    this.outcomeRepository = outcomeRepository;
    this.artifactStore = artifactStore;
    this.payloadCipher = payloadCipher;
    this.audioDecoder = audioDecoder;
    this.qualityControlEngine = qualityControlEngine;
    this.jobScheduler = jobScheduler;
    this.resultAggregator = resultAggregator;
    this.leaseTable = leaseTable;
    this.uploadValidator = uploadValidator;
    this.supportedSpecies = Collections.unmodifiableSortedSet(new TreeSet<>(supportedSpecies));
  }

  /**
   * Validate, encrypt and store a recording, then register it.
   *
   * <p>The artifact is registered only after the encrypted bytes are stored, so a storage failure
   * leaves nothing behind.
   *
   * @return the new artifact id
   * @throws com.scholary.vocalization.artifact.UploadValidationException if the input breaks an
   *     upload rule
   * @throws com.scholary.vocalization.objectstore.StorageUnavailableException if the store is
   *     unreachable
   */
  public String upload(byte[] bytes, String format, String species, String ownerId) {
    long size = bytes == null ? 0 : bytes.length;
    AudioFormat audioFormat = uploadValidator.validate(size, format, species);

    String artifactId = UUID.randomUUID().toString();
    String storageKey = AudioArtifact.storageKeyFor(artifactId, audioFormat);
    artifactStore.put(storageKey, payloadCipher.encrypt(bytes));

    AudioArtifact artifact =
        new AudioArtifact(
            artifactId, species, audioFormat, size, storageKey, Instant.now(), ownerId);
    artifactRepository.save(artifact);

    LOGGER.info(
        "Stored artifact {}: species={}, format={}, size={} bytes, owner={}",
        artifactId,
        species,
        audioFormat,
        size,
        ownerId);
    return artifactId;
  }

  /**
   * Start analysis of an artifact, or return the job already running for it.
   *
   * <p>If the worker queue is full the new job is failed with {@link FailureReason#QUEUE_FULL} and
   * its handle returned; the caller can trigger again later.
   *
   * @throws ArtifactNotFoundException if the artifact is unknown
   */
  public JobHandle triggerAnalysis(String artifactId) {
    if (artifactRepository.findById(artifactId).isEmpty()) {
      throw new ArtifactNotFoundException(artifactId);
    }

    try {
      return jobScheduler.submit(artifactId, this::runPipeline);
    } catch (SchedulerSaturatedException e) {
      AnalysisJob job = e.getJob();
      LOGGER.warn("Worker queue full, failing job {} for artifact {}", job.getJobId(), artifactId);
      commit(
          job,
          job.getDispatchToken(),
          Reconciliation.failed(FailureReason.QUEUE_FULL, "Analysis queue is full"));
      return JobHandle.of(job);
    }
  }

  /**
   * Latest terminal outcome for an artifact.
   *
   * <p>Outcomes are stored once and never mutated; repeated calls return the same object until a
   * newer job for the artifact commits.
   *
   * @throws ArtifactNotFoundException if the artifact is unknown
   * @throws ResultNotReadyException if no job for the artifact has finished yet
   * @throws ResultExpiredException if a job finished but its outcome is no longer retained
   */
  public AnalysisOutcome getResult(String artifactId) {
    AudioArtifact artifact =
        artifactRepository
            .findById(artifactId)
            .orElseThrow(() -> new ArtifactNotFoundException(artifactId));

    JobStatus status = artifact.getStatus();
    return outcomeRepository
        .findLatest(artifactId)
        .orElseThrow(
            () ->
                status.isTerminal()
                    ? new ResultExpiredException(artifactId, status)
                    : new ResultNotReadyException(artifactId, status));
  }

  public AnalysisJob getJob(String jobId) {
    return jobRepository.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
  }

  /**
   * Cancel a job.
   *
   * <p>The CANCELLED failure is committed first, under the lease and with a fresh dispatch token,
   * and only then is the in-flight inference call interrupted. Whatever that call returns
   * afterwards is discarded. Cancelling a terminal job is a no-op.
   *
   * @throws JobNotFoundException if the job is unknown
   */
  public JobHandle cancel(String jobId) {
    AnalysisJob job = getJob(jobId);
    Lease lease = leaseTable.leaseFor(job.getArtifactId());

    boolean cancelled;
    lease.lock();
    try {
      if (job.getStatus().isTerminal()) {
        LOGGER.info("Job {} already {}, nothing to cancel", jobId, job.getStatus());
        return JobHandle.of(job);
      }
      long token = job.issueDispatchToken();
      cancelled =
          commit(
              job,
              token,
              Reconciliation.failed(FailureReason.CANCELLED, "Cancelled by request"));
    } finally {
      lease.unlock();
    }

    if (cancelled) {
      jobScheduler.cancel(jobId);
    }
    return JobHandle.of(job);
  }

  public SortedSet<String> listSupportedSpecies() {
    return supportedSpecies;
  }

  public List<AudioFormat> listSupportedFormats() {
    return List.of(AudioFormat.values());
  }

  /** Worker-side pipeline for one admitted job. */
  void runPipeline(AnalysisJob job) {
    StructuredLogger.setJobContext(job.getJobId(), job.getArtifactId());
    try {
      AudioArtifact artifact = artifactRepository.findById(job.getArtifactId()).orElse(null);
      if (artifact == null) {
        commit(
            job,
            job.getDispatchToken(),
            Reconciliation.failed(FailureReason.INTERNAL_ERROR, "Artifact no longer registered"));
        return;
      }

      byte[] plaintext;
      try {
        plaintext = payloadCipher.decrypt(artifactStore.get(artifact.getStorageKey()));
      } catch (ObjectStoreException | PayloadCipherException e) {
        LOGGER.error("Failed to load artifact {}", artifact.getArtifactId(), e);
        commit(
            job,
            job.getDispatchToken(),
            Reconciliation.failed(FailureReason.STORAGE_UNAVAILABLE, e.getMessage()));
        return;
      }

      DecodedAudio audio = null;
      QualityVerdict verdict;
      try {
        audio = audioDecoder.decode(plaintext, artifact.getFormat());
        verdict = qualityControlEngine.evaluate(artifact.getArtifactId(), audio);
      } catch (AudioDecodingException e) {
        LOGGER.warn("Artifact {} is undecodable: {}", artifact.getArtifactId(), e.getMessage());
        verdict = QualityVerdict.undecodable(artifact.getArtifactId());
      }
      structuredLogger.logQualityVerdict(
          verdict.artifactId(), verdict.flags(), verdict.score(), verdict.usable(), verdict.snrDb());

      if (!advance(job, JobStatus.QUALITY_CHECKED, verdict)) {
        return;
      }

      if (!verdict.usable()) {
        Reconciliation rejection = resultAggregator.reconcile(job.getJobId(), verdict, null);
        commit(job, job.getDispatchToken(), rejection);
        return;
      }

      long token = markDispatched(job);
      if (token < 0) {
        return;
      }

      InferenceRequest request =
          new InferenceRequest(
              job.getJobId(),
              artifact.getSpecies(),
              artifact.getFormat(),
              plaintext,
              audio.sampleRate(),
              audio.durationSeconds());
      DispatchOutcome outcome = jobScheduler.dispatch(job, request);

      commit(job, token, resultAggregator.reconcile(job.getJobId(), verdict, outcome));

    } catch (RuntimeException e) {
      LOGGER.error("Pipeline failed for job {}", job.getJobId(), e);
      commit(
          job,
          job.getDispatchToken(),
          Reconciliation.failed(FailureReason.INTERNAL_ERROR, String.valueOf(e.getMessage())));
    } finally {
      StructuredLogger.clearJobContext();
    }
  }

  /** Non-terminal move under the lease. Returns false if the job was finished meanwhile. */
  private boolean advance(AnalysisJob job, JobStatus next, QualityVerdict verdict) {
    Lease lease = leaseTable.leaseFor(job.getArtifactId());
    lease.lock();
    try {
      if (job.getStatus().isTerminal()) {
        LOGGER.info("Job {} is {}, stopping pipeline", job.getJobId(), job.getStatus());
        return false;
      }
      job.recordVerdict(verdict);
      applyTransition(job, next);
      return true;
    } finally {
      lease.unlock();
    }
  }

  /** @return the dispatch token, or -1 if the job was finished meanwhile */
  private long markDispatched(AnalysisJob job) {
    Lease lease = leaseTable.leaseFor(job.getArtifactId());
    lease.lock();
    try {
      if (job.getStatus().isTerminal()) {
        LOGGER.info("Job {} is {}, not dispatching", job.getJobId(), job.getStatus());
        return -1;
      }
      applyTransition(job, JobStatus.DISPATCHED);
      return job.issueDispatchToken();
    } finally {
      lease.unlock();
    }
  }

  /**
   * Apply a terminal decision.
   *
   * <p>Under the lease: check the job is still live and the token current, store the outcome,
   * transition, then free the lease.
   *
   * @return true if committed, false if discarded as stale
   */
  private boolean commit(AnalysisJob job, long expectedToken, Reconciliation reconciliation) {
    Lease lease = leaseTable.leaseFor(job.getArtifactId());
    lease.lock();
    try {
      long currentToken = job.getDispatchToken();
      if (job.getStatus().isTerminal() || currentToken != expectedToken) {
        structuredLogger.logStaleCommit(
            job.getJobId(), expectedToken, currentToken, job.getStatus());
        return false;
      }

      JobStatus terminal = reconciliation.terminalState();
      if (!job.getStatus().canTransitionTo(terminal)) {
        throw new IllegalStateException(
            String.format(
                "Cannot commit %s for job %s in %s", terminal, job.getJobId(), job.getStatus()));
      }

      Instant finalizedAt =
          reconciliation.result() != null ? reconciliation.result().finalizedAt() : Instant.now();
      outcomeRepository.save(
          new AnalysisOutcome(
              job.getArtifactId(),
              job.getJobId(),
              terminal,
              job.getAttempts(),
              job.getQualityVerdict(),
              reconciliation.result(),
              reconciliation.failureReason(),
              reconciliation.message(),
              finalizedAt));

      JobStatus from = job.getStatus();
      if (terminal == JobStatus.FAILED) {
        job.fail(reconciliation.failureReason(), reconciliation.message());
      } else {
        job.transitionTo(terminal);
      }
      structuredLogger.logJobTransition(job.getJobId(), job.getArtifactId(), from, terminal);
      jobRepository.save(job);
      mirrorArtifactStatus(job);

      lease.release(job.getJobId());
      return true;
    } finally {
      lease.unlock();
    }
  }

  private void applyTransition(AnalysisJob job, JobStatus next) {
    JobStatus from = job.getStatus();
    job.transitionTo(next);
    structuredLogger.logJobTransition(job.getJobId(), job.getArtifactId(), from, next);
    mirrorArtifactStatus(job);
  }

  private void mirrorArtifactStatus(AnalysisJob job) {
    artifactRepository
        .findById(job.getArtifactId())
        .ifPresent(artifact -> artifact.setStatus(job.getStatus()));
  }
}
