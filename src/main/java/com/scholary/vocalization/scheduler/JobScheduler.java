package com.scholary.vocalization.scheduler;

import com.scholary.vocalization.inference.InferenceBackend;
import com.scholary.vocalization.inference.InferenceOutput;
import com.scholary.vocalization.inference.InferenceRequest;
import com.scholary.vocalization.inference.InferenceUnavailableException;
import com.scholary.vocalization.inference.ModelErrorException;
import com.scholary.vocalization.job.AnalysisJob;
import com.scholary.vocalization.job.ArtifactLeaseTable;
import com.scholary.vocalization.job.ArtifactLeaseTable.Lease;
import com.scholary.vocalization.job.FailureReason;
import com.scholary.vocalization.job.JobHandle;
import com.scholary.vocalization.job.JobRepository;
import com.scholary.vocalization.logging.StructuredLogger;
import java.time.Duration;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskExecutor;

/**
 * Admission control and inference dispatch.
 *
 * <p>Two pools are involved:
 *
 * <ul>
 *   <li>the worker pool, whose bounded queue is the job queue; each admitted job runs its pipeline
 *       task there
 *   <li>the inference pool, where backend calls run so the worker can enforce the wall-clock
 *       budget and interrupt the call on timeout or cancellation
 * </ul>
 *
 * <p>The scheduler records admissions and attempt counts but never changes a job's status; it
 * reports back to the orchestrator, which owns every transition.
 */
public class JobScheduler {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobScheduler.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final ArtifactLeaseTable leaseTable;
  private final JobRepository jobRepository;
  private final TaskExecutor workerPool;
  private final TaskExecutor inferencePool;
  private final InferenceBackend backend;
  private final RetryPolicy retryPolicy;
  private final Duration jobTimeout;

  private final Map<String, Future<InferenceOutput>> inFlight = new ConcurrentHashMap<>();

  public JobScheduler(
      ArtifactLeaseTable leaseTable,
      JobRepository jobRepository,
      TaskExecutor workerPool,
      TaskExecutor inferencePool,
      InferenceBackend backend,
      RetryPolicy retryPolicy,
      Duration jobTimeout) {
    this.leaseTable = leaseTable;
    this.jobRepository = jobRepository;
    this.workerPool = workerPool;
    this.inferencePool = inferencePool;
    this.backend = backend;
    this.retryPolicy = retryPolicy;
    this.jobTimeout = jobTimeout;
  }

  /**
   * Admit a job for an artifact, or return the one already running.
   *
   * <p>Admission happens under the artifact lease, so concurrent submissions for the same artifact
   * see each other: exactly one creates a job, the rest get its handle with {@code deduplicated}
   * set.
   *
   * @param artifactId artifact to analyze
   * @param pipeline task run on the worker pool for a newly admitted job
   * @return handle of the new or existing job
   * @throws SchedulerSaturatedException if the worker queue refused the new job
   */
  public JobHandle submit(String artifactId, Consumer<AnalysisJob> pipeline) {
    Lease lease = leaseTable.leaseFor(artifactId);
    AnalysisJob job;

    lease.lock();
    try {
      AnalysisJob active = activeJob(lease);
      if (active != null) {
        LOGGER.info(
            "Duplicate active job for artifact {}: returning job {} ({})",
            artifactId,
            active.getJobId(),
            active.getStatus());
        return JobHandle.deduplicated(active);
      }

      job = new AnalysisJob(UUID.randomUUID().toString(), artifactId);
      jobRepository.save(job);
      lease.hold(job);
    } finally {
      lease.unlock();
    }

    try {
      workerPool.execute(() -> pipeline.accept(job));
    } catch (RejectedExecutionException e) {
      throw new SchedulerSaturatedException(job, e);
    }

    LOGGER.info("Admitted job {} for artifact {}", job.getJobId(), artifactId);
    return JobHandle.of(job);
  }

  /**
   * Run inference for a job, blocking the calling worker until it finishes, fails, times out or is
   * cancelled.
   *
   * <p>Transient failures are retried per the {@link RetryPolicy}; model errors are not. The whole
   * sequence, backoff included, counts against the job timeout.
   *
   * @return the outcome; never throws for inference failures
   */
  public DispatchOutcome dispatch(AnalysisJob job, InferenceRequest request) {
    String jobId = job.getJobId();
    FutureTask<InferenceOutput> future = new FutureTask<>(() -> invokeWithRetries(job, request));
    inFlight.put(jobId, future);

    // A cancel that committed before the put found nothing to interrupt.
    if (job.getStatus().isTerminal()) {
      inFlight.remove(jobId, future);
      return DispatchOutcome.failure(
          FailureReason.CANCELLED, "Job finished before dispatch", job.getAttempts());
    }

    try {
      inferencePool.execute(future);
    } catch (RejectedExecutionException e) {
      inFlight.remove(jobId, future);
      return DispatchOutcome.failure(
          FailureReason.INFERENCE_UNAVAILABLE, "Inference pool saturated", job.getAttempts());
    }

    try {
      InferenceOutput output = future.get(jobTimeout.toMillis(), TimeUnit.MILLISECONDS);
      return DispatchOutcome.success(output, job.getAttempts());

    } catch (TimeoutException e) {
      future.cancel(true);
      String message = "Exceeded wall-clock budget of " + jobTimeout.toSeconds() + "s";
      structuredLogger.logInferenceFailed(jobId, job.getAttempts(), "TIMEOUT", message);
      return DispatchOutcome.failure(FailureReason.TIMEOUT, message, job.getAttempts());

    } catch (CancellationException e) {
      LOGGER.info("Inference for job {} was cancelled", jobId);
      return DispatchOutcome.failure(
          FailureReason.CANCELLED, "Cancelled while dispatched", job.getAttempts());

    } catch (ExecutionException e) {
      return failureFrom(job, e.getCause());

    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      future.cancel(true);
      return DispatchOutcome.failure(
          FailureReason.CANCELLED, "Worker interrupted", job.getAttempts());

    } finally {
      inFlight.remove(jobId, future);
    }
  }

  /**
   * Signal the in-flight inference call for a job to stop. Best effort: a backend that ignores
   * interrupts keeps running, but its result is never delivered.
   *
   * @return true if an in-flight call was signalled
   */
  public boolean cancel(String jobId) {
    Future<InferenceOutput> future = inFlight.get(jobId);
    if (future == null) {
      return false;
    }
    boolean cancelled = future.cancel(true);
    LOGGER.info("Cancellation signalled for job {}: {}", jobId, cancelled);
    return cancelled;
  }

  private static AnalysisJob activeJob(Lease lease) {
    AnalysisJob active = lease.activeJob();
    if (active != null && active.getStatus().isTerminal()) {
      lease.release(active.getJobId());
      return null;
    }
    return active;
  }

  private InferenceOutput invokeWithRetries(AnalysisJob job, InferenceRequest request)
      throws InterruptedException {
    StructuredLogger.setJobContext(job.getJobId(), job.getArtifactId());
    try {
      while (true) {
        if (Thread.currentThread().isInterrupted() || job.getStatus().isTerminal()) {
          throw new InterruptedException("Job " + job.getJobId() + " stopped before next attempt");
        }
        int attempt = job.recordAttempt();
        try {
          LOGGER.debug(
              "Inference attempt {}/{} for job {} via {}",
              attempt,
              retryPolicy.maxAttempts(),
              job.getJobId(),
              backend.name());
          return backend.infer(request);

        } catch (InferenceUnavailableException e) {
          if (!retryPolicy.shouldRetry(attempt)) {
            throw e;
          }
          Duration delay = retryPolicy.nextDelay(attempt);
          structuredLogger.logInferenceRetry(
              job.getJobId(), attempt, retryPolicy.maxAttempts(), delay.toMillis(), e.getMessage());
          Thread.sleep(delay.toMillis());
        }
      }
    } finally {
      StructuredLogger.clearJobContext();
    }
  }

  private DispatchOutcome failureFrom(AnalysisJob job, Throwable cause) {
    int attempts = job.getAttempts();
    FailureReason reason;
    String message;

    if (cause instanceof InferenceUnavailableException) {
      reason = FailureReason.INFERENCE_UNAVAILABLE;
      message = "Inference unavailable after " + attempts + " attempts: " + cause.getMessage();
    } else if (cause instanceof ModelErrorException) {
      reason = FailureReason.MODEL_ERROR;
      message = cause.getMessage();
    } else if (cause instanceof InterruptedException) {
      reason = FailureReason.CANCELLED;
      message = "Inference interrupted";
    } else {
      LOGGER.error("Unexpected inference failure for job {}", job.getJobId(), cause);
      reason = FailureReason.INTERNAL_ERROR;
      message = "Unexpected inference failure: " + cause;
    }

    structuredLogger.logInferenceFailed(job.getJobId(), attempts, reason.name(), message);
    return DispatchOutcome.failure(reason, message, attempts);
  }
}
