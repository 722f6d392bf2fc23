package com.scholary.vocalization.scheduler;

import com.scholary.vocalization.job.AnalysisJob;

/**
 * The worker queue refused a freshly admitted job.
 *
 * <p>The job already exists and holds its artifact lease; the orchestrator fails it so the lease
 * is released.
 */
public class SchedulerSaturatedException extends RuntimeException {

  private final transient AnalysisJob job;

  public SchedulerSaturatedException(AnalysisJob job, Throwable cause) {
    super("Worker queue full, cannot schedule job " + job.getJobId(), cause);
    this.job = job;
  }

  public AnalysisJob getJob() {
    return job;
  }
}
