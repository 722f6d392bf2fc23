package com.scholary.vocalization.result;

import com.scholary.vocalization.job.FailureReason;
import com.scholary.vocalization.job.JobStatus;

/**
 * What the aggregator decided. The orchestrator applies it; the aggregator never touches job
 * state itself.
 *
 * @param terminalState state to commit
 * @param result present iff the state is SUCCEEDED or PARTIAL
 * @param failureReason present iff the state is FAILED
 * @param message human-readable explanation for REJECTED and FAILED
 */
public record Reconciliation(
    JobStatus terminalState, AnalysisResult result, FailureReason failureReason, String message) {

  public static Reconciliation completed(AnalysisResult result) {
    return new Reconciliation(
        result.partial() ? JobStatus.PARTIAL : JobStatus.SUCCEEDED, result, null, null);
  }

  public static Reconciliation rejected(String message) {
    return new Reconciliation(JobStatus.REJECTED, null, null, message);
  }

  public static Reconciliation failed(FailureReason reason, String message) {
    return new Reconciliation(JobStatus.FAILED, null, reason, message);
  }
}
