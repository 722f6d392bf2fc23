package com.scholary.vocalization.scheduler;

import com.scholary.vocalization.inference.InferenceOutput;
import com.scholary.vocalization.job.FailureReason;

/**
 * What came back from dispatching a job to inference.
 *
 * @param output model output, null on failure
 * @param failureReason set on failure
 * @param error failure description
 * @param attempts inference attempts made
 */
public record DispatchOutcome(
    InferenceOutput output, FailureReason failureReason, String error, int attempts) {

  public static DispatchOutcome success(InferenceOutput output, int attempts) {
    return new DispatchOutcome(output, null, null, attempts);
  }

  public static DispatchOutcome failure(FailureReason reason, String error, int attempts) {
    return new DispatchOutcome(null, reason, error, attempts);
  }

  public boolean succeeded() {
    return output != null;
  }
}
