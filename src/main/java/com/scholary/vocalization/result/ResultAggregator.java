package com.scholary.vocalization.result;

import com.scholary.vocalization.inference.InferenceOutput;
import com.scholary.vocalization.job.FailureReason;
import com.scholary.vocalization.quality.QualityVerdict;
import com.scholary.vocalization.scheduler.DispatchOutcome;
import java.time.Clock;
import java.util.HashSet;

/**
 * Turns a quality verdict and an inference outcome into a terminal decision.
 *
 * <p>Policy:
 *
 * <ul>
 *   <li>Unusable verdict: REJECTED, whatever inference did
 *   <li>Dispatch failure: FAILED with the dispatch's reason
 *   <li>Confidence missing or outside [0, 1]: FAILED as MODEL_ERROR
 *   <li>Confidence at or above the floor and no quality flags: SUCCEEDED
 *   <li>Otherwise: PARTIAL
 * </ul>
 *
 * <p>Persists nothing; the orchestrator commits the returned {@link Reconciliation}.
 */
public class ResultAggregator {

  private final double accuracyFloor;
  private final Clock clock;

  public ResultAggregator(double accuracyFloor, Clock clock) {
    this.accuracyFloor = accuracyFloor;
    this.clock = clock;
  }

  public Reconciliation reconcile(String jobId, QualityVerdict verdict, DispatchOutcome outcome) {
    if (!verdict.usable()) {
      return Reconciliation.rejected("Recording failed quality control: " + verdict.flags());
    }
    if (outcome == null) {
      throw new IllegalArgumentException("usable verdict requires a dispatch outcome");
    }
    if (!outcome.succeeded()) {
      return Reconciliation.failed(outcome.failureReason(), outcome.error());
    }

    InferenceOutput output = outcome.output();
    if (output.confidence() == null) {
      return Reconciliation.failed(
          FailureReason.MODEL_ERROR, "Model response did not include a confidence");
    }
    double confidence = output.confidence();
    if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
      return Reconciliation.failed(
          FailureReason.MODEL_ERROR, "Model returned confidence outside [0,1]: " + confidence);
    }

    boolean partial = confidence < accuracyFloor || verdict.hasFlags();
    AnalysisResult result =
        new AnalysisResult(
            jobId,
            output.translation(),
            new HashSet<>(output.tags()),
            confidence,
            verdict,
            partial,
            clock.instant());
    return Reconciliation.completed(result);
  }

  public double getAccuracyFloor() {
    return accuracyFloor;
  }
}
