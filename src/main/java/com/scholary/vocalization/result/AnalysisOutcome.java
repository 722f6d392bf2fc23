package com.scholary.vocalization.result;

import com.scholary.vocalization.job.FailureReason;
import com.scholary.vocalization.job.JobStatus;
import com.scholary.vocalization.quality.QualityVerdict;
import java.time.Instant;

/**
 * Structured answer to a result query for an artifact whose job reached a terminal state.
 *
 * <p>Always well-formed: a rejected job carries its quality verdict, a failed job carries the
 * failure reason, and successful or partial jobs carry the full {@link AnalysisResult}. Stored
 * once at commit time and never mutated, so repeated reads return the same object.
 *
 * @param artifactId artifact analyzed
 * @param jobId job that reached the terminal state
 * @param state terminal state
 * @param attempts inference attempts made
 * @param qualityVerdict verdict, null only if quality control never ran
 * @param result present iff state is SUCCEEDED or PARTIAL
 * @param failureReason present iff state is FAILED
 * @param message explanation for REJECTED and FAILED
 * @param finalizedAt commit time
 */
public record AnalysisOutcome(
    String artifactId,
    String jobId,
    JobStatus state,
    int attempts,
    QualityVerdict qualityVerdict,
    AnalysisResult result,
    FailureReason failureReason,
    String message,
    Instant finalizedAt) {}
