package com.scholary.vocalization.logging;

import java.util.Collection;
import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each event sets an {@code event_type} plus event-specific fields for the duration of a single
 * log call, so log shippers can index pipeline events without parsing messages.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log a job state transition. */
  public void logJobTransition(String jobId, String artifactId, Object from, Object to) {
    try {
      MDC.put("event_type", "job_transition");
      MDC.put("fromStatus", String.valueOf(from));
      MDC.put("toStatus", String.valueOf(to));

      logger.info("Job transition: jobId={}, artifactId={}, {} -> {}", jobId, artifactId, from, to);
    } finally {
      clearEventFields();
    }
  }

  /** Log a quality-control verdict. */
  public void logQualityVerdict(
      String artifactId, Collection<?> flags, double score, boolean usable, double snrDb) {
    try {
      MDC.put("event_type", "quality_verdict");
      MDC.put("flags", String.valueOf(flags));
      MDC.put("score", String.valueOf(score));
      MDC.put("usable", String.valueOf(usable));

      logger.info(
          "Quality verdict: artifactId={}, flags={}, score={}, usable={}, snrDb={}",
          artifactId,
          flags,
          String.format("%.3f", score),
          usable,
          String.format("%.1f", snrDb));
    } finally {
      clearEventFields();
    }
  }

  /** Log an inference retry. */
  public void logInferenceRetry(
      String jobId, int attempt, int maxAttempts, long delayMs, String message) {
    try {
      MDC.put("event_type", "inference_retry");
      MDC.put("attempt", String.valueOf(attempt));
      MDC.put("maxAttempts", String.valueOf(maxAttempts));
      MDC.put("delayMs", String.valueOf(delayMs));

      logger.warn(
          "Inference retry: jobId={}, attempt={}/{}, retryIn={}ms, message={}",
          jobId,
          attempt,
          maxAttempts,
          delayMs,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log an inference failure that ends the dispatch. */
  public void logInferenceFailed(String jobId, int attempts, String reason, String message) {
    try {
      MDC.put("event_type", "inference_failed");
      MDC.put("attempt", String.valueOf(attempts));
      MDC.put("errorType", reason);

      logger.error(
          "Inference failed: jobId={}, attempts={}, reason={}, message={}",
          jobId,
          attempts,
          reason,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log a commit that was discarded because the job moved on. */
  public void logStaleCommit(
      String jobId, long expectedToken, long actualToken, Object currentStatus) {
    try {
      MDC.put("event_type", "stale_commit");
      MDC.put("expectedToken", String.valueOf(expectedToken));
      MDC.put("actualToken", String.valueOf(actualToken));

      logger.warn(
          "Discarding stale commit: jobId={}, token={} (current={}), status={}",
          jobId,
          expectedToken,
          actualToken,
          currentStatus);
    } finally {
      clearEventFields();
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(String jobId, String artifactId) {
    MDC.put("jobId", jobId);
    MDC.put("artifactId", artifactId);
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove("jobId");
    MDC.remove("artifactId");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("fromStatus");
    MDC.remove("toStatus");
    MDC.remove("flags");
    MDC.remove("score");
    MDC.remove("usable");
    MDC.remove("attempt");
    MDC.remove("maxAttempts");
    MDC.remove("delayMs");
    MDC.remove("errorType");
    MDC.remove("expectedToken");
    MDC.remove("actualToken");
  }
}
