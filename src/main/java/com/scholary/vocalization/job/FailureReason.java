package com.scholary.vocalization.job;

/** Why a job ended in {@link JobStatus#FAILED}. */
public enum FailureReason {
  /** Transient inference failures outlasted the retry budget. */
  INFERENCE_UNAVAILABLE,
  /** The model rejected the input, or returned data outside its contract. */
  MODEL_ERROR,
  /** Wall-clock budget exceeded while dispatched. */
  TIMEOUT,
  /** Cancelled by a caller. */
  CANCELLED,
  /** The stored recording could not be read back. */
  STORAGE_UNAVAILABLE,
  /** The worker queue was full at submission. */
  QUEUE_FULL,
  /** Unexpected error inside the pipeline. */
  INTERNAL_ERROR
}
