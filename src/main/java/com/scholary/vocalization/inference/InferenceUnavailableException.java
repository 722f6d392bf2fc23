package com.scholary.vocalization.inference;

/**
 * Transient backend failure (network, overload, 5xx).
 *
 * <p>Retried by the scheduler with exponential backoff until the attempt budget runs out.
 */
public class InferenceUnavailableException extends RuntimeException {

  public InferenceUnavailableException(String message) {
    super(message);
  }

  public InferenceUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
