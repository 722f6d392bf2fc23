package com.scholary.vocalization.inference;

/**
 * The model rejected the input.
 *
 * <p>Deterministic, so never retried: the job fails immediately.
 */
public class ModelErrorException extends RuntimeException {

  public ModelErrorException(String message) {
    super(message);
  }

  public ModelErrorException(String message, Throwable cause) {
    super(message, cause);
  }
}
