package com.scholary.vocalization.inference;

/**
 * Black-box translation and behavioral tagging capability.
 *
 * <p>Concrete backends are selected by configuration ({@code inference.backend}). Implementations
 * may block for a long time; the scheduler runs them on a dedicated pool and interrupts the
 * calling thread on timeout or cancellation.
 */
public interface InferenceBackend {

  /**
   * Translate and tag one recording.
   *
   * @param request decrypted audio plus context
   * @return the model output
   * @throws InferenceUnavailableException on transient failures; the scheduler retries these
   * @throws ModelErrorException when the model rejects the input; never retried
   */
  InferenceOutput infer(InferenceRequest request);

  /** Short name used in logs. */
  String name();
}
