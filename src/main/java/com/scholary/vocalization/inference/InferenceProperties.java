package com.scholary.vocalization.inference;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration for the inference backend.
 *
 * <p>{@code baseUrl} and the timeouts apply to the HTTP backend; {@code simulatedConfidence}
 * applies to the simulated backend.
 */
@ConfigurationProperties(prefix = "inference")
@Validated
public record InferenceProperties(
    @NotNull Backend backend,
    String baseUrl,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    @DecimalMin("0.0") @DecimalMax("1.0") double simulatedConfidence) {

  public enum Backend {
    SIMULATED,
    HTTP
  }
}
