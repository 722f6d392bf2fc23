package com.scholary.vocalization.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.vocalization.inference.HttpInferenceBackend;
import com.scholary.vocalization.inference.InferenceBackend;
import com.scholary.vocalization.inference.InferenceProperties;
import com.scholary.vocalization.inference.SimulatedInferenceBackend;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the inference backend.
 *
 * <p>{@code inference.backend} picks the implementation; the pipeline only sees {@link
 * InferenceBackend}.
 */
@Configuration
@EnableConfigurationProperties(InferenceProperties.class)
public class InferenceConfig {

  @Bean
  public InferenceBackend inferenceBackend(
      InferenceProperties properties, ObjectMapper objectMapper) {
    if (properties.backend() == InferenceProperties.Backend.HTTP) {
      return new HttpInferenceBackend(properties, objectMapper);
    }
    return new SimulatedInferenceBackend(properties.simulatedConfidence());
  }
}
