package com.scholary.vocalization.inference;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.vocalization.artifact.AudioFormat;
import org.junit.jupiter.api.Test;

class SimulatedInferenceBackendTest {

  private final SimulatedInferenceBackend backend = new SimulatedInferenceBackend(0.85);

  @Test
  void infer_shouldReturnSpeciesTagsAndConfiguredConfidence() {
    InferenceOutput output = backend.infer(request("canis_lupus"));

    assertThat(output.tags()).containsExactly("mating_call", "territorial");
    assertThat(output.confidence()).isEqualTo(0.85);
    assertThat(output.translation()).contains("canis_lupus");
  }

  @Test
  void infer_shouldFallBackToDefaultTags() {
    assertThat(backend.infer(request("panthera_leo")).tags()).containsExactly("aggression");
  }

  private static InferenceRequest request(String species) {
    return new InferenceRequest("j1", species, AudioFormat.WAV, new byte[0], 16000, 1.0);
  }
}
