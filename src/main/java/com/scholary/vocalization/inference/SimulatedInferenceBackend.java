package com.scholary.vocalization.inference;

import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Deterministic stand-in for a real model.
 *
 * <p>Returns a canned translation and per-species tags with a fixed confidence. Useful for local
 * runs and demos when no model service is deployed.
 */
public class SimulatedInferenceBackend implements InferenceBackend {

  private static final Logger LOGGER = LoggerFactory.getLogger(SimulatedInferenceBackend.class);

  private static final Map<String, List<String>> TAGS_BY_SPECIES =
      Map.of(
          "canis_lupus", List.of("mating_call", "territorial"),
          "corvus_brachyrhynchos", List.of("alarm_call"),
          "delphinus_delphis", List.of("social_contact"));
  private static final List<String> DEFAULT_TAGS = List.of("aggression");

  private final double confidence;

  public SimulatedInferenceBackend(double confidence) {
    this.confidence = confidence;
  }

  @Override
  public InferenceOutput infer(InferenceRequest request) {
    List<String> tags = TAGS_BY_SPECIES.getOrDefault(request.species(), DEFAULT_TAGS);
    String translation = "Simulated translation for " + request.species();
    LOGGER.info(
        "Simulated inference: jobId={}, species={}, tags={}, confidence={}",
        request.jobId(),
        request.species(),
        tags,
        confidence);
    return new InferenceOutput(translation, tags, confidence);
  }

  @Override
  public String name() {
    return "simulated";
  }
}
