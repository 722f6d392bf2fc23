package com.scholary.vocalization.inference;

import java.util.List;

/**
 * Raw output of a backend, before reconciliation.
 *
 * <p>Checks on {@code confidence} happen in the result aggregator, where a missing or
 * out-of-range value is treated as a model error rather than rejected at parse time.
 *
 * @param translation free-text interpretation, may be null
 * @param tags behavior labels, may be null or empty
 * @param confidence model confidence, expected in [0, 1]; null if the backend omitted it
 */
public record InferenceOutput(String translation, List<String> tags, Double confidence) {

  public InferenceOutput {
    tags = tags == null ? List.of() : List.copyOf(tags);
  }
}
