package com.scholary.vocalization.result;

import com.scholary.vocalization.quality.QualityVerdict;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Interpretation of a recording produced by a successful or partial analysis.
 *
 * <p>Exists only for jobs that ended SUCCEEDED or PARTIAL. Tags are kept sorted so the serialized
 * form is stable across reads.
 *
 * @param jobId job that produced the result
 * @param translation model translation, may be null
 * @param tags behavior labels
 * @param confidence model confidence in [0, 1]
 * @param qualityVerdict verdict the job ran under
 * @param partial true when confidence was below the accuracy floor or quality flags were present
 * @param finalizedAt when the result was committed
 */
public record AnalysisResult(
    String jobId,
    String translation,
    Set<String> tags,
    double confidence,
    QualityVerdict qualityVerdict,
    boolean partial,
    Instant finalizedAt) {

  public AnalysisResult {
    if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
      throw new IllegalArgumentException("confidence must be in [0,1], got " + confidence);
    }
    tags = sortedCopy(tags);
  }

  private static Set<String> sortedCopy(Collection<String> tags) {
    TreeSet<String> sorted = new TreeSet<>();
    if (tags != null) {
      sorted.addAll(tags);
    }
    return Collections.unmodifiableSortedSet(sorted);
  }
}
