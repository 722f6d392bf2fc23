package com.scholary.vocalization.quality;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Outcome of the signal-quality checks for one artifact.
 *
 * <p>{@code usable} is derived from the flags: any blocking flag makes the recording unusable.
 * Non-blocking flags (noisy, overlapping) let analysis proceed but mark the result partial.
 *
 * @param artifactId artifact the verdict belongs to
 * @param flags findings, iterated in declaration order
 * @param score overall quality in [0, 1]
 * @param usable whether inference may run
 * @param durationSeconds decoded duration
 * @param snrDb estimated signal-to-noise ratio
 * @param clippingRatio share of saturated samples
 */
public record QualityVerdict(
    String artifactId,
    Set<QualityFlag> flags,
    double score,
    boolean usable,
    double durationSeconds,
    double snrDb,
    double clippingRatio) {

  public QualityVerdict {
    if (Double.isNaN(score) || score < 0.0 || score > 1.0) {
      throw new IllegalArgumentException("quality score must be in [0,1], got " + score);
    }
    flags = Collections.unmodifiableSet(copyOf(flags));
  }

  /** Build a verdict whose {@code usable} field follows the blocking-flag policy. */
  public static QualityVerdict of(
      String artifactId,
      Collection<QualityFlag> flags,
      double score,
      double durationSeconds,
      double snrDb,
      double clippingRatio) {
    boolean usable = flags.stream().noneMatch(QualityFlag::isBlocking);
    return new QualityVerdict(
        artifactId, copyOf(flags), score, usable, durationSeconds, snrDb, clippingRatio);
  }

  /** Verdict for audio that could not be decoded at all. */
  public static QualityVerdict undecodable(String artifactId) {
    return of(artifactId, EnumSet.of(QualityFlag.UNDECODABLE), 0.0, 0.0, 0.0, 0.0);
  }

  public boolean hasFlags() {
    return !flags.isEmpty();
  }

  public boolean hasFlag(QualityFlag flag) {
    return flags.contains(flag);
  }

  private static EnumSet<QualityFlag> copyOf(Collection<QualityFlag> flags) {
    EnumSet<QualityFlag> copy = EnumSet.noneOf(QualityFlag.class);
    if (flags != null) {
      copy.addAll(flags);
    }
    return copy;
  }
}
