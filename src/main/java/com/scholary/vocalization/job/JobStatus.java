package com.scholary.vocalization.job;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle of an analysis job.
 *
 * <pre>
 * UPLOADED -> QUALITY_CHECKED -> REJECTED
 *                             -> DISPATCHED -> SUCCEEDED | PARTIAL | FAILED
 * </pre>
 *
 * <p>Any non-terminal state may also move to FAILED (cancellation, storage failure, queue full).
 * Transitions only go forward; no state is ever revisited.
 */
public enum JobStatus {
  UPLOADED,
  QUALITY_CHECKED,
  REJECTED,
  DISPATCHED,
  SUCCEEDED,
  PARTIAL,
  FAILED;

  private static final Map<JobStatus, Set<JobStatus>> ALLOWED = new EnumMap<>(JobStatus.class);

  static {
    ALLOWED.put(UPLOADED, EnumSet.of(QUALITY_CHECKED, FAILED));
    ALLOWED.put(QUALITY_CHECKED, EnumSet.of(REJECTED, DISPATCHED, FAILED));
    ALLOWED.put(DISPATCHED, EnumSet.of(SUCCEEDED, PARTIAL, FAILED));
    ALLOWED.put(REJECTED, EnumSet.noneOf(JobStatus.class));
    ALLOWED.put(SUCCEEDED, EnumSet.noneOf(JobStatus.class));
    ALLOWED.put(PARTIAL, EnumSet.noneOf(JobStatus.class));
    ALLOWED.put(FAILED, EnumSet.noneOf(JobStatus.class));
  }

  public boolean isTerminal() {
    return ALLOWED.get(this).isEmpty();
  }

  public boolean canTransitionTo(JobStatus next) {
    return ALLOWED.get(this).contains(next);
  }
}
