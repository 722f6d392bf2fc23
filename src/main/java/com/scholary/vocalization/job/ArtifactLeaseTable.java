package com.scholary.vocalization.job;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-artifact mutual-exclusion leases.
 *
 * <p>Each artifact gets its own lock and at most one active job. The lease is held from job
 * admission until the job's terminal commit. Locks are per artifact, so work on distinct
 * artifacts never contends.
 *
 * <p>Leases are weakly referenced: an idle lease nobody is using is collected, so the table does
 * not grow with every artifact ever analyzed. A held lease is pinned until it is released, and any
 * thread that obtained a lease keeps it reachable, so two callers for the same artifact always see
 * the same lock.
 *
 * <p>Usage:
 *
 * <pre>
 * Lease lease = leases.leaseFor(artifactId);
 * lease.lock();
 * try {
 *   ...
 * } finally {
 *   lease.unlock();
 * }
 * </pre>
 */
public class ArtifactLeaseTable {

  private final Cache<String, Lease> leases = Caffeine.newBuilder().weakValues().build();
  private final Map<String, Lease> pinned = new ConcurrentHashMap<>();

  public Lease leaseFor(String artifactId) {
    return leases.get(artifactId, id -> new Lease(id, pinned));
  }

  /** Leases currently held by an active job. */
  int pinnedCount() {
    return pinned.size();
  }

  /** Leases still tracked, held or not. */
  long trackedCount() {
    leases.cleanUp();
    return leases.estimatedSize();
  }

  /** Lock plus the job currently holding the artifact. */
  public static final class Lease {

    private final String artifactId;
    private final Map<String, Lease> pinned;
    private final ReentrantLock lock = new ReentrantLock();
    private AnalysisJob activeJob;

    private Lease(String artifactId, Map<String, Lease> pinned) {
      this.artifactId = artifactId;
      this.pinned = pinned;
    }

    public void lock() {
      lock.lock();
    }

    public void unlock() {
      lock.unlock();
    }

    public String artifactId() {
      return artifactId;
    }

    /** @return the holding job, or null when free. Caller must hold the lock. */
    public AnalysisJob activeJob() {
      requireHeld();
      return activeJob;
    }

    /** Caller must hold the lock. */
    public void hold(AnalysisJob job) {
      requireHeld();
      this.activeJob = job;
      pinned.put(artifactId, this);
    }

    /**
     * Free the lease if {@code jobId} holds it. Caller must hold the lock.
     *
     * @return true if the lease was released
     */
    public boolean release(String jobId) {
      requireHeld();
      if (activeJob != null && activeJob.getJobId().equals(jobId)) {
        activeJob = null;
        pinned.remove(artifactId, this);
        return true;
      }
      return false;
    }

    private void requireHeld() {
      if (!lock.isHeldByCurrentThread()) {
        throw new IllegalStateException("Lease lock for " + artifactId + " not held");
      }
    }
  }
}
