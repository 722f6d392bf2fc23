package com.scholary.vocalization.job;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

/**
 * In-memory repository for analysis jobs.
 *
 * <p>Uses Caffeine cache for automatic eviction of old jobs, which keeps memory bounded. Only
 * finished jobs count towards the size bound: a running job weighs nothing, so size pressure from
 * other artifacts never evicts it. Jobs are saved again when they finish so the cache re-weighs
 * them. Expiry is measured in hours, far longer than any job's wall-clock budget.
 */
@Repository
public class JobRepository {

  private final Cache<String, AnalysisJob> cache;

  public JobRepository(
      @Value("${registry.maxSize}") int maxSize,
      @Value("${registry.expireAfterHours}") int expireAfterHours) {

    this.cache =
        Caffeine.newBuilder()
            .maximumWeight(maxSize)
            .weigher((String jobId, AnalysisJob job) -> job.getStatus().isTerminal() ? 1 : 0)
            .expireAfterWrite(Duration.ofHours(expireAfterHours))
            .build();
  }

  /** Insert or re-weigh a job. */
  public void save(AnalysisJob job) {
    cache.put(job.getJobId(), job);
  }

  public Optional<AnalysisJob> findById(String jobId) {
    return Optional.ofNullable(cache.getIfPresent(jobId));
  }
}
