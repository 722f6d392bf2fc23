package com.scholary.vocalization.result;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

/**
 * Latest terminal outcome per artifact.
 *
 * <p>A new terminal outcome for the same artifact supersedes the previous one; until then the
 * previous outcome stays queryable even while a newer job runs.
 */
@Repository
public class OutcomeRepository {

  private final Cache<String, AnalysisOutcome> cache;

  public OutcomeRepository(
      @Value("${registry.maxSize}") int maxSize,
      @Value("${registry.expireAfterHours}") int expireAfterHours) {

    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterWrite(Duration.ofHours(expireAfterHours))
            .build();
  }

  public void save(AnalysisOutcome outcome) {
    cache.put(outcome.artifactId(), outcome);
  }

  public Optional<AnalysisOutcome> findLatest(String artifactId) {
    return Optional.ofNullable(cache.getIfPresent(artifactId));
  }
}
