package com.scholary.vocalization.artifact;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

/**
 * In-memory registry of uploaded artifacts.
 *
 * <p>Caffeine keeps the registry bounded. Entries expire after write, on the same schedule as
 * outcomes, so polling an artifact does not keep it alive past its outcome. An outcome evicted
 * early by the size bound is reported as expired rather than not ready.
 */
@Repository
public class ArtifactRepository {

  private final Cache<String, AudioArtifact> cache;

  public ArtifactRepository(
      @Value("${registry.maxSize}") int maxSize,
      @Value("${registry.expireAfterHours}") int expireAfterHours) {

    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterWrite(Duration.ofHours(expireAfterHours))
            .build();
  }

  public void save(AudioArtifact artifact) {
    cache.put(artifact.getArtifactId(), artifact);
  }

  public Optional<AudioArtifact> findById(String artifactId) {
    return Optional.ofNullable(cache.getIfPresent(artifactId));
  }
}
