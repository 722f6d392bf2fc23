package com.scholary.vocalization.config;

import com.scholary.vocalization.objectstore.ArtifactStore;
import com.scholary.vocalization.objectstore.InMemoryArtifactStore;
import com.scholary.vocalization.objectstore.ObjectStoreProperties;
import com.scholary.vocalization.objectstore.S3ArtifactStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for object storage.
 *
 * <p>Selects the S3 (MinIO-compatible) store or the in-memory store from {@code objectstore.type}.
 */
@Configuration
@EnableConfigurationProperties(ObjectStoreProperties.class)
public class ObjectStoreConfig {

  private static final Logger LOGGER = LoggerFactory.getLogger(ObjectStoreConfig.class);

  @Bean
  public ArtifactStore artifactStore(ObjectStoreProperties properties) {
    if (properties.type() == ObjectStoreProperties.StoreType.MEMORY) {
      LOGGER.warn("Using in-memory artifact store; uploads will not survive a restart");
      return new InMemoryArtifactStore();
    }

    S3ArtifactStore store = new S3ArtifactStore(properties);
    if (properties.createBucket()) {
      store.ensureBucketExists();
    }
    return store;
  }
}
