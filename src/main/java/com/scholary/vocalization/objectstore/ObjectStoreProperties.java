package com.scholary.vocalization.objectstore;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for object storage.
 *
 * <p>These map to the "objectstore.*" keys in application.yml. The S3 connection fields are only
 * read when {@code type} is {@code S3}.
 */
@ConfigurationProperties(prefix = "objectstore")
@Validated
public record ObjectStoreProperties(
    @NotNull StoreType type,
    String endpoint,
    String accessKey,
    String secretKey,
    @NotBlank String bucket,
    String region,
    boolean pathStyleAccess,
    boolean createBucket) {

  public enum StoreType {
    S3,
    MEMORY
  }
}
