package com.scholary.vocalization.objectstore;

import java.net.URI;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CreateBucketRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

/**
 * S3/MinIO implementation of {@link ArtifactStore}.
 *
 * <p>Uses AWS SDK v2, which works with both real S3 and S3-compatible services like MinIO. All
 * artifacts live in a single configured bucket; keys are unique per artifact so no locking is
 * needed here.
 *
 * <p>The SDK's own transport retries stay enabled; anything that still fails is reported as
 * {@link StorageUnavailableException}. A missing key is {@link ObjectNotFoundException}.
 */
public class S3ArtifactStore implements ArtifactStore, AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(S3ArtifactStore.class);

  private static final String CONTENT_TYPE = "application/octet-stream";

  private final S3Client s3Client;
  private final String bucket;

  public S3ArtifactStore(ObjectStoreProperties properties) {
    this(buildClient(properties), properties.bucket());
  }

  S3ArtifactStore(S3Client s3Client, String bucket) {
    this.s3Client = s3Client;
    this.bucket = bucket;
  }

  private static S3Client buildClient(ObjectStoreProperties properties) {
    LOGGER.info(
        "Initializing S3 artifact store: endpoint={}, bucket={}, pathStyleAccess={}",
        properties.endpoint(),
        properties.bucket(),
        properties.pathStyleAccess());

    AwsBasicCredentials credentials =
        AwsBasicCredentials.create(properties.accessKey(), properties.secretKey());

    Region region =
        properties.region() != null && !properties.region().isEmpty()
            ? Region.of(properties.region())
            : Region.US_EAST_1;

    var builder =
        S3Client.builder()
            .region(region)
            .credentialsProvider(StaticCredentialsProvider.create(credentials))
            .forcePathStyle(properties.pathStyleAccess()); // Required for MinIO

    if (properties.endpoint() != null && !properties.endpoint().isEmpty()) {
      builder.endpointOverride(URI.create(properties.endpoint()));
    }
    return builder.build();
  }

  @Override
  public void put(String key, byte[] encryptedBytes) {
    LOGGER.debug("Uploading artifact: bucket={}, key={}, size={}", bucket, key, encryptedBytes.length);

    try {
      PutObjectRequest request =
          PutObjectRequest.builder()
              .bucket(bucket)
              .key(key)
              .contentType(CONTENT_TYPE)
              .contentLength((long) encryptedBytes.length)
              .build();

      s3Client.putObject(request, RequestBody.fromBytes(encryptedBytes));
      LOGGER.info("Stored artifact: bucket={}, key={}", bucket, key);

    } catch (S3Exception e) {
      String message =
          String.format(
              "Failed to store artifact: bucket=%s, key=%s, statusCode=%s",
              bucket, key, e.statusCode());
      LOGGER.error(message, e);
      throw new StorageUnavailableException(message, e);

    } catch (SdkException e) {
      String message = String.format("Storage unreachable: bucket=%s, key=%s", bucket, key);
      LOGGER.error(message, e);
      throw new StorageUnavailableException(message, e);
    }
  }

  @Override
  public byte[] get(String key) {
    LOGGER.debug("Fetching artifact: bucket={}, key={}", bucket, key);

    try {
      GetObjectRequest request = GetObjectRequest.builder().bucket(bucket).key(key).build();
      ResponseBytes<GetObjectResponse> response = s3Client.getObjectAsBytes(request);

      LOGGER.info("Retrieved artifact: bucket={}, key={}", bucket, key);
      return response.asByteArray();

    } catch (NoSuchKeyException e) {
      LOGGER.warn("Artifact not found: bucket={}, key={}", bucket, key);
      throw new ObjectNotFoundException(key, e);

    } catch (S3Exception e) {
      String message =
          String.format(
              "Failed to retrieve artifact: bucket=%s, key=%s, statusCode=%s",
              bucket, key, e.statusCode());
      LOGGER.error(message, e);
      throw new StorageUnavailableException(message, e);

    } catch (SdkException e) {
      String message = String.format("Storage unreachable: bucket=%s, key=%s", bucket, key);
      LOGGER.error(message, e);
      throw new StorageUnavailableException(message, e);
    }
  }

  @Override
  public void delete(String key) {
    LOGGER.debug("Deleting artifact: bucket={}, key={}", bucket, key);

    try {
      s3Client.deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(key).build());
      LOGGER.info("Deleted artifact: bucket={}, key={}", bucket, key);

    } catch (SdkException e) {
      String message = String.format("Failed to delete artifact: bucket=%s, key=%s", bucket, key);
      LOGGER.error(message, e);
      throw new StorageUnavailableException(message, e);
    }
  }

  /** Create the configured bucket if it does not exist yet. */
  public void ensureBucketExists() {
    try {
      s3Client.headBucket(HeadBucketRequest.builder().bucket(bucket).build());
    } catch (NoSuchBucketException e) {
      s3Client.createBucket(CreateBucketRequest.builder().bucket(bucket).build());
      LOGGER.info("Created bucket: {}", bucket);
    } catch (S3Exception e) {
      if (e.statusCode() != 404) {
        throw new StorageUnavailableException("Failed to check bucket: " + bucket, e);
      }
      s3Client.createBucket(CreateBucketRequest.builder().bucket(bucket).build());
      LOGGER.info("Created bucket: {}", bucket);
    } catch (SdkException e) {
      throw new StorageUnavailableException("Failed to check bucket: " + bucket, e);
    }
  }

  /** Release SDK connections and threads. */
  @Override
  public void close() {
    LOGGER.info("Closing S3 client");
    s3Client.close();
  }
}
