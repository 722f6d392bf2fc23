package com.scholary.vocalization.objectstore;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.wait.strategy.HttpWaitStrategy;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * Round trip against a real MinIO server.
 *
 * <p>Skipped when Docker is not available.
 */
@Testcontainers(disabledWithoutDocker = true)
class S3ArtifactStoreIntegrationTest {

  private static final String ACCESS_KEY = "minioadmin";
  private static final String SECRET_KEY = "minioadmin";

  @Container
  static GenericContainer<?> minio =
      new GenericContainer<>("minio/minio:RELEASE.2024-01-16T16-07-38Z")
          .withExposedPorts(9000)
          .withEnv("MINIO_ROOT_USER", ACCESS_KEY)
          .withEnv("MINIO_ROOT_PASSWORD", SECRET_KEY)
          .withCommand("server /data")
          .waitingFor(new HttpWaitStrategy().forPath("/minio/health/ready").forPort(9000));

  private static S3ArtifactStore store;

  @BeforeAll
  static void setUp() {
    String endpoint = String.format("http://%s:%d", minio.getHost(), minio.getMappedPort(9000));
    store =
        new S3ArtifactStore(
            new ObjectStoreProperties(
                ObjectStoreProperties.StoreType.S3,
                endpoint,
                ACCESS_KEY,
                SECRET_KEY,
                "animal-vocalizations",
                "us-east-1",
                true,
                true));
    store.ensureBucketExists();
  }

  @AfterAll
  static void tearDown() {
    if (store != null) {
      store.close();
    }
  }

  @Test
  void putAndGet_shouldReturnStoredBytes() {
    byte[] payload = {10, 20, 30, 40};

    store.put("artifacts/it-1.wav.enc", payload);

    assertThat(store.get("artifacts/it-1.wav.enc")).isEqualTo(payload);
  }

  @Test
  void get_shouldThrowNotFoundForMissingKey() {
    assertThatThrownBy(() -> store.get("artifacts/never-written.wav.enc"))
        .isInstanceOf(ObjectNotFoundException.class);
  }

  @Test
  void delete_shouldRemoveObject() {
    store.put("artifacts/it-2.wav.enc", new byte[] {1});

    store.delete("artifacts/it-2.wav.enc");

    assertThatThrownBy(() -> store.get("artifacts/it-2.wav.enc"))
        .isInstanceOf(ObjectNotFoundException.class);
  }

  @Test
  void ensureBucketExists_shouldBeIdempotent() {
    store.ensureBucketExists();
    store.ensureBucketExists();
  }
}
