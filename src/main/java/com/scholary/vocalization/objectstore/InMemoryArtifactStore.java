package com.scholary.vocalization.objectstore;

import java.util.Arrays;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-local {@link ArtifactStore} for development runs and tests.
 *
 * <p>Copies on the way in and out so callers can never mutate stored ciphertext.
 */
public class InMemoryArtifactStore implements ArtifactStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryArtifactStore.class);

  private final Map<String, byte[]> blobs = new ConcurrentHashMap<>();

  @Override
  public void put(String key, byte[] encryptedBytes) {
    blobs.put(key, Arrays.copyOf(encryptedBytes, encryptedBytes.length));
    LOGGER.debug("Stored artifact in memory: key={}, size={}", key, encryptedBytes.length);
  }

  @Override
  public byte[] get(String key) {
    byte[] stored = blobs.get(key);
    if (stored == null) {
      throw new ObjectNotFoundException(key);
    }
    return Arrays.copyOf(stored, stored.length);
  }

  @Override
  public void delete(String key) {
    blobs.remove(key);
  }

  public int size() {
    return blobs.size();
  }
}
