package com.scholary.vocalization.objectstore;

/**
 * Opaque blob storage for encrypted audio artifacts.
 *
 * <p>Implementations never see plaintext: callers encrypt before {@link #put} and decrypt after
 * {@link #get}. There are no internal retries; the caller owns the retry policy.
 *
 * <p>Infrastructure failures are reported as {@link StorageUnavailableException} so callers can
 * tell them apart from a missing key ({@link ObjectNotFoundException}).
 */
public interface ArtifactStore {

  /**
   * Store an encrypted blob, replacing any existing blob under the same key.
   *
   * @param key the storage key
   * @param encryptedBytes the ciphertext to store
   * @throws StorageUnavailableException if the backend cannot be reached or rejects the write
   */
  void put(String key, byte[] encryptedBytes);

  /**
   * Retrieve an encrypted blob.
   *
   * @param key the storage key
   * @return the ciphertext exactly as stored
   * @throws ObjectNotFoundException if nothing is stored under the key
   * @throws StorageUnavailableException if the backend cannot be reached
   */
  byte[] get(String key);

  /**
   * Delete a blob. Deleting a missing key is not an error.
   *
   * @param key the storage key
   * @throws StorageUnavailableException if the backend cannot be reached
   */
  void delete(String key);
}
