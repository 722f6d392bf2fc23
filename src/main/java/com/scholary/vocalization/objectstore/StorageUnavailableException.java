package com.scholary.vocalization.objectstore;

/**
 * The storage backend could not complete the operation (network, credentials, 5xx).
 *
 * <p>Surfaces to upload callers as a service-unavailable error. Never raised after a job state
 * transition has been committed.
 */
public class StorageUnavailableException extends ObjectStoreException {

  public StorageUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
