package com.scholary.vocalization.objectstore;

/**
 * Exception thrown when object storage operations fail.
 *
 * <p>Runtime exception because storage failures are not something the pipeline can repair; the
 * two subclasses tell callers whether the key was missing or the backend was down.
 */
public class ObjectStoreException extends RuntimeException {

  public ObjectStoreException(String message) {
    super(message);
  }

  public ObjectStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
