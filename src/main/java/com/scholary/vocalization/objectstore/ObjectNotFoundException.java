package com.scholary.vocalization.objectstore;

/** Nothing is stored under the requested key. */
public class ObjectNotFoundException extends ObjectStoreException {

  private final String key;

  public ObjectNotFoundException(String key) {
    super("Object not found: key=" + key);
    this.key = key;
  }

  public ObjectNotFoundException(String key, Throwable cause) {
    super("Object not found: key=" + key, cause);
    this.key = key;
  }

  public String getKey() {
    return key;
  }
}
