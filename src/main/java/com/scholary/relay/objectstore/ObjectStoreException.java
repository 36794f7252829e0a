package com.scholary.relay.objectstore;

/**
 * Exception thrown when object storage operations fail.
 *
 * <p>Archive writes are best-effort, so callers log this rather than failing the relay.
 */
public class ObjectStoreException extends RuntimeException {

  public ObjectStoreException(String message) {
    super(message);
  }

  public ObjectStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
