package dev.minutes.storage;

/** Raised when object storage rejects a read or write. */
public class ObjectStoreException extends RuntimeException {

  public ObjectStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
