package dev.minutes.segment;

/**
 * Thrown when an uploaded chunk is empty or cannot be reached in object storage.
 *
 * <p>Retryable: the notification should be redelivered, since the object may become visible
 * later.
 */
public class InvalidSegmentException extends RuntimeException {

  public InvalidSegmentException(String message) {
    super(message);
  }
}
