package dev.minutes.intake;

/** The object key does not follow {@code users/{tenant}/chunks/{session}/chunk_NNN.mp4}. */
public class MalformedKeyException extends RuntimeException {

  public MalformedKeyException(String objectKey) {
    super("Not a chunk key: " + objectKey);
  }
}
