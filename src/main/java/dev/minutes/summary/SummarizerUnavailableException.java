package dev.minutes.summary;

/** The model rejected the request with a transient error such as throttling. */
public class SummarizerUnavailableException extends RuntimeException {

  public SummarizerUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
