package dev.minutes.summary;

/** Model output that is not a JSON object of the expected shape. Never retried. */
public class SummaryFormatException extends RuntimeException {

  public SummaryFormatException(String message) {
    super(message);
  }

  public SummaryFormatException(String message, Throwable cause) {
    super(message, cause);
  }
}
