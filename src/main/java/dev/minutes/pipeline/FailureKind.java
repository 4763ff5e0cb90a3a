package dev.minutes.pipeline;

/** Typed stage failures. Retryable kinds are rescheduled until the attempt limit. */
public enum FailureKind {
  VALIDATION_ERROR(false),
  PROCESSING_ERROR(true),
  TRANSCRIPTION_ERROR(false),
  SUMMARY_FORMAT_ERROR(false),
  CATALOG_ERROR(true);

  private final boolean retryable;

  FailureKind(boolean retryable) {
    this.retryable = retryable;
  }

  public boolean isRetryable() {
    return retryable;
  }
}
