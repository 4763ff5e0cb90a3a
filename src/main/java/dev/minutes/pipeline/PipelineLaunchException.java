package dev.minutes.pipeline;

/** The pipeline execution could not be created. */
public class PipelineLaunchException extends RuntimeException {

  public PipelineLaunchException(String message, Throwable cause) {
    super(message, cause);
  }
}
