package dev.minutes.pipeline;

/** Starts a pipeline execution for a complete session. */
public interface PipelineLauncher {

  /**
   * Starts an execution.
   *
   * @return an opaque handle identifying the execution
   * @throws PipelineLaunchException if the execution could not be created
   */
  String start(PipelineStartRequest request);

  /** Whether an execution was ever started for the session. */
  boolean hasExecution(String tenantId, String sessionId);
}
