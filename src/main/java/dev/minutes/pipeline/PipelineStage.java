package dev.minutes.pipeline;

/** One step of the post-processing pipeline. Implementations must be safe to re-run. */
public interface PipelineStage {

  StageOutcome execute(PipelineContext context);
}
