package dev.minutes.pipeline;

import java.time.Duration;

/** Result of running one stage adapter. */
public sealed interface StageOutcome {

  /** The stage finished; the pipeline moves to the next state. */
  record Advance(PipelineContext context) implements StageOutcome {}

  /** The stage is waiting on external work; run it again after {@code delay}. */
  record Wait(PipelineContext context, Duration delay) implements StageOutcome {}

  /** The stage failed. */
  record Failure(FailureKind kind, String message) implements StageOutcome {}

  static StageOutcome advance(PipelineContext context) {
    return new Advance(context);
  }

  static StageOutcome waitFor(PipelineContext context, Duration delay) {
    return new Wait(context, delay);
  }

  static StageOutcome failure(FailureKind kind, String message) {
    return new Failure(kind, message);
  }
}
