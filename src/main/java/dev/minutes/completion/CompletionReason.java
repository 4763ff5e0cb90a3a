package dev.minutes.completion;

/** Why a completion evaluation ended the way it did. */
public enum CompletionReason {
  /** No expected chunk count has been declared yet. */
  AWAITING_DECLARATION,
  /** Some indices in {@code 0..k-1} are not registered. */
  MISSING_SEGMENTS,
  /** Indices at or above the declared count are registered. */
  UNEXPECTED_SEGMENTS,
  /** This evaluation won the READY transition and started the pipeline. */
  DISPATCHED,
  /** The session is complete but another evaluation already dispatched it. */
  ALREADY_DISPATCHED,
  /** This evaluation won the READY transition but could not start the pipeline. */
  DISPATCH_FAILED
}
