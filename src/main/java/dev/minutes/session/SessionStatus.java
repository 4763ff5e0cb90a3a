package dev.minutes.session;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle states of a {@link RecordingSession}.
 *
 * <p>Collection flow: {@code PENDING → INCOMPLETE* → READY}. Processing flow: {@code READY →
 * VALIDATING → TRANSCODING → TRANSCRIBING → SUMMARIZING → FINALIZING → COMPLETED}. Any processing
 * state may move to {@code FAILED}. {@code READY → DISPATCH_FAILED → READY} is the only backward
 * edge and is used when starting the pipeline fails.
 *
 * <p>{@code COMPLETED} and {@code FAILED} are terminal: they appear in no predecessor set, so no
 * compare-and-swap can ever leave them.
 */
public enum SessionStatus {
  /** Declared or first seen, no completeness verdict yet. */
  PENDING,
  /** Evaluated at least once with missing or unexpected chunks. */
  INCOMPLETE,
  /** All chunks present; the pipeline has been (or is being) started. */
  READY,
  /** The pipeline could not be started; eligible for another dispatch attempt. */
  DISPATCH_FAILED,
  VALIDATING,
  TRANSCODING,
  TRANSCRIBING,
  SUMMARIZING,
  FINALIZING,
  /** Summary written and catalog finalized. */
  COMPLETED,
  /** A pipeline stage failed terminally; see the error detail. */
  FAILED;

  /** Statuses from which a session may still be dispatched. */
  public static final Set<SessionStatus> NOT_DISPATCHED =
      EnumSet.of(PENDING, INCOMPLETE, DISPATCH_FAILED);

  /** Statuses in which the expected chunk count may still be revised. */
  public static final Set<SessionStatus> REVISABLE = EnumSet.of(PENDING, INCOMPLETE);

  /** Returns the statuses from which a transition into this status is legal. */
  public Set<SessionStatus> allowedPredecessors() {
    return switch (this) {
      case PENDING -> EnumSet.noneOf(SessionStatus.class);
      case INCOMPLETE -> EnumSet.of(PENDING, INCOMPLETE);
      case READY -> EnumSet.of(PENDING, INCOMPLETE, DISPATCH_FAILED);
      case DISPATCH_FAILED -> EnumSet.of(READY);
      case VALIDATING -> EnumSet.of(READY);
      case TRANSCODING -> EnumSet.of(VALIDATING);
      case TRANSCRIBING -> EnumSet.of(TRANSCODING);
      case SUMMARIZING -> EnumSet.of(TRANSCRIBING);
      case FINALIZING -> EnumSet.of(SUMMARIZING);
      case COMPLETED -> EnumSet.of(FINALIZING);
      case FAILED -> EnumSet.of(READY, VALIDATING, TRANSCODING, TRANSCRIBING, SUMMARIZING, FINALIZING);
    };
  }

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED;
  }

  /**
   * Rejects transitions that leave the status graph.
   *
   * @throws IllegalArgumentException if {@code from} is empty or names a status that is not an
   *     allowed predecessor of {@code to}
   */
  public static void requireLegalTransition(Set<SessionStatus> from, SessionStatus to) {
    if (from.isEmpty()) {
      throw new IllegalArgumentException("from must name at least one status");
    }
    Set<SessionStatus> allowed = to.allowedPredecessors();
    for (SessionStatus status : from) {
      if (!allowed.contains(status)) {
        throw new IllegalArgumentException("Illegal transition " + status + " -> " + to);
      }
    }
  }
}
