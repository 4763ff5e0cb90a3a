package dev.minutes.pipeline;

import dev.minutes.session.SessionStatus;

/**
 * States of a {@link PipelineExecution}.
 *
 * <p>Flow: {@code VALIDATING → TRANSCODING → AWAITING_TRANSCRIPTION → SUMMARIZING → FINALIZING →
 * COMPLETED}. Any non-terminal state may end in {@code FAILED}. Each state mirrors one session
 * catalog status.
 */
public enum PipelineState {
  VALIDATING(SessionStatus.VALIDATING),
  TRANSCODING(SessionStatus.TRANSCODING),
  /** Transcription job started or about to be started; polled until it finishes. */
  AWAITING_TRANSCRIPTION(SessionStatus.TRANSCRIBING),
  SUMMARIZING(SessionStatus.SUMMARIZING),
  FINALIZING(SessionStatus.FINALIZING),
  COMPLETED(SessionStatus.COMPLETED),
  FAILED(SessionStatus.FAILED);

  private final SessionStatus sessionStatus;

  PipelineState(SessionStatus sessionStatus) {
    this.sessionStatus = sessionStatus;
  }

  public SessionStatus sessionStatus() {
    return sessionStatus;
  }

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED;
  }

  /** The state entered when this state's stage succeeds. */
  public PipelineState next() {
    return switch (this) {
      case VALIDATING -> TRANSCODING;
      case TRANSCODING -> AWAITING_TRANSCRIPTION;
      case AWAITING_TRANSCRIPTION -> SUMMARIZING;
      case SUMMARIZING -> FINALIZING;
      case FINALIZING -> COMPLETED;
      case COMPLETED, FAILED -> throw new IllegalStateException(this + " is terminal");
    };
  }
}
