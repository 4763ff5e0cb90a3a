package dev.minutes.transcription;

/** Job states reported by the speech-to-text worker. */
public enum TranscriptionJobState {
    QUEUED,
    IN_PROGRESS,
    COMPLETED,
    FAILED;

    public boolean isFinished() {
        return this == COMPLETED || this == FAILED;
    }
}
