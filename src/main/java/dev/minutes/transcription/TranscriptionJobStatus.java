package dev.minutes.transcription;

import org.jspecify.annotations.Nullable;

/**
 * Snapshot of a transcription job.
 *
 * @param jobName unique job name
 * @param status current state
 * @param transcriptUri {@code s3://} location of the transcript, set once COMPLETED
 * @param failureReason engine-supplied reason, set once FAILED
 */
public record TranscriptionJobStatus(
        String jobName,
        TranscriptionJobState status,
        @Nullable String transcriptUri,
        @Nullable String failureReason
) {
    public static TranscriptionJobStatus failed(String jobName, String reason) {
        return new TranscriptionJobStatus(jobName, TranscriptionJobState.FAILED, null, reason);
    }
}
