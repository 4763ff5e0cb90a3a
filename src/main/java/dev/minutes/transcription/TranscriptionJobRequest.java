package dev.minutes.transcription;

import java.util.List;

/**
 * Body of {@code POST /jobs}: transcribe one audio file with speaker diarization.
 */
public record TranscriptionJobRequest(
        String jobName,
        String mediaUri,
        String mediaFormat,
        int sampleRateHertz,
        String outputBucket,
        String outputKey,
        List<String> languageOptions,
        boolean showSpeakerLabels,
        int maxSpeakerLabels
) {
    public TranscriptionJobRequest {
        languageOptions = List.copyOf(languageOptions);
    }
}
