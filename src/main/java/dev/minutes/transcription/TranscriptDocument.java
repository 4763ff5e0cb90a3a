package dev.minutes.transcription;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;

/**
 * Transcript artifact written by the speech-to-text worker.
 *
 * <p>Required: recording id, generation time, segments, pipeline and model versions. Duration,
 * segment count and detected speakers are optional.
 */
public record TranscriptDocument(
        @JsonProperty("recording_id") @NotBlank String recordingId,
        @JsonProperty("generated_at") @NotBlank String generatedAt,
        @NotNull List<@NotNull @Valid TranscriptSegment> segments,
        @JsonProperty("pipeline_version") @NotBlank String pipelineVersion,
        @JsonProperty("model_version") @NotBlank String modelVersion,
        @JsonProperty("duration_ms") @Nullable Long durationMs,
        @JsonProperty("total_segments") @Nullable Integer totalSegments,
        @JsonProperty("speakers_detected") @Nullable Integer speakersDetected
) {
    public TranscriptDocument {
        segments = segments == null ? null : List.copyOf(segments);
    }

    /** Renders the transcript as {@code speaker: text} lines, one per segment. */
    public String toDialogue() {
        return segments.stream()
                .map(segment -> segment.speakerLabel() + ": " + segment.text().strip())
                .collect(Collectors.joining("\n"));
    }
}
