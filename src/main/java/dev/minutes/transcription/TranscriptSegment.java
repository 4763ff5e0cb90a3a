package dev.minutes.transcription;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** One diarized utterance of the transcript. */
public record TranscriptSegment(
        @NotBlank String id,
        @JsonProperty("start_ms") @PositiveOrZero long startMs,
        @JsonProperty("end_ms") @PositiveOrZero long endMs,
        @JsonProperty("speaker_label") @NotBlank String speakerLabel,
        @NotNull String text,
        @Nullable @DecimalMin("0.0") @DecimalMax("1.0") Double confidence,
        @Nullable List<@Valid TranscriptWord> words
) {
    public TranscriptSegment {
        words = words == null ? null : List.copyOf(words);
    }
}
