package dev.minutes.transcription;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import org.jspecify.annotations.Nullable;

/** A single recognized word with timing. */
public record TranscriptWord(
        @NotNull String word,
        @JsonProperty("start_ms") @PositiveOrZero long startMs,
        @JsonProperty("end_ms") @PositiveOrZero long endMs,
        @Nullable @DecimalMin("0.0") @DecimalMax("1.0") Double confidence
) {}
