package dev.minutes.summary;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import org.jspecify.annotations.Nullable;

/** A decision reached during the meeting. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SummaryDecision(
    @NotBlank String id,
    @NotBlank String decision,
    @Nullable String rationale,
    @Nullable String impact,
    @Nullable @DecimalMin("0.0") @DecimalMax("1.0") Double confidence,
    @JsonProperty("source_timestamp_ms") @Nullable @PositiveOrZero Long sourceTimestampMs) {}
