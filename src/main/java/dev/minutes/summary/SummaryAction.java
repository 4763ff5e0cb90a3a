package dev.minutes.summary;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;
import org.jspecify.annotations.Nullable;

/** An action item extracted from the meeting. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SummaryAction(
    @NotBlank String id,
    @NotBlank String description,
    @Nullable String owner,
    @JsonProperty("due_date") @Nullable @Pattern(regexp = "\\d{4}-\\d{2}-\\d{2}") String dueDate,
    @Nullable String status,
    @Nullable @DecimalMin("0.0") @DecimalMax("1.0") Double confidence,
    @JsonProperty("source_timestamp_ms") @Nullable @PositiveOrZero Long sourceTimestampMs) {}
