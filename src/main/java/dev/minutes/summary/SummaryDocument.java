package dev.minutes.summary;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Summary artifact stored at {@code users/{tenant}/summaries/{session}.json}.
 *
 * <p>Field names are snake_case on the wire to match the transcript artifact.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SummaryDocument(
    @JsonProperty("recording_id") @NotBlank String recordingId,
    @JsonProperty("generated_at") @NotBlank String generatedAt,
    @JsonProperty("summary_text") @NotBlank String summaryText,
    @NotNull List<@NotNull @Valid SummaryAction> actions,
    @NotNull List<@NotNull @Valid SummaryDecision> decisions,
    @JsonProperty("key_topics") @Nullable List<String> keyTopics,
    @Nullable List<String> participants,
    @JsonProperty("pipeline_version") @NotBlank String pipelineVersion,
    @JsonProperty("model_version") @NotBlank String modelVersion,
    @JsonProperty("generation_id") @Nullable String generationId) {

  public SummaryDocument {
    actions = actions == null ? null : List.copyOf(actions);
    decisions = decisions == null ? null : List.copyOf(decisions);
  }
}
