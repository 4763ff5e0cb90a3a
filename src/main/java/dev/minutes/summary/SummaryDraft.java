package dev.minutes.summary;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** The part of a summary produced by the model, before metadata is attached. */
public record SummaryDraft(
    @JsonProperty("summary_text") @NotBlank String summaryText,
    @NotNull List<@NotNull @Valid SummaryAction> actions,
    @NotNull List<@NotNull @Valid SummaryDecision> decisions,
    @JsonProperty("key_topics") @Nullable List<String> keyTopics,
    @Nullable List<String> participants) {}
