package dev.minutes.pipeline;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Instant;

/**
 * Input payload of a pipeline execution.
 *
 * @param sessionId recording session
 * @param tenantId owning tenant
 * @param storageBucket bucket holding the chunks
 * @param storagePrefix key prefix of the chunks, {@code users/{tenant}/chunks/{session}/}
 * @param chunkCount declared number of chunks
 * @param pipelineVersion version stamped into artifacts
 * @param createdAt time the execution was requested
 * @param metadata trigger information
 */
public record PipelineStartRequest(
    @NotBlank String sessionId,
    @NotBlank String tenantId,
    @NotBlank String storageBucket,
    @NotBlank String storagePrefix,
    @Positive int chunkCount,
    @NotBlank String pipelineVersion,
    @NotNull Instant createdAt,
    @NotNull @Valid Metadata metadata) {

  /**
   * @param trigger what started the execution, e.g. {@code session-completion}
   * @param originalChunkCount chunk count seen at trigger time
   * @param triggeredAt trigger time
   */
  public record Metadata(@NotBlank String trigger, int originalChunkCount, Instant triggeredAt) {}
}
